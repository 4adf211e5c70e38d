package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.DebugAnnotation;
import io.github.eutro.ir2cfg.source.DebugInfo;
import io.github.eutro.ir2cfg.source.ValMd;
import io.github.eutro.ir2cfg.ssa.SourceLocation;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * The current source position while lowering a routine. It only moves when a statement
 * carries a usable location, so statements without one inherit the last position seen.
 */
public final class LocationCursor {
    private final ScopeFileResolver files;
    private SourceLocation current;

    public LocationCursor(ScopeFileResolver files, SourceLocation initial) {
        this.files = files;
        this.current = initial;
    }

    public SourceLocation current() {
        return current;
    }

    /**
     * Move to the location given by some annotations, if they give one.
     *
     * @param annotations The annotations.
     * @return Whether the cursor moved.
     */
    public boolean update(List<DebugAnnotation> annotations) {
        SourceLocation loc = locationOf(annotations);
        if (loc == null) return false;
        current = loc;
        return true;
    }

    /**
     * Find the location the first usable {@code dbg} annotation gives.
     * <p>
     * A debug location gives its line and column in the file of its scope. A subprogram
     * with a file gives its line, at column 0.
     *
     * @param annotations The annotations.
     * @return The location, or null if no annotation gives one.
     */
    public @Nullable SourceLocation locationOf(List<DebugAnnotation> annotations) {
        for (DebugAnnotation annotation : annotations) {
            if (!DebugAnnotation.DBG.equals(annotation.kind)) continue;
            ValMd md = annotation.md;
            if (md instanceof ValMd.Loc) {
                ValMd.Loc loc = (ValMd.Loc) md;
                return new SourceLocation(files.findPath(loc.loc.scope), loc.loc.line, loc.loc.col);
            }
            if (md instanceof ValMd.Info && ((ValMd.Info) md).info instanceof DebugInfo.Subprogram) {
                DebugInfo.Subprogram subp = (DebugInfo.Subprogram) ((ValMd.Info) md).info;
                if (subp.file != null) {
                    return new SourceLocation(files.findPath(subp.file), subp.line, 0);
                }
            }
        }
        return null;
    }
}
