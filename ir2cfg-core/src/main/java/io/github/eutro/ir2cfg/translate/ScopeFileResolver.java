package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.DebugInfo;
import io.github.eutro.ir2cfg.source.TypeContext;
import io.github.eutro.ir2cfg.source.ValMd;
import org.jetbrains.annotations.Nullable;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the source file a debug scope belongs to, by walking outwards through enclosing
 * scopes until one names its file.
 * <p>
 * References are looked up in the module's metadata table. The walk gives up after
 * {@link #MAX_DEPTH} steps, or on reaching a reference it has already followed.
 */
public final class ScopeFileResolver {
    public static final int MAX_DEPTH = 64;

    private final TypeContext tc;

    public ScopeFileResolver(TypeContext tc) {
        this.tc = tc;
    }

    /**
     * Find the file of a scope.
     *
     * @param scope The scope.
     * @return The file, or null if none could be found.
     */
    public DebugInfo.@Nullable File findFile(@Nullable ValMd scope) {
        Set<Integer> seen = new HashSet<>();
        ValMd md = scope;
        for (int depth = 0; md != null && depth < MAX_DEPTH; depth++) {
            if (md instanceof ValMd.Ref) {
                int id = ((ValMd.Ref) md).id;
                if (!seen.add(id)) return null;
                ValMd node = tc.lookupMetadata(id);
                if (node instanceof ValMd.Tuple) {
                    return legacyFile((ValMd.Tuple) node);
                }
                md = node;
                continue;
            }
            if (!(md instanceof ValMd.Info)) return null;
            DebugInfo di = ((ValMd.Info) md).info;
            if (di instanceof DebugInfo.File) {
                return (DebugInfo.File) di;
            }
            ValMd file;
            ValMd outer;
            if (di instanceof DebugInfo.LexicalBlock) {
                file = ((DebugInfo.LexicalBlock) di).file;
                outer = ((DebugInfo.LexicalBlock) di).scope;
            } else if (di instanceof DebugInfo.LexicalBlockFile) {
                file = ((DebugInfo.LexicalBlockFile) di).file;
                outer = ((DebugInfo.LexicalBlockFile) di).scope;
            } else if (di instanceof DebugInfo.Subprogram) {
                file = ((DebugInfo.Subprogram) di).file;
                outer = ((DebugInfo.Subprogram) di).scope;
            } else {
                return null;
            }
            DebugInfo.File direct = asFile(file);
            if (direct != null) return direct;
            md = outer;
        }
        return null;
    }

    /**
     * Find the path of a scope's file.
     *
     * @param scope The scope.
     * @return The path, or the empty string if the file could not be found.
     */
    public String findPath(@Nullable ValMd scope) {
        DebugInfo.File file = findFile(scope);
        return file == null ? "" : file.path();
    }

    // a file slot holds the file inline, or a reference to it
    private DebugInfo.@Nullable File asFile(@Nullable ValMd md) {
        if (md instanceof ValMd.Ref) {
            md = tc.lookupMetadata(((ValMd.Ref) md).id);
        }
        if (md instanceof ValMd.Info && ((ValMd.Info) md).info instanceof DebugInfo.File) {
            return (DebugInfo.File) ((ValMd.Info) md).info;
        }
        return null;
    }

    // old-style scopes are tuples whose second element refers to a [filename, directory] pair
    private DebugInfo.@Nullable File legacyFile(ValMd.Tuple scope) {
        List<ValMd> elts = scope.elements;
        if (elts.size() < 2 || !(elts.get(1) instanceof ValMd.Ref)) return null;
        ValMd pair = tc.lookupMetadata(((ValMd.Ref) elts.get(1)).id);
        if (!(pair instanceof ValMd.Tuple)) return null;
        List<ValMd> names = ((ValMd.Tuple) pair).elements;
        if (names.size() != 2
                || !(names.get(0) instanceof ValMd.Str)
                || !(names.get(1) instanceof ValMd.Str)) {
            return null;
        }
        return new DebugInfo.File(((ValMd.Str) names.get(0)).value, ((ValMd.Str) names.get(1)).value);
    }
}
