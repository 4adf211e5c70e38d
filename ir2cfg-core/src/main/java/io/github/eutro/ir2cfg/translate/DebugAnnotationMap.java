package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.DebugAnnotation;
import io.github.eutro.ir2cfg.source.Ident;
import io.github.eutro.ir2cfg.source.StmtNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * The result of {@link ProcessDebugDeclares}: the annotations accumulated for each identifier,
 * and the effective annotations of the statements they were moved onto.
 * <p>
 * Read-only once built.
 */
public final class DebugAnnotationMap {
    private final Map<Ident, List<DebugAnnotation>> byIdent;
    private final Map<StmtNode, List<DebugAnnotation>> effective;

    DebugAnnotationMap(Map<Ident, List<DebugAnnotation>> byIdent, IdentityHashMap<StmtNode, List<DebugAnnotation>> effective) {
        this.byIdent = Collections.unmodifiableMap(byIdent);
        this.effective = effective;
    }

    /**
     * Get the annotations accumulated for an identifier.
     *
     * @param ident The identifier.
     * @return The annotations, possibly empty.
     */
    public List<DebugAnnotation> forIdent(Ident ident) {
        return byIdent.getOrDefault(ident, Collections.emptyList());
    }

    /**
     * Get the annotations a statement should be lowered with: its own, unless debug
     * declarations were moved onto it.
     *
     * @param stmt The statement.
     * @return The annotations.
     */
    public List<DebugAnnotation> effective(StmtNode stmt) {
        List<DebugAnnotation> moved = effective.get(stmt);
        return moved == null ? stmt.annotations : moved;
    }
}
