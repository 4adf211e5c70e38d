package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * A metadata attachment on a statement or definition, such as {@code !dbg !12}.
 */
public final class DebugAnnotation {
    /**
     * The attachment kind that carries source locations.
     */
    public static final String DBG = "dbg";

    public final String kind;
    public final ValMd md;

    public DebugAnnotation(String kind, ValMd md) {
        this.kind = Objects.requireNonNull(kind);
        this.md = Objects.requireNonNull(md);
    }

    public static DebugAnnotation dbg(ValMd md) {
        return new DebugAnnotation(DBG, md);
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DebugAnnotation)) return false;
        DebugAnnotation that = (DebugAnnotation) o;
        return kind.equals(that.kind) && md == that.md;
    }

    @Override
    public int hashCode() {
        return kind.hashCode() * 31 + System.identityHashCode(md);
    }

    @Override
    public String toString() {
        return "!" + kind + " " + md;
    }
}
