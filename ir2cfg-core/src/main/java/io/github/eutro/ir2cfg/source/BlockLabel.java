package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * The label of a source basic block.
 */
public final class BlockLabel {
    public final String name;

    public BlockLabel(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public static BlockLabel of(String name) {
        return new BlockLabel(name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BlockLabel && ((BlockLabel) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return "%" + name;
    }
}
