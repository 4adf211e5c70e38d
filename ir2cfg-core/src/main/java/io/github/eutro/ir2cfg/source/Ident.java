package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * A local SSA identifier, such as {@code %x} or {@code %3}.
 */
public final class Ident implements Comparable<Ident> {
    public final String name;

    public Ident(String name) {
        this.name = Objects.requireNonNull(name);
    }

    public static Ident of(String name) {
        return new Ident(name);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Ident && ((Ident) o).name.equals(name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public int compareTo(Ident o) {
        return name.compareTo(o.name);
    }

    @Override
    public String toString() {
        return "%" + name;
    }
}
