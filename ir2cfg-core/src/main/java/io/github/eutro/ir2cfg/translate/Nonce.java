package io.github.eutro.ir2cfg.translate;

/**
 * An identity token, equal only to itself.
 */
public final class Nonce {
    private final HandleAllocator source;
    private final int id;

    Nonce(HandleAllocator source, int id) {
        this.source = source;
        this.id = id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Nonce)) return false;
        Nonce that = (Nonce) o;
        return id == that.id && source == that.source;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "nonce#" + id;
    }
}
