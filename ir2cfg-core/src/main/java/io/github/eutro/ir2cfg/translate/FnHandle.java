package io.github.eutro.ir2cfg.translate;

import java.util.Objects;

/**
 * The identity of a routine within a translation, and its lifted signature.
 * <p>
 * Handles compare by identity; two declarations of one symbol share a handle.
 */
public final class FnHandle {
    public final int id;
    public final String symbol;
    public final FnSignature signature;

    FnHandle(int id, String symbol, FnSignature signature) {
        this.id = id;
        this.symbol = Objects.requireNonNull(symbol);
        this.signature = Objects.requireNonNull(signature);
    }

    @Override
    public String toString() {
        return "@" + symbol + "#" + id + signature;
    }
}
