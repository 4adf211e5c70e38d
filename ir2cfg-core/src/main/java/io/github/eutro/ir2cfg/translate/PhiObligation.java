package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.BlockLabel;
import io.github.eutro.ir2cfg.source.Ident;
import io.github.eutro.ir2cfg.source.TypedValue;

/**
 * A value that must be copied into a phi's register when control arrives from a given predecessor.
 */
public final class PhiObligation {
    public final BlockLabel from;
    public final Ident target;
    public final TypedValue value;

    public PhiObligation(BlockLabel from, Ident target, TypedValue value) {
        this.from = from;
        this.target = target;
        this.value = value;
    }

    @Override
    public String toString() {
        return target + " <- " + value + " from " + from;
    }
}
