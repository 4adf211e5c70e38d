package io.github.eutro.ir2cfg.passes;

import io.github.eutro.ir2cfg.passes.misc.ChainedPass;

/**
 * A transformation or analysis over some IR.
 *
 * @param <A> The input type.
 * @param <B> The output type.
 */
public interface IRPass<A, B> {
    B run(A a);

    /**
     * Whether this pass mutates its input and returns it, rather than building something new.
     *
     * @return Whether this pass is in-place.
     */
    default boolean isInPlace() {
        return false;
    }

    default <C> IRPass<A, C> then(IRPass<B, C> next) {
        return new ChainedPass<>(this, next);
    }
}
