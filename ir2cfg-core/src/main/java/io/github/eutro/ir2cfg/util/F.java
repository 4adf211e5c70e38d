package io.github.eutro.ir2cfg.util;

/**
 * A simple unary function.
 * <p>
 * Equivalent to {@link java.util.function.Function}, but doesn't collide with
 * {@link io.github.eutro.ir2cfg.ssa.Function}.
 *
 * @param <A> The argument type.
 * @param <B> The return type.
 */
@FunctionalInterface
public interface F<A, B> {
    B apply(A a);
}
