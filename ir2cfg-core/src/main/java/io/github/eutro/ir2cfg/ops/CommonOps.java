package io.github.eutro.ir2cfg.ops;

import io.github.eutro.ir2cfg.ssa.Insn;

/**
 * {@link Op}s and {@link OpKey}s that are not specific to any source construct.
 */
public class CommonOps {
    /**
     * Control: an unconditional jump.
     */
    public static final Op BR = new SimpleOpKey("br").create();
    /**
     * Control: returns from the function, with its argument if it has one.
     */
    public static final Op RETURN = new SimpleOpKey("return").create();
    /**
     * Control: aborts execution with the given message.
     */
    public static final UnaryOpKey<String> TRAP = new UnaryOpKey<>("trap");

    /**
     * Effect: returns its argument(s).
     * <p>
     * With several arguments and targets, each target receives the corresponding argument,
     * all arguments being read before any target is written.
     */
    public static final Op IDENTITY = new SimpleOpKey("id").create();

    /**
     * Effect: returns the constant. Integers are {@link Long}s, interpreted at the register width,
     * booleans are {@link Boolean}s and floating point values are {@link Float}s or {@link Double}s.
     */
    public static final UnaryOpKey<Object> CONST = new UnaryOpKey<>("const");

    /**
     * Return a constant instruction which returns {@code k}.
     *
     * @param k The constant.
     * @return The instruction.
     */
    public static Insn constant(Object k) {
        return CONST.create(k).insn();
    }
}
