package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * A conversion, such as {@code zext} or {@code bitcast}.
 */
public class ConvInsnNode extends AbstractInsnNode {
    public final TypedValue value;
    public final TypeNode to;

    public ConvInsnNode(Opcode opcode, TypedValue value, TypeNode to) {
        super(opcode);
        checkOpcode(opcode.isConversion());
        this.value = Objects.requireNonNull(value);
        this.to = Objects.requireNonNull(to);
    }

    @Override
    public String toString() {
        return opcode + " " + value + " to " + to;
    }
}
