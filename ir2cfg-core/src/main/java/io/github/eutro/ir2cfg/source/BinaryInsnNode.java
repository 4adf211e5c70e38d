package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * An arithmetic or bitwise instruction. Both operands have the type of {@link #lhs}.
 */
public class BinaryInsnNode extends AbstractInsnNode {
    public final TypedValue lhs;
    public final ValueNode rhs;

    public BinaryInsnNode(Opcode opcode, TypedValue lhs, ValueNode rhs) {
        super(opcode);
        checkOpcode(opcode.isBinary());
        this.lhs = Objects.requireNonNull(lhs);
        this.rhs = Objects.requireNonNull(rhs);
    }

    @Override
    public String toString() {
        return opcode + " " + lhs + ", " + rhs;
    }
}
