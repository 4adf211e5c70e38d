package io.github.eutro.ir2cfg.source;

/**
 * An instruction with no operands, such as {@code unreachable}.
 */
public class InsnNode extends AbstractInsnNode {
    public InsnNode(Opcode opcode) {
        super(opcode);
        checkOpcode(opcode == Opcode.UNREACHABLE);
    }

    @Override
    public String toString() {
        return opcode.toString();
    }
}
