package io.github.eutro.ir2cfg.source;

/**
 * A source instruction.
 */
public abstract class AbstractInsnNode {
    /**
     * The opcode of the instruction.
     */
    public final Opcode opcode;

    protected AbstractInsnNode(Opcode opcode) {
        this.opcode = opcode;
    }

    protected void checkOpcode(boolean ok) {
        if (!ok) {
            throw new IllegalArgumentException("Opcode " + opcode + " not valid for " + getClass().getSimpleName());
        }
    }
}
