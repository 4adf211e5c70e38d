package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * An unconditional {@code br}.
 */
public class JumpInsnNode extends AbstractInsnNode {
    public final BlockLabel target;

    public JumpInsnNode(BlockLabel target) {
        super(Opcode.BR);
        this.target = Objects.requireNonNull(target);
    }

    @Override
    public String toString() {
        return opcode + " label " + target;
    }
}
