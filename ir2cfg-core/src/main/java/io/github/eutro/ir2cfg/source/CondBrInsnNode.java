package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * A conditional {@code br} on an {@code i1}.
 */
public class CondBrInsnNode extends AbstractInsnNode {
    public final TypedValue cond;
    public final BlockLabel ifTrue;
    public final BlockLabel ifFalse;

    public CondBrInsnNode(TypedValue cond, BlockLabel ifTrue, BlockLabel ifFalse) {
        super(Opcode.CONDBR);
        this.cond = Objects.requireNonNull(cond);
        this.ifTrue = Objects.requireNonNull(ifTrue);
        this.ifFalse = Objects.requireNonNull(ifFalse);
    }

    @Override
    public String toString() {
        return "br " + cond + ", label " + ifTrue + ", label " + ifFalse;
    }
}
