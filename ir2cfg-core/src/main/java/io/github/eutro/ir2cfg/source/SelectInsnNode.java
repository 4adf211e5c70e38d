package io.github.eutro.ir2cfg.source;

import java.util.Objects;

public class SelectInsnNode extends AbstractInsnNode {
    public final TypedValue cond;
    public final TypedValue ifTrue;
    public final ValueNode ifFalse;

    public SelectInsnNode(TypedValue cond, TypedValue ifTrue, ValueNode ifFalse) {
        super(Opcode.SELECT);
        this.cond = Objects.requireNonNull(cond);
        this.ifTrue = Objects.requireNonNull(ifTrue);
        this.ifFalse = Objects.requireNonNull(ifFalse);
    }

    @Override
    public String toString() {
        return opcode + " " + cond + ", " + ifTrue + ", " + ifFalse;
    }
}
