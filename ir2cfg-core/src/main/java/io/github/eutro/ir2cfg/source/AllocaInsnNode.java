package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public class AllocaInsnNode extends AbstractInsnNode {
    public final TypeNode type;
    @Nullable
    public final TypedValue count;
    public final int align;

    public AllocaInsnNode(TypeNode type, @Nullable TypedValue count, int align) {
        super(Opcode.ALLOCA);
        this.type = Objects.requireNonNull(type);
        this.count = count;
        this.align = align;
    }

    public AllocaInsnNode(TypeNode type) {
        this(type, null, 0);
    }

    @Override
    public String toString() {
        return opcode + " " + type + (count == null ? "" : ", " + count) + (align == 0 ? "" : ", align " + align);
    }
}
