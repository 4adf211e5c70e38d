package io.github.eutro.ir2cfg.source;

import java.util.Objects;

public class StoreInsnNode extends AbstractInsnNode {
    public final TypedValue value;
    public final TypedValue ptr;
    public final int align;

    public StoreInsnNode(TypedValue value, TypedValue ptr, int align) {
        super(Opcode.STORE);
        this.value = Objects.requireNonNull(value);
        this.ptr = Objects.requireNonNull(ptr);
        this.align = align;
    }

    public StoreInsnNode(TypedValue value, TypedValue ptr) {
        this(value, ptr, 0);
    }

    @Override
    public String toString() {
        return opcode + " " + value + ", " + ptr;
    }
}
