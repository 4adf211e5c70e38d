package io.github.eutro.ir2cfg.source;

import java.util.Objects;

public class LoadInsnNode extends AbstractInsnNode {
    public final TypedValue ptr;
    public final int align;

    public LoadInsnNode(TypedValue ptr, int align) {
        super(Opcode.LOAD);
        this.ptr = Objects.requireNonNull(ptr);
        this.align = align;
    }

    public LoadInsnNode(TypedValue ptr) {
        this(ptr, 0);
    }

    @Override
    public String toString() {
        return opcode + " " + ptr;
    }
}
