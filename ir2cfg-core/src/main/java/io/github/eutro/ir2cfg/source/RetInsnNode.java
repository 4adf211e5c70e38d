package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

public class RetInsnNode extends AbstractInsnNode {
    @Nullable
    public final TypedValue value;

    public RetInsnNode(@Nullable TypedValue value) {
        super(Opcode.RET);
        this.value = value;
    }

    @Override
    public String toString() {
        return value == null ? "ret void" : opcode + " " + value;
    }
}
