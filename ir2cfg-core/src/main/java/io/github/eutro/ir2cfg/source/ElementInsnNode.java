package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * An {@code extractelement} or {@code insertelement} instruction, indexing into a vector.
 */
public class ElementInsnNode extends AbstractInsnNode {
    public final TypedValue vector;
    /**
     * The inserted element, null for {@code extractelement}.
     */
    @Nullable
    public final TypedValue element;
    public final TypedValue index;

    private ElementInsnNode(Opcode opcode, TypedValue vector, @Nullable TypedValue element, TypedValue index) {
        super(opcode);
        this.vector = Objects.requireNonNull(vector);
        this.element = element;
        this.index = Objects.requireNonNull(index);
    }

    public static ElementInsnNode extract(TypedValue vector, TypedValue index) {
        return new ElementInsnNode(Opcode.EXTRACTELEMENT, vector, null, index);
    }

    public static ElementInsnNode insert(TypedValue vector, TypedValue element, TypedValue index) {
        return new ElementInsnNode(Opcode.INSERTELEMENT, vector, Objects.requireNonNull(element), index);
    }

    @Override
    public String toString() {
        return opcode + " " + vector + (element == null ? "" : ", " + element) + ", " + index;
    }
}
