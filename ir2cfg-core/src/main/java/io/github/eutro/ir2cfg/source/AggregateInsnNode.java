package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Objects;

/**
 * An {@code extractvalue} or {@code insertvalue} instruction, indexing into a struct or array
 * by constant indices.
 */
public class AggregateInsnNode extends AbstractInsnNode {
    public final TypedValue aggregate;
    /**
     * The inserted element, null for {@code extractvalue}.
     */
    @Nullable
    public final TypedValue element;
    public final int[] indices;

    private AggregateInsnNode(Opcode opcode, TypedValue aggregate, @Nullable TypedValue element, int[] indices) {
        super(opcode);
        this.aggregate = Objects.requireNonNull(aggregate);
        this.element = element;
        this.indices = indices.clone();
    }

    public static AggregateInsnNode extract(TypedValue aggregate, int... indices) {
        return new AggregateInsnNode(Opcode.EXTRACTVALUE, aggregate, null, indices);
    }

    public static AggregateInsnNode insert(TypedValue aggregate, TypedValue element, int... indices) {
        return new AggregateInsnNode(Opcode.INSERTVALUE, aggregate, Objects.requireNonNull(element), indices);
    }

    @Override
    public String toString() {
        return opcode + " " + aggregate + (element == null ? "" : ", " + element) + ", " + Arrays.toString(indices);
    }
}
