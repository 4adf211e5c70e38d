package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A {@code getelementptr} instruction.
 * <p>
 * The first index steps over the base pointer; each further index selects a member
 * of the aggregate reached so far. Struct members must be selected by constant indices.
 */
public class GepInsnNode extends AbstractInsnNode {
    public final boolean inBounds;
    public final TypedValue base;
    public final List<TypedValue> indices;

    public GepInsnNode(boolean inBounds, TypedValue base, List<TypedValue> indices) {
        super(Opcode.GETELEMENTPTR);
        this.inBounds = inBounds;
        this.base = Objects.requireNonNull(base);
        this.indices = Collections.unmodifiableList(new ArrayList<>(indices));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder().append(opcode);
        if (inBounds) sb.append(" inbounds");
        sb.append(' ').append(base);
        for (TypedValue index : indices) {
            sb.append(", ").append(index);
        }
        return sb.toString();
    }
}
