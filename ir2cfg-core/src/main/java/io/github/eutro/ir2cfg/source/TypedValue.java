package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * An operand, together with its source type.
 */
public final class TypedValue {
    public final TypeNode type;
    public final ValueNode value;

    public TypedValue(TypeNode type, ValueNode value) {
        this.type = Objects.requireNonNull(type);
        this.value = Objects.requireNonNull(value);
    }

    public static TypedValue of(TypeNode type, ValueNode value) {
        return new TypedValue(type, value);
    }

    @Override
    public String toString() {
        return type + " " + value;
    }
}
