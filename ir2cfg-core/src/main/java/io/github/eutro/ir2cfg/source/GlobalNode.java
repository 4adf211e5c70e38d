package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A global variable, with its initializer if it is defined in this module.
 */
public final class GlobalNode {
    public final String symbol;
    public final TypeNode type;
    @Nullable
    public final ValueNode init;
    public final boolean constant;

    public GlobalNode(String symbol, TypeNode type, @Nullable ValueNode init, boolean constant) {
        this.symbol = Objects.requireNonNull(symbol);
        this.type = Objects.requireNonNull(type);
        this.init = init;
        this.constant = constant;
    }

    @Override
    public String toString() {
        return "@" + symbol + " = " + (constant ? "constant " : "global ") + type + (init == null ? "" : " " + init);
    }
}
