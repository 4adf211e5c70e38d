package io.github.eutro.ir2cfg.source;

import java.util.Objects;

/**
 * A source operand: a local identifier, a global symbol, a constant, or metadata.
 */
public abstract class ValueNode {
    public static final ValueNode NULL = new Simple("null");
    public static final ValueNode UNDEF = new Simple("undef");
    public static final ValueNode ZERO_INIT = new Simple("zeroinitializer");

    ValueNode() {
    }

    public static IdentValue ident(Ident ident) {
        return new IdentValue(ident);
    }

    public static IdentValue ident(String name) {
        return new IdentValue(Ident.of(name));
    }

    public static SymbolValue symbol(String symbol) {
        return new SymbolValue(symbol);
    }

    public static IntValue integer(long value) {
        return new IntValue(value);
    }

    public static BoolValue bool(boolean value) {
        return value ? BoolValue.TRUE : BoolValue.FALSE;
    }

    public static FloatValue floating(double value, boolean single) {
        return new FloatValue(value, single);
    }

    public static MdValue md(ValMd md) {
        return new MdValue(md);
    }

    private static final class Simple extends ValueNode {
        private final String name;

        Simple(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class IdentValue extends ValueNode {
        public final Ident ident;

        IdentValue(Ident ident) {
            this.ident = Objects.requireNonNull(ident);
        }

        @Override
        public String toString() {
            return ident.toString();
        }
    }

    public static final class SymbolValue extends ValueNode {
        public final String symbol;

        SymbolValue(String symbol) {
            this.symbol = Objects.requireNonNull(symbol);
        }

        @Override
        public String toString() {
            return "@" + symbol;
        }
    }

    public static final class IntValue extends ValueNode {
        public final long value;

        IntValue(long value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    public static final class BoolValue extends ValueNode {
        static final BoolValue TRUE = new BoolValue(true);
        static final BoolValue FALSE = new BoolValue(false);

        public final boolean value;

        private BoolValue(boolean value) {
            this.value = value;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    public static final class FloatValue extends ValueNode {
        public final double value;
        public final boolean single;

        FloatValue(double value, boolean single) {
            this.value = value;
            this.single = single;
        }

        @Override
        public String toString() {
            return single ? Float.toString((float) value) : Double.toString(value);
        }
    }

    /**
     * A metadata operand, only meaningful as an argument to an intrinsic.
     */
    public static final class MdValue extends ValueNode {
        public final ValMd md;

        MdValue(ValMd md) {
            this.md = Objects.requireNonNull(md);
        }

        @Override
        public String toString() {
            return "metadata " + md;
        }
    }
}
