package io.github.eutro.ir2cfg.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The static type of a register in the target CFG.
 * <p>
 * Types are immutable values, compared structurally.
 */
public abstract class CType {
    /**
     * The type of routines that return nothing.
     */
    public static final CType UNIT = new Simple("unit");
    /**
     * A dynamically typed value, only used for vararg packs.
     */
    public static final CType ANY = new Simple("any");

    CType() {
    }

    /**
     * Get the bitvector type of the given width.
     *
     * @param width The width, in bits. Must be positive.
     * @return The type.
     */
    public static BitVector bitvector(int width) {
        return new BitVector(width);
    }

    /**
     * Get the floating point type of the given precision.
     *
     * @param info The precision.
     * @return The type.
     */
    public static FloatT floating(FloatInfo info) {
        return new FloatT(info);
    }

    /**
     * Get the pointer type of the given width.
     *
     * @param width The width of a pointer's offset, in bits.
     * @return The type.
     */
    public static Pointer pointer(int width) {
        return new Pointer(width);
    }

    /**
     * Get the vector type with the given element.
     *
     * @param element The element type.
     * @return The type.
     */
    public static Vector vector(CType element) {
        return new Vector(element);
    }

    /**
     * Get the struct type with the given fields.
     *
     * @param fields The field types.
     * @return The type.
     */
    public static Struct struct(CType... fields) {
        return new Struct(Arrays.asList(fields));
    }

    /**
     * Get the struct type with the given fields.
     *
     * @param fields The field types.
     * @return The type.
     */
    public static Struct struct(List<CType> fields) {
        return new Struct(fields);
    }

    /**
     * Floating point precisions.
     */
    public enum FloatInfo {
        HALF("half"),
        SINGLE("float"),
        DOUBLE("double"),
        QUAD("fp128"),
        X86_80("x86_fp80");

        private final String mnemonic;

        FloatInfo(String mnemonic) {
            this.mnemonic = mnemonic;
        }

        @Override
        public String toString() {
            return mnemonic;
        }
    }

    private static final class Simple extends CType {
        private final String name;

        private Simple(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A fixed-width bitvector.
     */
    public static final class BitVector extends CType {
        public final int width;

        private BitVector(int width) {
            if (width <= 0) {
                throw new IllegalArgumentException("bitvector width must be positive, got " + width);
            }
            this.width = width;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof BitVector && ((BitVector) o).width == width;
        }

        @Override
        public int hashCode() {
            return width * 31 + 1;
        }

        @Override
        public String toString() {
            return "bv" + width;
        }
    }

    /**
     * A floating point value.
     */
    public static final class FloatT extends CType {
        public final FloatInfo info;

        private FloatT(FloatInfo info) {
            this.info = Objects.requireNonNull(info);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FloatT && ((FloatT) o).info == info;
        }

        @Override
        public int hashCode() {
            return info.hashCode();
        }

        @Override
        public String toString() {
            return info.toString();
        }
    }

    /**
     * A pointer, as a block and an offset of the given width.
     */
    public static final class Pointer extends CType {
        public final int width;

        private Pointer(int width) {
            this.width = width;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Pointer && ((Pointer) o).width == width;
        }

        @Override
        public int hashCode() {
            return width * 31 + 2;
        }

        @Override
        public String toString() {
            return "ptr" + width;
        }
    }

    /**
     * A homogeneous sequence of values. Used for both source arrays and source vectors.
     */
    public static final class Vector extends CType {
        public final CType element;

        private Vector(CType element) {
            this.element = Objects.requireNonNull(element);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Vector && ((Vector) o).element.equals(element);
        }

        @Override
        public int hashCode() {
            return element.hashCode() * 31 + 3;
        }

        @Override
        public String toString() {
            return "vector<" + element + ">";
        }
    }

    /**
     * A tuple of values.
     */
    public static final class Struct extends CType {
        public final List<CType> fields;

        private Struct(List<CType> fields) {
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Struct && ((Struct) o).fields.equals(fields);
        }

        @Override
        public int hashCode() {
            return fields.hashCode() * 31 + 4;
        }

        @Override
        public String toString() {
            return fields.stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "struct{", "}"));
        }
    }
}
