package io.github.eutro.ir2cfg.source;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A source-level type.
 * <p>
 * Named types are referenced through {@link Alias} and resolved with a {@link TypeContext}.
 */
public abstract class TypeNode {
    public static final TypeNode VOID = new Prim("void");
    public static final TypeNode LABEL = new Prim("label");
    public static final TypeNode METADATA = new Prim("metadata");
    public static final TypeNode OPAQUE = new Prim("opaque");

    public static final IntType I1 = new IntType(1);
    public static final IntType I8 = new IntType(8);
    public static final IntType I32 = new IntType(32);
    public static final IntType I64 = new IntType(64);

    TypeNode() {
    }

    public static IntType integer(int bits) {
        return new IntType(bits);
    }

    public static FloatType floating(FloatType.Kind kind) {
        return new FloatType(kind);
    }

    public static PointerType ptrTo(TypeNode pointee) {
        return new PointerType(pointee);
    }

    public static ArrayType array(long length, TypeNode element) {
        return new ArrayType(length, element);
    }

    public static VectorType vector(long length, TypeNode element) {
        return new VectorType(length, element);
    }

    public static StructType struct(boolean packed, TypeNode... fields) {
        return new StructType(packed, Arrays.asList(fields));
    }

    public static FunctionType function(TypeNode ret, List<TypeNode> params, boolean varArgs) {
        return new FunctionType(ret, params, varArgs);
    }

    public static Alias alias(String name) {
        return new Alias(name);
    }

    private static final class Prim extends TypeNode {
        private final String name;

        Prim(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    public static final class IntType extends TypeNode {
        public final int bits;

        IntType(int bits) {
            this.bits = bits;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof IntType && ((IntType) o).bits == bits;
        }

        @Override
        public int hashCode() {
            return bits;
        }

        @Override
        public String toString() {
            return "i" + bits;
        }
    }

    public static final class FloatType extends TypeNode {
        public enum Kind {
            HALF, FLOAT, DOUBLE, FP128, X86_FP80, PPC_FP128
        }

        public final Kind kind;

        FloatType(Kind kind) {
            this.kind = Objects.requireNonNull(kind);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof FloatType && ((FloatType) o).kind == kind;
        }

        @Override
        public int hashCode() {
            return kind.hashCode();
        }

        @Override
        public String toString() {
            return kind.name().toLowerCase();
        }
    }

    public static final class PointerType extends TypeNode {
        public final TypeNode pointee;

        PointerType(TypeNode pointee) {
            this.pointee = Objects.requireNonNull(pointee);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof PointerType && ((PointerType) o).pointee.equals(pointee);
        }

        @Override
        public int hashCode() {
            return pointee.hashCode() * 31 + 7;
        }

        @Override
        public String toString() {
            return pointee + "*";
        }
    }

    public static final class ArrayType extends TypeNode {
        public final long length;
        public final TypeNode element;

        ArrayType(long length, TypeNode element) {
            this.length = length;
            this.element = Objects.requireNonNull(element);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof ArrayType)) return false;
            ArrayType that = (ArrayType) o;
            return length == that.length && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(length, element, "array");
        }

        @Override
        public String toString() {
            return "[" + length + " x " + element + "]";
        }
    }

    public static final class VectorType extends TypeNode {
        public final long length;
        public final TypeNode element;

        VectorType(long length, TypeNode element) {
            this.length = length;
            this.element = Objects.requireNonNull(element);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof VectorType)) return false;
            VectorType that = (VectorType) o;
            return length == that.length && element.equals(that.element);
        }

        @Override
        public int hashCode() {
            return Objects.hash(length, element, "vector");
        }

        @Override
        public String toString() {
            return "<" + length + " x " + element + ">";
        }
    }

    public static final class StructType extends TypeNode {
        public final boolean packed;
        public final List<TypeNode> fields;

        StructType(boolean packed, List<TypeNode> fields) {
            this.packed = packed;
            this.fields = Collections.unmodifiableList(new ArrayList<>(fields));
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof StructType)) return false;
            StructType that = (StructType) o;
            return packed == that.packed && fields.equals(that.fields);
        }

        @Override
        public int hashCode() {
            return Objects.hash(packed, fields);
        }

        @Override
        public String toString() {
            String body = fields.stream().map(Objects::toString).collect(Collectors.joining(", ", "{ ", " }"));
            return packed ? "<" + body + ">" : body;
        }
    }

    public static final class FunctionType extends TypeNode {
        public final TypeNode ret;
        public final List<TypeNode> params;
        public final boolean varArgs;

        FunctionType(TypeNode ret, List<TypeNode> params, boolean varArgs) {
            this.ret = Objects.requireNonNull(ret);
            this.params = Collections.unmodifiableList(new ArrayList<>(params));
            this.varArgs = varArgs;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FunctionType)) return false;
            FunctionType that = (FunctionType) o;
            return varArgs == that.varArgs && ret.equals(that.ret) && params.equals(that.params);
        }

        @Override
        public int hashCode() {
            return Objects.hash(ret, params, varArgs);
        }

        @Override
        public String toString() {
            List<String> ps = params.stream().map(Objects::toString).collect(Collectors.toList());
            if (varArgs) ps.add("...");
            return ret + " (" + String.join(", ", ps) + ")";
        }
    }

    /**
     * A reference to a named type, such as {@code %struct.node}.
     */
    public static final class Alias extends TypeNode {
        public final String name;

        Alias(String name) {
            this.name = Objects.requireNonNull(name);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Alias && ((Alias) o).name.equals(name);
        }

        @Override
        public int hashCode() {
            return name.hashCode() * 31 + 11;
        }

        @Override
        public String toString() {
            return "%" + name;
        }
    }

    /**
     * Get the function type a callee of this type has, looking through one level of pointer.
     *
     * @param tc The type context to resolve aliases in.
     * @return The function type, or null if this is not a (pointer to a) function type.
     */
    public @Nullable FunctionType asCalleeType(TypeContext tc) {
        TypeNode ty = tc.resolve(this);
        if (ty instanceof PointerType) {
            ty = tc.resolve(((PointerType) ty).pointee);
        }
        return ty instanceof FunctionType ? (FunctionType) ty : null;
    }
}
