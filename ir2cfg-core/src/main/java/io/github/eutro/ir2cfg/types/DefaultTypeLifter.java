package io.github.eutro.ir2cfg.types;

import io.github.eutro.ir2cfg.source.TypeContext;
import io.github.eutro.ir2cfg.source.TypeNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The standard mapping of source types: integers to bitvectors, arrays and vectors to
 * {@link CType.Vector vectors}, structs to {@link CType.Struct structs}, and every pointer
 * to the same {@link CType.Pointer pointer} type.
 * <p>
 * A named type that contains itself other than through a pointer cannot be lifted.
 */
public class DefaultTypeLifter implements TypeLifter {
    /**
     * A lifter for 64-bit pointers.
     */
    public static final DefaultTypeLifter INSTANCE = new DefaultTypeLifter(64);

    private final CType.Pointer pointerType;

    public DefaultTypeLifter(int pointerWidth) {
        if (pointerWidth <= 0) {
            throw new IllegalArgumentException("pointer width must be positive, got " + pointerWidth);
        }
        this.pointerType = CType.pointer(pointerWidth);
    }

    @Override
    public CType pointerType() {
        return pointerType;
    }

    @Override
    public CType liftMemType(TypeNode type, TypeContext tc) {
        return lift(type, tc, new LinkedHashSet<>());
    }

    private CType lift(TypeNode type, TypeContext tc, Set<String> expanding) {
        if (type instanceof TypeNode.IntType) {
            int bits = ((TypeNode.IntType) type).bits;
            if (bits <= 0) throw new TypeLiftException(type, "integer width must be positive");
            return CType.bitvector(bits);
        }
        if (type instanceof TypeNode.FloatType) {
            return CType.floating(liftFloat((TypeNode.FloatType) type));
        }
        if (type instanceof TypeNode.PointerType) {
            return pointerType;
        }
        if (type instanceof TypeNode.ArrayType) {
            return CType.vector(lift(((TypeNode.ArrayType) type).element, tc, expanding));
        }
        if (type instanceof TypeNode.VectorType) {
            return CType.vector(lift(((TypeNode.VectorType) type).element, tc, expanding));
        }
        if (type instanceof TypeNode.StructType) {
            List<CType> fields = new ArrayList<>();
            for (TypeNode field : ((TypeNode.StructType) type).fields) {
                fields.add(lift(field, tc, expanding));
            }
            return CType.struct(fields);
        }
        if (type instanceof TypeNode.Alias) {
            String name = ((TypeNode.Alias) type).name;
            if (!expanding.add(name)) {
                throw new TypeLiftException(type, "type contains itself through " + expanding);
            }
            CType lifted = lift(tc.resolve(type), tc, expanding);
            expanding.remove(name);
            return lifted;
        }
        throw new TypeLiftException(type, "not a first-class value type");
    }

    private static CType.FloatInfo liftFloat(TypeNode.FloatType type) {
        switch (type.kind) {
            case HALF:
                return CType.FloatInfo.HALF;
            case FLOAT:
                return CType.FloatInfo.SINGLE;
            case DOUBLE:
                return CType.FloatInfo.DOUBLE;
            case FP128:
                return CType.FloatInfo.QUAD;
            case X86_FP80:
                return CType.FloatInfo.X86_80;
            default:
                throw new TypeLiftException(type, "unsupported floating point format");
        }
    }
}
