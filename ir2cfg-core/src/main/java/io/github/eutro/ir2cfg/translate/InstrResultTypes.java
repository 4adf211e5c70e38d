package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.AbstractInsnNode;
import io.github.eutro.ir2cfg.source.AggregateInsnNode;
import io.github.eutro.ir2cfg.source.AllocaInsnNode;
import io.github.eutro.ir2cfg.source.BinaryInsnNode;
import io.github.eutro.ir2cfg.source.CallInsnNode;
import io.github.eutro.ir2cfg.source.CmpInsnNode;
import io.github.eutro.ir2cfg.source.ConvInsnNode;
import io.github.eutro.ir2cfg.source.ElementInsnNode;
import io.github.eutro.ir2cfg.source.GepInsnNode;
import io.github.eutro.ir2cfg.source.LoadInsnNode;
import io.github.eutro.ir2cfg.source.PhiInsnNode;
import io.github.eutro.ir2cfg.source.SelectInsnNode;
import io.github.eutro.ir2cfg.source.TypeContext;
import io.github.eutro.ir2cfg.source.TypeNode;
import io.github.eutro.ir2cfg.source.TypedValue;
import io.github.eutro.ir2cfg.source.ValueNode;
import io.github.eutro.ir2cfg.types.TypeLiftException;

/**
 * The source type of the value each instruction produces.
 */
public final class InstrResultTypes {
    private InstrResultTypes() {
    }

    /**
     * Get the type of an instruction's result.
     *
     * @param insn The instruction.
     * @param tc   The context to resolve named types in.
     * @return The type. {@link TypeNode#VOID} for calls to routines returning nothing.
     * @throws TypeLiftException If the instruction produces no value, or is ill-typed.
     */
    public static TypeNode resultType(AbstractInsnNode insn, TypeContext tc) {
        switch (insn.opcode) {
            case ICMP:
            case FCMP: {
                TypeNode operand = tc.resolve(((CmpInsnNode) insn).lhs.type);
                if (operand instanceof TypeNode.VectorType) {
                    return TypeNode.vector(((TypeNode.VectorType) operand).length, TypeNode.I1);
                }
                return TypeNode.I1;
            }
            case ALLOCA:
                return TypeNode.ptrTo(((AllocaInsnNode) insn).type);
            case LOAD:
                return pointee(((LoadInsnNode) insn).ptr, tc);
            case GETELEMENTPTR:
                return gepResult((GepInsnNode) insn, tc);
            case CALL: {
                CallInsnNode call = (CallInsnNode) insn;
                TypeNode.FunctionType fnType = call.calleeType.asCalleeType(tc);
                if (fnType == null) throw new TypeLiftException(call.calleeType, "callee is not a function");
                return fnType.ret;
            }
            case PHI:
                return ((PhiInsnNode) insn).type;
            case SELECT:
                return ((SelectInsnNode) insn).ifTrue.type;
            case EXTRACTVALUE: {
                AggregateInsnNode agg = (AggregateInsnNode) insn;
                TypeNode ty = agg.aggregate.type;
                for (int index : agg.indices) {
                    ty = member(ty, index, tc);
                }
                return ty;
            }
            case INSERTVALUE:
                return ((AggregateInsnNode) insn).aggregate.type;
            case EXTRACTELEMENT: {
                TypeNode vec = tc.resolve(((ElementInsnNode) insn).vector.type);
                if (!(vec instanceof TypeNode.VectorType)) throw new TypeLiftException(vec, "not a vector");
                return ((TypeNode.VectorType) vec).element;
            }
            case INSERTELEMENT:
                return ((ElementInsnNode) insn).vector.type;
            default:
                if (insn.opcode.isBinary()) return ((BinaryInsnNode) insn).lhs.type;
                if (insn.opcode.isConversion()) return ((ConvInsnNode) insn).to;
                throw new TypeLiftException(null, "Instruction " + insn.opcode + " produces no value");
        }
    }

    static TypeNode pointee(TypedValue ptr, TypeContext tc) {
        TypeNode ty = tc.resolve(ptr.type);
        if (!(ty instanceof TypeNode.PointerType)) throw new TypeLiftException(ptr.type, "not a pointer");
        return ((TypeNode.PointerType) ty).pointee;
    }

    private static TypeNode gepResult(GepInsnNode gep, TypeContext tc) {
        TypeNode ty = pointee(gep.base, tc);
        // the first index only steps over the base pointer
        for (int i = 1; i < gep.indices.size(); i++) {
            TypeNode agg = tc.resolve(ty);
            if (agg instanceof TypeNode.StructType) {
                ValueNode index = gep.indices.get(i).value;
                if (!(index instanceof ValueNode.IntValue)) {
                    throw new TypeLiftException(agg, "struct member selected by non-constant index " + index);
                }
                ty = member(agg, ((ValueNode.IntValue) index).value, tc);
            } else {
                ty = member(agg, 0, tc);
            }
        }
        return TypeNode.ptrTo(ty);
    }

    private static TypeNode member(TypeNode aggregate, long index, TypeContext tc) {
        TypeNode agg = tc.resolve(aggregate);
        if (agg instanceof TypeNode.StructType) {
            TypeNode.StructType st = (TypeNode.StructType) agg;
            if (index < 0 || index >= st.fields.size()) {
                throw new TypeLiftException(agg, "member index " + index + " out of range");
            }
            return st.fields.get((int) index);
        }
        if (agg instanceof TypeNode.ArrayType) return ((TypeNode.ArrayType) agg).element;
        if (agg instanceof TypeNode.VectorType) return ((TypeNode.VectorType) agg).element;
        throw new TypeLiftException(agg, "not an aggregate");
    }
}
