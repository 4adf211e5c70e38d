package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ops.CfgOps;
import io.github.eutro.ir2cfg.ops.CommonOps;
import io.github.eutro.ir2cfg.ops.Op;
import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.IRBuilder;
import io.github.eutro.ir2cfg.ssa.Insn;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.types.CType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lowers the statements of one source block into a target basic block.
 * <p>
 * Every identifier must already have its register, see {@link InferRegisterTypes}.
 * Phis emit nothing where they stand; their copies are emitted by the branches into their block.
 */
public final class BlockTranslator {
    private static final Logger LOGGER = LoggerFactory.getLogger(BlockTranslator.class);
    private static final String DBG_INTRINSIC_PREFIX = "llvm.dbg.";

    private BlockTranslator() {
    }

    /**
     * Lower a source block.
     *
     * @param rs The routine state.
     * @param bn The source block.
     * @param bb The block to lower into.
     * @throws MissingTerminatorException If the block does not end in a terminator.
     */
    public static void translate(RoutineState rs, BlockNode bn, BasicBlock bb) {
        rs.currentLabel = bn.label;
        IRBuilder ib = new IRBuilder(rs.func, bb);
        List<StmtNode> stmts = bn.stmts;
        for (int i = 0; i < stmts.size(); i++) {
            StmtNode stmt = stmts.get(i);
            List<DebugAnnotation> annotations = rs.debugMap.effective(stmt);
            rs.cursor.update(annotations);
            ib.setLocation(rs.cursor.current());
            ib.setAnnotations(annotations);

            Converter converter = CONVERTERS.get(stmt.insn.opcode);
            if (converter == null) {
                throw new UnsupportedInstructionException(stmt.insn, "no lowering");
            }
            converter.convert(rs, ib, stmt);

            if (stmt.insn.opcode.terminator) {
                if (i + 1 < stmts.size()) {
                    LOGGER.debug("Ignoring {} statement(s) after the terminator of {}", stmts.size() - i - 1, bn.label);
                }
                return;
            }
        }
        throw new MissingTerminatorException(bn.label);
    }

    /**
     * Get the register holding an operand, emitting the effect that produces it if it is a constant.
     *
     * @param rs   The routine state.
     * @param ib   The builder to emit into.
     * @param type The operand's type.
     * @param v    The operand.
     * @return The register.
     */
    static Var value(RoutineState rs, IRBuilder ib, TypeNode type, ValueNode v) {
        if (v instanceof ValueNode.IdentValue) {
            return rs.identMap.get(((ValueNode.IdentValue) v).ident);
        }
        Insn insn;
        if (v instanceof ValueNode.SymbolValue) {
            String symbol = ((ValueNode.SymbolValue) v).symbol;
            Optional<FnHandle> handle = rs.registry.lookup(symbol);
            insn = handle.isPresent()
                    ? CfgOps.FUNC_PTR.create(handle.get()).insn()
                    : CfgOps.GLOBAL_PTR.create(symbol).insn();
        } else if (v instanceof ValueNode.IntValue) {
            insn = CommonOps.constant(((ValueNode.IntValue) v).value);
        } else if (v instanceof ValueNode.BoolValue) {
            insn = CommonOps.constant(((ValueNode.BoolValue) v).value);
        } else if (v instanceof ValueNode.FloatValue) {
            ValueNode.FloatValue fv = (ValueNode.FloatValue) v;
            insn = fv.single ? CommonOps.constant((float) fv.value) : CommonOps.constant(fv.value);
        } else if (v == ValueNode.NULL) {
            insn = CfgOps.NULL_PTR.insn();
        } else if (v == ValueNode.UNDEF) {
            insn = CfgOps.UNDEF.insn();
        } else if (v == ValueNode.ZERO_INIT) {
            insn = CfgOps.ZERO.insn();
        } else {
            throw new TranslationException("Operand " + v + " of type " + type + " is not a value");
        }
        return ib.insert(insn, rs.newTemp("k", rs.lift(type)));
    }

    private static Var value(RoutineState rs, IRBuilder ib, TypedValue tv) {
        return value(rs, ib, tv.type, tv.value);
    }

    private static void emit(RoutineState rs, IRBuilder ib, StmtNode stmt, Insn insn) {
        if (stmt.result == null) {
            ib.insert(insn.assignTo());
        } else {
            ib.insert(insn, rs.identMap.get(stmt.result));
        }
    }

    /**
     * Emit the copies owed on the edge from the current block into {@code target},
     * as one parallel copy. If a target is assigned twice on the edge, the first value wins.
     */
    private static void emitCopies(RoutineState rs, IRBuilder ib, BlockInfo target) {
        if (rs.currentLabel == null) return;
        List<PhiObligation> obligations = target.phisFrom(rs.currentLabel);
        if (obligations.isEmpty()) return;
        Map<Ident, PhiObligation> byTarget = new LinkedHashMap<>();
        for (PhiObligation obligation : obligations) {
            byTarget.putIfAbsent(obligation.target, obligation);
        }
        List<Var> sources = new ArrayList<>();
        List<Var> targets = new ArrayList<>();
        for (PhiObligation obligation : byTarget.values()) {
            sources.add(value(rs, ib, obligation.value));
            targets.add(rs.identMap.get(obligation.target));
        }
        Effect copy = CommonOps.IDENTITY.insn(sources).assignTo(targets);
        copy.attachExt(CommonExts.IS_PHI, true);
        ib.insert(copy);
    }

    private static void jump(RoutineState rs, IRBuilder ib, BlockLabel label) {
        BlockInfo info = rs.blockInfo(label);
        emitCopies(rs, ib, info);
        ib.insertCtrl(Control.br(info.block));
    }

    /**
     * Get the block a multi-way branch should jump to for one of its edges.
     * An edge that owes copies gets a block of its own, holding them and a jump.
     */
    private static BasicBlock edgeTo(RoutineState rs, IRBuilder ib, BlockLabel label) {
        BlockInfo info = rs.blockInfo(label);
        if (rs.currentLabel == null || info.phisFrom(rs.currentLabel).isEmpty()) {
            return info.block;
        }
        BasicBlock from = ib.getBlock();
        BasicBlock edge = rs.func.newBb();
        edge.attachExt(CfgExts.IS_EDGE_BLOCK, true);
        ib.setBlock(edge);
        jump(rs, ib, label);
        ib.setBlock(from);
        return edge;
    }

    private interface Converter {
        void convert(RoutineState rs, IRBuilder ib, StmtNode stmt);
    }

    private static final Map<Opcode, Converter> CONVERTERS = new EnumMap<>(Opcode.class);

    static {
        Converter binary = (rs, ib, stmt) -> {
            BinaryInsnNode insn = (BinaryInsnNode) stmt.insn;
            Var lhs = value(rs, ib, insn.lhs);
            Var rhs = value(rs, ib, insn.lhs.type, insn.rhs);
            emit(rs, ib, stmt, CfgOps.BINOP.create(insn.opcode).insn(lhs, rhs));
        };
        Converter conversion = (rs, ib, stmt) -> {
            ConvInsnNode insn = (ConvInsnNode) stmt.insn;
            emit(rs, ib, stmt, CfgOps.CONV.create(insn.opcode).insn(value(rs, ib, insn.value)));
        };
        for (Opcode opcode : Opcode.values()) {
            if (opcode.isBinary()) CONVERTERS.put(opcode, binary);
            else if (opcode.isConversion()) CONVERTERS.put(opcode, conversion);
        }

        Converter cmp = (rs, ib, stmt) -> {
            CmpInsnNode insn = (CmpInsnNode) stmt.insn;
            Var lhs = value(rs, ib, insn.lhs);
            Var rhs = value(rs, ib, insn.lhs.type, insn.rhs);
            emit(rs, ib, stmt, CfgOps.CMP.create(insn.predicate).insn(lhs, rhs));
        };
        CONVERTERS.put(Opcode.ICMP, cmp);
        CONVERTERS.put(Opcode.FCMP, cmp);

        CONVERTERS.put(Opcode.ALLOCA, (rs, ib, stmt) -> {
            AllocaInsnNode insn = (AllocaInsnNode) stmt.insn;
            Op op = CfgOps.ALLOCA.create(rs.lift(insn.type));
            emit(rs, ib, stmt, insn.count == null ? op.insn() : op.insn(value(rs, ib, insn.count)));
        });
        CONVERTERS.put(Opcode.LOAD, (rs, ib, stmt) -> {
            LoadInsnNode insn = (LoadInsnNode) stmt.insn;
            CType ty = rs.lift(InstrResultTypes.pointee(insn.ptr, rs.tc));
            emit(rs, ib, stmt, CfgOps.LOAD.create(ty).insn(value(rs, ib, insn.ptr)));
        });
        CONVERTERS.put(Opcode.STORE, (rs, ib, stmt) -> {
            StoreInsnNode insn = (StoreInsnNode) stmt.insn;
            Var val = value(rs, ib, insn.value);
            Var ptr = value(rs, ib, insn.ptr);
            emit(rs, ib, stmt, CfgOps.STORE.create(rs.lift(insn.value.type)).insn(val, ptr));
        });
        CONVERTERS.put(Opcode.GETELEMENTPTR, (rs, ib, stmt) -> {
            GepInsnNode insn = (GepInsnNode) stmt.insn;
            TypeNode source = InstrResultTypes.pointee(insn.base, rs.tc);
            List<Var> args = new ArrayList<>();
            args.add(value(rs, ib, insn.base));
            for (TypedValue index : insn.indices) {
                args.add(value(rs, ib, index));
            }
            emit(rs, ib, stmt, CfgOps.GEP.create(source).insn(args));
        });
        CONVERTERS.put(Opcode.CALL, BlockTranslator::convertCall);
        CONVERTERS.put(Opcode.PHI, (rs, ib, stmt) -> {
            // copied in by the predecessors
        });
        CONVERTERS.put(Opcode.SELECT, (rs, ib, stmt) -> {
            SelectInsnNode insn = (SelectInsnNode) stmt.insn;
            Var cond = value(rs, ib, insn.cond);
            Var ifTrue = value(rs, ib, insn.ifTrue);
            Var ifFalse = value(rs, ib, insn.ifTrue.type, insn.ifFalse);
            emit(rs, ib, stmt, CfgOps.SELECT.insn(cond, ifTrue, ifFalse));
        });
        CONVERTERS.put(Opcode.EXTRACTVALUE, (rs, ib, stmt) -> {
            AggregateInsnNode insn = (AggregateInsnNode) stmt.insn;
            emit(rs, ib, stmt, CfgOps.EXTRACT_VALUE.create(insn.indices).insn(value(rs, ib, insn.aggregate)));
        });
        CONVERTERS.put(Opcode.INSERTVALUE, (rs, ib, stmt) -> {
            AggregateInsnNode insn = (AggregateInsnNode) stmt.insn;
            Var agg = value(rs, ib, insn.aggregate);
            Var elt = value(rs, ib, insn.element);
            emit(rs, ib, stmt, CfgOps.INSERT_VALUE.create(insn.indices).insn(agg, elt));
        });
        CONVERTERS.put(Opcode.EXTRACTELEMENT, (rs, ib, stmt) -> {
            ElementInsnNode insn = (ElementInsnNode) stmt.insn;
            Var vec = value(rs, ib, insn.vector);
            Var idx = value(rs, ib, insn.index);
            emit(rs, ib, stmt, CfgOps.EXTRACT_ELT.insn(vec, idx));
        });
        CONVERTERS.put(Opcode.INSERTELEMENT, (rs, ib, stmt) -> {
            ElementInsnNode insn = (ElementInsnNode) stmt.insn;
            Var vec = value(rs, ib, insn.vector);
            Var elt = value(rs, ib, insn.element);
            Var idx = value(rs, ib, insn.index);
            emit(rs, ib, stmt, CfgOps.INSERT_ELT.insn(vec, elt, idx));
        });
    }

    static {
        CONVERTERS.put(Opcode.BR, (rs, ib, stmt) -> jump(rs, ib, ((JumpInsnNode) stmt.insn).target));
        CONVERTERS.put(Opcode.CONDBR, (rs, ib, stmt) -> {
            CondBrInsnNode insn = (CondBrInsnNode) stmt.insn;
            Var cond = value(rs, ib, insn.cond);
            BasicBlock ifTrue = edgeTo(rs, ib, insn.ifTrue);
            BasicBlock ifFalse = edgeTo(rs, ib, insn.ifFalse);
            ib.insertCtrl(CfgOps.brCond(cond, ifTrue, ifFalse));
        });
        CONVERTERS.put(Opcode.SWITCH, (rs, ib, stmt) -> {
            SwitchInsnNode insn = (SwitchInsnNode) stmt.insn;
            Var val = value(rs, ib, insn.value);
            long[] keys = new long[insn.cases.size()];
            List<BasicBlock> targets = new ArrayList<>();
            for (int i = 0; i < keys.length; i++) {
                SwitchInsnNode.Case c = insn.cases.get(i);
                keys[i] = c.key;
                targets.add(edgeTo(rs, ib, c.target));
            }
            BasicBlock dflt = edgeTo(rs, ib, insn.dflt);
            ib.insertCtrl(CfgOps.switchOn(val, keys, targets, dflt));
        });
        CONVERTERS.put(Opcode.RET, (rs, ib, stmt) -> {
            RetInsnNode insn = (RetInsnNode) stmt.insn;
            Insn ret = insn.value == null
                    ? CommonOps.RETURN.insn()
                    : CommonOps.RETURN.insn(value(rs, ib, insn.value));
            ib.insertCtrl(ret.jumpsTo());
        });
        CONVERTERS.put(Opcode.UNREACHABLE, (rs, ib, stmt) ->
                ib.insertCtrl(CommonOps.TRAP.create("unreachable").insn().jumpsTo()));
        CONVERTERS.put(Opcode.INDIRECTBR, (rs, ib, stmt) -> {
            throw new UnsupportedInstructionException(stmt.insn, "computed jumps are not supported");
        });
    }

    private static void convertCall(RoutineState rs, IRBuilder ib, StmtNode stmt) {
        CallInsnNode call = (CallInsnNode) stmt.insn;
        String symbol = call.calleeSymbol();
        if (symbol != null && symbol.startsWith(DBG_INTRINSIC_PREFIX)) return;

        List<Var> args = new ArrayList<>();
        FnSignature sig;
        Op op;
        if (symbol != null) {
            FnHandle handle = rs.registry.resolve(symbol);
            sig = handle.signature;
            op = CfgOps.CALL.create(handle);
        } else {
            TypeNode.FunctionType fnType = call.calleeType.asCalleeType(rs.tc);
            if (fnType == null) {
                throw new UnsupportedInstructionException(call, "callee type " + call.calleeType + " is not a function type");
            }
            sig = rs.registry.liftSignature(null, fnType.ret, fnType.params, fnType.varArgs);
            op = CfgOps.CALL_PTR.create(sig);
            args.add(value(rs, ib, TypeNode.ptrTo(fnType), call.callee));
        }

        int fixed = sig.fixedParams();
        int given = call.args.size();
        if (given < fixed || !sig.varArgs && given != fixed) {
            throw new SignatureMismatchException(symbol == null ? String.valueOf(call.callee) : symbol,
                    "expected " + (sig.varArgs ? "at least " : "") + fixed + " argument(s), got " + given);
        }
        for (int i = 0; i < fixed; i++) {
            args.add(value(rs, ib, call.args.get(i)));
        }
        if (sig.varArgs) {
            List<Var> extras = new ArrayList<>();
            for (int i = fixed; i < given; i++) {
                extras.add(value(rs, ib, call.args.get(i)));
            }
            args.add(ib.insert(CfgOps.PACK_VARARGS.insn(extras), rs.newTemp("varargs", FnSignature.VARARGS_TYPE)));
        }
        emit(rs, ib, stmt, op.insn(args));
    }
}
