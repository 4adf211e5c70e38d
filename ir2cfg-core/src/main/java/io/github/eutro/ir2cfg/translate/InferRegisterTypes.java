package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.passes.InPlaceIRPass;
import io.github.eutro.ir2cfg.source.BlockNode;
import io.github.eutro.ir2cfg.source.StmtNode;
import io.github.eutro.ir2cfg.source.TypeNode;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.types.CType;

/**
 * Allocates a typed register for every statement that produces a value, before any block
 * is lowered, so uses may precede definitions in source order.
 * <p>
 * Parameters must already be bound.
 */
public class InferRegisterTypes implements InPlaceIRPass<RoutineState> {
    public static final InferRegisterTypes INSTANCE = new InferRegisterTypes();

    @Override
    public void runInPlace(RoutineState rs) {
        for (BlockNode block : rs.def.body) {
            for (StmtNode stmt : block.stmts) {
                if (stmt.result == null) continue;
                TypeNode type = InstrResultTypes.resultType(stmt.insn, rs.tc);
                CType lifted = rs.lift(type);
                Var reg = rs.func.newReg(stmt.result.name, rs.allocator.nextRegister(), lifted);
                reg.attachExt(CfgExts.SOURCE_IDENT, stmt.result);
                rs.identMap.bind(stmt.result, reg);
            }
        }
    }
}
