package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.MetadataState;
import io.github.eutro.ir2cfg.ops.CfgOps;
import io.github.eutro.ir2cfg.ops.CommonOps;
import io.github.eutro.ir2cfg.passes.meta.CheckCfg;
import io.github.eutro.ir2cfg.source.Opcode;
import io.github.eutro.ir2cfg.ssa.*;
import io.github.eutro.ir2cfg.types.CType;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class CheckCfgTest {
    private static final CType I32 = CType.bitvector(32);

    @Test
    void testWellFormed() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        BasicBlock body = func.newBb();
        Var x = func.newReg("x", 0, I32);
        func.attachExt(CfgExts.PARAMETERS, Collections.singletonList(x));
        new IRBuilder(func, entry).insertCtrl(Control.br(body));
        IRBuilder ib = new IRBuilder(func, body);
        Var y = ib.insert(CfgOps.BINOP.create(Opcode.ADD).insn(x, x), "y", 1, I32);
        ib.insertCtrl(CommonOps.RETURN.insn(y).jumpsTo());

        CheckCfg.INSTANCE.run(func);
        assertTrue(func.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.VERIFIED));
    }

    @Test
    void testUnterminated() {
        Function func = new Function();
        func.newBb();
        assertThrows(IllegalStateException.class, () -> CheckCfg.INSTANCE.run(func));
    }

    @Test
    void testUseWithoutAssignment() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        Var ghost = func.newReg("ghost", 0, I32);
        new IRBuilder(func, entry).insertCtrl(CommonOps.RETURN.insn(ghost).jumpsTo());
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> CheckCfg.INSTANCE.run(func));
        assertTrue(e.getMessage().contains("never assigned"), e.getMessage());
    }

    @Test
    void testDoubleAssignment() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var x = func.newReg("x", 0, I32);
        ib.insert(CommonOps.constant(1L), x);
        ib.insert(CommonOps.constant(2L), x);
        ib.insertCtrl(CommonOps.RETURN.insn(x).jumpsTo());
        assertThrows(IllegalStateException.class, () -> CheckCfg.INSTANCE.run(func));
    }

    @Test
    void testMistypedCopy() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        IRBuilder ib = new IRBuilder(func, entry);
        Var wide = ib.insert(CommonOps.constant(1L), "wide", 0, CType.bitvector(64));
        Var narrow = func.newReg("narrow", 1, I32);
        Effect copy = CommonOps.IDENTITY.insn(wide).assignTo(narrow);
        copy.attachExt(CommonExts.IS_PHI, true);
        ib.insert(copy);
        ib.insertCtrl(CommonOps.RETURN.insn(narrow).jumpsTo());
        assertThrows(IllegalStateException.class, () -> CheckCfg.INSTANCE.run(func));
    }

    @Test
    void testEntryWithPredecessors() {
        Function func = new Function();
        BasicBlock entry = func.newBb();
        new IRBuilder(func, entry).insertCtrl(Control.br(entry));
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> CheckCfg.INSTANCE.run(func));
        assertTrue(e.getMessage().contains("Entry"), e.getMessage());
    }
}
