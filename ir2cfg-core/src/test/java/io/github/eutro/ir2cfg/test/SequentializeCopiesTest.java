package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.MetadataState;
import io.github.eutro.ir2cfg.ops.CommonOps;
import io.github.eutro.ir2cfg.passes.form.SequentializeCopies;
import io.github.eutro.ir2cfg.ssa.*;
import io.github.eutro.ir2cfg.translate.HandleAllocator;
import io.github.eutro.ir2cfg.types.CType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class SequentializeCopiesTest {
    private static final CType I32 = CType.bitvector(32);
    private static final SourceLocation LOC = new SourceLocation("copy.c", 12, 4);

    private static Map<Var, String> run(BasicBlock block, Map<Var, String> env) {
        Map<Var, String> out = new HashMap<>(env);
        for (Effect move : block.getEffects()) {
            assertSame(CommonOps.IDENTITY, move.insn().op);
            assertEquals(1, move.getAssignsTo().size(), move::toString);
            assertEquals(Boolean.TRUE, move.getNullable(CommonExts.IS_PHI));
            assertEquals(LOC, move.getNullable(CfgExts.LOCATION));
            out.put(move.getAssignsTo().get(0), out.get(move.insn().args().get(0)));
        }
        return out;
    }

    @Test
    void testRotationWithFanOut() {
        Function func = new Function();
        BasicBlock bb = func.newBb();
        Var a = func.newReg("a", 0, I32);
        Var b = func.newReg("b", 1, I32);
        Var c = func.newReg("c", 2, I32);
        Var d = func.newReg("d", 3, I32);
        IRBuilder ib = new IRBuilder(func, bb);
        ib.setLocation(LOC);
        Effect copy = CommonOps.IDENTITY.insn(b, c, a, a).assignTo(a, b, c, d);
        copy.attachExt(CommonExts.IS_PHI, true);
        ib.insert(copy);
        ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());

        SequentializeCopies.INSTANCE.run(func);

        assertEquals(5, bb.getEffects().size(), "four moves and one temporary");
        Map<Var, String> env = new HashMap<>();
        env.put(a, "A");
        env.put(b, "B");
        env.put(c, "C");
        Map<Var, String> out = run(bb, env);
        assertEquals("B", out.get(a));
        assertEquals("C", out.get(b));
        assertEquals("A", out.get(c));
        assertEquals("A", out.get(d));
        assertTrue(func.getExtOrThrow(CommonExts.METADATA_STATE).isValid(MetadataState.COPIES_SEQUENTIAL));
    }

    @Test
    void testSelfCopiesDropped() {
        Function func = new Function();
        BasicBlock bb = func.newBb();
        Var a = func.newReg("a", 0, I32);
        Var b = func.newReg("b", 1, I32);
        Var c = func.newReg("c", 2, I32);
        IRBuilder ib = new IRBuilder(func, bb);
        ib.setLocation(LOC);
        Effect copy = CommonOps.IDENTITY.insn(a, b).assignTo(a, c);
        copy.attachExt(CommonExts.IS_PHI, true);
        ib.insert(copy);
        ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());

        SequentializeCopies.INSTANCE.run(func);

        assertEquals(1, bb.getEffects().size());
        Effect move = bb.getEffects().get(0);
        assertSame(c, move.getAssignsTo().get(0));
        assertSame(b, move.insn().args().get(0));
    }

    @Test
    void testTemporariesGetFreshIds() {
        HandleAllocator allocator = new HandleAllocator();
        Function func = new Function();
        func.attachExt(CfgExts.ALLOCATOR, allocator);
        Var a = func.newReg("a", allocator.nextRegister(), I32);
        Var b = func.newReg("b", allocator.nextRegister(), I32);
        BasicBlock left = func.newBb();
        BasicBlock right = func.newBb();
        for (BasicBlock bb : new BasicBlock[]{left, right}) {
            IRBuilder ib = new IRBuilder(func, bb);
            ib.setLocation(LOC);
            Effect swap = CommonOps.IDENTITY.insn(b, a).assignTo(a, b);
            swap.attachExt(CommonExts.IS_PHI, true);
            ib.insert(swap);
            ib.insertCtrl(CommonOps.RETURN.insn().jumpsTo());
        }

        SequentializeCopies.INSTANCE.run(func);

        Set<Integer> ids = new HashSet<>();
        ids.add(a.index);
        ids.add(b.index);
        for (BasicBlock bb : new BasicBlock[]{left, right}) {
            assertEquals(3, bb.getEffects().size());
            Var tmp = bb.getEffects().get(0).getAssignsTo().get(0);
            assertNotSame(a, tmp);
            assertNotSame(b, tmp);
            assertTrue(ids.add(tmp.index), tmp::toString);

            Map<Var, String> env = new HashMap<>();
            env.put(a, "A");
            env.put(b, "B");
            Map<Var, String> out = run(bb, env);
            assertEquals("B", out.get(a));
            assertEquals("A", out.get(b));
        }
    }
}
