package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ops.CfgOps;
import io.github.eutro.ir2cfg.ops.CommonOps;
import io.github.eutro.ir2cfg.passes.Passes;
import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.translate.FnSignature;
import io.github.eutro.ir2cfg.translate.ModuleTranslator;
import io.github.eutro.ir2cfg.types.CType;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.eutro.ir2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class BlockTranslatorTest {
    private static Function translate(ModuleNode module, String symbol) {
        return new ModuleTranslator(config().build())
                .run(module)
                .findCfg(symbol)
                .orElseThrow(AssertionError::new);
    }

    private static PhiInsnNode phi(ValueNode v0, String from0, ValueNode v1, String from1) {
        return new PhiInsnNode(TypeNode.I32, Arrays.asList(
                new PhiInsnNode.Incoming(v0, label(from0)),
                new PhiInsnNode.Incoming(v1, label(from1))
        ));
    }

    // loop: a, b = b, a
    private static DefineNode swapLoop() {
        return define("swap", TypeNode.VOID, Collections.singletonList(param(TypeNode.I1, "c")),
                block("entry", br("loop")),
                block("loop",
                        assign("a", phi(ValueNode.integer(1), "entry", ValueNode.ident("b"), "loop")),
                        assign("b", phi(ValueNode.integer(2), "entry", ValueNode.ident("a"), "loop")),
                        effect(new CondBrInsnNode(local(TypeNode.I1, "c"), label("loop"), label("exit")))),
                block("exit", retVoid()));
    }

    @Test
    void testPhiSwapIsParallelCopy() {
        Function func = translate(module(swapLoop()), "swap");
        BasicBlock loop = labelled(func, "loop");
        Control ctrl = loop.getControl();
        assertNotNull(ctrl);
        assertSame(CfgOps.BR_COND, ctrl.insn().op);

        BasicBlock edge = ctrl.targets.get(0);
        assertEquals(Boolean.TRUE, edge.getNullable(CfgExts.IS_EDGE_BLOCK));
        assertSame(labelled(func, "exit"), ctrl.targets.get(1));

        assertEquals(1, edge.getEffects().size());
        Effect copy = edge.getEffects().get(0);
        assertSame(CommonOps.IDENTITY, copy.insn().op);
        assertEquals(Boolean.TRUE, copy.getNullable(CommonExts.IS_PHI));
        assertEquals(Arrays.asList("a", "b"), names(copy.getAssignsTo()));
        assertEquals(Arrays.asList("b", "a"), names(copy.insn().args()));
        assertEquals(Collections.singletonList(loop), edge.successors());
    }

    @Test
    void testPhiSwapSurvivesSequentializing() {
        Function func = translate(module(swapLoop()), "swap");
        BasicBlock edge = labelled(func, "loop").getControl().targets.get(0);
        List<Var> regs = edge.getEffects().get(0).getAssignsTo();
        Var a = regs.get(0);
        Var b = regs.get(1);

        Passes.SEQUENTIAL.run(func);

        Set<Integer> ids = new HashSet<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                for (Var v : effect.getAssignsTo()) {
                    if (v != a && v != b) assertTrue(ids.add(v.index), v::toString);
                }
            }
        }
        assertFalse(ids.contains(a.index));
        assertFalse(ids.contains(b.index));

        Map<Var, String> env = new HashMap<>();
        env.put(a, "A");
        env.put(b, "B");
        for (Effect move : edge.getEffects()) {
            assertSame(CommonOps.IDENTITY, move.insn().op);
            assertEquals(1, move.getAssignsTo().size());
            env.put(move.getAssignsTo().get(0), env.get(move.insn().args().get(0)));
        }
        assertEquals("B", env.get(a));
        assertEquals("A", env.get(b));
    }

    @Test
    void testSingleSuccessorCopiesBeforeJump() {
        Function func = translate(module(swapLoop()), "swap");
        BasicBlock entry = labelled(func, "entry");
        List<Effect> effects = entry.getEffects();
        assertEquals(3, effects.size());
        assertSame(CommonOps.CONST, effects.get(0).insn().op.key);
        assertSame(CommonOps.CONST, effects.get(1).insn().op.key);
        assertEquals(1L, CommonOps.CONST.cast(effects.get(0).insn().op).arg);
        assertEquals(2L, CommonOps.CONST.cast(effects.get(1).insn().op).arg);

        Effect copy = effects.get(2);
        assertSame(CommonOps.IDENTITY, copy.insn().op);
        assertEquals(Arrays.asList("a", "b"), names(copy.getAssignsTo()));
        assertEquals(CType.bitvector(32), copy.insn().args().get(0).getType());
        assertEquals(Collections.singletonList(labelled(func, "loop")), entry.successors());
    }

    @Test
    void testNoEdgeBlocksWithoutPhis() {
        DefineNode def = define("pick", TypeNode.I32, Collections.singletonList(param(TypeNode.I1, "c")),
                block("entry", effect(new CondBrInsnNode(local(TypeNode.I1, "c"), label("t"), label("f")))),
                block("t", ret(i32(1))),
                block("f", ret(i32(0))));
        Function func = translate(module(def), "pick");
        for (BasicBlock block : func.blocks) {
            assertNull(block.getNullable(CfgExts.IS_EDGE_BLOCK), block::toString);
        }
        assertEquals(Arrays.asList(labelled(func, "t"), labelled(func, "f")),
                labelled(func, "entry").successors());
    }

    @Test
    void testSwitchEdgesGetOwnBlocks() {
        DefineNode def = define("sw", TypeNode.I32, Collections.singletonList(param(TypeNode.I32, "x")),
                block("entry", effect(new SwitchInsnNode(local(TypeNode.I32, "x"), label("join"), Arrays.asList(
                        new SwitchInsnNode.Case(0, label("join")),
                        new SwitchInsnNode.Case(1, label("other")))))),
                block("other", br("join")),
                block("join",
                        assign("r", phi(ValueNode.integer(10), "entry", ValueNode.integer(20), "other")),
                        ret(local(TypeNode.I32, "r"))));
        Function func = translate(module(def), "sw");
        Control sw = labelled(func, "entry").getControl();
        assertNotNull(sw);
        assertSame(CfgOps.SWITCH, sw.insn().op.key);
        assertArrayEquals(new long[]{0, 1}, CfgOps.SWITCH.cast(sw.insn().op).arg);
        assertEquals(3, sw.targets.size());

        BasicBlock case0 = sw.targets.get(0);
        BasicBlock dflt = sw.targets.get(2);
        assertNotSame(case0, dflt);
        for (BasicBlock edge : Arrays.asList(case0, dflt)) {
            assertEquals(Boolean.TRUE, edge.getNullable(CfgExts.IS_EDGE_BLOCK));
            assertEquals(Collections.singletonList(labelled(func, "join")), edge.successors());
        }
        BasicBlock other = labelled(func, "other");
        assertSame(other, sw.targets.get(1));
        List<Effect> inline = other.getEffects();
        assertEquals(2, inline.size());
        assertEquals(20L, CommonOps.CONST.cast(inline.get(0).insn().op).arg);
        assertSame(CommonOps.IDENTITY, inline.get(1).insn().op);
        assertEquals(Collections.singletonList("r"), names(inline.get(1).getAssignsTo()));
    }

    @Test
    void testVarArgCallPacksExtras() {
        ModuleNode module = ModuleNode.builder()
                .declare(new DeclareNode("printf", TypeNode.I32,
                        Collections.singletonList(TypeNode.ptrTo(TypeNode.I8)), true))
                .define(define("main", TypeNode.I32, Collections.emptyList(),
                        block("entry",
                                assign("n", new CallInsnNode(false,
                                        TypeNode.function(TypeNode.I32,
                                                Collections.singletonList(TypeNode.ptrTo(TypeNode.I8)), true),
                                        ValueNode.symbol("printf"),
                                        Arrays.asList(
                                                TypedValue.of(TypeNode.ptrTo(TypeNode.I8), ValueNode.NULL),
                                                i32(1),
                                                i32(2)))),
                                ret(i32(0)))))
                .build();
        Function func = translate(module, "main");

        List<Effect> packs = effectsOf(func, CfgOps.PACK_VARARGS);
        assertEquals(1, packs.size());
        Effect pack = packs.get(0);
        assertEquals(2, pack.insn().args().size());
        assertEquals(FnSignature.VARARGS_TYPE, pack.getAssignsTo().get(0).getType());

        Effect call = null;
        for (Effect fx : labelled(func, "entry").getEffects()) {
            if (fx.insn().op.key == CfgOps.CALL) call = fx;
        }
        assertNotNull(call);
        assertEquals("printf", CfgOps.CALL.cast(call.insn().op).arg.symbol);
        assertEquals(2, call.insn().args().size());
        assertSame(pack.getAssignsTo().get(0), call.insn().args().get(1));
        assertEquals(Collections.singletonList("n"), names(call.getAssignsTo()));
    }

    @Test
    void testUnreachableTraps() {
        DefineNode def = define("dead", TypeNode.VOID, Collections.emptyList(),
                block("entry", effect(new InsnNode(Opcode.UNREACHABLE)), retVoid()));
        Function func = translate(module(def), "dead");
        Control ctrl = labelled(func, "entry").getControl();
        assertNotNull(ctrl);
        assertEquals("unreachable", CommonOps.TRAP.cast(ctrl.insn().op).arg);
        assertTrue(ctrl.targets.isEmpty());
    }
}
