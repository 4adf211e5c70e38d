package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ops.CfgOps;
import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.SourceLocation;
import io.github.eutro.ir2cfg.translate.DebugAnnotationMap;
import io.github.eutro.ir2cfg.translate.ModuleTranslator;
import io.github.eutro.ir2cfg.translate.ProcessDebugDeclares;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.ir2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ProcessDebugDeclaresTest {
    private static final ValMd FILE = file("a.c", "/src");
    private static final TypeNode I8_PTR = TypeNode.ptrTo(TypeNode.I8);
    private static final TypeNode I32_PTR = TypeNode.ptrTo(TypeNode.I32);

    @Test
    void testDeclareMovesToAlloca() {
        DebugAnnotation declared = dbgLoc(7, 3, FILE);
        DebugAnnotation own = dbgLoc(6, 1, FILE);
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(),
                block("entry",
                        assign("x", new AllocaInsnNode(TypeNode.I32), own),
                        dbgDeclare(I32_PTR, "x", declared),
                        retVoid()));
        DebugAnnotationMap map = ProcessDebugDeclares.INSTANCE.run(def);

        assertEquals(Collections.singletonList(declared), map.forIdent(Ident.of("x")));
        StmtNode alloca = def.body.get(0).stmts.get(0);
        assertEquals(Arrays.asList(declared, own), map.effective(alloca));
        StmtNode ret = def.body.get(0).stmts.get(2);
        assertEquals(Collections.emptyList(), map.effective(ret));
    }

    @Test
    void testBitcastChain() {
        DebugAnnotation cast = dbgLoc(2, 0, FILE);
        DebugAnnotation ofQ = dbgLoc(3, 0, FILE);
        DebugAnnotation ofP = dbgLoc(4, 0, FILE);
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(),
                block("entry",
                        assign("p", new AllocaInsnNode(TypeNode.I8)),
                        assign("q", new ConvInsnNode(Opcode.BITCAST, local(I8_PTR, "p"), I32_PTR), cast),
                        dbgDeclare(I32_PTR, "q", ofQ),
                        dbgDeclare(I8_PTR, "p", ofP),
                        retVoid()));
        DebugAnnotationMap map = ProcessDebugDeclares.INSTANCE.run(def);

        assertEquals(Collections.singletonList(ofQ), map.forIdent(Ident.of("q")));
        assertEquals(Arrays.asList(cast, ofQ, ofP), map.forIdent(Ident.of("p")));
        assertEquals(Arrays.asList(cast, ofQ, ofP), map.effective(def.body.get(0).stmts.get(0)));
    }

    @Test
    void testDeclaresAcrossBlocks() {
        DebugAnnotation declared = dbgLoc(9, 2, FILE);
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(),
                block("entry",
                        assign("x", new AllocaInsnNode(TypeNode.I32)),
                        br("body")),
                block("body",
                        dbgDeclare(I32_PTR, "x", declared),
                        retVoid()));
        DebugAnnotationMap map = ProcessDebugDeclares.INSTANCE.run(def);
        assertEquals(Collections.singletonList(declared), map.effective(def.body.get(0).stmts.get(0)));
    }

    @Test
    void testMalformedDeclareIgnored() {
        StmtNode malformed = effect(new CallInsnNode(false,
                TypeNode.function(TypeNode.VOID, Collections.singletonList(TypeNode.I32), false),
                ValueNode.symbol(ProcessDebugDeclares.DBG_DECLARE),
                Collections.singletonList(i32(0))), dbgLoc(1, 1, FILE));
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(),
                block("entry",
                        assign("x", new AllocaInsnNode(TypeNode.I32)),
                        malformed,
                        retVoid()));
        DebugAnnotationMap map = ProcessDebugDeclares.INSTANCE.run(def);
        assertEquals(Collections.emptyList(), map.forIdent(Ident.of("x")));

        Function func = new ModuleTranslator(config().build()).run(module(def)).findCfg("f").orElseThrow(AssertionError::new);
        for (Effect effect : labelled(func, "entry").getEffects()) {
            assertNotSame(CfgOps.CALL, effect.insn().op.key, effect::toString);
        }
    }

    @Test
    void testLoweredAllocaCarriesDeclaration() {
        DebugAnnotation declared = dbgLoc(7, 3, FILE);
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(),
                block("entry",
                        assign("x", new AllocaInsnNode(TypeNode.I32)),
                        dbgDeclare(I32_PTR, "x", declared),
                        retVoid()));
        Function func = new ModuleTranslator(config().build()).run(module(def)).findCfg("f").orElseThrow(AssertionError::new);

        List<Effect> effects = labelled(func, "entry").getEffects();
        assertEquals(1, effects.size(), "the debug declaration emits nothing");
        Effect alloca = effects.get(0);
        assertSame(CfgOps.ALLOCA, alloca.insn().op.key);
        assertEquals(Collections.singletonList(declared), alloca.getNullable(CfgExts.DEBUG_ANNOTATIONS));
        assertEquals(new SourceLocation("/src/a.c", 7, 3), alloca.getNullable(CfgExts.LOCATION));
    }
}
