package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ops.CfgOps;
import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.translate.*;
import io.github.eutro.ir2cfg.types.CType;
import io.github.eutro.ir2cfg.types.TypeLiftException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static io.github.eutro.ir2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class ModuleTranslatorTest {
    private static DefineNode identity(String symbol) {
        return define(symbol, TypeNode.I32, Collections.singletonList(param(TypeNode.I32, "x")),
                block("entry", ret(local(TypeNode.I32, "x"))));
    }

    private static DefineNode twiceAssigned() {
        return define("bad", TypeNode.I32, Collections.emptyList(),
                block("entry",
                        assign("x", new BinaryInsnNode(Opcode.ADD, i32(1), ValueNode.integer(2))),
                        br("next")),
                block("next",
                        assign("x", new BinaryInsnNode(Opcode.ADD, i32(3), ValueNode.integer(4))),
                        ret(local(TypeNode.I32, "x"))));
    }

    @Test
    void testNonceEquality() {
        ModuleTranslator translator = new ModuleTranslator(config().build());
        ModuleNode module = module(identity("id"));
        ModuleTranslation first = translator.run(module);
        ModuleTranslation second = translator.run(module);
        assertEquals(first, first);
        assertNotEquals(first, second);
        assertNotEquals(first.nonce(), second.nonce());
        assertEquals(first.hashCode(), first.nonce().hashCode());
    }

    @Test
    void testFindCfg() {
        ModuleTranslation mt = new ModuleTranslator(config().build()).run(module(identity("id")));
        assertTrue(mt.findCfg("id").isPresent());
        assertSame(mt.cfgMap().get("id"), mt.findCfg("id").get());
        assertFalse(mt.findCfg("di").isPresent());
    }

    @Test
    void testDeclarationsAndDefinitionsHaveHandles() {
        ModuleNode module = ModuleNode.builder()
                .declare(new DeclareNode("puts", TypeNode.I32,
                        Collections.singletonList(TypeNode.ptrTo(TypeNode.I8)), false))
                .define(identity("id"))
                .build();
        ModuleTranslation mt = new ModuleTranslator(config().build()).run(module);
        HandleRegistry handles = mt.handleContext();
        assertEquals(Arrays.asList("puts", "id"), new ArrayList<>(handles.handles().keySet()));
        assertEquals(Collections.singleton("id"), mt.cfgMap().keySet());
    }

    @Test
    void testParallelKeepsOrder() {
        ModuleNode.Builder builder = ModuleNode.builder();
        List<String> symbols = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            symbols.add("f" + i);
            builder.define(identity("f" + i));
        }
        ModuleNode module = builder.build();
        ModuleTranslation parallel = new ModuleTranslator(config().setParallel(true).build()).run(module);
        ModuleTranslation sequential = new ModuleTranslator(config().build()).run(module);
        assertEquals(symbols, new ArrayList<>(parallel.cfgMap().keySet()));
        assertEquals(symbols, new ArrayList<>(sequential.cfgMap().keySet()));
    }

    @Test
    void testDuplicateAssignmentAborts() {
        ModuleNode module = module(identity("good"), twiceAssigned());
        for (boolean parallel : new boolean[]{false, true}) {
            ModuleTranslator translator = new ModuleTranslator(config().setParallel(parallel).build());
            DuplicateAssignmentException e = assertThrows(DuplicateAssignmentException.class,
                    () -> translator.run(module));
            assertEquals(Ident.of("x"), e.ident);
            assertEquals("bad", e.getSymbol());
        }
    }

    @Test
    void testDuplicateDefinition() {
        ModuleNode module = module(identity("id"), identity("id"));
        assertThrows(TranslationException.class, () -> new ModuleTranslator(config().build()).run(module));
    }

    @Test
    void testStrictRedeclaration() {
        ModuleNode module = ModuleNode.builder()
                .declare(new DeclareNode("id", TypeNode.I64, Collections.singletonList(TypeNode.I64), false))
                .define(identity("id"))
                .build();
        ModuleTranslator strict = new ModuleTranslator(config().setStrictRedeclarations(true).build());
        SignatureMismatchException e = assertThrows(SignatureMismatchException.class, () -> strict.run(module));
        assertEquals("id", e.getSymbol());
    }

    @Test
    void testGlobalInitializers() {
        ModuleNode module = ModuleNode.builder()
                .global(new GlobalNode("counter", TypeNode.I32, ValueNode.integer(0), false))
                .global(new GlobalNode("external", TypeNode.I32, null, false))
                .global(new GlobalNode("broken", TypeNode.alias("missing"), ValueNode.ZERO_INIT, true))
                .build();
        ModuleTranslation mt = new ModuleTranslator(config().build()).run(module);

        assertEquals(Arrays.asList("counter", "broken"), new ArrayList<>(mt.globalInitMap().keySet()));
        GlobalInitializer counter = mt.globalInitMap().get("counter");
        assertEquals(CType.bitvector(32), counter.type().orElseThrow(AssertionError::new));
        assertFalse(counter.error().isPresent());
        GlobalInitializer broken = mt.globalInitMap().get("broken");
        assertFalse(broken.type().isPresent());
        assertTrue(broken.error().isPresent());
    }

    @Test
    void testSymbolOperands() {
        TypeNode fnType = TypeNode.function(TypeNode.I32, Collections.singletonList(TypeNode.I32), false);
        ModuleNode module = ModuleNode.builder()
                .global(new GlobalNode("counter", TypeNode.I32, ValueNode.integer(0), false))
                .define(identity("id"))
                .define(define("use", TypeNode.VOID, Collections.singletonList(param(TypeNode.ptrTo(TypeNode.ptrTo(fnType)), "slot")),
                        block("entry",
                                effect(new StoreInsnNode(
                                        TypedValue.of(TypeNode.ptrTo(fnType), ValueNode.symbol("id")),
                                        local(TypeNode.ptrTo(TypeNode.ptrTo(fnType)), "slot"))),
                                effect(new StoreInsnNode(i32(1),
                                        TypedValue.of(TypeNode.ptrTo(TypeNode.I32), ValueNode.symbol("counter")))),
                                retVoid())))
                .build();
        Function func = new ModuleTranslator(config().build()).run(module).findCfg("use").orElseThrow(AssertionError::new);

        List<Effect> effects = labelled(func, "entry").getEffects();
        assertEquals("id", CfgOps.FUNC_PTR.cast(effects.get(0).insn().op).arg.symbol);
        assertSame(CfgOps.STORE, effects.get(1).insn().op.key);
        assertEquals("counter", CfgOps.GLOBAL_PTR.cast(effects.get(3).insn().op).arg);
    }

    @Test
    void testIndirectCall() {
        TypeNode fnPtr = TypeNode.ptrTo(TypeNode.function(TypeNode.I32, Collections.singletonList(TypeNode.I32), false));
        DefineNode def = define("apply", TypeNode.I32, Collections.singletonList(param(fnPtr, "fp")),
                block("entry",
                        assign("r", new CallInsnNode(false, fnPtr, ValueNode.ident("fp"),
                                Collections.singletonList(i32(7)))),
                        ret(local(TypeNode.I32, "r"))));
        Function func = new ModuleTranslator(config().build()).run(module(def)).findCfg("apply").orElseThrow(AssertionError::new);

        Effect call = null;
        for (Effect fx : labelled(func, "entry").getEffects()) {
            if (fx.insn().op.key == CfgOps.CALL_PTR) call = fx;
        }
        assertNotNull(call);
        assertEquals("fp", call.insn().args().get(0).name);
        assertEquals(2, call.insn().args().size());
        FnSignature sig = CfgOps.CALL_PTR.cast(call.insn().op).arg;
        assertEquals(CType.bitvector(32), sig.ret);
        assertEquals(Collections.singletonList("r"), names(call.getAssignsTo()));
    }

    @Test
    void testCallArityMismatch() {
        ModuleNode module = ModuleNode.builder()
                .define(identity("id"))
                .define(define("caller", TypeNode.VOID, Collections.emptyList(),
                        block("entry",
                                effect(new CallInsnNode(false,
                                        TypeNode.function(TypeNode.I32, Collections.singletonList(TypeNode.I32), false),
                                        ValueNode.symbol("id"),
                                        Arrays.asList(i32(1), i32(2)))),
                                retVoid())))
                .build();
        SignatureMismatchException e = assertThrows(SignatureMismatchException.class,
                () -> new ModuleTranslator(config().build()).run(module));
        assertEquals("caller", e.getSymbol());
    }

    @Test
    void testUnliftableDeclarationAbortsModule() {
        ModuleNode module = ModuleNode.builder()
                .declare(new DeclareNode("f", TypeNode.VOID, Collections.singletonList(TypeNode.METADATA), false))
                .define(identity("id"))
                .build();
        for (boolean parallel : new boolean[]{false, true}) {
            ModuleTranslator translator = new ModuleTranslator(config().setParallel(parallel).build());
            TypeLiftException e = assertThrows(TypeLiftException.class, () -> translator.run(module));
            assertEquals("f", e.getSymbol());
        }
    }
}
