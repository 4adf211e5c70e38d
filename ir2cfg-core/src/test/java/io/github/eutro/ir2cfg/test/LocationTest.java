package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ops.CfgOps;
import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.SourceLocation;
import io.github.eutro.ir2cfg.translate.LocationCursor;
import io.github.eutro.ir2cfg.translate.ModuleTranslator;
import io.github.eutro.ir2cfg.translate.ScopeFileResolver;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.github.eutro.ir2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class LocationTest {
    private static final ValMd FILE = file("main.c", "/home/me");
    private static final String PATH = "/home/me/main.c";

    private static TypeContext withMetadata(Map<Integer, ValMd> metadata) {
        return new TypeContext(Collections.emptyMap(), metadata);
    }

    @Test
    void testCarryForward() {
        DefineNode def = define("f", TypeNode.I32, Collections.emptyList(),
                block("entry",
                        assign("a", new BinaryInsnNode(Opcode.ADD, i32(1), ValueNode.integer(2)), dbgLoc(3, 5, FILE)),
                        assign("b", new BinaryInsnNode(Opcode.MUL, local(TypeNode.I32, "a"), ValueNode.integer(2))),
                        effect(new RetInsnNode(local(TypeNode.I32, "b")), dbgLoc(4, 1, FILE))));
        Function func = new ModuleTranslator(config().build()).run(module(def)).findCfg("f").orElseThrow(AssertionError::new);

        SourceLocation first = new SourceLocation(PATH, 3, 5);
        List<Effect> effects = labelled(func, "entry").getEffects();
        assertEquals(2, effects.stream().filter(fx -> fx.insn().op.key == CfgOps.BINOP).count());
        for (Effect effect : effects) {
            assertEquals(first, effect.getNullable(CfgExts.LOCATION), effect::toString);
        }
        assertEquals(new SourceLocation(PATH, 4, 1),
                labelled(func, "entry").getControl().getNullable(CfgExts.LOCATION));
    }

    @Test
    void testEntryUsesDefinitionMetadata() {
        Map<String, ValMd> md = new HashMap<>();
        md.put(DebugAnnotation.DBG, ValMd.info(new DebugInfo.Subprogram("f", null, FILE, 10)));
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(), md, block("entry", retVoid()));
        Function func = new ModuleTranslator(config().build()).run(module(def)).findCfg("f").orElseThrow(AssertionError::new);

        SourceLocation expected = new SourceLocation(PATH, 10, 0);
        assertEquals(expected, func.entry().getControl().getNullable(CfgExts.LOCATION));
        assertEquals(expected, labelled(func, "entry").getControl().getNullable(CfgExts.LOCATION));
    }

    @Test
    void testEntryWithoutMetadataIsInternal() {
        DefineNode def = define("f", TypeNode.VOID, Collections.emptyList(), block("entry", retVoid()));
        Function func = new ModuleTranslator(config().build()).run(module(def)).findCfg("f").orElseThrow(AssertionError::new);
        assertEquals(SourceLocation.INTERNAL, func.entry().getControl().getNullable(CfgExts.LOCATION));
    }

    @Test
    void testScopeWalk() {
        Map<Integer, ValMd> metadata = new HashMap<>();
        metadata.put(1, FILE);
        metadata.put(2, ValMd.info(new DebugInfo.Subprogram("f", null, ValMd.ref(1), 1)));
        metadata.put(3, ValMd.info(new DebugInfo.LexicalBlock(ValMd.ref(2), null, 2, 3)));
        ScopeFileResolver files = new ScopeFileResolver(withMetadata(metadata));

        ValMd nested = ValMd.info(new DebugInfo.LexicalBlockFile(ValMd.ref(3), null, 0));
        assertEquals(PATH, files.findPath(nested));
        assertEquals(PATH, files.findPath(ValMd.ref(3)));
        assertEquals(PATH, files.findPath(FILE));
    }

    @Test
    void testLegacyTupleScope() {
        Map<Integer, ValMd> metadata = new HashMap<>();
        metadata.put(1, ValMd.tuple(ValMd.string("0x29"), ValMd.ref(2)));
        metadata.put(2, ValMd.tuple(ValMd.string("old.c"), ValMd.string("/legacy")));
        ScopeFileResolver files = new ScopeFileResolver(withMetadata(metadata));
        assertEquals("/legacy/old.c", files.findPath(ValMd.ref(1)));
    }

    @Test
    void testCyclicScopeGivesEmptyPath() {
        Map<Integer, ValMd> metadata = new HashMap<>();
        metadata.put(1, ValMd.info(new DebugInfo.LexicalBlock(ValMd.ref(2), null, 1, 1)));
        metadata.put(2, ValMd.info(new DebugInfo.LexicalBlock(ValMd.ref(1), null, 2, 2)));
        ScopeFileResolver files = new ScopeFileResolver(withMetadata(metadata));
        assertNull(files.findFile(ValMd.ref(1)));
        assertEquals("", files.findPath(ValMd.ref(1)));
        assertEquals("", files.findPath(null));
    }

    private static ValMd nestedBlocks(int depth) {
        ValMd scope = FILE;
        for (int i = 0; i < depth; i++) {
            scope = ValMd.info(new DebugInfo.LexicalBlock(scope, null, i, 0));
        }
        return scope;
    }

    @Test
    void testScopeWalkIsBounded() {
        ScopeFileResolver files = new ScopeFileResolver(TypeContext.EMPTY);
        assertEquals(PATH, files.findPath(nestedBlocks(ScopeFileResolver.MAX_DEPTH - 1)));
        assertNull(files.findFile(nestedBlocks(ScopeFileResolver.MAX_DEPTH + 1)));
        assertEquals("", files.findPath(nestedBlocks(ScopeFileResolver.MAX_DEPTH + 1)));
    }

    @Test
    void testCursor() {
        LocationCursor cursor = new LocationCursor(new ScopeFileResolver(TypeContext.EMPTY), SourceLocation.INTERNAL);
        assertFalse(cursor.update(Collections.emptyList()));
        assertFalse(cursor.update(Collections.singletonList(
                new DebugAnnotation("tbaa", ValMd.tuple()))));
        assertSame(SourceLocation.INTERNAL, cursor.current());

        assertTrue(cursor.update(Collections.singletonList(
                DebugAnnotation.dbg(ValMd.info(new DebugInfo.Subprogram("g", null, FILE, 42))))));
        assertEquals(new SourceLocation(PATH, 42, 0), cursor.current());

        assertTrue(cursor.update(Collections.singletonList(dbgLoc(5, 6, ValMd.ref(99)))));
        assertEquals(new SourceLocation("", 5, 6), cursor.current());
    }
}
