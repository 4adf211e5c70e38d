package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.translate.InstrResultTypes;
import io.github.eutro.ir2cfg.types.CType;
import io.github.eutro.ir2cfg.types.DefaultTypeLifter;
import io.github.eutro.ir2cfg.types.TypeLiftException;
import io.github.eutro.ir2cfg.types.TypeLifter;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static io.github.eutro.ir2cfg.test.Utils.*;
import static org.junit.jupiter.api.Assertions.*;

public class TypeLifterTest {
    private static final TypeLifter LIFTER = DefaultTypeLifter.INSTANCE;

    private static TypeContext types(String name, TypeNode type) {
        Map<String, TypeNode> named = new HashMap<>();
        named.put(name, type);
        return new TypeContext(named, Collections.emptyMap());
    }

    @Test
    void testScalars() {
        TypeContext tc = TypeContext.EMPTY;
        assertEquals(CType.bitvector(32), LIFTER.liftMemType(TypeNode.I32, tc));
        assertEquals(CType.bitvector(1), LIFTER.liftMemType(TypeNode.I1, tc));
        assertEquals(CType.floating(CType.FloatInfo.DOUBLE),
                LIFTER.liftMemType(TypeNode.floating(TypeNode.FloatType.Kind.DOUBLE), tc));
        assertEquals(CType.pointer(64), LIFTER.liftMemType(TypeNode.ptrTo(TypeNode.I8), tc));
        assertEquals(CType.pointer(32), new DefaultTypeLifter(32).liftMemType(TypeNode.ptrTo(TypeNode.I8), tc));
        assertEquals(CType.UNIT, LIFTER.liftRetType(TypeNode.VOID, tc));
        assertThrows(TypeLiftException.class, () -> LIFTER.liftMemType(TypeNode.VOID, tc));
        assertThrows(TypeLiftException.class,
                () -> LIFTER.liftMemType(TypeNode.floating(TypeNode.FloatType.Kind.PPC_FP128), tc));
    }

    @Test
    void testAggregates() {
        TypeContext tc = TypeContext.EMPTY;
        assertEquals(CType.vector(CType.bitvector(8)), LIFTER.liftMemType(TypeNode.array(4, TypeNode.I8), tc));
        assertEquals(CType.struct(CType.bitvector(32), CType.pointer(64)),
                LIFTER.liftMemType(TypeNode.struct(false, TypeNode.I32, TypeNode.ptrTo(TypeNode.I8)), tc));
    }

    @Test
    void testNamedTypes() {
        TypeContext list = types("node", TypeNode.struct(false, TypeNode.I32, TypeNode.ptrTo(TypeNode.alias("node"))));
        assertEquals(CType.struct(CType.bitvector(32), CType.pointer(64)),
                LIFTER.liftMemType(TypeNode.alias("node"), list));

        TypeContext infinite = types("loop", TypeNode.struct(false, TypeNode.I32, TypeNode.alias("loop")));
        assertThrows(TypeLiftException.class, () -> LIFTER.liftMemType(TypeNode.alias("loop"), infinite));

        assertThrows(TypeLiftException.class, () -> LIFTER.liftMemType(TypeNode.alias("nothing"), TypeContext.EMPTY));
    }

    @Test
    void testGepResult() {
        TypeNode agg = TypeNode.struct(false, TypeNode.I32, TypeNode.array(4, TypeNode.I8));
        GepInsnNode gep = new GepInsnNode(true, local(TypeNode.ptrTo(agg), "p"), Arrays.asList(
                i32(0), i32(1), TypedValue.of(TypeNode.I64, ValueNode.ident("i"))));
        assertEquals(TypeNode.ptrTo(TypeNode.I8), InstrResultTypes.resultType(gep, TypeContext.EMPTY));
    }

    @Test
    void testVectorCompare() {
        TypeNode vec = TypeNode.vector(4, TypeNode.I32);
        CmpInsnNode cmp = new CmpInsnNode(CmpInsnNode.Predicate.EQ, local(vec, "a"), ValueNode.ident("b"));
        assertEquals(TypeNode.vector(4, TypeNode.I1), InstrResultTypes.resultType(cmp, TypeContext.EMPTY));
    }

    @Test
    void testNoValue() {
        assertThrows(TypeLiftException.class, () -> InstrResultTypes.resultType(
                new JumpInsnNode(label("next")), TypeContext.EMPTY));
    }
}
