package io.github.eutro.ir2cfg.test;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ops.Op;
import io.github.eutro.ir2cfg.source.*;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.translate.HandleAllocator;
import io.github.eutro.ir2cfg.translate.TranslatorConfig;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class Utils {
    public static TranslatorConfig.Builder config() {
        return TranslatorConfig.builder()
                .setAllocator(new HandleAllocator())
                .setVerify(true);
    }

    public static TypedValue local(TypeNode type, String name) {
        return TypedValue.of(type, ValueNode.ident(name));
    }

    public static TypedValue i32(long value) {
        return TypedValue.of(TypeNode.I32, ValueNode.integer(value));
    }

    public static BlockLabel label(String name) {
        return BlockLabel.of(name);
    }

    public static StmtNode assign(String name, AbstractInsnNode insn, DebugAnnotation... annotations) {
        return StmtNode.result(Ident.of(name), insn, annotations);
    }

    public static StmtNode effect(AbstractInsnNode insn, DebugAnnotation... annotations) {
        return StmtNode.effect(insn, annotations);
    }

    public static BlockNode block(String label, StmtNode... stmts) {
        return new BlockNode(label == null ? null : BlockLabel.of(label), Arrays.asList(stmts));
    }

    public static DefineNode.Param param(TypeNode type, String name) {
        return new DefineNode.Param(type, Ident.of(name));
    }

    public static DefineNode define(String symbol, TypeNode ret, List<DefineNode.Param> params, BlockNode... body) {
        return new DefineNode(symbol, ret, params, false, Arrays.asList(body), Collections.emptyMap());
    }

    public static DefineNode define(String symbol,
                                    TypeNode ret,
                                    List<DefineNode.Param> params,
                                    Map<String, ValMd> metadata,
                                    BlockNode... body) {
        return new DefineNode(symbol, ret, params, false, Arrays.asList(body), metadata);
    }

    public static ModuleNode module(DefineNode... defines) {
        ModuleNode.Builder builder = ModuleNode.builder();
        for (DefineNode define : defines) {
            builder.define(define);
        }
        return builder.build();
    }

    public static StmtNode ret(TypedValue value) {
        return effect(new RetInsnNode(value));
    }

    public static StmtNode retVoid() {
        return effect(new RetInsnNode(null));
    }

    public static StmtNode br(String target) {
        return effect(new JumpInsnNode(label(target)));
    }

    public static StmtNode dbgDeclare(TypeNode type, String ident, DebugAnnotation... annotations) {
        return effect(new CallInsnNode(
                false,
                TypeNode.function(TypeNode.VOID, Arrays.asList(TypeNode.METADATA, TypeNode.METADATA), false),
                ValueNode.symbol("llvm.dbg.declare"),
                Arrays.asList(
                        TypedValue.of(TypeNode.METADATA, ValueNode.md(ValMd.value(local(type, ident)))),
                        TypedValue.of(TypeNode.METADATA, ValueNode.md(ValMd.info(
                                new DebugInfo.LocalVariable(ident, null, null, 0))))
                )), annotations);
    }

    public static ValMd file(String filename, String directory) {
        return ValMd.info(new DebugInfo.File(filename, directory));
    }

    public static DebugAnnotation dbgLoc(int line, int col, ValMd scope) {
        return DebugAnnotation.dbg(ValMd.loc(new DebugLoc(line, col, scope)));
    }

    @NotNull
    public static BasicBlock labelled(Function func, String label) {
        for (BasicBlock block : func.blocks) {
            if (BlockLabel.of(label).equals(block.getNullable(CfgExts.SOURCE_LABEL))) {
                return block;
            }
        }
        throw new AssertionError("No block labelled " + label + " in\n" + func);
    }

    public static List<Effect> effectsOf(Function func, Op op) {
        List<Effect> effects = new ArrayList<>();
        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                if (effect.insn().op == op) effects.add(effect);
            }
        }
        return effects;
    }

    public static List<String> names(List<Var> vars) {
        List<String> names = new ArrayList<>();
        for (Var var : vars) {
            names.add(var.name);
        }
        return names;
    }
}
