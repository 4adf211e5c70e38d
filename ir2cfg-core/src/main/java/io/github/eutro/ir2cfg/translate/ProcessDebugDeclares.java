package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.passes.IRPass;
import io.github.eutro.ir2cfg.source.AllocaInsnNode;
import io.github.eutro.ir2cfg.source.BlockNode;
import io.github.eutro.ir2cfg.source.CallInsnNode;
import io.github.eutro.ir2cfg.source.ConvInsnNode;
import io.github.eutro.ir2cfg.source.DebugAnnotation;
import io.github.eutro.ir2cfg.source.DefineNode;
import io.github.eutro.ir2cfg.source.Ident;
import io.github.eutro.ir2cfg.source.Opcode;
import io.github.eutro.ir2cfg.source.StmtNode;
import io.github.eutro.ir2cfg.source.TypedValue;
import io.github.eutro.ir2cfg.source.ValMd;
import io.github.eutro.ir2cfg.source.ValueNode;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;

/**
 * Moves the metadata of {@code llvm.dbg.declare} calls onto the {@code alloca}s they describe,
 * following {@code bitcast}s of the allocated pointer back to the allocation.
 * <p>
 * Statements are scanned once, last to first, so a declaration is always seen before
 * the casts and allocation it refers to.
 */
public class ProcessDebugDeclares implements IRPass<DefineNode, DebugAnnotationMap> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessDebugDeclares.class);

    public static final ProcessDebugDeclares INSTANCE = new ProcessDebugDeclares();

    /**
     * The intrinsic whose metadata is moved.
     */
    public static final String DBG_DECLARE = "llvm.dbg.declare";

    @Override
    public DebugAnnotationMap run(DefineNode def) {
        Map<Ident, List<DebugAnnotation>> acc = new HashMap<>();
        IdentityHashMap<StmtNode, List<DebugAnnotation>> effective = new IdentityHashMap<>();

        ListIterator<BlockNode> blocks = def.body.listIterator(def.body.size());
        while (blocks.hasPrevious()) {
            List<StmtNode> stmts = blocks.previous().stmts;
            ListIterator<StmtNode> it = stmts.listIterator(stmts.size());
            while (it.hasPrevious()) {
                StmtNode stmt = it.previous();
                if (stmt.result != null && stmt.insn instanceof AllocaInsnNode) {
                    List<DebugAnnotation> declared = acc.get(stmt.result);
                    if (declared != null) {
                        effective.put(stmt, concat(declared, stmt.annotations));
                    }
                } else if (stmt.result != null && stmt.insn.opcode == Opcode.BITCAST) {
                    ValueNode from = ((ConvInsnNode) stmt.insn).value.value;
                    if (from instanceof ValueNode.IdentValue) {
                        List<DebugAnnotation> md = concat(stmt.annotations,
                                acc.getOrDefault(stmt.result, Collections.emptyList()));
                        acc.merge(((ValueNode.IdentValue) from).ident, md, (existing, cast) -> concat(cast, existing));
                    }
                } else if (stmt.insn instanceof CallInsnNode
                        && DBG_DECLARE.equals(((CallInsnNode) stmt.insn).calleeSymbol())) {
                    Ident declared = declaredIdent((CallInsnNode) stmt.insn);
                    if (declared == null) {
                        LOGGER.debug("Ignoring ill-formed debug declaration in @{}: {}", def.symbol, stmt);
                    } else {
                        acc.put(declared, stmt.annotations);
                    }
                }
            }
        }
        return new DebugAnnotationMap(acc, effective);
    }

    private static @Nullable Ident declaredIdent(CallInsnNode call) {
        if (call.args.isEmpty()) return null;
        ValueNode arg = call.args.get(0).value;
        if (!(arg instanceof ValueNode.MdValue)) return null;
        ValMd md = ((ValueNode.MdValue) arg).md;
        if (!(md instanceof ValMd.Value)) return null;
        TypedValue declared = ((ValMd.Value) md).value;
        if (!(declared.value instanceof ValueNode.IdentValue)) return null;
        return ((ValueNode.IdentValue) declared.value).ident;
    }

    private static <T> List<T> concat(List<T> first, List<T> second) {
        if (second.isEmpty()) return first;
        if (first.isEmpty()) return second;
        List<T> ls = new ArrayList<>(first.size() + second.size());
        ls.addAll(first);
        ls.addAll(second);
        return ls;
    }
}
