package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.source.BlockLabel;
import io.github.eutro.ir2cfg.source.BlockNode;
import io.github.eutro.ir2cfg.source.DefineNode;
import io.github.eutro.ir2cfg.source.PhiInsnNode;
import io.github.eutro.ir2cfg.source.StmtNode;
import io.github.eutro.ir2cfg.source.TypedValue;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Function;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What is known about a labelled source block before any block is lowered:
 * the target block it lowers into, and the phi copies owed on each edge into it.
 */
public final class BlockInfo {
    public final BlockLabel label;
    public final BasicBlock block;
    private final Map<BlockLabel, List<PhiObligation>> phis = new LinkedHashMap<>();

    BlockInfo(BlockLabel label, BasicBlock block) {
        this.label = label;
        this.block = block;
    }

    /**
     * Get the phi copies owed when control arrives from the given block, in phi order.
     *
     * @param pred The label of the predecessor.
     * @return The obligations, possibly empty.
     */
    public List<PhiObligation> phisFrom(BlockLabel pred) {
        return phis.getOrDefault(pred, Collections.emptyList());
    }

    private void addPhi(PhiObligation obligation) {
        phis.computeIfAbsent(obligation.from, $ -> new ArrayList<>()).add(obligation);
    }

    /**
     * Create a target block for every labelled block of a routine, and collect their phis.
     *
     * @param def  The routine.
     * @param func The function to create blocks in.
     * @return The block infos, by label, in source order.
     */
    public static Map<BlockLabel, BlockInfo> buildAll(DefineNode def, Function func) {
        Map<BlockLabel, BlockInfo> infos = new LinkedHashMap<>();
        for (BlockNode bn : def.body) {
            if (bn.label == null) continue;
            BasicBlock bb = func.newBb();
            bb.attachExt(CfgExts.SOURCE_LABEL, bn.label);
            BlockInfo info = new BlockInfo(bn.label, bb);
            if (infos.putIfAbsent(bn.label, info) != null) {
                throw new TranslationException("Duplicate block label " + bn.label);
            }
            for (StmtNode stmt : bn.stmts) {
                if (!(stmt.insn instanceof PhiInsnNode) || stmt.result == null) continue;
                PhiInsnNode phi = (PhiInsnNode) stmt.insn;
                for (PhiInsnNode.Incoming in : phi.incoming) {
                    info.addPhi(new PhiObligation(in.from, stmt.result, TypedValue.of(phi.type, in.value)));
                }
            }
        }
        return infos;
    }
}
