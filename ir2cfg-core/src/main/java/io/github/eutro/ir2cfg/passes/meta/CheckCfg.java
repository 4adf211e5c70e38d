package io.github.eutro.ir2cfg.passes.meta;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.MetadataState;
import io.github.eutro.ir2cfg.ops.CommonOps;
import io.github.eutro.ir2cfg.passes.InPlaceIRPass;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.Insn;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.types.CType;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Verifies the structural invariants of a translated CFG, throwing {@link IllegalStateException}
 * on the first violation:
 * <ul>
 *     <li>every block ends in a control instruction, whose targets are in the function;</li>
 *     <li>the entry block has no predecessors;</li>
 *     <li>every register used or assigned has a type;</li>
 *     <li>every register used is a parameter or assigned somewhere;</li>
 *     <li>only phi copies assign a register more than once;</li>
 *     <li>copies assign registers of the types they read.</li>
 * </ul>
 */
public class CheckCfg implements InPlaceIRPass<Function> {
    public static final CheckCfg INSTANCE = new CheckCfg();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);
        if (func.blocks.isEmpty()) {
            throw new IllegalStateException("Function has no blocks");
        }

        Set<BasicBlock> blocks = new HashSet<>(func.blocks);
        Set<Var> defined = new HashSet<>(func.getExt(CfgExts.PARAMETERS).orElse(Collections.emptyList()));
        Set<Var> assignedOnce = new HashSet<>();
        for (Var param : defined) {
            checkTyped(param, "parameter");
        }
        for (BasicBlock block : func.blocks) {
            Control ctrl = block.getControl();
            if (ctrl == null) {
                throw new IllegalStateException("Block " + block.toTargetString() + " is not terminated");
            }
            for (BasicBlock target : ctrl.targets) {
                if (!blocks.contains(target)) {
                    throw new IllegalStateException("Block " + block.toTargetString()
                            + " jumps to " + target.toTargetString() + ", which is not in the function");
                }
            }
            for (Effect effect : block.getEffects()) {
                boolean isPhi = effect.getNullable(CommonExts.IS_PHI) != null;
                List<Var> targets = effect.getAssignsTo();
                for (Var var : targets) {
                    checkTyped(var, "target");
                    if (!assignedOnce.add(var) && !isPhi) {
                        throw new IllegalStateException("Register " + var + " assigned more than once, at " + effect);
                    }
                    defined.add(var);
                }
                if (effect.insn().op == CommonOps.IDENTITY) {
                    checkCopy(effect);
                }
            }
        }

        for (BasicBlock block : func.blocks) {
            for (Effect effect : block.getEffects()) {
                checkUses(effect.insn(), defined);
            }
            checkUses(block.getControl().insn(), defined);
        }

        ms.ensureValid(func, MetadataState.PREDS);
        List<BasicBlock> entryPreds = func.entry().getExtOrThrow(CommonExts.PREDS);
        if (!entryPreds.isEmpty()) {
            throw new IllegalStateException("Entry block has predecessors " + entryPreds);
        }

        ms.validate(MetadataState.VERIFIED);
    }

    private static void checkTyped(Var var, String what) {
        if (var.getNullable(CfgExts.REG_TYPE) == null) {
            throw new IllegalStateException("Untyped " + what + " register " + var);
        }
    }

    private static void checkUses(Insn insn, Set<Var> defined) {
        for (Var arg : insn) {
            checkTyped(arg, "argument");
            if (!defined.contains(arg)) {
                throw new IllegalStateException("Register " + arg + " used in " + insn + " is never assigned");
            }
        }
    }

    private static void checkCopy(Effect effect) {
        List<Var> targets = effect.getAssignsTo();
        List<Var> sources = effect.insn().args();
        if (targets.size() != sources.size()) {
            throw new IllegalStateException("Copy " + effect + " has " + sources.size()
                    + " sources but " + targets.size() + " targets");
        }
        for (int i = 0; i < targets.size(); i++) {
            CType to = targets.get(i).getType();
            CType from = sources.get(i).getType();
            if (!to.equals(from)) {
                throw new IllegalStateException("Copy " + effect + " moves " + from + " into " + to);
            }
        }
    }
}
