package io.github.eutro.ir2cfg.passes.meta;

import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.MetadataState;
import io.github.eutro.ir2cfg.passes.InPlaceIRPass;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Function;

import java.util.ArrayList;

/**
 * Computes {@link CommonExts#PREDS} for each block.
 */
public class ComputePreds implements InPlaceIRPass<Function> {
    public static final ComputePreds INSTANCE = new ComputePreds();

    @Override
    public void runInPlace(Function func) {
        MetadataState ms = func.getExtOrThrow(CommonExts.METADATA_STATE);

        for (BasicBlock block : func.blocks) {
            block.attachExt(CommonExts.PREDS, new ArrayList<>());
        }
        for (BasicBlock block : func.blocks) {
            for (BasicBlock target : block.successors()) {
                target.getExtOrThrow(CommonExts.PREDS).add(block);
            }
        }

        ms.validate(MetadataState.PREDS);
    }
}
