package io.github.eutro.ir2cfg.passes.opts;

import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.passes.InPlaceIRPass;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.util.GraphWalker;

import java.util.HashSet;

/**
 * Removes any blocks unreachable from the entry block.
 */
public class EliminateDeadBlocks implements InPlaceIRPass<Function> {
    public static final EliminateDeadBlocks INSTANCE = new EliminateDeadBlocks();

    @Override
    public void runInPlace(Function function) {
        if (function.blocks.retainAll(new HashSet<>(
                GraphWalker.blockWalker(function)
                        .preOrder()
                        .toList()))) {
            function.getExtOrThrow(CommonExts.METADATA_STATE)
                    .graphChanged();
        }
    }
}
