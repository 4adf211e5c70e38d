package io.github.eutro.ir2cfg.passes;

import io.github.eutro.ir2cfg.passes.form.SequentializeCopies;
import io.github.eutro.ir2cfg.passes.meta.CheckCfg;
import io.github.eutro.ir2cfg.passes.meta.ComputePreds;
import io.github.eutro.ir2cfg.passes.opts.EliminateDeadBlocks;
import io.github.eutro.ir2cfg.ssa.Function;

/**
 * Common pipelines over translated CFGs.
 */
public class Passes {
    /**
     * The default structuring of a freshly lowered CFG: drop unreachable blocks, then
     * compute predecessors.
     */
    public static final IRPass<Function, Function> STRUCTURE =
            EliminateDeadBlocks.INSTANCE
                    .then(ComputePreds.INSTANCE);

    /**
     * Lower parallel copies for consumers that need sequential assignments, and check the result.
     */
    public static final IRPass<Function, Function> SEQUENTIAL =
            SequentializeCopies.INSTANCE
                    .then(CheckCfg.INSTANCE);
}
