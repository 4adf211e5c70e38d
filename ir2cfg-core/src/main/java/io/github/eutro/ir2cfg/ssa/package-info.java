/**
 * The target CFG: {@link io.github.eutro.ir2cfg.ssa.Function functions} of
 * {@link io.github.eutro.ir2cfg.ssa.BasicBlock basic blocks}, each a list of
 * {@link io.github.eutro.ir2cfg.ssa.Effect effects} ended by one
 * {@link io.github.eutro.ir2cfg.ssa.Control control} instruction.
 * <p>
 * There are no phi nodes. Values flowing along edges are assigned by parallel copies
 * ({@link io.github.eutro.ir2cfg.ops.CommonOps#IDENTITY} effects with several targets)
 * at the end of the predecessor, or in a block of their own on that edge.
 * <p>
 * Every {@link io.github.eutro.ir2cfg.ssa.Var register} has exactly one static type.
 */
package io.github.eutro.ir2cfg.ssa;
