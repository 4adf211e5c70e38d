package io.github.eutro.ir2cfg.ext;

import io.github.eutro.ir2cfg.passes.form.SequentializeCopies;
import io.github.eutro.ir2cfg.passes.meta.ComputePreds;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.Insn;
import io.github.eutro.ir2cfg.ssa.Var;

import java.util.List;

/**
 * {@link Ext}s describing the structure of the target IR itself.
 *
 * @see CfgExts
 */
public class CommonExts {
    /**
     * Attached to a {@link Function}. Has metadata about the form of the function.
     *
     * @see MetadataState
     */
    public static final Ext<MetadataState> METADATA_STATE = Ext.create(MetadataState.class, "METADATA_STATE");

    /**
     * Attached to a {@link BasicBlock}. The predecessors of the block.
     * <p>
     * Computed by {@link ComputePreds}.
     */
    public static final Ext<List<BasicBlock>> PREDS = Ext.create(List.class, "PREDS");

    /**
     * Attached to an {@link Effect}. Whether the effect is a parallel copy lowered from phi nodes.
     *
     * @see SequentializeCopies
     */
    public static final Ext<Boolean> IS_PHI = Ext.create(Boolean.class, "IS_PHI");

    /**
     * Attached to a {@link Var}. The {@link Effect} this was assigned at.
     */
    public static final Ext<Effect> ASSIGNED_AT = Ext.create(Effect.class, "ASSIGNED_AT");

    /**
     * Attached to a {@link BasicBlock}. The function this basic block is in.
     */
    public static final Ext<Function> OWNING_FUNCTION = Ext.create(Function.class, "OWNING_FUNCTION");
    /**
     * Attached to a {@link Control} or {@link Effect}. The block this instruction is in.
     */
    public static final Ext<BasicBlock> OWNING_BLOCK = Ext.create(BasicBlock.class, "OWNING_BLOCK");
    /**
     * Attached to a {@link Insn}. The control instruction this insn is part of, if any.
     */
    public static final Ext<Control> OWNING_CONTROL = Ext.create(Control.class, "OWNING_CONTROL");
    /**
     * Attached to a {@link Insn}. The effect instruction this insn is part of, if any.
     */
    public static final Ext<Effect> OWNING_EFFECT = Ext.create(Effect.class, "OWNING_EFFECT");
}
