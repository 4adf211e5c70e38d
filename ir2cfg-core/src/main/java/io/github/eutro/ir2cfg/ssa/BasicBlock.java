package io.github.eutro.ir2cfg.ssa;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.Ext;
import io.github.eutro.ir2cfg.ext.ExtHolder;
import io.github.eutro.ir2cfg.ext.TrackedList;
import io.github.eutro.ir2cfg.source.BlockLabel;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * A basic block, encapsulating a list of {@link Effect} instructions,
 * followed by exactly one {@link Control} instruction at the end.
 */
public final class BasicBlock extends ExtHolder {
    private final TrackedList<Effect> effects = new TrackedList<Effect>(new ArrayList<>()) {
        @Override
        protected void onAdded(Effect elt) {
            elt.attachExt(CommonExts.OWNING_BLOCK, BasicBlock.this);
        }

        @Override
        protected void onRemoved(Effect elt) {
            elt.removeExt(CommonExts.OWNING_BLOCK);
        }
    };
    private Control control;

    BasicBlock() {
    }

    /**
     * Format this block as a jump target, for debugging. Blocks lowered from a labelled
     * source block show the label.
     *
     * @return The jump target string.
     */
    public String toTargetString() {
        BlockLabel label = getNullable(CfgExts.SOURCE_LABEL);
        String id = String.format("@%08x", System.identityHashCode(this));
        return label == null ? id : id + "(" + label.name + ")";
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(toTargetString()).append("\n{\n");
        for (Effect effect : getEffects()) {
            sb.append(' ').append(effect).append('\n');
        }
        sb.append(' ').append(getControl());
        sb.append("\n}");
        return sb.toString();
    }

    /**
     * Get the list of {@link Effect effects} in this basic block.
     *
     * @return The list.
     */
    public List<Effect> getEffects() {
        return effects;
    }

    /**
     * Add an {@link Effect effect} to the end of this basic block.
     *
     * @param effect The effect to add.
     */
    public void addEffect(Effect effect) {
        effects.add(effect);
    }

    /**
     * Get the control instruction of this block.
     *
     * @return The control instruction, or null if the block is not yet terminated.
     */
    public @Nullable Control getControl() {
        return control;
    }

    /**
     * Set the control instruction of this block.
     *
     * @param control The control instruction.
     */
    public void setControl(Control control) {
        control.attachExt(CommonExts.OWNING_BLOCK, this);
        this.control = control;
    }

    /**
     * Get the jump targets of this block's control instruction.
     *
     * @return The targets.
     * @throws IllegalStateException If the block is not terminated.
     */
    public List<BasicBlock> successors() {
        if (control == null) {
            throw new IllegalStateException("Block " + toTargetString() + " has no control instruction");
        }
        return control.targets;
    }

    // exts
    private Function owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = (Function) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_FUNCTION) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }
}
