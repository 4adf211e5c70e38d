package io.github.eutro.ir2cfg.ssa;

import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.DelegatingExtHolder;
import io.github.eutro.ir2cfg.ext.Ext;
import io.github.eutro.ir2cfg.ext.ExtContainer;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;
import java.util.stream.Collectors;

/**
 * An effect, encapsulating an {@link Insn instruction}, and the
 * registers its results are assigned to.
 * <p>
 * An effect with several targets assigns them all at once: every argument is read
 * before any target is written.
 */
public final class Effect extends DelegatingExtHolder {
    private Var[] assignsTo;
    private Insn insn;

    Effect(List<Var> assignsTo, Insn insn) {
        this.setAssignsTo(assignsTo);
        this.setInsn(insn);
    }

    @Override
    protected ExtContainer getDelegate() {
        return insn();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (assignsTo.length != 0) {
            sb.append(getAssignsTo().stream()
                    .map(Objects::toString)
                    .collect(Collectors.joining(", ", "", " = ")));
        }
        sb.append(insn());
        return sb.toString();
    }

    /**
     * Get the list of registers this effect assigns to.
     *
     * @return The list.
     */
    public List<Var> getAssignsTo() {
        return new AssignedTo();
    }

    /**
     * Set the list of registers this effect assigns to. The list will be copied.
     *
     * @param assignsTo The list of registers.
     */
    public void setAssignsTo(List<Var> assignsTo) {
        this.assignsTo = assignsTo.toArray(new Var[0]);
        for (Var var : this.assignsTo) {
            register(var);
        }
    }

    private void register(Var var) {
        var.attachExt(CommonExts.ASSIGNED_AT, this);
    }

    /**
     * Get the {@link Insn underlying instruction} of this effect instruction.
     *
     * @return The instruction.
     */
    public Insn insn() {
        return insn;
    }

    /**
     * Set the {@link Insn underlying instruction} of this effect instruction.
     *
     * @param insn The instruction.
     */
    public void setInsn(Insn insn) {
        insn.attachExt(CommonExts.OWNING_EFFECT, this);
        this.insn = insn;
    }

    // exts
    private BasicBlock owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            return (T) owner;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = (BasicBlock) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_BLOCK) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }

    private class AssignedTo extends AbstractList<Var> implements RandomAccess {
        @Override
        public Var get(int index) {
            return assignsTo[index];
        }

        @Override
        public Var set(int index, Var value) {
            Var old = assignsTo[index];
            assignsTo[index] = value;
            register(value);
            return old;
        }

        @Override
        public int size() {
            return assignsTo.length;
        }
    }
}
