package io.github.eutro.ir2cfg.ssa;

import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.DelegatingExtHolder;
import io.github.eutro.ir2cfg.ext.Ext;
import io.github.eutro.ir2cfg.ext.ExtContainer;
import io.github.eutro.ir2cfg.ops.Op;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.RandomAccess;

/**
 * An instruction: an {@link Op operation} applied to argument registers.
 * <p>
 * Exts not found on the instruction are looked up on its operation.
 */
public final class Insn extends DelegatingExtHolder implements Iterable<Var> {
    /**
     * Whether to record a stack trace when instructions are created, to find where
     * a malformed one came from.
     */
    public static boolean TRACK_INSN_CREATIONS = System.getenv("IR2CFG_TRACK_INSN_CREATIONS") != null;

    public final @Nullable Throwable created = TRACK_INSN_CREATIONS ? new Throwable("constructed") : null;
    public Op op;
    private final Var[] args;

    public Insn(Op op, List<Var> args) {
        this.op = op;
        this.args = args.toArray(new Var[0]);
    }

    public Insn(Op op, Var... args) {
        this(op, Arrays.asList(args));
    }

    @Override
    protected ExtContainer getDelegate() {
        return op;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(op);
        for (Var arg : args) {
            sb.append(' ').append(arg);
        }
        return sb.toString();
    }

    public Effect assignTo(Var... vars) {
        return new Effect(new ArrayList<>(Arrays.asList(vars)), this);
    }

    public Effect assignTo(List<Var> vars) {
        return new Effect(vars, this);
    }

    public Control jumpsTo(BasicBlock... targets) {
        return jumpsTo(new ArrayList<>(Arrays.asList(targets)));
    }

    public Control jumpsTo(List<BasicBlock> targets) {
        return new Control(this, targets);
    }

    /**
     * Get the arguments of this instruction. The list may be updated in place, but not resized.
     *
     * @return The arguments.
     */
    public List<Var> args() {
        return new Args();
    }

    @NotNull
    @Override
    public Iterator<Var> iterator() {
        return args().iterator();
    }

    // exts
    private Object owner = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT) {
            return owner instanceof Effect ? (T) owner : null;
        } else if (ext == CommonExts.OWNING_CONTROL) {
            return owner instanceof Control ? (T) owner : null;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.OWNING_EFFECT || ext == CommonExts.OWNING_CONTROL) {
            owner = null;
            return;
        }
        super.removeExt(ext);
    }

    private class Args extends AbstractList<Var> implements RandomAccess {
        @Override
        public Var get(int index) {
            return args[index];
        }

        @Override
        public Var set(int index, Var value) {
            Var old = args[index];
            args[index] = value;
            return old;
        }

        @Override
        public int size() {
            return args.length;
        }
    }
}
