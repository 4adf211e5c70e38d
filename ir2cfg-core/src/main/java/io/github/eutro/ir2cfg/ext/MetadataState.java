package io.github.eutro.ir2cfg.ext;

import io.github.eutro.ir2cfg.passes.IRPass;
import io.github.eutro.ir2cfg.passes.form.SequentializeCopies;
import io.github.eutro.ir2cfg.passes.meta.ComputePreds;
import io.github.eutro.ir2cfg.ssa.Function;

import java.util.BitSet;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Keeps track of the state of certain metadata in a {@link Function}, such as whether
 * its predecessor lists are up to date.
 */
public class MetadataState {
    /**
     * A kind of metadata whose presence can be checked on {@link MetadataState}.
     */
    public static class MetaKind {
        private static final AtomicInteger COUNTER = new AtomicInteger();
        final int id = COUNTER.getAndIncrement();
        final String name;

        MetaKind(String name) {
            this.name = name;
        }

        @Override
        public String toString() {
            return name;
        }
    }

    /**
     * A kind of metadata whose presence can be checked, but also specifies how to compute it.
     *
     * @param <T> The IR on which passes must be run to compute the metadata.
     */
    public static class ComputableMetaKind<T> extends MetaKind {
        private final IRPass<T, T>[] passes;

        @SafeVarargs
        ComputableMetaKind(String name, IRPass<T, T>... passes) {
            super(name);
            this.passes = passes;
        }

        void computeFor(T t) {
            for (IRPass<T, T> pass : passes) {
                if (!pass.isInPlace()) throw new IllegalArgumentException("Pass " + pass + " is not in-place");
                pass.run(t);
            }
        }
    }

    /**
     * Metadata that can be computed for functions.
     */
    public static final ComputableMetaKind<Function>
            PREDS = new ComputableMetaKind<>("PREDS", ComputePreds.INSTANCE),
            COPIES_SEQUENTIAL = new ComputableMetaKind<>("COPIES_SEQUENTIAL", SequentializeCopies.INSTANCE);

    /**
     * Set once a function has passed verification, and cleared by any change to it.
     */
    public static final MetaKind VERIFIED = new MetaKind("VERIFIED");

    private final BitSet validSet = new BitSet();

    /**
     * Check whether the given metadata is valid.
     *
     * @param kind The kind of metadata.
     * @return Whether it is valid on this.
     */
    public boolean isValid(MetaKind kind) {
        return validSet.get(kind.id);
    }

    /**
     * Check whether the given metadata are valid, and compute it if it is not.
     *
     * @param t     The thing that passes can be run on.
     * @param first The first metadata kind.
     * @param kinds The other metadata kinds.
     * @param <T>   The type of {@code t}.
     */
    @SafeVarargs
    public final <T> void ensureValid(T t, ComputableMetaKind<T> first, ComputableMetaKind<T>... kinds) {
        ensureValid0(t, first);
        for (ComputableMetaKind<T> kind : kinds) {
            ensureValid0(t, kind);
        }
    }

    private <T> void ensureValid0(T t, ComputableMetaKind<T> kind) {
        if (!isValid(kind)) {
            kind.computeFor(t);
            validate(kind);
        }
    }

    public void validate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, true);
        }
    }

    public void invalidate(MetaKind... kinds) {
        for (MetaKind kind : kinds) {
            validSet.set(kind.id, false);
        }
    }

    /**
     * Invalidate everything that becomes invalid if the control flow graph changes.
     */
    public void graphChanged() {
        invalidate(PREDS);
        varsChanged();
    }

    /**
     * Invalidate everything that becomes invalid if the instructions change.
     */
    public void varsChanged() {
        invalidate(VERIFIED);
    }
}
