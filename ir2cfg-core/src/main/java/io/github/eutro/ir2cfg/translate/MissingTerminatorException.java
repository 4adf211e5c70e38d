package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.BlockLabel;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a block's statements end without a control transfer.
 */
public class MissingTerminatorException extends TranslationException {
    @Nullable
    public final BlockLabel label;

    public MissingTerminatorException(@Nullable BlockLabel label) {
        super("Basic block " + (label == null ? "(unlabeled)" : label) + " ended without a terminating instruction");
        this.label = label;
    }
}
