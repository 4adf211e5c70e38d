package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.BlockLabel;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a block is missing a label, or a branch targets a label with no block.
 */
public class UnknownLabelException extends TranslationException {
    @Nullable
    public final BlockLabel label;

    public UnknownLabelException(@Nullable BlockLabel label) {
        super(label == null ? "Basic block has no label" : "Basic block not found in block info map: " + label);
        this.label = label;
    }
}
