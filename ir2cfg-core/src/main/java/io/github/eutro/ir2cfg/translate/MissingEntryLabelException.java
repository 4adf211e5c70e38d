package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.BlockLabel;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when the first block of a routine has no label, or its label has no block info.
 */
public class MissingEntryLabelException extends TranslationException {
    @Nullable
    public final BlockLabel label;

    public MissingEntryLabelException(@Nullable BlockLabel label) {
        super(label == null ? "Entry block has no label" : "Entry label not found in label map: " + label);
        this.label = label;
    }
}
