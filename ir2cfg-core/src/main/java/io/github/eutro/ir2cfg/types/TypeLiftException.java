package io.github.eutro.ir2cfg.types;

import io.github.eutro.ir2cfg.source.TypeNode;
import io.github.eutro.ir2cfg.translate.TranslationException;
import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a source type has no target counterpart, or an instruction has no result type.
 */
public class TypeLiftException extends TranslationException {
    @Nullable
    public final TypeNode type;

    public TypeLiftException(@Nullable TypeNode type, String reason) {
        super(type == null ? reason : "Cannot lift type " + type + ": " + reason);
        this.type = type;
    }
}
