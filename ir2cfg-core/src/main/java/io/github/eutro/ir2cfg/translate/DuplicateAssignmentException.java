package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.Ident;

/**
 * Thrown when an identifier is defined more than once, breaking SSA form.
 */
public class DuplicateAssignmentException extends TranslationException {
    public final Ident ident;

    public DuplicateAssignmentException(Ident ident) {
        super("Register not used in SSA fashion: " + ident);
        this.ident = ident;
    }
}
