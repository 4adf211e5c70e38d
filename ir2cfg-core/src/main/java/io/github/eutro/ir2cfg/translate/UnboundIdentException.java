package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.Ident;

/**
 * Thrown when an identifier is used, but defined nowhere in its routine.
 */
public class UnboundIdentException extends TranslationException {
    public final Ident ident;

    public UnboundIdentException(Ident ident) {
        super("Identifier not bound: " + ident);
        this.ident = ident;
    }
}
