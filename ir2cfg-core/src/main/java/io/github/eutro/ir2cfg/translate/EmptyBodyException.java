package io.github.eutro.ir2cfg.translate;

/**
 * Thrown when a routine definition has no blocks.
 */
public class EmptyBodyException extends TranslationException {
    public EmptyBodyException(String symbol) {
        super("Routine @" + symbol + " has no blocks");
        inRoutine(symbol);
    }
}
