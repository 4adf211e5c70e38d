package io.github.eutro.ir2cfg.translate;

import org.jetbrains.annotations.Nullable;

/**
 * Thrown when a module, or one of its routines, cannot be translated.
 * <p>
 * There is no partial output: a routine which throws this produces no CFG, and neither
 * does its module.
 */
public class TranslationException extends RuntimeException {
    @Nullable
    private String symbol;

    public TranslationException(String message) {
        super(message);
    }

    public TranslationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Get the symbol of the routine being translated when this was thrown, if known.
     *
     * @return The symbol, or null.
     */
    public @Nullable String getSymbol() {
        return symbol;
    }

    /**
     * Record the routine this was thrown in, unless one is already recorded.
     *
     * @param symbol The routine symbol.
     * @return This exception.
     */
    public TranslationException inRoutine(String symbol) {
        if (this.symbol == null) {
            this.symbol = symbol;
        }
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return symbol == null ? message : message + " (in @" + symbol + ")";
    }
}
