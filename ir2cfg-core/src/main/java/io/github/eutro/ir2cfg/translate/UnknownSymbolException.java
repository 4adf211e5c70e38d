package io.github.eutro.ir2cfg.translate;

/**
 * Thrown when a routine symbol is not in the {@link HandleRegistry}.
 */
public class UnknownSymbolException extends TranslationException {
    public final String missingSymbol;

    public UnknownSymbolException(String symbol) {
        super("Could not find symbol: @" + symbol);
        this.missingSymbol = symbol;
    }
}
