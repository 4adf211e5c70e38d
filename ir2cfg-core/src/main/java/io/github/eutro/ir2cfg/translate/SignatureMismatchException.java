package io.github.eutro.ir2cfg.translate;

/**
 * Thrown when two signatures for one routine disagree, or a call disagrees with its callee's
 * signature, where this is checked.
 */
public class SignatureMismatchException extends TranslationException {
    public SignatureMismatchException(String callee, String detail) {
        super("Incompatible signatures for @" + callee + ": " + detail);
    }
}
