package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.AbstractInsnNode;

/**
 * Thrown for instructions the translator does not handle, such as computed jumps.
 */
public class UnsupportedInstructionException extends TranslationException {
    public final AbstractInsnNode insn;

    public UnsupportedInstructionException(AbstractInsnNode insn, String reason) {
        super("Unsupported instruction " + insn.opcode + ": " + reason);
        this.insn = insn;
    }
}
