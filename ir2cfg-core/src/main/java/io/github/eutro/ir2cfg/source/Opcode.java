package io.github.eutro.ir2cfg.source;

/**
 * Source instruction opcodes.
 */
public enum Opcode {
    // binary
    ADD, SUB, MUL, UDIV, SDIV, UREM, SREM,
    SHL, LSHR, ASHR, AND, OR, XOR,
    FADD, FSUB, FMUL, FDIV, FREM,

    // comparison
    ICMP, FCMP,

    // conversion
    TRUNC, ZEXT, SEXT, FPTRUNC, FPEXT,
    FPTOUI, FPTOSI, UITOFP, SITOFP,
    PTRTOINT, INTTOPTR, BITCAST,

    // memory
    ALLOCA, LOAD, STORE, GETELEMENTPTR,

    // other
    CALL, PHI, SELECT,
    EXTRACTVALUE, INSERTVALUE,
    EXTRACTELEMENT, INSERTELEMENT,

    // terminators
    BR(true), CONDBR(true), SWITCH(true), RET(true), UNREACHABLE(true), INDIRECTBR(true),
    ;

    /**
     * Whether instructions with this opcode end their block.
     */
    public final boolean terminator;

    Opcode(boolean terminator) {
        this.terminator = terminator;
    }

    Opcode() {
        this(false);
    }

    public boolean isBinary() {
        return compareTo(ADD) >= 0 && compareTo(FREM) <= 0;
    }

    public boolean isConversion() {
        return compareTo(TRUNC) >= 0 && compareTo(BITCAST) <= 0;
    }

    @Override
    public String toString() {
        return name().toLowerCase();
    }
}
