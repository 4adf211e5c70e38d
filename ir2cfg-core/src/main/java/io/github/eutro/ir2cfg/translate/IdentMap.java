package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.Ident;
import io.github.eutro.ir2cfg.ssa.Var;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The registers of a routine's identifiers. Each identifier is bound exactly once.
 */
public final class IdentMap {
    private final Map<Ident, Var> regs = new LinkedHashMap<>();

    /**
     * Bind an identifier to its register.
     *
     * @param ident The identifier.
     * @param reg   The register.
     * @throws DuplicateAssignmentException If the identifier is already bound.
     */
    public void bind(Ident ident, Var reg) {
        if (regs.putIfAbsent(ident, reg) != null) {
            throw new DuplicateAssignmentException(ident);
        }
    }

    /**
     * Get the register of an identifier.
     *
     * @param ident The identifier.
     * @return The register.
     * @throws UnboundIdentException If the identifier is not bound.
     */
    public Var get(Ident ident) {
        Var reg = regs.get(ident);
        if (reg == null) throw new UnboundIdentException(ident);
        return reg;
    }

    public @Nullable Var lookup(Ident ident) {
        return regs.get(ident);
    }

    public Map<Ident, Var> asMap() {
        return Collections.unmodifiableMap(regs);
    }
}
