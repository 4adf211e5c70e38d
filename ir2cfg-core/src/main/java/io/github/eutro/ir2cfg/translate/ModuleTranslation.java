package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.ssa.Function;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;

/**
 * The result of translating a module: a CFG for every definition, the initializers of
 * its globals, and the handles its routines were given.
 * <p>
 * Every translation is given a fresh {@link Nonce}, and two translations are equal exactly
 * when their nonces are.
 */
public final class ModuleTranslation {
    private final Map<String, Function> cfgMap;
    private final Map<String, GlobalInitializer> globalInitMap;
    private final HandleRegistry handleContext;
    private final Nonce nonce;

    ModuleTranslation(Map<String, Function> cfgMap,
                      Map<String, GlobalInitializer> globalInitMap,
                      HandleRegistry handleContext,
                      Nonce nonce) {
        this.cfgMap = Collections.unmodifiableMap(cfgMap);
        this.globalInitMap = Collections.unmodifiableMap(globalInitMap);
        this.handleContext = handleContext;
        this.nonce = nonce;
    }

    /**
     * Get the CFGs of the module's definitions, by symbol, in definition order.
     *
     * @return The CFGs.
     */
    public Map<String, Function> cfgMap() {
        return cfgMap;
    }

    public Map<String, GlobalInitializer> globalInitMap() {
        return globalInitMap;
    }

    /**
     * Get the handles of every routine declared or defined in the module.
     *
     * @return The sealed registry.
     */
    public HandleRegistry handleContext() {
        return handleContext;
    }

    public Nonce nonce() {
        return nonce;
    }

    public Optional<Function> findCfg(String symbol) {
        return Optional.ofNullable(cfgMap.get(symbol));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModuleTranslation)) return false;
        return nonce.equals(((ModuleTranslation) o).nonce);
    }

    @Override
    public int hashCode() {
        return nonce.hashCode();
    }

    @Override
    public String toString() {
        return "ModuleTranslation{" + nonce + ", routines=" + cfgMap.keySet() + ", globals=" + globalInitMap.keySet() + "}";
    }
}
