package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.GlobalNode;
import io.github.eutro.ir2cfg.source.ModuleNode;
import io.github.eutro.ir2cfg.types.TypeLiftException;
import io.github.eutro.ir2cfg.types.TypeLifter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the global initializer map of a module translation.
 */
@FunctionalInterface
public interface GlobalInitializerBuilder {
    /**
     * Records every global that has an initializer. A global whose type cannot be lifted
     * is recorded with the reason, rather than failing the module.
     */
    GlobalInitializerBuilder DEFAULT = (module, lifter) -> {
        Map<String, GlobalInitializer> map = new LinkedHashMap<>();
        for (GlobalNode global : module.globals) {
            if (global.init == null) continue;
            GlobalInitializer init;
            try {
                init = GlobalInitializer.of(global, lifter.liftMemType(global.type, module.typeContext()));
            } catch (TypeLiftException e) {
                init = GlobalInitializer.failed(global, e.getMessage());
            }
            map.put(global.symbol, init);
        }
        return map;
    };

    /**
     * Build the initializer map.
     *
     * @param module The module.
     * @param lifter The type lifter in use.
     * @return The initializers, by global symbol.
     */
    Map<String, GlobalInitializer> build(ModuleNode module, TypeLifter lifter);
}
