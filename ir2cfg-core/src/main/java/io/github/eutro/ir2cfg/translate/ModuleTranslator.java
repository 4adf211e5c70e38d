package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.passes.IRPass;
import io.github.eutro.ir2cfg.source.DeclareNode;
import io.github.eutro.ir2cfg.source.DefineNode;
import io.github.eutro.ir2cfg.source.ModuleNode;
import io.github.eutro.ir2cfg.ssa.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Translates a whole module.
 * <p>
 * Every declaration and definition is given a handle first, so calls may refer to routines
 * in any order. Definitions are then lowered independently of each other, concurrently if
 * {@link TranslatorConfig#isParallel() configured}. The first error aborts the translation.
 */
public class ModuleTranslator implements IRPass<ModuleNode, ModuleTranslation> {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModuleTranslator.class);

    public static final ModuleTranslator DEFAULT = new ModuleTranslator(TranslatorConfig.DEFAULT);

    private final TranslatorConfig config;

    public ModuleTranslator(TranslatorConfig config) {
        this.config = config;
    }

    @Override
    public ModuleTranslation run(ModuleNode module) {
        HandleRegistry registry = new HandleRegistry(
                config.getTypeLifter(),
                module.typeContext(),
                config.getAllocator(),
                config.isStrictRedeclarations()
        );
        for (DeclareNode decl : module.allDeclares()) {
            registry.declare(decl);
        }
        registry.seal();
        LOGGER.debug("Declared {} routine(s)", registry.handles().size());

        Set<String> defined = new HashSet<>();
        for (DefineNode def : module.defines) {
            if (!defined.add(def.symbol)) {
                throw new TranslationException("Routine @" + def.symbol + " is defined more than once");
            }
        }

        RoutineTranslator translator = new RoutineTranslator(registry, config);
        Stream<DefineNode> defines = config.isParallel()
                ? module.defines.parallelStream()
                : module.defines.stream();
        List<Function> funcs = defines.map(translator::run).collect(Collectors.toList());
        Map<String, Function> cfgs = new LinkedHashMap<>();
        for (int i = 0; i < funcs.size(); i++) {
            cfgs.put(module.defines.get(i).symbol, funcs.get(i));
        }

        Map<String, GlobalInitializer> globals = config.getGlobalInitializerBuilder()
                .build(module, config.getTypeLifter());
        Nonce nonce = config.getAllocator().freshNonce();
        LOGGER.debug("Translated {} routine(s) and {} global initializer(s) as {}", cfgs.size(), globals.size(), nonce);
        return new ModuleTranslation(cfgs, globals, registry, nonce);
    }
}
