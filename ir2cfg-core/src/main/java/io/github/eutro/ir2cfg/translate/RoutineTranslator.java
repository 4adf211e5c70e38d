package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.passes.IRPass;
import io.github.eutro.ir2cfg.passes.meta.CheckCfg;
import io.github.eutro.ir2cfg.source.BlockLabel;
import io.github.eutro.ir2cfg.source.BlockNode;
import io.github.eutro.ir2cfg.source.DebugAnnotation;
import io.github.eutro.ir2cfg.source.DefineNode;
import io.github.eutro.ir2cfg.source.ValMd;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.IRBuilder;
import io.github.eutro.ir2cfg.ssa.SourceLocation;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.types.CType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lowers one routine definition into a CFG.
 * <p>
 * The resulting function has a synthetic entry block, whose only content is a jump to the
 * block of the first source block, so nothing ever branches back to the entry.
 * <p>
 * Any {@link TranslationException} thrown is tagged with the routine's symbol.
 */
public class RoutineTranslator implements IRPass<DefineNode, Function> {
    private static final Logger LOGGER = LoggerFactory.getLogger(RoutineTranslator.class);

    private final HandleRegistry registry;
    private final TranslatorConfig config;

    /**
     * Construct a routine translator.
     *
     * @param registry The handles of the module, which must contain the routines translated.
     * @param config   The translator settings.
     */
    public RoutineTranslator(HandleRegistry registry, TranslatorConfig config) {
        this.registry = registry;
        this.config = config;
    }

    @Override
    public Function run(DefineNode def) {
        try {
            return translate(def);
        } catch (TranslationException e) {
            throw e.inRoutine(def.symbol);
        }
    }

    private Function translate(DefineNode def) {
        LOGGER.debug("Translating @{}", def.symbol);
        FnHandle handle = registry.resolve(def.symbol);
        if (def.body.isEmpty()) {
            throw new EmptyBodyException(def.symbol);
        }
        BlockLabel entryLabel = def.body.get(0).label;
        if (entryLabel == null) {
            throw new MissingEntryLabelException(null);
        }

        Function func = new Function();
        BasicBlock entry = func.newBb();
        func.attachExt(CfgExts.FUNCTION_HANDLE, handle);
        func.attachExt(CfgExts.ALLOCATOR, config.getAllocator());

        List<DebugAnnotation> defMetadata = new ArrayList<>();
        for (Map.Entry<String, ValMd> md : def.metadata.entrySet()) {
            defMetadata.add(new DebugAnnotation(md.getKey(), md.getValue()));
        }
        LocationCursor cursor = new LocationCursor(new ScopeFileResolver(registry.getTypeContext()), SourceLocation.INTERNAL);
        cursor.update(defMetadata);

        Map<BlockLabel, BlockInfo> infos = BlockInfo.buildAll(def, func);
        BlockInfo entryInfo = infos.get(entryLabel);
        if (entryInfo == null) {
            throw new MissingEntryLabelException(entryLabel);
        }
        RoutineState rs = new RoutineState(def, handle, func, registry, config.getAllocator(), infos, cursor);

        bindParameters(rs);
        InferRegisterTypes.INSTANCE.runInPlace(rs);
        rs.debugMap = ProcessDebugDeclares.INSTANCE.run(def);

        IRBuilder ib = new IRBuilder(func, entry);
        ib.setLocation(cursor.current());
        ib.insertCtrl(Control.br(entryInfo.block));

        for (BlockNode bn : def.body) {
            BasicBlock bb = bn.label == null ? func.newBb() : rs.blockInfo(bn.label).block;
            BlockTranslator.translate(rs, bn, bb);
        }

        func = config.getStructurer().run(func);
        if (config.isVerify()) {
            CheckCfg.INSTANCE.runInPlace(func);
        }
        LOGGER.debug("Translated @{} into {} block(s)", def.symbol, func.blocks.size());
        return func;
    }

    private static void bindParameters(RoutineState rs) {
        DefineNode def = rs.def;
        FnSignature sig = rs.handle.signature;
        if (def.params.size() != sig.fixedParams() || def.varArgs != sig.varArgs) {
            throw new SignatureMismatchException(def.symbol, "declared as " + sig + ", defined as " + def.toDeclare());
        }
        List<Var> params = new ArrayList<>();
        for (int i = 0; i < def.params.size(); i++) {
            DefineNode.Param param = def.params.get(i);
            CType type = rs.lift(param.type);
            if (!type.equals(sig.params.get(i))) {
                throw new SignatureMismatchException(def.symbol,
                        "parameter " + param.ident + " is " + type + ", declared " + sig.params.get(i));
            }
            Var reg = rs.func.newReg(param.ident.name, rs.allocator.nextRegister(), type);
            reg.attachExt(CfgExts.SOURCE_IDENT, param.ident);
            rs.identMap.bind(param.ident, reg);
            params.add(reg);
        }
        if (sig.varArgs) {
            params.add(rs.newTemp("varargs", FnSignature.VARARGS_TYPE));
        }
        rs.func.attachExt(CfgExts.PARAMETERS, params);
    }
}
