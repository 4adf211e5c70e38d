package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.BlockLabel;
import io.github.eutro.ir2cfg.source.DefineNode;
import io.github.eutro.ir2cfg.source.TypeContext;
import io.github.eutro.ir2cfg.source.TypeNode;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.types.CType;
import io.github.eutro.ir2cfg.types.TypeLifter;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Everything known while one routine is being lowered. Owned by a single translation.
 */
public final class RoutineState {
    public final DefineNode def;
    public final FnHandle handle;
    public final Function func;
    public final HandleRegistry registry;
    public final TypeContext tc;
    public final TypeLifter lifter;
    public final HandleAllocator allocator;
    public final IdentMap identMap = new IdentMap();
    public final Map<BlockLabel, BlockInfo> blockInfos;
    public final LocationCursor cursor;
    public DebugAnnotationMap debugMap;
    @Nullable
    public BlockLabel currentLabel;

    RoutineState(DefineNode def,
                 FnHandle handle,
                 Function func,
                 HandleRegistry registry,
                 HandleAllocator allocator,
                 Map<BlockLabel, BlockInfo> blockInfos,
                 LocationCursor cursor) {
        this.def = def;
        this.handle = handle;
        this.func = func;
        this.registry = registry;
        this.tc = registry.getTypeContext();
        this.lifter = registry.getLifter();
        this.allocator = allocator;
        this.blockInfos = blockInfos;
        this.cursor = cursor;
    }

    public CType lift(TypeNode type) {
        return lifter.liftMemType(type, tc);
    }

    /**
     * Create a register that no source identifier names.
     *
     * @param name The register name.
     * @param type The register type.
     * @return The register.
     */
    public Var newTemp(String name, CType type) {
        return func.newReg(name, allocator.nextRegister(), type);
    }

    /**
     * Get the info of a labelled block.
     *
     * @param label The label.
     * @return The info.
     * @throws UnknownLabelException If no block has the label.
     */
    public BlockInfo blockInfo(BlockLabel label) {
        BlockInfo info = blockInfos.get(label);
        if (info == null) throw new UnknownLabelException(label);
        return info;
    }
}
