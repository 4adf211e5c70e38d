package io.github.eutro.ir2cfg.ext;

import io.github.eutro.ir2cfg.source.BlockLabel;
import io.github.eutro.ir2cfg.source.DebugAnnotation;
import io.github.eutro.ir2cfg.source.Ident;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Effect;
import io.github.eutro.ir2cfg.ssa.Function;
import io.github.eutro.ir2cfg.ssa.SourceLocation;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.translate.FnHandle;
import io.github.eutro.ir2cfg.translate.HandleAllocator;
import io.github.eutro.ir2cfg.types.CType;

import java.util.List;

/**
 * {@link Ext}s linking the target CFG back to its source, and carrying what the
 * execution engine needs beside the instructions.
 */
public class CfgExts {
    /**
     * Attached to a {@link Var}. The static type of the register. Once attached it cannot be changed.
     */
    public static final Ext<CType> REG_TYPE = Ext.create(CType.class, "REG_TYPE");

    /**
     * Attached to an {@link Effect} or {@link Control}. The source position it was lowered from.
     */
    public static final Ext<SourceLocation> LOCATION = Ext.create(SourceLocation.class, "LOCATION");

    /**
     * Attached to an {@link Effect} or {@link Control}. The effective metadata of the statement
     * it was lowered from, after debug declarations have been propagated.
     */
    public static final Ext<List<DebugAnnotation>> DEBUG_ANNOTATIONS = Ext.create(List.class, "DEBUG_ANNOTATIONS");

    /**
     * Attached to a {@link Var}. The source identifier the register holds.
     */
    public static final Ext<Ident> SOURCE_IDENT = Ext.create(Ident.class, "SOURCE_IDENT");

    /**
     * Attached to a {@link BasicBlock}. The label of the source block it was lowered from.
     */
    public static final Ext<BlockLabel> SOURCE_LABEL = Ext.create(BlockLabel.class, "SOURCE_LABEL");

    /**
     * Attached to a {@link BasicBlock}. Whether the block exists only to hold the phi copies of one edge.
     */
    public static final Ext<Boolean> IS_EDGE_BLOCK = Ext.create(Boolean.class, "IS_EDGE_BLOCK");

    /**
     * Attached to a {@link Function}. The handle of the routine it implements.
     */
    public static final Ext<FnHandle> FUNCTION_HANDLE = Ext.create(FnHandle.class, "FUNCTION_HANDLE");

    /**
     * Attached to a {@link Function}. The registers holding the routine's arguments on entry,
     * in order. A vararg routine has one more, holding the vararg pack.
     */
    public static final Ext<List<Var>> PARAMETERS = Ext.create(List.class, "PARAMETERS");

    /**
     * Attached to a {@link Function}. Where later passes take the ids of registers they create.
     */
    public static final Ext<HandleAllocator> ALLOCATOR = Ext.create(HandleAllocator.class, "ALLOCATOR");
}
