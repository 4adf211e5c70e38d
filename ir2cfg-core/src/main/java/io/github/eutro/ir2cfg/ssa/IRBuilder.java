package io.github.eutro.ir2cfg.ssa;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.ExtContainer;
import io.github.eutro.ir2cfg.source.DebugAnnotation;
import io.github.eutro.ir2cfg.types.CType;

import java.util.Collections;
import java.util.List;

/**
 * An instruction builder, which encapsulates a position in a function
 * where instructions are being inserted, and the source position they come from.
 * <p>
 * Every effect and control inserted is tagged with the current {@link CfgExts#LOCATION location}
 * and, if any, the current {@link CfgExts#DEBUG_ANNOTATIONS annotations}.
 */
public class IRBuilder {
    /**
     * The function being inserted into.
     */
    public final Function func;
    private BasicBlock bb;
    private SourceLocation location = SourceLocation.INTERNAL;
    private List<DebugAnnotation> annotations = Collections.emptyList();

    /**
     * Construct an instruction builder, inserting into a specific basic block.
     *
     * @param func The function.
     * @param bb   One of the function's basic blocks.
     */
    public IRBuilder(Function func, BasicBlock bb) {
        this.func = func;
        this.bb = bb;
    }

    public BasicBlock getBlock() {
        return bb;
    }

    public void setBlock(BasicBlock bb) {
        this.bb = bb;
    }

    public SourceLocation getLocation() {
        return location;
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

    public void setAnnotations(List<DebugAnnotation> annotations) {
        this.annotations = annotations;
    }

    private void tag(ExtContainer insn) {
        insn.attachExt(CfgExts.LOCATION, location);
        if (!annotations.isEmpty()) {
            insn.attachExt(CfgExts.DEBUG_ANNOTATIONS, annotations);
        }
    }

    /**
     * Insert an effect at the end of the block.
     *
     * @param effect The effect.
     */
    public void insert(Effect effect) {
        tag(effect);
        bb.addEffect(effect);
    }

    /**
     * Assign the result of the instruction to a register, and insert the effect.
     *
     * @param insn The instruction.
     * @param v    The register.
     * @return The same register.
     */
    public Var insert(Insn insn, Var v) {
        insert(insn.assignTo(v));
        return v;
    }

    /**
     * Assign the result of the instruction to a new register, and insert the effect.
     *
     * @param insn      The instruction.
     * @param name      The name of the register.
     * @param indexHint The index hint of the register.
     * @param type      The type of the register.
     * @return The assigned register.
     */
    public Var insert(Insn insn, String name, int indexHint, CType type) {
        return insert(insn, func.newReg(name, indexHint, type));
    }

    /**
     * Insert a control instruction at the end of the current block.
     *
     * @param ctrl The instruction to insert.
     */
    public void insertCtrl(Control ctrl) {
        tag(ctrl);
        bb.setControl(ctrl);
    }
}
