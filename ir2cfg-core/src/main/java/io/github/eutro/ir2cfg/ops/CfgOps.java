package io.github.eutro.ir2cfg.ops;

import io.github.eutro.ir2cfg.source.CmpInsnNode;
import io.github.eutro.ir2cfg.source.Opcode;
import io.github.eutro.ir2cfg.source.TypeNode;
import io.github.eutro.ir2cfg.ssa.BasicBlock;
import io.github.eutro.ir2cfg.ssa.Control;
import io.github.eutro.ir2cfg.ssa.Var;
import io.github.eutro.ir2cfg.translate.FnHandle;
import io.github.eutro.ir2cfg.translate.FnSignature;
import io.github.eutro.ir2cfg.types.CType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * {@link Op}s and {@link OpKey}s of the target CFG that source instructions lower to.
 * <p>
 * Result types are never carried by operations; they are the {@link io.github.eutro.ir2cfg.ext.CfgExts#REG_TYPE types}
 * of the registers assigned.
 */
public class CfgOps {
    /**
     * Effect: an arithmetic or bitwise operation on its two arguments.
     */
    public static final UnaryOpKey<Opcode> BINOP = new UnaryOpKey<>("binop");
    /**
     * Effect: compares its two arguments, returning a boolean or vector of booleans.
     */
    public static final UnaryOpKey<CmpInsnNode.Predicate> CMP = new UnaryOpKey<>("cmp");
    /**
     * Effect: converts its argument to the type of the target register.
     */
    public static final UnaryOpKey<Opcode> CONV = new UnaryOpKey<>("conv");

    /**
     * Effect: allocates stack memory for a number of values of the given type.
     * The argument, if present, is the number of values.
     */
    public static final UnaryOpKey<CType> ALLOCA = new UnaryOpKey<>("alloca");
    /**
     * Effect: loads a value of the given type from the pointer argument.
     */
    public static final UnaryOpKey<CType> LOAD = new UnaryOpKey<>("load");
    /**
     * Effect: stores the first argument, of the given type, at the pointer in the second. Returns nothing.
     */
    public static final UnaryOpKey<CType> STORE = new UnaryOpKey<>("store");
    /**
     * Effect: computes a pointer from a base pointer and indices, stepping through values of the given
     * source type, as {@code getelementptr} does.
     */
    public static final UnaryOpKey<TypeNode> GEP = new UnaryOpKey<>("gep");

    /**
     * Effect: calls a known routine with its arguments.
     */
    public static final UnaryOpKey<FnHandle> CALL = new UnaryOpKey<>("call", h -> "@" + h.symbol);
    /**
     * Effect: calls the routine pointed to by its first argument with the rest of its arguments.
     */
    public static final UnaryOpKey<FnSignature> CALL_PTR = new UnaryOpKey<>("call_ptr");
    /**
     * Effect: packs its arguments into a vararg vector.
     */
    public static final Op PACK_VARARGS = new SimpleOpKey("pack_varargs").create();

    /**
     * Effect: returns its second argument if the first is true, else its third.
     */
    public static final Op SELECT = new SimpleOpKey("select").create();
    /**
     * Effect: returns the member of its aggregate argument at the given path.
     */
    public static final UnaryOpKey<int[]> EXTRACT_VALUE = new UnaryOpKey<>("extract_value", Arrays::toString);
    /**
     * Effect: returns its aggregate first argument with the member at the given path replaced by the second.
     */
    public static final UnaryOpKey<int[]> INSERT_VALUE = new UnaryOpKey<>("insert_value", Arrays::toString);
    /**
     * Effect: returns the element of its vector first argument at the index in the second.
     */
    public static final Op EXTRACT_ELT = new SimpleOpKey("extract_elt").create();
    /**
     * Effect: returns its vector first argument with the element at the index in the third replaced by the second.
     */
    public static final Op INSERT_ELT = new SimpleOpKey("insert_elt").create();

    /**
     * Effect: returns an unspecified value of the target's type.
     */
    public static final Op UNDEF = new SimpleOpKey("undef").create();
    /**
     * Effect: returns the all-zero value of the target's type.
     */
    public static final Op ZERO = new SimpleOpKey("zero").create();
    /**
     * Effect: returns the null pointer.
     */
    public static final Op NULL_PTR = new SimpleOpKey("null_ptr").create();
    /**
     * Effect: returns a pointer to the given routine.
     */
    public static final UnaryOpKey<FnHandle> FUNC_PTR = new UnaryOpKey<>("func_ptr", h -> "@" + h.symbol);
    /**
     * Effect: returns a pointer to the global with the given symbol.
     */
    public static final UnaryOpKey<String> GLOBAL_PTR = new UnaryOpKey<>("global_ptr", s -> "@" + s);

    /**
     * Control: jumps to the first target if the argument is true, else the second.
     */
    public static final Op BR_COND = new SimpleOpKey("br_cond").create();
    /**
     * Control: jumps to the target whose key matches the argument.
     * Targets correspond to the keys in order, the last target is the default.
     */
    public static final UnaryOpKey<long[]> SWITCH = new UnaryOpKey<>("switch", Arrays::toString);

    public static Control brCond(Var cond, BasicBlock ifTrue, BasicBlock ifFalse) {
        return BR_COND.insn(cond).jumpsTo(ifTrue, ifFalse);
    }

    public static Control switchOn(Var value, long[] keys, List<BasicBlock> targets, BasicBlock dflt) {
        if (keys.length != targets.size()) {
            throw new IllegalArgumentException("Switch has " + keys.length + " keys but " + targets.size() + " targets");
        }
        List<BasicBlock> all = new ArrayList<>(targets);
        all.add(dflt);
        return SWITCH.create(keys).insn(value).jumpsTo(all);
    }
}
