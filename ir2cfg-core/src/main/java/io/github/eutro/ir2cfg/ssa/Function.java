package io.github.eutro.ir2cfg.ssa;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.Ext;
import io.github.eutro.ir2cfg.ext.ExtHolder;
import io.github.eutro.ir2cfg.ext.MetadataState;
import io.github.eutro.ir2cfg.ext.TrackedList;
import io.github.eutro.ir2cfg.translate.FnHandle;
import io.github.eutro.ir2cfg.types.CType;
import org.jetbrains.annotations.Nullable;

import java.lang.ref.SoftReference;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A control flow graph, encapsulating a list of {@link BasicBlock basic blocks}.
 */
public final class Function extends ExtHolder {
    /**
     * The list of basic blocks in this function. The first element is the entry block,
     * and must be added when this function is first constructed.
     */
    public final List<BasicBlock> blocks = new TrackedList<BasicBlock>(new ArrayList<>()) {
        @Override
        protected void onAdded(BasicBlock elt) {
            elt.attachExt(CommonExts.OWNING_FUNCTION, Function.this);
        }

        @Override
        protected void onRemoved(BasicBlock elt) {
            elt.removeExt(CommonExts.OWNING_FUNCTION);
        }
    }; // [0] is entry

    /**
     * Whether variable name collisions should be counted, so that registers with the same
     * name display differently. Useful for debugging.
     */
    public static boolean UNIQUE_VAR_NAMES = System.getenv("IR2CFG_UNIQUE_VAR_NAMES") != null;

    // names only matter for debugging, let the JVM clear them if it has to
    private SoftReference<Map<String, Integer>> varsRef = UNIQUE_VAR_NAMES ? new SoftReference<>(new HashMap<>()) : null;

    /**
     * Create a new variable with the given name.
     *
     * @param name      The name.
     * @param indexHint The minimum value of the variable index.
     * @return The new variable.
     */
    public Var newVar(String name, int indexHint) {
        if (!UNIQUE_VAR_NAMES) {
            return new Var(name, indexHint);
        }
        Map<String, Integer> vars = varsRef == null ? null : varsRef.get();
        if (vars == null) {
            vars = new HashMap<>();
            varsRef = new SoftReference<>(vars);
        }
        Integer next = vars.get(name);
        int index = next == null ? indexHint : Math.max(indexHint, next);
        vars.put(name, index + 1);
        return new Var(name, index);
    }

    /**
     * Create a new variable with the given name.
     *
     * @param name The name.
     * @return The new variable.
     */
    public Var newVar(String name) {
        return newVar(name, 0);
    }

    /**
     * Create a new register of the given type.
     *
     * @param name      The name.
     * @param indexHint The minimum value of the variable index.
     * @param type      The type of the register.
     * @return The new register.
     */
    public Var newReg(String name, int indexHint, CType type) {
        Var var = newVar(name, indexHint);
        var.attachExt(CfgExts.REG_TYPE, type);
        return var;
    }

    /**
     * Creates a new basic block in this function.
     *
     * @return The new basic block.
     */
    public BasicBlock newBb() {
        BasicBlock bb = new BasicBlock();
        blocks.add(bb);
        return bb;
    }

    /**
     * Get the entry block of this function.
     *
     * @return The entry block.
     */
    public BasicBlock entry() {
        return blocks.get(0);
    }

    @Override
    public String toString() {
        FnHandle handle = getNullable(CfgExts.FUNCTION_HANDLE);
        List<Var> params = getNullable(CfgExts.PARAMETERS);
        StringBuilder sb = new StringBuilder();
        sb.append("fn ").append(handle == null ? "" : handle.symbol).append('(');
        if (params != null) {
            for (int i = 0; i < params.size(); i++) {
                if (i != 0) sb.append(", ");
                sb.append(params.get(i));
            }
        }
        sb.append(") {\n");
        for (BasicBlock block : blocks) {
            sb.append(block).append('\n');
        }
        sb.append("}");
        return sb.toString();
    }

    // exts
    private MetadataState metaState = new MetadataState();

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = (MetadataState) value;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            metaState = null;
            return;
        }
        super.removeExt(ext);
    }

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.METADATA_STATE) {
            return (T) metaState;
        }
        return super.getNullable(ext);
    }
}
