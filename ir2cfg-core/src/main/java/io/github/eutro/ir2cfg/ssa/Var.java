package io.github.eutro.ir2cfg.ssa;

import io.github.eutro.ir2cfg.ext.CfgExts;
import io.github.eutro.ir2cfg.ext.CommonExts;
import io.github.eutro.ir2cfg.ext.Ext;
import io.github.eutro.ir2cfg.ext.ExtHolder;
import io.github.eutro.ir2cfg.types.CType;
import org.jetbrains.annotations.Nullable;

/**
 * A variable, a typed register.
 * <p>
 * The {@link CfgExts#REG_TYPE type} of a register is fixed once it is attached.
 */
public final class Var extends ExtHolder {
    /**
     * The name of the variable.
     */
    public final String name;
    /**
     * The index of the variable, to distinguish from others with the same name.
     */
    public final int index;

    Var(String name, int index) {
        this.name = name;
        this.index = index;
    }

    @Override
    public String toString() {
        return '$' + name + (index == 0 ? "" : "." + index);
    }

    /**
     * Get the type of this register.
     *
     * @return The type.
     * @throws IllegalStateException If no type has been attached.
     */
    public CType getType() {
        return getExtOrThrow(CfgExts.REG_TYPE);
    }

    // exts
    private Effect assignedAt = null;
    private CType type = null;

    @SuppressWarnings("unchecked")
    @Override
    public <T> @Nullable T getNullable(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            return (T) assignedAt;
        }
        if (ext == CfgExts.REG_TYPE) {
            return (T) type;
        }
        return super.getNullable(ext);
    }

    @Override
    public <T> void attachExt(Ext<T> ext, T value) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = (Effect) value;
            return;
        }
        if (ext == CfgExts.REG_TYPE) {
            CType newType = (CType) value;
            if (type != null && !type.equals(newType)) {
                throw new IllegalStateException("Register " + this + " already has type " + type + ", cannot retype to " + newType);
            }
            type = newType;
            return;
        }
        super.attachExt(ext, value);
    }

    @Override
    public <T> void removeExt(Ext<T> ext) {
        if (ext == CommonExts.ASSIGNED_AT) {
            assignedAt = null;
            return;
        }
        if (ext == CfgExts.REG_TYPE) {
            throw new IllegalStateException("Cannot remove the type of register " + this);
        }
        super.removeExt(ext);
    }
}
