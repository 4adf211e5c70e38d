package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.types.CType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The lifted signature of a routine.
 * <p>
 * For a vararg routine the last parameter is the {@link #VARARGS_TYPE vararg pack}.
 */
public final class FnSignature {
    /**
     * The type of the trailing parameter vararg routines receive their extra arguments in.
     */
    public static final CType VARARGS_TYPE = CType.vector(CType.ANY);

    public final List<CType> params;
    public final CType ret;
    public final boolean varArgs;

    public FnSignature(List<CType> params, CType ret, boolean varArgs) {
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.ret = Objects.requireNonNull(ret);
        this.varArgs = varArgs;
        if (varArgs && (params.isEmpty() || !VARARGS_TYPE.equals(params.get(params.size() - 1)))) {
            throw new IllegalArgumentException("vararg signature must end in the vararg pack: " + params);
        }
    }

    /**
     * Get the number of arguments a caller passes before any varargs.
     *
     * @return The number of fixed parameters.
     */
    public int fixedParams() {
        return varArgs ? params.size() - 1 : params.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FnSignature)) return false;
        FnSignature that = (FnSignature) o;
        return varArgs == that.varArgs && params.equals(that.params) && ret.equals(that.ret);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, ret, varArgs);
    }

    @Override
    public String toString() {
        return params.stream().map(Objects::toString).collect(Collectors.joining(", ", "(", ")"))
                + (varArgs ? "..." : "") + " -> " + ret;
    }
}
