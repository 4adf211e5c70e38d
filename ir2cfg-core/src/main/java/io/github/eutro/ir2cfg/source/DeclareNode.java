package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The signature of a routine, as in a {@code declare} line.
 */
public final class DeclareNode {
    public final String symbol;
    public final TypeNode ret;
    public final List<TypeNode> params;
    public final boolean varArgs;

    public DeclareNode(String symbol, TypeNode ret, List<TypeNode> params, boolean varArgs) {
        this.symbol = Objects.requireNonNull(symbol);
        this.ret = Objects.requireNonNull(ret);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.varArgs = varArgs;
    }

    @Override
    public String toString() {
        List<String> ps = new ArrayList<>();
        for (TypeNode param : params) {
            ps.add(param.toString());
        }
        if (varArgs) ps.add("...");
        return "declare " + ret + " @" + symbol + "(" + String.join(", ", ps) + ")";
    }
}
