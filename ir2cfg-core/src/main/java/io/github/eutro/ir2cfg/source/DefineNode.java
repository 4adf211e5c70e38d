package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A routine definition.
 */
public final class DefineNode {
    public final String symbol;
    public final TypeNode ret;
    public final List<Param> params;
    public final boolean varArgs;
    public final List<BlockNode> body;
    /**
     * Metadata attached to the definition itself, such as its {@code !dbg} subprogram.
     */
    public final Map<String, ValMd> metadata;

    public DefineNode(String symbol,
                      TypeNode ret,
                      List<Param> params,
                      boolean varArgs,
                      List<BlockNode> body,
                      Map<String, ValMd> metadata) {
        this.symbol = Objects.requireNonNull(symbol);
        this.ret = Objects.requireNonNull(ret);
        this.params = Collections.unmodifiableList(new ArrayList<>(params));
        this.varArgs = varArgs;
        this.body = Collections.unmodifiableList(new ArrayList<>(body));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static final class Param {
        public final TypeNode type;
        public final Ident ident;

        public Param(TypeNode type, Ident ident) {
            this.type = Objects.requireNonNull(type);
            this.ident = Objects.requireNonNull(ident);
        }

        @Override
        public String toString() {
            return type + " " + ident;
        }
    }

    /**
     * Get the declaration this definition implies.
     *
     * @return The declaration.
     */
    public DeclareNode toDeclare() {
        List<TypeNode> paramTypes = new ArrayList<>();
        for (Param param : params) {
            paramTypes.add(param.type);
        }
        return new DeclareNode(symbol, ret, paramTypes, varArgs);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("define ").append(ret).append(" @").append(symbol).append('(');
        for (int i = 0; i < params.size(); i++) {
            if (i != 0) sb.append(", ");
            sb.append(params.get(i));
        }
        if (varArgs) sb.append(params.isEmpty() ? "..." : ", ...");
        sb.append(") {\n");
        for (BlockNode block : body) {
            sb.append(block);
        }
        return sb.append('}').toString();
    }
}
