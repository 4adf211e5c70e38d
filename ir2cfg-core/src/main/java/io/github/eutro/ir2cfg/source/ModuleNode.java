package io.github.eutro.ir2cfg.source;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A whole source module.
 * <p>
 * Instances are built through {@link Builder}, and are immutable afterwards.
 */
public final class ModuleNode {
    public final List<DeclareNode> declares;
    public final List<DefineNode> defines;
    public final List<GlobalNode> globals;
    public final Map<String, TypeNode> namedTypes;
    public final Map<Integer, ValMd> metadata;
    private final TypeContext typeContext;

    private ModuleNode(Builder b) {
        declares = Collections.unmodifiableList(new ArrayList<>(b.declares));
        defines = Collections.unmodifiableList(new ArrayList<>(b.defines));
        globals = Collections.unmodifiableList(new ArrayList<>(b.globals));
        namedTypes = Collections.unmodifiableMap(new LinkedHashMap<>(b.namedTypes));
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(b.metadata));
        typeContext = new TypeContext(namedTypes, metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Get every routine signature in this module: the declarations, followed by the
     * signatures of the definitions.
     *
     * @return The declarations.
     */
    public List<DeclareNode> allDeclares() {
        List<DeclareNode> all = new ArrayList<>(declares);
        for (DefineNode define : defines) {
            all.add(define.toDeclare());
        }
        return all;
    }

    public TypeContext typeContext() {
        return typeContext;
    }

    public static final class Builder {
        private final List<DeclareNode> declares = new ArrayList<>();
        private final List<DefineNode> defines = new ArrayList<>();
        private final List<GlobalNode> globals = new ArrayList<>();
        private final Map<String, TypeNode> namedTypes = new LinkedHashMap<>();
        private final Map<Integer, ValMd> metadata = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder declare(DeclareNode declare) {
            declares.add(declare);
            return this;
        }

        public Builder define(DefineNode define) {
            defines.add(define);
            return this;
        }

        public Builder global(GlobalNode global) {
            globals.add(global);
            return this;
        }

        public Builder namedType(String name, TypeNode type) {
            namedTypes.put(name, type);
            return this;
        }

        public Builder metadata(int id, ValMd md) {
            metadata.put(id, md);
            return this;
        }

        public ModuleNode build() {
            return new ModuleNode(this);
        }
    }
}
