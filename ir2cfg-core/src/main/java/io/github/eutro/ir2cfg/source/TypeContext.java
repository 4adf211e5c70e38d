package io.github.eutro.ir2cfg.source;

import io.github.eutro.ir2cfg.types.TypeLiftException;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Module-wide tables needed to interpret types and metadata: named types,
 * and the numbered metadata nodes that {@link ValMd.Ref references} point into.
 */
public final class TypeContext {
    /**
     * A context with no named types or metadata.
     */
    public static final TypeContext EMPTY = new TypeContext(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, TypeNode> namedTypes;
    private final Map<Integer, ValMd> metadata;

    public TypeContext(Map<String, TypeNode> namedTypes, Map<Integer, ValMd> metadata) {
        this.namedTypes = Collections.unmodifiableMap(new HashMap<>(namedTypes));
        this.metadata = Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /**
     * Resolve aliases until a structural type is reached.
     *
     * @param type The type.
     * @return The type, with top-level aliases resolved.
     * @throws TypeLiftException If an alias is unknown, or aliases form a cycle.
     */
    public TypeNode resolve(TypeNode type) {
        if (!(type instanceof TypeNode.Alias)) return type;
        Set<String> seen = new LinkedHashSet<>();
        TypeNode ty = type;
        while (ty instanceof TypeNode.Alias) {
            String name = ((TypeNode.Alias) ty).name;
            if (!seen.add(name)) {
                throw new TypeLiftException(type, "cyclic type alias " + seen);
            }
            ty = namedTypes.get(name);
            if (ty == null) {
                throw new TypeLiftException(type, "unknown type alias %" + name);
            }
        }
        return ty;
    }

    /**
     * Look up a numbered metadata node.
     *
     * @param id The metadata number.
     * @return The node, or null if there is none.
     */
    public @Nullable ValMd lookupMetadata(int id) {
        return metadata.get(id);
    }
}
