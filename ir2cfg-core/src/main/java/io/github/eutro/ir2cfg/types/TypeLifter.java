package io.github.eutro.ir2cfg.types;

import io.github.eutro.ir2cfg.source.TypeContext;
import io.github.eutro.ir2cfg.source.TypeNode;

/**
 * Maps source types to target register types.
 */
public interface TypeLifter {
    /**
     * Lift the type of a first-class value, as held in a register or memory.
     *
     * @param type The source type.
     * @param tc   The context to resolve named types in.
     * @return The target type.
     * @throws TypeLiftException If the type has no target counterpart.
     */
    CType liftMemType(TypeNode type, TypeContext tc);

    /**
     * Lift the return type of a routine. Unlike {@link #liftMemType(TypeNode, TypeContext)},
     * this accepts {@link TypeNode#VOID}.
     *
     * @param type The source type.
     * @param tc   The context to resolve named types in.
     * @return The target type.
     * @throws TypeLiftException If the type has no target counterpart.
     */
    default CType liftRetType(TypeNode type, TypeContext tc) {
        if (type == TypeNode.VOID) return CType.UNIT;
        return liftMemType(type, tc);
    }

    /**
     * Get the type of every pointer.
     *
     * @return The pointer type.
     */
    CType pointerType();
}
