package io.github.eutro.ir2cfg.translate;

import io.github.eutro.ir2cfg.source.DeclareNode;
import io.github.eutro.ir2cfg.source.TypeContext;
import io.github.eutro.ir2cfg.source.TypeNode;
import io.github.eutro.ir2cfg.types.CType;
import io.github.eutro.ir2cfg.types.TypeLifter;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The routine handles of one module translation, one per symbol.
 * <p>
 * Handles are only added during the declare phase. Once {@link #seal() sealed}, the
 * registry is read-only and may be shared between routine translations.
 */
public final class HandleRegistry {
    private final Map<String, FnHandle> handles = new LinkedHashMap<>();
    private final TypeLifter lifter;
    private final TypeContext tc;
    private final HandleAllocator allocator;
    private final boolean strict;
    private volatile boolean sealed = false;

    public HandleRegistry(TypeLifter lifter, TypeContext tc, HandleAllocator allocator, boolean strict) {
        this.lifter = lifter;
        this.tc = tc;
        this.allocator = allocator;
        this.strict = strict;
    }

    /**
     * Get the handle for a declaration, creating it if its symbol has none yet.
     * <p>
     * A symbol that already has a handle keeps it. If this registry is strict, the
     * declaration's signature must then match the handle's.
     *
     * @param decl The declaration.
     * @return The handle.
     * @throws io.github.eutro.ir2cfg.types.TypeLiftException If the signature cannot be lifted.
     * @throws SignatureMismatchException If strict, and the signature disagrees with an earlier one.
     */
    public FnHandle declare(DeclareNode decl) {
        if (sealed) {
            throw new IllegalStateException("Registry is sealed, cannot declare @" + decl.symbol);
        }
        FnHandle existing = handles.get(decl.symbol);
        if (existing != null) {
            if (strict) {
                FnSignature sig = liftSignature(decl.symbol, decl.ret, decl.params, decl.varArgs);
                if (!sig.equals(existing.signature)) {
                    throw new SignatureMismatchException(decl.symbol, existing.signature + " vs " + sig)
                            .inRoutine(decl.symbol);
                }
            }
            return existing;
        }
        FnSignature sig = liftSignature(decl.symbol, decl.ret, decl.params, decl.varArgs);
        FnHandle handle = new FnHandle(allocator.nextHandle(), decl.symbol, sig);
        handles.put(decl.symbol, handle);
        return handle;
    }

    /**
     * Lift a source signature.
     *
     * @param symbol  The routine symbol, for error reporting, or null for a call through a pointer.
     * @param ret     The return type.
     * @param params  The parameter types.
     * @param varArgs Whether the routine takes varargs.
     * @return The lifted signature.
     */
    public FnSignature liftSignature(@Nullable String symbol, TypeNode ret, List<TypeNode> params, boolean varArgs) {
        try {
            List<CType> args = new ArrayList<>();
            for (TypeNode param : params) {
                args.add(lifter.liftMemType(param, tc));
            }
            if (varArgs) {
                args.add(FnSignature.VARARGS_TYPE);
            }
            return new FnSignature(args, lifter.liftRetType(ret, tc), varArgs);
        } catch (TranslationException e) {
            if (symbol != null) e.inRoutine(symbol);
            throw e;
        }
    }

    /**
     * Get the handle of a symbol.
     *
     * @param symbol The symbol.
     * @return The handle.
     * @throws UnknownSymbolException If there is none.
     */
    public FnHandle resolve(String symbol) {
        FnHandle handle = handles.get(symbol);
        if (handle == null) throw new UnknownSymbolException(symbol);
        return handle;
    }

    public Optional<FnHandle> lookup(String symbol) {
        return Optional.ofNullable(handles.get(symbol));
    }

    /**
     * Get every handle, by symbol, in declaration order.
     *
     * @return The handles.
     */
    public Map<String, FnHandle> handles() {
        return Collections.unmodifiableMap(handles);
    }

    public TypeLifter getLifter() {
        return lifter;
    }

    public TypeContext getTypeContext() {
        return tc;
    }

    /**
     * End the declare phase. No handles can be added after this.
     */
    public void seal() {
        sealed = true;
    }
}
