package io.github.eutro.ir2cfg.translate;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands out the ids of registers and routine handles, and the {@link Nonce}s of translations.
 * <p>
 * Safe to share between threads; no id is ever handed out twice by one allocator.
 */
public final class HandleAllocator {
    /**
     * The allocator used when none is configured.
     */
    public static final HandleAllocator GLOBAL = new HandleAllocator();

    private final AtomicInteger registers = new AtomicInteger(1);
    private final AtomicInteger handles = new AtomicInteger();
    private final AtomicInteger nonces = new AtomicInteger();

    public int nextRegister() {
        return registers.getAndIncrement();
    }

    public int nextHandle() {
        return handles.getAndIncrement();
    }

    public Nonce freshNonce() {
        return new Nonce(this, nonces.getAndIncrement());
    }
}
