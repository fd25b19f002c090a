package com.hwsc.userservice.concurrency;

import java.util.concurrent.locks.Lock;

/**
 * A held per-identity lock. Close it (try-with-resources) to release; closing twice is a no-op.
 */
public final class IdentityLock implements AutoCloseable {

    private final IdentityLockRegistry registry;
    private final String id;
    private final IdentityLockRegistry.Entry entry;
    private final Lock held;
    private boolean released;

    IdentityLock(IdentityLockRegistry registry, String id, IdentityLockRegistry.Entry entry, Lock held) {
        this.registry = registry;
        this.id = id;
        this.entry = entry;
        this.held = held;
    }

    public String id() {
        return id;
    }

    /**
     * Marks this id's entry for removal once every current holder and waiter has released it.
     * Used when the store reports that the account no longer exists.
     */
    public void evict() {
        registry.markStale(id, entry);
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        held.unlock();
        registry.release(id, entry);
    }
}
