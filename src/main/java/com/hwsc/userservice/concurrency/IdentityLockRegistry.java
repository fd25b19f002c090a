package com.hwsc.userservice.concurrency;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local table of reader/writer locks keyed by account id.
 *
 * <p>All requests referencing the same id share one lock: the first reference creates the entry
 * atomically, later ones join it. An entry is only removed once it has been marked stale
 * (see {@link IdentityLock#evict()}) and no request holds or waits on it, so a handle obtained by
 * one request can never be silently replaced under another.
 */
@Slf4j
public class IdentityLockRegistry {

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public IdentityLock acquireExclusive(String id) {
        Entry entry = retain(id);
        entry.lock.writeLock().lock();
        return new IdentityLock(this, id, entry, entry.lock.writeLock());
    }

    public IdentityLock acquireShared(String id) {
        Entry entry = retain(id);
        entry.lock.readLock().lock();
        return new IdentityLock(this, id, entry, entry.lock.readLock());
    }

    /** Drops every entry nobody currently holds or waits on. */
    public void clear() {
        int before = entries.size();
        for (Map.Entry<String, Entry> e : entries.entrySet()) {
            entries.computeIfPresent(e.getKey(), (k, v) -> v.holders == 0 ? null : v);
        }
        log.info("Identity lock table cleared ({} -> {} entries)", before, entries.size());
    }

    public int size() {
        return entries.size();
    }

    public boolean isTracked(String id) {
        return entries.containsKey(id);
    }

    private Entry retain(String id) {
        if (id == null) {
            throw new IllegalArgumentException("lock id must not be null");
        }
        return entries.compute(id, (k, existing) -> {
            Entry entry = existing != null ? existing : new Entry();
            entry.holders++;
            return entry;
        });
    }

    void markStale(String id, Entry entry) {
        entries.computeIfPresent(id, (k, current) -> {
            if (current != entry) {
                return current;
            }
            current.stale = true;
            return current;
        });
    }

    void release(String id, Entry entry) {
        entries.computeIfPresent(id, (k, current) -> {
            if (current != entry) {
                return current;
            }
            current.holders--;
            return current.holders == 0 && current.stale ? null : current;
        });
    }

    /** Mutable bookkeeping; only touched inside ConcurrentHashMap compute callbacks. */
    static final class Entry {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        int holders;
        boolean stale;
    }
}
