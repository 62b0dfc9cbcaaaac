package com.parley.common.infra;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Objects;

/**
 * Bounded map that remembers insertion order and evicts in batches.
 * <p>
 * When an insert pushes the size past {@code maxSize}, the oldest
 * {@code maxSize / 2} entries are dropped in one pass, which keeps eviction
 * amortized O(1) per insert. Lookups do not refresh an entry's position.
 * <p>
 * Every public method holds this instance's monitor for its whole body and
 * nothing else: callers must never perform I/O through this class.
 */
public class InsertionOrderCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>();
    private long evicted;

    public InsertionOrderCache(int maxSize) {
        if (maxSize < 2) {
            throw new IllegalArgumentException("maxSize must be at least 2, got " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * Insert {@code value} unless the key is already bound.
     *
     * @return the value already bound to the key, or {@code null} if this call
     *         inserted it
     */
    public synchronized V putIfAbsent(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        V existing = entries.get(key);
        if (existing != null) {
            return existing;
        }
        entries.put(key, value);
        if (entries.size() > maxSize) {
            evictOldestHalf();
        }
        return null;
    }

    public synchronized V get(K key) {
        return key == null ? null : entries.get(key);
    }

    public synchronized boolean containsKey(K key) {
        return key != null && entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    /** Total entries dropped by eviction since creation. */
    public synchronized long evictedCount() {
        return evicted;
    }

    public int maxSize() {
        return maxSize;
    }

    public synchronized void clear() {
        entries.clear();
    }

    private void evictOldestHalf() {
        int toRemove = maxSize / 2;
        Iterator<K> it = entries.keySet().iterator();
        while (toRemove-- > 0 && it.hasNext()) {
            it.next();
            it.remove();
            evicted++;
        }
    }
}
