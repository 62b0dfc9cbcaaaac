package com.parley.common.infra;

/**
 * Set of recently seen trigger keys with an atomic check-and-register.
 * <p>
 * Keys are only ever removed by the batch eviction of the underlying
 * {@link InsertionOrderCache}; an evicted key may be admitted again.
 */
public class DedupeCache {

    private final String name;
    private final InsertionOrderCache<String, Boolean> seen;

    public DedupeCache(String name, int maxSize) {
        this.name = name;
        this.seen = new InsertionOrderCache<>(maxSize);
    }

    /**
     * Register the key if it has not been seen.
     *
     * @return {@code true} if the key was newly registered and the caller should
     *         proceed, {@code false} if it was already present
     */
    public boolean checkAndRegister(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("dedupe key must not be empty");
        }
        return seen.putIfAbsent(key, Boolean.TRUE) == null;
    }

    public boolean contains(String key) {
        return seen.containsKey(key);
    }

    public int size() {
        return seen.size();
    }

    public int maxSize() {
        return seen.maxSize();
    }

    public long evictedCount() {
        return seen.evictedCount();
    }

    public String getName() {
        return name;
    }

    public void clear() {
        seen.clear();
    }
}
