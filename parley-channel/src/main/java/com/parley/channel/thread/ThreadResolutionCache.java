package com.parley.channel.thread;

import com.parley.channel.discord.DiscordTypes.ThreadRef;
import com.parley.common.infra.InsertionOrderCache;

import java.util.Optional;

/**
 * Originating event id to resolved thread, bounded with batch eviction.
 */
public class ThreadResolutionCache {

    private final InsertionOrderCache<String, ThreadRef> threads;

    public ThreadResolutionCache(int maxSize) {
        this.threads = new InsertionOrderCache<>(maxSize);
    }

    public Optional<ThreadRef> resolve(String eventId) {
        return Optional.ofNullable(threads.get(eventId));
    }

    /**
     * Bind the thread to the event unless another resolver got there first.
     *
     * @return the thread now bound to the event; callers must use this value
     *         rather than the one they passed in
     */
    public ThreadRef register(String eventId, ThreadRef thread) {
        ThreadRef existing = threads.putIfAbsent(eventId, thread);
        return existing != null ? existing : thread;
    }

    public int size() {
        return threads.size();
    }

    public int maxSize() {
        return threads.maxSize();
    }
}
