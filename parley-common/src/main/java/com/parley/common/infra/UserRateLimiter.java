package com.parley.common.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Per-user request limiter: a cooldown between requests plus a cap per
 * sliding minute.
 */
@Slf4j
public class UserRateLimiter {

    private static final long MINUTE_MS = 60_000;
    private static final long CLEANUP_INTERVAL_MS = 3_600_000;

    public enum Reason {
        COOLDOWN, MAX_PER_MINUTE
    }

    public record Decision(boolean limited, double waitSeconds, Reason reason) {

        static final Decision ALLOWED = new Decision(false, 0, null);
    }

    private final long cooldownMs;
    private final int maxPerMinute;
    private final int maxTrackedUsers;
    private final LongSupplier clock;

    private final Map<String, Long> lastRequest = new HashMap<>();
    private final Map<String, Deque<Long>> recentRequests = new HashMap<>();
    private long lastCleanup;

    public UserRateLimiter(int cooldownSeconds, int maxPerMinute, int maxTrackedUsers) {
        this(cooldownSeconds, maxPerMinute, maxTrackedUsers, System::currentTimeMillis);
    }

    /**
     * A negative cooldown counts as none and a per-minute cap below 1 as 1.
     */
    public UserRateLimiter(int cooldownSeconds, int maxPerMinute, int maxTrackedUsers, LongSupplier clock) {
        if (cooldownSeconds < 0 || maxPerMinute < 1) {
            log.warn("Rate limit settings out of range (cooldown={}s, maxPerMinute={}), clamping",
                    cooldownSeconds, maxPerMinute);
        }
        this.cooldownMs = Math.max(0, cooldownSeconds) * 1000L;
        this.maxPerMinute = Math.max(1, maxPerMinute);
        this.maxTrackedUsers = maxTrackedUsers;
        this.clock = clock;
        this.lastCleanup = clock.getAsLong();
    }

    /**
     * Check and, when allowed, count a request for the user.
     */
    public synchronized Decision check(String userId) {
        long now = clock.getAsLong();

        if (lastRequest.size() > maxTrackedUsers) {
            log.warn("Rate limiter tracking {} users, performing aggressive cleanup", lastRequest.size());
            cleanup(now, true);
            lastCleanup = now;
        } else if (now - lastCleanup > CLEANUP_INTERVAL_MS) {
            cleanup(now, false);
            lastCleanup = now;
        }

        Long last = lastRequest.get(userId);
        if (last != null && now - last < cooldownMs) {
            return new Decision(true, (cooldownMs - (now - last)) / 1000.0, Reason.COOLDOWN);
        }

        Deque<Long> window = recentRequests.computeIfAbsent(userId, k -> new ArrayDeque<>());
        while (!window.isEmpty() && window.peekFirst() <= now - MINUTE_MS) {
            window.pollFirst();
        }
        if (window.size() >= maxPerMinute) {
            long oldest = window.peekFirst();
            return new Decision(true, (oldest + MINUTE_MS - now) / 1000.0, Reason.MAX_PER_MINUTE);
        }

        lastRequest.put(userId, now);
        window.addLast(now);
        return Decision.ALLOWED;
    }

    public synchronized int trackedUsers() {
        return lastRequest.size();
    }

    private void cleanup(long now, boolean aggressive) {
        // Aggressive mode drops anyone idle past the cooldown, not just the minute window
        long cutoff = aggressive ? now - cooldownMs : now - MINUTE_MS;
        lastRequest.entrySet().removeIf(e -> e.getValue() <= cutoff);
        recentRequests.entrySet().removeIf(e -> {
            Deque<Long> window = e.getValue();
            return window.isEmpty() || window.peekLast() <= now - MINUTE_MS;
        });
    }
}
