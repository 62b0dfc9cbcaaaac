package com.parley.common.infra;

import java.util.concurrent.Callable;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Retry executor with exponential backoff, server-supplied retryAfter
 * support and configurable shouldRetry / onRetry hooks.
 */
public final class RetryRunner {

    /**
     * Retry configuration.
     *
     * @param attempts   maximum number of attempts (>= 1)
     * @param minDelayMs delay before the second attempt; doubles afterwards
     * @param maxDelayMs cap for a single delay
     */
    public record Config(int attempts, long minDelayMs, long maxDelayMs) {

        public static final Config DEFAULT = new Config(3, 1000, 4000);

        public Config {
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1");
            }
        }
    }

    /**
     * Information passed to the onRetry callback.
     */
    public record RetryInfo(int attempt, int maxAttempts, long delayMs, Throwable err, String label) {
    }

    private final Config config;
    private final BiPredicate<Throwable, Integer> shouldRetry;
    private final Function<Throwable, Long> retryAfterMs;
    private final Consumer<RetryInfo> onRetry;
    private final Sleeper sleeper;

    /**
     * @param retryAfterMs wait the failure itself asks for, or a value {@code <= 0}
     *                     (or null) when it names none; never shortens the backoff
     */
    public RetryRunner(Config config,
            BiPredicate<Throwable, Integer> shouldRetry,
            Function<Throwable, Long> retryAfterMs,
            Consumer<RetryInfo> onRetry,
            Sleeper sleeper) {
        this.config = config != null ? config : Config.DEFAULT;
        this.shouldRetry = shouldRetry != null ? shouldRetry : (err, attempt) -> true;
        this.retryAfterMs = retryAfterMs;
        this.onRetry = onRetry;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    }

    public RetryRunner(Config config,
            BiPredicate<Throwable, Integer> shouldRetry,
            Consumer<RetryInfo> onRetry,
            Sleeper sleeper) {
        this(config, shouldRetry, null, onRetry, sleeper);
    }

    public RetryRunner(Config config) {
        this(config, null, null, null, null);
    }

    /**
     * Execute the callable with retry logic.
     *
     * @param fn    the operation to retry
     * @param label optional label for logging
     * @return the result of the first successful call
     * @throws Exception the last exception if all attempts fail or the failure
     *                   is not retryable
     */
    public <T> T execute(Callable<T> fn, String label) throws Exception {
        int maxAttempts = config.attempts();
        Exception lastErr = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return fn.call();
            } catch (Exception err) {
                lastErr = err;
                if (attempt >= maxAttempts || !shouldRetry.test(err, attempt)) {
                    break;
                }
                long delay = delayFor(attempt);
                Long requested = retryAfterMs != null ? retryAfterMs.apply(err) : null;
                if (requested != null && requested > delay) {
                    delay = requested;
                }
                if (onRetry != null) {
                    onRetry.accept(new RetryInfo(attempt, maxAttempts, delay, err, label));
                }
                sleeper.sleep(delay);
            }
        }
        throw lastErr;
    }

    /**
     * Delay after the given (1-based) failed attempt: min * 2^(attempt-1), capped.
     */
    public long delayFor(int attempt) {
        long maxDelay = config.maxDelayMs() > 0 ? config.maxDelayMs() : Long.MAX_VALUE;
        long base = config.minDelayMs() * (1L << Math.min(attempt - 1, 30));
        return Math.min(base, maxDelay);
    }

    public Config getConfig() {
        return config;
    }
}
