package com.parley.common.infra;

import java.util.Optional;

/**
 * Bounded poll-with-timeout for resources created by someone else.
 * <p>
 * Sleeps first, then probes; the interval grows by {@code multiplier} up to
 * {@code maxDelayMs}. The last sleep is clamped so the total wait never
 * exceeds {@code timeoutMs}.
 */
public final class PollWait {

    private PollWait() {
    }

    public record Config(long initialDelayMs, double multiplier, long maxDelayMs, long timeoutMs) {
    }

    /**
     * Outcome of a poll. {@code error} is set when the probe threw, which ends
     * the poll early.
     */
    public record Result<T>(Optional<T> value, int attempts, long waitedMs, Exception error) {

        public boolean found() {
            return value.isPresent();
        }
    }

    @FunctionalInterface
    public interface Probe<T> {
        Optional<T> poll() throws Exception;
    }

    public static <T> Result<T> poll(Config config, Probe<T> probe, Sleeper sleeper) throws InterruptedException {
        long waited = 0;
        long delay = Math.max(1, config.initialDelayMs());
        int attempts = 0;

        while (waited < config.timeoutMs()) {
            long step = Math.min(delay, config.timeoutMs() - waited);
            sleeper.sleep(step);
            waited += step;
            attempts++;
            try {
                Optional<T> found = probe.poll();
                if (found.isPresent()) {
                    return new Result<>(found, attempts, waited, null);
                }
            } catch (Exception e) {
                return new Result<>(Optional.empty(), attempts, waited, e);
            }
            delay = Math.max(1, Math.min((long) Math.ceil(delay * config.multiplier()), config.maxDelayMs()));
        }
        return new Result<>(Optional.empty(), attempts, waited, null);
    }
}
