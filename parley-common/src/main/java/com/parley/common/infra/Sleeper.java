package com.parley.common.infra;

/**
 * Pause abstraction for backoff and polling loops, so tests can run them on a
 * virtual clock.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
