package com.parley.channel;

import com.parley.common.infra.Sleeper;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sleeper that advances a virtual clock instead of blocking.
 */
public class VirtualClock implements Sleeper {

    private final AtomicLong now = new AtomicLong();
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(long millis) {
        sleeps.add(millis);
        now.addAndGet(millis);
    }

    public long now() {
        return now.get();
    }

    public List<Long> sleeps() {
        return sleeps;
    }
}
