package com.parley.channel.dispatch;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of one inbound event's lifecycle.
 */
public enum LifecycleState {
    ARRIVED,
    DEDUP_REJECTED,
    DEDUP_ACCEPTED,
    THREAD_RESOLVING,
    THREAD_READY,
    PROCESSING,
    DELIVERING,
    DELIVERED,
    FAILED;

    public boolean isTerminal() {
        return this == DEDUP_REJECTED || this == DELIVERED || this == FAILED;
    }

    public boolean canTransitionTo(LifecycleState next) {
        return successors().contains(next);
    }

    private Set<LifecycleState> successors() {
        return switch (this) {
            case ARRIVED -> EnumSet.of(DEDUP_REJECTED, DEDUP_ACCEPTED);
            case DEDUP_ACCEPTED -> EnumSet.of(THREAD_RESOLVING);
            case THREAD_RESOLVING -> EnumSet.of(THREAD_READY);
            case THREAD_READY -> EnumSet.of(PROCESSING);
            case PROCESSING -> EnumSet.of(DELIVERING, FAILED);
            case DELIVERING -> EnumSet.of(DELIVERED, FAILED);
            case DEDUP_REJECTED, DELIVERED, FAILED -> EnumSet.noneOf(LifecycleState.class);
        };
    }
}
