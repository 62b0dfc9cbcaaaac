package com.parley.channel.dispatch;

import com.parley.channel.delivery.DeliveryReport;
import com.parley.channel.discord.DiscordTypes.ThreadRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one event's lifecycle. Owned by the worker running it and
 * never shared.
 */
class Lifecycle {

    private final String eventId;
    private final List<LifecycleState> transitions = new ArrayList<>();
    private LifecycleState state = LifecycleState.ARRIVED;
    private ThreadRef thread;
    private String destinationId;
    private DeliveryReport delivery;
    private Throwable failure;

    Lifecycle(String eventId) {
        this.eventId = eventId;
        transitions.add(state);
    }

    void transition(LifecycleState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("event " + eventId + ": illegal transition " + state + " -> " + next);
        }
        state = next;
        transitions.add(next);
    }

    void fail(Throwable cause) {
        failure = cause;
        transition(LifecycleState.FAILED);
    }

    LifecycleState state() {
        return state;
    }

    void destination(ThreadRef thread, String destinationId) {
        this.thread = thread;
        this.destinationId = destinationId;
    }

    String destinationId() {
        return destinationId;
    }

    void delivered(DeliveryReport report) {
        this.delivery = report;
        transition(LifecycleState.DELIVERED);
    }

    LifecycleOutcome toOutcome() {
        return new LifecycleOutcome(eventId, state, thread, destinationId, delivery, failure,
                List.copyOf(transitions));
    }
}
