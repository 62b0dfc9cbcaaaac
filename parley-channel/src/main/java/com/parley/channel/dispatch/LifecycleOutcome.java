package com.parley.channel.dispatch;

import com.parley.channel.delivery.DeliveryReport;
import com.parley.channel.discord.DiscordTypes.ThreadRef;

import java.util.List;

/**
 * Terminal snapshot of an event's lifecycle.
 *
 * @param thread        resolved thread, or {@code null} when the reply went to
 *                      the original channel
 * @param destinationId where notices and the reply were sent
 * @param delivery      set when the state is {@link LifecycleState#DELIVERED}
 * @param failure       cause of a {@link LifecycleState#FAILED} lifecycle, when
 *                      there was one
 * @param transitions   every state visited, in order
 */
public record LifecycleOutcome(String eventId, LifecycleState state, ThreadRef thread, String destinationId,
        DeliveryReport delivery, Throwable failure, List<LifecycleState> transitions) {

    public boolean reached(LifecycleState s) {
        return transitions.contains(s);
    }
}
