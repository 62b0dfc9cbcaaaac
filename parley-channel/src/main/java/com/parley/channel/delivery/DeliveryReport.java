package com.parley.channel.delivery;

import com.parley.channel.discord.DiscordTypes.MessageHandle;

import java.util.List;

/**
 * Result of a completed delivery.
 *
 * @param firstHandle        first delivered chunk
 * @param handles            every delivered chunk, in order
 * @param attachmentsDropped whether the first chunk went out text-only after
 *                           the attachment upload kept failing
 * @param firstChunkAttempts send attempts spent on the first chunk, degraded
 *                           resend included
 */
public record DeliveryReport(MessageHandle firstHandle, List<MessageHandle> handles,
        boolean attachmentsDropped, int firstChunkAttempts) {

    public int chunkCount() {
        return handles.size();
    }
}
