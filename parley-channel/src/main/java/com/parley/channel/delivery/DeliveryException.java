package com.parley.channel.delivery;

import com.parley.channel.discord.DiscordTypes.MessageHandle;

import java.util.List;

/**
 * Terminal delivery failure. Chunks sent before the failure stay delivered
 * and are listed in {@link #getDelivered()}.
 */
public class DeliveryException extends RuntimeException {

    private final List<MessageHandle> delivered;

    public DeliveryException(String message, List<MessageHandle> delivered, Throwable cause) {
        super(message, cause);
        this.delivered = List.copyOf(delivered);
    }

    public List<MessageHandle> getDelivered() {
        return delivered;
    }
}
