package com.parley.channel.dispatch;

import com.parley.channel.discord.DiscordTypes.InboundEvent;

/**
 * Records completed exchanges for audit and later summarization. Called off
 * the lifecycle's critical path; failures are logged, never shown to users.
 */
public interface ExchangeStore {

    ExchangeStore NOOP = (event, query, destinationId, reply) -> {
    };

    void recordExchange(InboundEvent event, String query, String destinationId, Collaborator.Reply reply)
            throws Exception;
}
