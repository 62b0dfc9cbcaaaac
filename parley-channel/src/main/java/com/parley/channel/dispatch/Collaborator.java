package com.parley.channel.dispatch;

import com.parley.channel.discord.DiscordTypes.Attachment;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.dispatch.CommandParser.ParsedCommand;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Produces the reply for an accepted event: text generation, scraping,
 * summarization, chart rendering. Called once per lifecycle and never
 * retried; a failed future ends the lifecycle.
 */
@FunctionalInterface
public interface Collaborator {

    CompletableFuture<Reply> process(InboundEvent event, ParsedCommand command);

    /**
     * @param text           reply text, may be empty
     * @param visualizations rendered images, attached to the first chunk
     */
    record Reply(String text, List<Attachment> visualizations) {

        public Reply {
            visualizations = visualizations != null ? List.copyOf(visualizations) : List.of();
        }

        public static Reply text(String text) {
            return new Reply(text, List.of());
        }
    }
}
