package com.parley.channel.discord;

import com.parley.channel.discord.DiscordTypes.Attachment;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.discord.DiscordTypes.MessageHandle;
import com.parley.channel.discord.DiscordTypes.ThreadRef;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Operations the coordinator needs from the chat platform. All calls are
 * asynchronous and may complete exceptionally.
 */
public interface DiscordPlatform {

    /**
     * Post a message to a channel or thread.
     *
     * @param channelId   destination channel or thread id
     * @param content     message text, already within the platform limit
     * @param attachments files to upload with the message; may be empty
     */
    CompletableFuture<MessageHandle> sendMessage(String channelId, String content, List<Attachment> attachments);

    /**
     * Create a thread for the event. Completes exceptionally with
     * {@link ThreadCreateException} when the platform refuses.
     */
    CompletableFuture<ThreadRef> createThread(InboundEvent event, String name);

    /**
     * Look up a thread that already hangs off the event's message, typically
     * one the platform created on its own.
     */
    CompletableFuture<Optional<ThreadRef>> fetchExistingThread(InboundEvent event);

    CompletableFuture<Void> deleteMessage(MessageHandle handle);
}
