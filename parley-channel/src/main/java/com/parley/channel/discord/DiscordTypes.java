package com.parley.channel.discord;

import lombok.Builder;

import java.util.List;

/**
 * Value types exchanged with the Discord platform boundary.
 */
public final class DiscordTypes {

    private DiscordTypes() {
    }

    public enum EventKind {
        MENTION, SLASH_COMMAND, THREAD_REPLY
    }

    /**
     * One delivery of a user trigger. Redelivery reuses the same
     * {@code eventId}, so the id identifies the logical occurrence only
     * together with the channel or the author.
     * <p>
     * When {@code alreadyInThread} is set, {@code channelId} is the thread the
     * event was posted in. {@code guildId} is {@code null} for direct messages.
     */
    @Builder(toBuilder = true)
    public record InboundEvent(
            String eventId,
            String authorId,
            String authorDisplayName,
            String channelId,
            String guildId,
            boolean alreadyInThread,
            boolean hasAttachments,
            EventKind kind,
            String content,
            String botUserId) {

        public String messageKey() {
            return eventId + ":" + channelId;
        }

        public String commandKey() {
            return eventId + ":" + authorId;
        }

        public boolean isDirectMessage() {
            return guildId == null || guildId.isBlank();
        }
    }

    public record ThreadRef(String id, String name) {
    }

    public record MessageHandle(String channelId, String messageId) {
    }

    /**
     * A file to upload with a message. Upload bodies consume their source, so
     * each send attempt works on a {@link #copy()}.
     */
    public record Attachment(String filename, byte[] data, String contentType) {

        public Attachment copy() {
            return new Attachment(filename, data.clone(), contentType);
        }

        public static List<Attachment> copyAll(List<Attachment> attachments) {
            if (attachments == null || attachments.isEmpty()) {
                return List.of();
            }
            return attachments.stream().map(Attachment::copy).toList();
        }
    }
}
