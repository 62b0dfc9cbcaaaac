package com.parley.channel.discord;

import java.util.regex.Pattern;

/**
 * Thread naming helpers.
 */
public final class DiscordThreading {

    private DiscordThreading() {
    }

    public static final int MAX_THREAD_NAME_LENGTH = 100;

    private static final Pattern USER_MENTION = Pattern.compile("<@!?\\d+>");
    private static final Pattern ROLE_MENTION = Pattern.compile("<@&\\d+>");
    private static final Pattern CHANNEL_MENTION = Pattern.compile("<#\\d+>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Name for a reply thread: {@code "<prefix> - <display name>"}.
     */
    public static String buildThreadName(String prefix, String displayName, String fallbackId) {
        String who = displayName != null && !displayName.isBlank() ? displayName : "user " + fallbackId;
        String base = prefix != null && !prefix.isBlank() ? prefix.trim() + " - " + who : who;
        return sanitizeThreadName(base, fallbackId);
    }

    /**
     * Remove Discord mentions, collapse whitespace and cap to the platform's
     * thread name limit.
     */
    public static String sanitizeThreadName(String rawName, String fallbackId) {
        String cleaned = rawName != null ? rawName : "";
        cleaned = USER_MENTION.matcher(cleaned).replaceAll("");
        cleaned = ROLE_MENTION.matcher(cleaned).replaceAll("");
        cleaned = CHANNEL_MENTION.matcher(cleaned).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
        String base = cleaned.isEmpty() ? "Thread " + fallbackId : cleaned;
        if (base.length() > MAX_THREAD_NAME_LENGTH) {
            int end = MAX_THREAD_NAME_LENGTH;
            if (Character.isHighSurrogate(base.charAt(end - 1))) {
                end--;
            }
            base = base.substring(0, end).trim();
        }
        return base;
    }
}
