package com.parley.common.config;

import lombok.Data;

import java.util.Map;

/**
 * Root configuration type for Parley.
 * Loaded from {@code ~/.parley/config.json} by {@link ConfigService}.
 */
@Data
public class ParleyConfig {

    /** Discord connection settings. */
    private DiscordConfig discord;

    /** Duplicate-delivery tracking. */
    private DedupConfig dedup;

    /** Thread resolution settings. */
    private ThreadsConfig threads;

    /** Reply delivery settings. */
    private DeliveryConfig delivery;

    /** Per-user rate limiting. */
    private RateLimitConfig rateLimit;

    /** Lifecycle worker pool. */
    private WorkersConfig workers;

    /** User-facing notices. */
    private MessagesConfig messages;

    /** Exchange store. */
    private StoreConfig store;

    /** Logging settings. */
    private LoggingConfig logging;

    // --- Nested config types ---

    @Data
    public static class DiscordConfig {
        private String token;
        private String apiBaseUrl = "https://discord.com/api/v10";
        private int requestTimeoutMs = 30_000;
    }

    @Data
    public static class DedupConfig {
        /** Bound for (eventId, channelId) keys. */
        private int messageCacheSize = 1000;
        /** Bound for (eventId, authorId) keys. */
        private int commandCacheSize = 500;
    }

    @Data
    public static class ThreadsConfig {
        private int cacheSize = 500;
        private String namePrefix = "Bot Response";
        private int autoArchiveMinutes = 1440;
        private AutoThreadWaitConfig autoThreadWait = new AutoThreadWaitConfig();
    }

    /**
     * Bounded wait for a platform-created thread on attachment messages.
     */
    @Data
    public static class AutoThreadWaitConfig {
        private long initialDelayMs = 200;
        private double multiplier = 1.5;
        private long maxDelayMs = 2000;
        private long timeoutMs = 5000;
    }

    @Data
    public static class DeliveryConfig {
        /** Hard platform limit for one message. */
        private int textLimit = 2000;
        /** Split size; leaves room for part headers. */
        private int chunkLimit = 1900;
        private boolean partHeaders = true;
        private int retryAttempts = 3;
        private long retryInitialDelayMs = 1000;
        private long retryMaxDelayMs = 4000;
    }

    @Data
    public static class RateLimitConfig {
        private boolean enabled = true;
        private int cooldownSeconds = 10;
        private int maxPerMinute = 6;
        private int maxTrackedUsers = 10_000;
    }

    @Data
    public static class WorkersConfig {
        private int poolSize = 8;
    }

    @Data
    public static class MessagesConfig {
        private String processing = "Processing your request, please wait...";
        private String noQuery = "Please provide a query after mentioning the bot.";
        private String processingError = "Sorry, an error occurred while processing your request. Please try again later.";
        private String summaryError = "Sorry, an error occurred while generating the summary. Please try again later.";
        private String invalidHoursRange = "Number of hours must be between 1 and {max} (7 days).";
        private String invalidHoursFormat = "Please provide a valid number of hours. Usage: `/sum-hr <number>` (e.g., `/sum-hr 10`)";
        private String rateLimitCooldown = "Please wait {wait} seconds before making another request.";
        private String rateLimitExceeded = "You've reached the maximum number of requests per minute. Please try again in {wait} seconds.";
        private String emptyResponse = "No response generated. Please try again.";
        /** Sent in place of a blank reply whose attachments could not be uploaded. */
        private String attachmentsDropped = "The generated chart could not be uploaded. Please try again.";
        private int maxSummaryHours = 168;
        /** Extra notices keyed by name, for collaborators that want them. */
        private Map<String, String> extra;
    }

    @Data
    public static class StoreConfig {
        private boolean enabled = true;
        private String path = "~/.parley/exchanges.jsonl";
    }

    @Data
    public static class LoggingConfig {
        private String level = "info";
    }
}
