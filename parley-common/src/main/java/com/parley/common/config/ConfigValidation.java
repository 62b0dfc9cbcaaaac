package com.parley.common.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Semantic checks on a loaded {@link ParleyConfig}.
 * Defaults must already be applied (see {@link ConfigService#applyDefaults}).
 */
public final class ConfigValidation {

    private ConfigValidation() {
    }

    public enum Severity {
        ERROR, WARNING
    }

    public record ValidationIssue(String path, String message, Severity severity) {
    }

    public record ValidationResult(List<ValidationIssue> issues) {

        public boolean ok() {
            return issues.stream().noneMatch(i -> i.severity() == Severity.ERROR);
        }

        public List<ValidationIssue> errors() {
            return issues.stream().filter(i -> i.severity() == Severity.ERROR).toList();
        }

        public List<ValidationIssue> warnings() {
            return issues.stream().filter(i -> i.severity() == Severity.WARNING).toList();
        }
    }

    public static ValidationResult validate(ParleyConfig config) {
        List<ValidationIssue> issues = new ArrayList<>();

        String token = config.getDiscord().getToken();
        if (token == null || token.isBlank()) {
            issues.add(new ValidationIssue("discord.token",
                    "no bot token configured (set discord.token or " + ConfigService.TOKEN_ENV + ")",
                    Severity.WARNING));
        }

        ParleyConfig.DeliveryConfig delivery = config.getDelivery();
        if (delivery.getTextLimit() <= 0) {
            issues.add(new ValidationIssue("delivery.textLimit", "must be positive", Severity.ERROR));
        }
        if (delivery.getChunkLimit() <= 0 || delivery.getChunkLimit() >= delivery.getTextLimit()) {
            issues.add(new ValidationIssue("delivery.chunkLimit",
                    "must be positive and below delivery.textLimit to leave room for part headers",
                    Severity.ERROR));
        }
        if (delivery.getRetryAttempts() < 1) {
            issues.add(new ValidationIssue("delivery.retryAttempts", "must be at least 1", Severity.ERROR));
        }

        ParleyConfig.DedupConfig dedup = config.getDedup();
        if (dedup.getMessageCacheSize() < 2) {
            issues.add(new ValidationIssue("dedup.messageCacheSize", "must be at least 2", Severity.ERROR));
        }
        if (dedup.getCommandCacheSize() < 2) {
            issues.add(new ValidationIssue("dedup.commandCacheSize", "must be at least 2", Severity.ERROR));
        }
        if (config.getThreads().getCacheSize() < 2) {
            issues.add(new ValidationIssue("threads.cacheSize", "must be at least 2", Severity.ERROR));
        }

        ParleyConfig.AutoThreadWaitConfig wait = config.getThreads().getAutoThreadWait();
        if (wait.getInitialDelayMs() <= 0 || wait.getTimeoutMs() < 0) {
            issues.add(new ValidationIssue("threads.autoThreadWait",
                    "initialDelayMs must be positive and timeoutMs non-negative", Severity.ERROR));
        }
        if (wait.getMultiplier() < 1.0) {
            issues.add(new ValidationIssue("threads.autoThreadWait.multiplier",
                    "below 1.0 shrinks the interval every attempt", Severity.WARNING));
        }

        ParleyConfig.RateLimitConfig rateLimit = config.getRateLimit();
        if (rateLimit.getMaxPerMinute() < 1) {
            issues.add(new ValidationIssue("rateLimit.maxPerMinute", "must be at least 1", Severity.ERROR));
        }
        if (rateLimit.getCooldownSeconds() < 0) {
            issues.add(new ValidationIssue("rateLimit.cooldownSeconds", "must not be negative", Severity.ERROR));
        }
        if (rateLimit.getMaxTrackedUsers() < 1) {
            issues.add(new ValidationIssue("rateLimit.maxTrackedUsers", "must be at least 1", Severity.ERROR));
        }

        if (config.getWorkers().getPoolSize() < 1) {
            issues.add(new ValidationIssue("workers.poolSize", "must be at least 1", Severity.ERROR));
        }
        if (config.getMessages().getMaxSummaryHours() < 1) {
            issues.add(new ValidationIssue("messages.maxSummaryHours", "must be at least 1", Severity.ERROR));
        }
        return new ValidationResult(issues);
    }
}
