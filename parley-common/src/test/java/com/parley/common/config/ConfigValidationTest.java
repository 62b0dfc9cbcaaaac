package com.parley.common.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigValidationTest {

    private ParleyConfig defaults() {
        return new ConfigService(Path.of("unused.json"), Duration.ofSeconds(1), Map.<String, String>of()::get)
                .applyDefaults(new ParleyConfig());
    }

    @Test
    void defaults_areValidButWarnAboutMissingToken() {
        ConfigValidation.ValidationResult result = ConfigValidation.validate(defaults());

        assertTrue(result.ok());
        assertEquals(1, result.warnings().size());
        assertEquals("discord.token", result.warnings().get(0).path());
    }

    @Test
    void chunkLimitAtTextLimit_isAnError() {
        ParleyConfig config = defaults();
        config.getDiscord().setToken("t");
        config.getDelivery().setChunkLimit(2000);

        ConfigValidation.ValidationResult result = ConfigValidation.validate(config);

        assertFalse(result.ok());
        assertEquals("delivery.chunkLimit", result.errors().get(0).path());
    }

    @Test
    void tinyCacheBounds_areErrors() {
        ParleyConfig config = defaults();
        config.getDiscord().setToken("t");
        config.getDedup().setCommandCacheSize(1);
        config.getThreads().setCacheSize(0);

        assertEquals(2, ConfigValidation.validate(config).errors().size());
    }

    @Test
    void rateLimitOutOfRange_isAnError() {
        ParleyConfig config = defaults();
        config.getDiscord().setToken("t");
        config.getRateLimit().setMaxPerMinute(0);
        config.getRateLimit().setCooldownSeconds(-1);

        ConfigValidation.ValidationResult result = ConfigValidation.validate(config);

        assertFalse(result.ok());
        assertEquals(2, result.errors().size());
        assertEquals("rateLimit.maxPerMinute", result.errors().get(0).path());
        assertEquals("rateLimit.cooldownSeconds", result.errors().get(1).path());
    }
}
