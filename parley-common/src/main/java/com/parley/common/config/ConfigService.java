package com.parley.common.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads and caches Parley configuration.
 */
@Slf4j
public class ConfigService {

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(5);
    private static final Pattern ENV_VAR_PATTERN = Pattern.compile("\\$\\{([^}:]+)(?::-(.*?))?}");
    static final String TOKEN_ENV = "DISCORD_BOT_TOKEN";

    private final ObjectMapper objectMapper;
    private final Cache<String, ParleyConfig> cache;
    private final Path configPath;
    private final Function<String, String> env;

    public ConfigService(Path configPath) {
        this(configPath, DEFAULT_CACHE_TTL, System::getenv);
    }

    public ConfigService(Path configPath, Duration cacheTtl, Function<String, String> env) {
        this.configPath = expandHome(configPath);
        this.env = env;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(cacheTtl)
                .maximumSize(1)
                .build();
    }

    /**
     * Load config with caching.
     */
    public ParleyConfig loadConfig() {
        return cache.get(configPath.toString(), key -> doLoadConfig());
    }

    /**
     * Force reload config, bypassing cache.
     */
    public ParleyConfig reloadConfig() {
        cache.invalidateAll();
        return loadConfig();
    }

    public Path getConfigPath() {
        return configPath;
    }

    /**
     * Expand a leading {@code ~} to the user home directory.
     */
    public static Path expandHome(Path path) {
        String pathStr = path.toString();
        if (pathStr.startsWith("~")) {
            return Path.of(System.getProperty("user.home") + pathStr.substring(1));
        }
        return path;
    }

    private ParleyConfig doLoadConfig() {
        ParleyConfig config;
        if (!Files.exists(configPath)) {
            log.warn("Config file not found: {}, using defaults", configPath);
            config = new ParleyConfig();
        } else {
            try {
                String raw = substituteEnvVars(Files.readString(configPath));
                config = objectMapper.readValue(raw, ParleyConfig.class);
                log.info("Config loaded from: {}", configPath);
            } catch (IOException e) {
                log.error("Failed to load config from: {}", configPath, e);
                config = new ParleyConfig();
            }
        }
        return applyDefaults(config);
    }

    /**
     * Substitute ${VAR} and ${VAR:-default} patterns.
     */
    String substituteEnvVars(String raw) {
        Matcher matcher = ENV_VAR_PATTERN.matcher(raw);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String varName = matcher.group(1);
            String defaultValue = matcher.group(2);
            String value = env.apply(varName);
            if (value == null) {
                value = defaultValue != null ? defaultValue : "";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Apply default values to missing config sections.
     */
    ParleyConfig applyDefaults(ParleyConfig config) {
        if (config.getDiscord() == null) {
            config.setDiscord(new ParleyConfig.DiscordConfig());
        }
        String token = config.getDiscord().getToken();
        if (token == null || token.isBlank()) {
            config.getDiscord().setToken(env.apply(TOKEN_ENV));
        }
        if (config.getDedup() == null) {
            config.setDedup(new ParleyConfig.DedupConfig());
        }
        if (config.getThreads() == null) {
            config.setThreads(new ParleyConfig.ThreadsConfig());
        }
        if (config.getThreads().getAutoThreadWait() == null) {
            config.getThreads().setAutoThreadWait(new ParleyConfig.AutoThreadWaitConfig());
        }
        if (config.getDelivery() == null) {
            config.setDelivery(new ParleyConfig.DeliveryConfig());
        }
        if (config.getRateLimit() == null) {
            config.setRateLimit(new ParleyConfig.RateLimitConfig());
        }
        if (config.getWorkers() == null) {
            config.setWorkers(new ParleyConfig.WorkersConfig());
        }
        if (config.getMessages() == null) {
            config.setMessages(new ParleyConfig.MessagesConfig());
        }
        if (config.getMessages().getExtra() == null) {
            config.getMessages().setExtra(Map.of());
        }
        if (config.getStore() == null) {
            config.setStore(new ParleyConfig.StoreConfig());
        }
        if (config.getLogging() == null) {
            config.setLogging(new ParleyConfig.LoggingConfig());
        }
        return config;
    }
}
