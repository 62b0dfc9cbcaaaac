package com.parley.app.config;

import com.parley.common.config.ConfigService;
import com.parley.common.config.ConfigValidation;
import com.parley.common.config.ParleyConfig;
import com.parley.common.logging.LogLevel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Validates the loaded config and applies the configured log level before
 * events are accepted. Problems are logged; startup continues.
 */
@Slf4j
@Component
@Order(0)
public class StartupCheck {

    static final String[] LOGGER_NAMES = { "parley", "com.parley" };

    private final ConfigService configService;
    private final ParleyConfig config;
    private final LoggingSystem loggingSystem;

    public StartupCheck(ConfigService configService, ParleyConfig config, LoggingSystem loggingSystem) {
        this.configService = configService;
        this.config = config;
        this.loggingSystem = loggingSystem;
    }

    @PostConstruct
    public void init() {
        applyLogLevel();

        ConfigValidation.ValidationResult result = ConfigValidation.validate(config);
        for (ConfigValidation.ValidationIssue w : result.warnings()) {
            log.warn("Config warning at {}: {}", w.path(), w.message());
        }
        for (ConfigValidation.ValidationIssue e : result.errors()) {
            log.warn("Config error at {}: {}", e.path(), e.message());
        }
        if (result.ok()) {
            log.info("Config check passed for {} ({} warning(s))",
                    configService.getConfigPath(), result.warnings().size());
        } else {
            log.error("Config {} has {} error(s); affected components may misbehave",
                    configService.getConfigPath(), result.errors().size());
        }
    }

    private void applyLogLevel() {
        LogLevel level = LogLevel.normalize(config.getLogging().getLevel());
        org.springframework.boot.logging.LogLevel target =
                org.springframework.boot.logging.LogLevel.valueOf(level.toSlf4jLevel());
        for (String name : LOGGER_NAMES) {
            loggingSystem.setLogLevel(name, target);
        }
        log.debug("Log level set to {}", target);
    }
}
