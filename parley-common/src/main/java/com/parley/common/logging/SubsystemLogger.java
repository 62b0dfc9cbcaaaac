package com.parley.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and adds structured subsystem
 * context.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("dispatch");
 * log.info("Lifecycle finished", Map.of("eventId", "123", "state", "DELIVERED"));
 * SubsystemLogger child = log.child("thread");
 * child.debug("Cache hit");
 * </pre>
 */
public class SubsystemLogger {

    private static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        // Subsystem doubles as the SLF4J logger name for per-subsystem control in
        // logback-spring.xml
        this.logger = LoggerFactory.getLogger("parley." + subsystem.replace('/', '.'));
    }

    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    /**
     * Create a child logger with extended subsystem path.
     */
    public SubsystemLogger child(String name) {
        return new SubsystemLogger(subsystem + "/" + name);
    }

    public void debug(String message) {
        debug(message, null);
    }

    public void debug(String message, Map<String, Object> meta) {
        emit(LogLevel.DEBUG, message, meta);
    }

    public void info(String message) {
        info(message, null);
    }

    public void info(String message, Map<String, Object> meta) {
        emit(LogLevel.INFO, message, meta);
    }

    public void warn(String message) {
        warn(message, null);
    }

    public void warn(String message, Map<String, Object> meta) {
        emit(LogLevel.WARN, message, meta);
    }

    public void error(String message, Map<String, Object> meta) {
        emit(LogLevel.ERROR, message, meta);
    }

    public void error(String message, Map<String, Object> meta, Throwable t) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            logger.error(formatMessage(message, meta), t);
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    public String getSubsystem() {
        return subsystem;
    }

    public Logger getSlf4jLogger() {
        return logger;
    }

    private void emit(LogLevel level, String message, Map<String, Object> meta) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
                case SILENT -> {
                }
                default -> logger.info(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}
