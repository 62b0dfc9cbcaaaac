package com.parley.channel.discord;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Non-2xx answer from the Discord REST API.
 */
public class DiscordApiException extends RuntimeException {

    public static final int THREAD_ALREADY_CREATED_CODE = 160004;
    public static final int MISSING_PERMISSIONS_CODE = 50013;
    public static final int INVALID_CHANNEL_TYPE_CODE = 50024;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int status;
    private final Integer code;
    private final Double retryAfterSeconds;

    public DiscordApiException(String message, int status, Integer code, Double retryAfterSeconds) {
        super(message);
        this.status = status;
        this.code = code;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    /**
     * Build from an HTTP status and the raw response body, reading the
     * {@code message}, {@code code} and {@code retry_after} fields when the
     * body is a JSON object.
     */
    public static DiscordApiException fromResponse(String operation, int status, String body) {
        String detail = body != null ? body.trim() : "";
        Integer code = null;
        Double retryAfter = null;
        if (detail.startsWith("{")) {
            try {
                JsonNode node = MAPPER.readTree(detail);
                if (node.hasNonNull("code")) {
                    code = node.get("code").asInt();
                }
                if (node.hasNonNull("retry_after")) {
                    retryAfter = node.get("retry_after").asDouble();
                }
                detail = node.path("message").asText("unknown error");
            } catch (IOException ignored) {
                // keep the raw body as detail
            }
        }
        String message = operation + " failed: HTTP " + status
                + (code != null ? " (code " + code + ")" : "")
                + (detail.isEmpty() ? "" : " - " + detail);
        return new DiscordApiException(message, status, code, retryAfter);
    }

    public int getStatus() {
        return status;
    }

    public Integer getCode() {
        return code;
    }

    public Double getRetryAfterSeconds() {
        return retryAfterSeconds;
    }

    /**
     * Wait the platform asked for in milliseconds, or -1 when it named none.
     */
    public long getRetryAfterMs() {
        return retryAfterSeconds != null ? (long) Math.ceil(retryAfterSeconds * 1000) : -1;
    }

    public boolean isRateLimited() {
        return status == 429;
    }

    public boolean isPayloadTooLarge() {
        return status == 413;
    }

    public boolean isNotFound() {
        return status == 404;
    }

    public boolean hasCode(int expected) {
        return code != null && code == expected;
    }
}
