package com.parley.channel.discord;

/**
 * The platform refused to create a thread.
 */
public class ThreadCreateException extends RuntimeException {

    public enum Reason {
        /** A thread already hangs off the message; fetch it instead. */
        ALREADY_EXISTS,
        FORBIDDEN,
        UNSUPPORTED_CHANNEL,
        OTHER
    }

    private final Reason reason;

    public ThreadCreateException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public ThreadCreateException(Reason reason, String message) {
        this(reason, message, null);
    }

    /**
     * Classify an API failure from a thread creation call.
     */
    public static ThreadCreateException from(DiscordApiException err) {
        Reason reason;
        if (err.hasCode(DiscordApiException.THREAD_ALREADY_CREATED_CODE)
                || (err.getMessage() != null
                        && err.getMessage().toLowerCase().contains("thread has already been created"))) {
            reason = Reason.ALREADY_EXISTS;
        } else if (err.getStatus() == 403 || err.hasCode(DiscordApiException.MISSING_PERMISSIONS_CODE)) {
            reason = Reason.FORBIDDEN;
        } else if (err.hasCode(DiscordApiException.INVALID_CHANNEL_TYPE_CODE)) {
            reason = Reason.UNSUPPORTED_CHANNEL;
        } else {
            reason = Reason.OTHER;
        }
        return new ThreadCreateException(reason, err.getMessage(), err);
    }

    public Reason getReason() {
        return reason;
    }
}
