package com.parley.channel.discord;

import javax.net.ssl.SSLException;
import java.io.EOFException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Transport error classification for delivery retry decisions.
 */
public final class DiscordTransportErrors {

    private DiscordTransportErrors() {
    }

    private static final Set<Class<? extends Throwable>> TRANSIENT_TYPES = Set.of(
            SSLException.class,
            ConnectException.class,
            SocketException.class,
            HttpTimeoutException.class,
            EOFException.class,
            ClosedChannelException.class);

    private static final String[] TRANSIENT_MESSAGE_SNIPPETS = {
            "ssl", "handshake", "connection reset", "broken pipe"
    };

    /**
     * Whether the error chain looks like a network or handshake failure that a
     * retry may fix. API answers from the platform are never transient.
     */
    public static boolean isTransient(Throwable err) {
        Set<Throwable> seen = new HashSet<>();
        Throwable current = unwrap(err);
        while (current != null && seen.add(current)) {
            if (current instanceof DiscordApiException) {
                return false;
            }
            for (Class<? extends Throwable> type : TRANSIENT_TYPES) {
                if (type.isInstance(current)) {
                    return true;
                }
            }
            String msg = current.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase();
                for (String snippet : TRANSIENT_MESSAGE_SNIPPETS) {
                    if (lower.contains(snippet)) {
                        return true;
                    }
                }
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Strip {@link CompletionException} / {@link ExecutionException} wrappers
     * added by future composition.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
