package com.parley.channel.delivery;

import com.parley.channel.discord.DiscordApiException;
import com.parley.channel.discord.DiscordPlatform;
import com.parley.channel.discord.DiscordTransportErrors;
import com.parley.channel.discord.DiscordTypes.Attachment;
import com.parley.channel.discord.DiscordTypes.MessageHandle;
import com.parley.common.config.ParleyConfig;
import com.parley.common.infra.RetryRunner;
import com.parley.common.infra.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sends a reply to a channel or thread.
 * <p>
 * Oversized text is split; attachments ride on the first chunk only. The
 * first chunk retries transient transport failures with exponential backoff,
 * uploading fresh copies of the attachments on each attempt. When those
 * retries run out, or the platform rejects the upload as too large, the first
 * chunk is resent once without attachments; a blank first chunk is replaced
 * by a notice so the resend is never empty. A rate-limited first chunk
 * (HTTP 429) is retried too, waiting at least as long as the platform asks.
 * Later chunks are plain text and are sent once.
 */
@Slf4j
public class ResponseDelivery {

    /** Room kept for a {@code [Part i/n]} header. */
    static final int PART_HEADER_RESERVE = 20;

    private final DiscordPlatform platform;
    private final int textLimit;
    private final int chunkLimit;
    private final boolean partHeaders;
    private final RetryRunner.Config retryConfig;
    private final String attachmentsDroppedNotice;
    private final Sleeper sleeper;

    public ResponseDelivery(DiscordPlatform platform, ParleyConfig.DeliveryConfig config, Sleeper sleeper) {
        this(platform, config, new ParleyConfig.MessagesConfig().getAttachmentsDropped(), sleeper);
    }

    /**
     * Out-of-range numbers are clamped to their minimum; the startup check
     * reports them.
     */
    public ResponseDelivery(DiscordPlatform platform, ParleyConfig.DeliveryConfig config,
            String attachmentsDroppedNotice, Sleeper sleeper) {
        this.platform = platform;
        this.textLimit = Math.max(1, config.getTextLimit());
        this.partHeaders = config.isPartHeaders();
        int split = partHeaders
                ? Math.min(config.getChunkLimit(), textLimit - PART_HEADER_RESERVE)
                : Math.min(config.getChunkLimit(), textLimit);
        this.chunkLimit = Math.max(1, split);
        this.retryConfig = new RetryRunner.Config(Math.max(1, config.getRetryAttempts()),
                config.getRetryInitialDelayMs(), config.getRetryMaxDelayMs());
        this.attachmentsDroppedNotice = attachmentsDroppedNotice;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    }

    /**
     * Chunks that {@link #deliver} would send for this text.
     */
    public List<String> plan(String text) {
        String body = text != null ? text : "";
        if (body.length() <= textLimit) {
            return List.of(body);
        }
        List<String> chunks = MessageSplitter.split(body, chunkLimit);
        return partHeaders ? MessageSplitter.withPartHeaders(chunks) : chunks;
    }

    /**
     * Deliver the reply.
     *
     * @param channelId         destination channel or thread
     * @param text              reply text
     * @param attachments       files for the first chunk; may be empty
     * @param afterFirstChunk   run once the first chunk was delivered or has
     *                          finally failed
     * @throws DeliveryException    when a chunk could not be delivered
     * @throws InterruptedException when interrupted during a backoff sleep
     */
    public DeliveryReport deliver(String channelId, String text, List<Attachment> attachments,
            Runnable afterFirstChunk) throws InterruptedException {
        List<String> chunks = plan(text);
        List<Attachment> files = attachments != null ? attachments : List.of();
        List<MessageHandle> handles = new ArrayList<>();
        AtomicInteger attempts = new AtomicInteger();
        boolean dropped = false;

        MessageHandle first;
        try {
            try {
                first = sendFirstChunk(channelId, chunks.get(0), files, attempts);
            } catch (InterruptedException e) {
                throw e;
            } catch (Exception e) {
                if (!canDegrade(e, files)) {
                    throw new DeliveryException("first chunk to " + channelId + " failed after "
                            + attempts.get() + " attempt(s)", handles, e);
                }
                log.warn("Sending to {} with {} attachment(s) failed ({}), resending text only",
                        channelId, files.size(), e.getMessage());
                dropped = true;
                attempts.incrementAndGet();
                String textOnlyChunk = chunks.get(0).isBlank() ? attachmentsDroppedNotice : chunks.get(0);
                try {
                    first = await(platform.sendMessage(channelId, textOnlyChunk, List.of()));
                } catch (Exception textOnly) {
                    textOnly.addSuppressed(e);
                    throw new DeliveryException("text-only resend to " + channelId + " failed", handles, textOnly);
                }
            }
        } finally {
            if (afterFirstChunk != null) {
                afterFirstChunk.run();
            }
        }
        handles.add(first);

        for (int i = 1; i < chunks.size(); i++) {
            try {
                handles.add(await(platform.sendMessage(channelId, chunks.get(i), List.of())));
            } catch (Exception e) {
                throw new DeliveryException("chunk " + (i + 1) + "/" + chunks.size() + " to "
                        + channelId + " failed", handles, e);
            }
        }

        if (chunks.size() > 1) {
            log.debug("Delivered {} chunks to {}", chunks.size(), channelId);
        }
        return new DeliveryReport(first, List.copyOf(handles), dropped, attempts.get());
    }

    private MessageHandle sendFirstChunk(String channelId, String chunk, List<Attachment> files,
            AtomicInteger attempts) throws Exception {
        RetryRunner runner = new RetryRunner(retryConfig,
                (err, attempt) -> DiscordTransportErrors.isTransient(err) || isRateLimited(err),
                ResponseDelivery::retryAfterMs,
                info -> log.warn("Failure sending to {} (attempt {}/{}), retrying in {}ms: {}",
                        channelId, info.attempt(), info.maxAttempts(), info.delayMs(), info.err().getMessage()),
                sleeper);
        return runner.execute(() -> {
            attempts.incrementAndGet();
            return await(platform.sendMessage(channelId, chunk, Attachment.copyAll(files)));
        }, "send " + channelId);
    }

    private static boolean isRateLimited(Throwable err) {
        return DiscordTransportErrors.unwrap(err) instanceof DiscordApiException api && api.isRateLimited();
    }

    private static Long retryAfterMs(Throwable err) {
        return DiscordTransportErrors.unwrap(err) instanceof DiscordApiException api ? api.getRetryAfterMs() : -1L;
    }

    private static boolean canDegrade(Exception err, List<Attachment> files) {
        if (files.isEmpty()) {
            return false;
        }
        if (DiscordTransportErrors.isTransient(err)) {
            return true;
        }
        return err instanceof DiscordApiException api && api.isPayloadTooLarge();
    }

    /**
     * Join the future, rethrowing the underlying failure instead of the
     * {@link CompletionException} wrapper.
     */
    static <T> T await(CompletableFuture<T> future) throws Exception {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = DiscordTransportErrors.unwrap(e);
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        }
    }
}
