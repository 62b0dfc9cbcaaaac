package com.parley.channel.dispatch;

import com.parley.channel.delivery.DeliveryException;
import com.parley.channel.delivery.DeliveryReport;
import com.parley.channel.delivery.ResponseDelivery;
import com.parley.channel.discord.DiscordPlatform;
import com.parley.channel.discord.DiscordTransportErrors;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.discord.DiscordTypes.MessageHandle;
import com.parley.channel.discord.DiscordTypes.ThreadRef;
import com.parley.channel.dispatch.CommandParser.ParseResult;
import com.parley.channel.dispatch.CommandParser.ParsedCommand;
import com.parley.channel.thread.ThreadResolver;
import com.parley.common.config.ParleyConfig;
import com.parley.common.infra.DedupeCache;
import com.parley.common.infra.UserRateLimiter;
import com.parley.common.logging.SubsystemLogger;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs each inbound event through dedup, thread resolution, the collaborator
 * and delivery, one worker task per event.
 * <p>
 * Both dedup keys are registered before any side effect, so a redelivered
 * copy of an event can never reach {@link LifecycleState#PROCESSING} twice.
 * This is the only place that turns failures into user-visible notices, and
 * the "processing" indicator is removed on every exit path.
 */
public class CommandCoordinator implements AutoCloseable {

    private static final SubsystemLogger log = SubsystemLogger.create("dispatch");

    private final DiscordPlatform platform;
    private final DedupeCache messageDedup;
    private final DedupeCache commandDedup;
    private final ThreadResolver threadResolver;
    private final ResponseDelivery delivery;
    private final Collaborator collaborator;
    private final ExchangeStore exchangeStore;
    private final UserRateLimiter rateLimiter;
    private final ParleyConfig.MessagesConfig messages;
    private final ExecutorService executor;

    /**
     * @param rateLimiter   may be {@code null} to disable rate limiting
     * @param exchangeStore may be {@code null} to skip recording
     * @param executor      runs lifecycles; owned and shut down by
     *                      {@link #close()}
     */
    @Builder
    public CommandCoordinator(DiscordPlatform platform,
            DedupeCache messageDedup,
            DedupeCache commandDedup,
            ThreadResolver threadResolver,
            ResponseDelivery delivery,
            Collaborator collaborator,
            ExchangeStore exchangeStore,
            UserRateLimiter rateLimiter,
            ParleyConfig.MessagesConfig messages,
            ExecutorService executor) {
        this.platform = Objects.requireNonNull(platform, "platform");
        this.messageDedup = Objects.requireNonNull(messageDedup, "messageDedup");
        this.commandDedup = Objects.requireNonNull(commandDedup, "commandDedup");
        this.threadResolver = Objects.requireNonNull(threadResolver, "threadResolver");
        this.delivery = Objects.requireNonNull(delivery, "delivery");
        this.collaborator = Objects.requireNonNull(collaborator, "collaborator");
        this.exchangeStore = exchangeStore != null ? exchangeStore : ExchangeStore.NOOP;
        this.rateLimiter = rateLimiter;
        this.messages = messages != null ? messages : new ParleyConfig.MessagesConfig();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Hand off an event. Returns immediately; the future completes with the
     * terminal outcome.
     */
    public CompletableFuture<LifecycleOutcome> submit(InboundEvent event) {
        return CompletableFuture.supplyAsync(() -> run(event), executor);
    }

    LifecycleOutcome run(InboundEvent event) {
        Lifecycle lifecycle = new Lifecycle(event.eventId());

        if (!admit(event)) {
            lifecycle.transition(LifecycleState.DEDUP_REJECTED);
            log.debug("Duplicate event dropped", meta(event));
            return lifecycle.toOutcome();
        }
        lifecycle.transition(LifecycleState.DEDUP_ACCEPTED);

        // rejected requests are answered in place and never get a thread
        String rejection = rateLimitNotice(event);
        ParseResult parsed = null;
        if (rejection == null) {
            parsed = CommandParser.parse(event, messages);
            if (!parsed.ok()) {
                rejection = parsed.notice();
            }
        }

        lifecycle.transition(LifecycleState.THREAD_RESOLVING);
        Optional<ThreadRef> thread = rejection == null ? resolveThread(event) : Optional.empty();
        String destination = thread.map(ThreadRef::id).orElse(event.channelId());
        lifecycle.destination(thread.orElse(null), destination);
        lifecycle.transition(LifecycleState.THREAD_READY);
        if (thread.isEmpty() && rejection == null) {
            log.info("No thread, replying in channel", meta(event));
        }

        lifecycle.transition(LifecycleState.PROCESSING);
        if (rejection != null) {
            sendNotice(destination, rejection);
            lifecycle.fail(null);
        } else {
            try {
                process(event, parsed.command(), lifecycle);
            } catch (RuntimeException e) {
                log.error("Lifecycle aborted", meta(event), e);
                if (!lifecycle.state().isTerminal()) {
                    lifecycle.fail(e);
                }
            }
        }

        Map<String, Object> done = meta(event);
        done.put("state", lifecycle.state());
        done.put("destination", destination);
        log.info("Lifecycle finished", done);
        return lifecycle.toOutcome();
    }

    /**
     * Register both dedup keys; the message key goes first and a rejected
     * message key leaves the command cache untouched.
     */
    private boolean admit(InboundEvent event) {
        return messageDedup.checkAndRegister(event.messageKey())
                && commandDedup.checkAndRegister(event.commandKey());
    }

    private Optional<ThreadRef> resolveThread(InboundEvent event) {
        try {
            return threadResolver.resolve(event);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while resolving thread", meta(event));
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Thread resolution failed: " + e.getMessage(), meta(event));
            return Optional.empty();
        }
    }

    /**
     * Notice for a rate-limited author, or null when the request may proceed.
     */
    private String rateLimitNotice(InboundEvent event) {
        if (rateLimiter == null) {
            return null;
        }
        UserRateLimiter.Decision decision = rateLimiter.check(event.authorId());
        if (!decision.limited()) {
            return null;
        }
        Map<String, Object> m = meta(event);
        m.put("reason", decision.reason());
        log.info("Rate limited", m);
        String template = decision.reason() == UserRateLimiter.Reason.COOLDOWN
                ? messages.getRateLimitCooldown()
                : messages.getRateLimitExceeded();
        return template.replace("{wait}", String.format(Locale.ROOT, "%.1f", decision.waitSeconds()));
    }

    private void process(InboundEvent event, ParsedCommand command, Lifecycle lifecycle) {
        String destination = lifecycle.destinationId();

        IndicatorCleanup indicator = new IndicatorCleanup(sendNotice(destination, messages.getProcessing()));
        try {
            Collaborator.Reply reply;
            try {
                reply = await(collaborator.process(event, command));
            } catch (Exception e) {
                log.error("Collaborator failed", meta(event), e);
                indicator.run();
                sendNotice(destination, command.type() == CommandParser.CommandType.QUERY
                        ? messages.getProcessingError()
                        : messages.getSummaryError());
                lifecycle.fail(e);
                return;
            }
            if (reply == null) {
                reply = Collaborator.Reply.text("");
            }

            String text = reply.text();
            if ((text == null || text.isBlank()) && reply.visualizations().isEmpty()) {
                text = messages.getEmptyResponse();
            }

            lifecycle.transition(LifecycleState.DELIVERING);
            try {
                DeliveryReport report = delivery.deliver(destination, text != null ? text : "",
                        reply.visualizations(), indicator);
                lifecycle.delivered(report);
                if (report.attachmentsDropped()) {
                    log.warn("Reply delivered without its attachments", meta(event));
                }
            } catch (DeliveryException e) {
                log.error("Delivery failed", meta(event), e);
                sendNotice(destination, messages.getProcessingError());
                lifecycle.fail(e);
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                lifecycle.fail(e);
                return;
            }
            recordExchange(event, command, destination, reply);
        } finally {
            indicator.run();
        }
    }

    private void recordExchange(InboundEvent event, ParsedCommand command, String destination,
            Collaborator.Reply reply) {
        try {
            CompletableFuture.runAsync(() -> {
                try {
                    exchangeStore.recordExchange(event, command.describe(), destination, reply);
                } catch (Exception e) {
                    log.warn("Exchange not recorded: " + e.getMessage(), meta(event));
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("Exchange not recorded: coordinator is shutting down", meta(event));
        }
    }

    /**
     * Best-effort plain message.
     *
     * @return the sent message, or {@code null} if sending failed
     */
    private MessageHandle sendNotice(String channelId, String text) {
        try {
            return platform.sendMessage(channelId, text, List.of()).join();
        } catch (RuntimeException e) {
            log.warn("Notice to " + channelId + " failed: " + DiscordTransportErrors.unwrap(e).getMessage());
            return null;
        }
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
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

    private static Map<String, Object> meta(InboundEvent event) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("eventId", event.eventId());
        m.put("channelId", event.channelId());
        m.put("authorId", event.authorId());
        return m;
    }

    /**
     * Stop accepting events and wait briefly for running lifecycles.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Deletes the "processing" indicator at most once.
     */
    private final class IndicatorCleanup implements Runnable {

        private final MessageHandle handle;
        private final AtomicBoolean done = new AtomicBoolean();

        IndicatorCleanup(MessageHandle handle) {
            this.handle = handle;
        }

        @Override
        public void run() {
            if (handle == null || !done.compareAndSet(false, true)) {
                return;
            }
            try {
                platform.deleteMessage(handle).join();
            } catch (RuntimeException e) {
                log.warn("Could not remove processing indicator " + handle.messageId() + ": "
                        + DiscordTransportErrors.unwrap(e).getMessage());
            }
        }
    }
}
