package com.parley.channel.discord;

import com.parley.channel.discord.DiscordTypes.Attachment;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.discord.DiscordTypes.MessageHandle;
import com.parley.channel.discord.DiscordTypes.ThreadRef;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.LongSupplier;

/**
 * In-memory Discord: records sends, owns threads, and can inject faults.
 * Thread creation is atomic per message, as on the real platform.
 */
public class FakeDiscordPlatform implements DiscordPlatform {

    public record SentMessage(String channelId, String content, List<Attachment> attachments,
            MessageHandle handle) {
    }

    private final LongSupplier clock;
    private final AtomicLong ids = new AtomicLong(1000);
    private final List<SentMessage> sent = new CopyOnWriteArrayList<>();
    private final List<SentMessage> sendAttempts = new CopyOnWriteArrayList<>();
    private final List<MessageHandle> deleted = new CopyOnWriteArrayList<>();
    private final Map<String, ThreadRef> threads = new HashMap<>();
    private final Map<String, Long> autoThreadAt = new ConcurrentHashMap<>();
    private final AtomicInteger createCalls = new AtomicInteger();
    private final AtomicInteger threadsCreated = new AtomicInteger();

    private volatile Function<SentMessage, Throwable> sendFault = m -> null;
    private volatile Function<InboundEvent, Throwable> createFault = e -> null;
    private volatile Runnable beforeCreate = () -> {
    };
    private volatile boolean fetchFails;
    private volatile boolean fetchHidesThreads;

    public FakeDiscordPlatform() {
        this(() -> 0L);
    }

    public FakeDiscordPlatform(LongSupplier clock) {
        this.clock = clock;
    }

    // --- DiscordPlatform ---

    @Override
    public CompletableFuture<MessageHandle> sendMessage(String channelId, String content,
            List<Attachment> attachments) {
        List<Attachment> files = attachments != null ? List.copyOf(attachments) : List.of();
        SentMessage attempt = new SentMessage(channelId, content, files, null);
        sendAttempts.add(attempt);
        Throwable fault = sendFault.apply(attempt);
        if (fault != null) {
            return CompletableFuture.failedFuture(fault);
        }
        MessageHandle handle = new MessageHandle(channelId, "m" + ids.incrementAndGet());
        sent.add(new SentMessage(channelId, content, files, handle));
        return CompletableFuture.completedFuture(handle);
    }

    @Override
    public CompletableFuture<ThreadRef> createThread(InboundEvent event, String name) {
        createCalls.incrementAndGet();
        beforeCreate.run();
        Throwable fault = createFault.apply(event);
        if (fault != null) {
            return CompletableFuture.failedFuture(fault);
        }
        synchronized (this) {
            materializeAutoThread(event.eventId());
            if (threads.containsKey(event.eventId())) {
                return CompletableFuture.failedFuture(new ThreadCreateException(
                        ThreadCreateException.Reason.ALREADY_EXISTS,
                        "A thread has already been created for this message"));
            }
            ThreadRef thread = new ThreadRef("t" + ids.incrementAndGet(), name);
            threads.put(event.eventId(), thread);
            threadsCreated.incrementAndGet();
            return CompletableFuture.completedFuture(thread);
        }
    }

    @Override
    public CompletableFuture<Optional<ThreadRef>> fetchExistingThread(InboundEvent event) {
        if (fetchFails) {
            return CompletableFuture.failedFuture(new IllegalStateException("fetch failed"));
        }
        synchronized (this) {
            materializeAutoThread(event.eventId());
            if (fetchHidesThreads) {
                return CompletableFuture.completedFuture(Optional.empty());
            }
            return CompletableFuture.completedFuture(Optional.ofNullable(threads.get(event.eventId())));
        }
    }

    @Override
    public CompletableFuture<Void> deleteMessage(MessageHandle handle) {
        deleted.add(handle);
        return CompletableFuture.completedFuture(null);
    }

    // --- Scenario setup ---

    /** The platform auto-creates a thread for the event at the given virtual time. */
    public void scheduleAutoThread(String eventId, long atMillis) {
        autoThreadAt.put(eventId, atMillis);
    }

    public synchronized void putThread(String eventId, ThreadRef thread) {
        threads.putIfAbsent(eventId, thread);
    }

    public void setSendFault(Function<SentMessage, Throwable> fault) {
        this.sendFault = fault;
    }

    public void setCreateFault(Function<InboundEvent, Throwable> fault) {
        this.createFault = fault;
    }

    public void setBeforeCreate(Runnable hook) {
        this.beforeCreate = hook;
    }

    public void setFetchFails(boolean fetchFails) {
        this.fetchFails = fetchFails;
    }

    public void setFetchHidesThreads(boolean hides) {
        this.fetchHidesThreads = hides;
    }

    // --- Inspection ---

    public List<SentMessage> sent() {
        return sent;
    }

    public List<SentMessage> sendAttempts() {
        return sendAttempts;
    }

    public List<SentMessage> sentContaining(String text) {
        return sent.stream().filter(m -> m.content().contains(text)).toList();
    }

    public List<MessageHandle> deleted() {
        return deleted;
    }

    public int createCalls() {
        return createCalls.get();
    }

    public int threadsCreated() {
        return threadsCreated.get();
    }

    private void materializeAutoThread(String eventId) {
        Long at = autoThreadAt.get(eventId);
        if (at != null && clock.getAsLong() >= at && !threads.containsKey(eventId)) {
            threads.put(eventId, new ThreadRef("auto-" + eventId, "auto"));
        }
    }
}
