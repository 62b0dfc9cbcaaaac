package com.parley.channel.thread;

import com.parley.channel.discord.DiscordPlatform;
import com.parley.channel.discord.DiscordThreading;
import com.parley.channel.discord.DiscordTransportErrors;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.discord.DiscordTypes.ThreadRef;
import com.parley.channel.discord.ThreadCreateException;
import com.parley.common.infra.PollWait;
import com.parley.common.infra.Sleeper;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Finds or creates the thread a reply should go to.
 * <p>
 * Order of checks:
 * <ol>
 * <li>event posted inside a thread: that thread</li>
 * <li>thread already resolved for this event id: the cached thread</li>
 * <li>direct message: no thread</li>
 * <li>event with attachments: wait a bounded time for the platform's own
 * auto-created thread</li>
 * <li>otherwise, or when the wait found nothing: create one; if the platform
 * reports one already exists, fetch and use that one</li>
 * </ol>
 * An empty result means "reply in the original channel".
 * <p>
 * Blocks the calling worker thread; never holds the cache lock across a
 * platform call.
 */
@Slf4j
public class ThreadResolver {

    private final DiscordPlatform platform;
    private final ThreadResolutionCache cache;
    private final PollWait.Config autoThreadWait;
    private final String namePrefix;
    private final Sleeper sleeper;

    public ThreadResolver(DiscordPlatform platform, ThreadResolutionCache cache,
            PollWait.Config autoThreadWait, String namePrefix, Sleeper sleeper) {
        this.platform = platform;
        this.cache = cache;
        this.autoThreadWait = autoThreadWait;
        this.namePrefix = namePrefix;
        this.sleeper = sleeper != null ? sleeper : Sleeper.SYSTEM;
    }

    public Optional<ThreadRef> resolve(InboundEvent event) throws InterruptedException {
        if (event.alreadyInThread()) {
            return Optional.of(new ThreadRef(event.channelId(), null));
        }

        Optional<ThreadRef> cached = cache.resolve(event.eventId());
        if (cached.isPresent()) {
            log.debug("Thread for event {} already resolved: {}", event.eventId(), cached.get().id());
            return cached;
        }

        if (event.isDirectMessage()) {
            log.info("Event {} is outside a guild, replying in channel {}", event.eventId(), event.channelId());
            return Optional.empty();
        }

        if (event.hasAttachments()) {
            Optional<ThreadRef> autoThread = awaitPlatformThread(event);
            if (autoThread.isPresent()) {
                return autoThread;
            }
        }

        return createThread(event);
    }

    private Optional<ThreadRef> awaitPlatformThread(InboundEvent event) throws InterruptedException {
        PollWait.Result<ThreadRef> result = PollWait.poll(autoThreadWait,
                () -> platform.fetchExistingThread(event).join(), sleeper);
        if (result.found()) {
            ThreadRef winner = cache.register(event.eventId(), result.value().get());
            log.info("Using platform-created thread {} for event {} after {}ms",
                    winner.id(), event.eventId(), result.waitedMs());
            return Optional.of(winner);
        }
        if (result.error() != null) {
            log.warn("Polling for auto-created thread of event {} stopped: {}",
                    event.eventId(), DiscordTransportErrors.unwrap(result.error()).getMessage());
        } else {
            log.debug("No auto-created thread for event {} within {}ms", event.eventId(), result.waitedMs());
        }
        return Optional.empty();
    }

    private Optional<ThreadRef> createThread(InboundEvent event) {
        String name = DiscordThreading.buildThreadName(namePrefix, event.authorDisplayName(), event.authorId());
        try {
            ThreadRef created = platform.createThread(event, name).join();
            ThreadRef winner = cache.register(event.eventId(), created);
            log.info("Created thread {} ('{}') for event {}", winner.id(), name, event.eventId());
            return Optional.of(winner);
        } catch (RuntimeException e) {
            Throwable cause = DiscordTransportErrors.unwrap(e);
            if (cause instanceof ThreadCreateException tce
                    && tce.getReason() == ThreadCreateException.Reason.ALREADY_EXISTS) {
                return adoptExistingThread(event);
            }
            log.info("Cannot create thread for event {} ({}), replying in channel",
                    event.eventId(), cause.getMessage());
            return Optional.empty();
        }
    }

    private Optional<ThreadRef> adoptExistingThread(InboundEvent event) {
        try {
            Optional<ThreadRef> existing = platform.fetchExistingThread(event).join();
            if (existing.isEmpty()) {
                log.warn("Platform reported a thread for event {} but none could be fetched", event.eventId());
                return Optional.empty();
            }
            ThreadRef winner = cache.register(event.eventId(), existing.get());
            log.info("Thread for event {} already existed, reusing {}", event.eventId(), winner.id());
            return Optional.of(winner);
        } catch (RuntimeException e) {
            log.warn("Fetching existing thread for event {} failed: {}",
                    event.eventId(), DiscordTransportErrors.unwrap(e).getMessage());
            return Optional.empty();
        }
    }
}
