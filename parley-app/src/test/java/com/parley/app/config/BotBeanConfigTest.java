package com.parley.app.config;

import com.parley.channel.delivery.ResponseDelivery;
import com.parley.channel.discord.DiscordRestClient;
import com.parley.channel.discord.DiscordTypes.EventKind;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.dispatch.Collaborator;
import com.parley.channel.dispatch.CommandParser.CommandType;
import com.parley.channel.dispatch.CommandParser.ParsedCommand;
import com.parley.common.config.ConfigService;
import com.parley.common.config.ParleyConfig;
import com.parley.common.infra.DedupeCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class BotBeanConfigTest {

    @Test
    void unavailableCollaboratorFailsEveryRequest() {
        Collaborator collaborator = BotBeanConfig.unavailableCollaborator();
        InboundEvent event = InboundEvent.builder()
                .eventId("1").authorId("u").channelId("c").kind(EventKind.MENTION).content("hi").build();

        CompletableFuture<Collaborator.Reply> reply =
                collaborator.process(event, new ParsedCommand(CommandType.QUERY, "hi", null, false));

        ExecutionException e = assertThrows(ExecutionException.class, reply::get);
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals("no collaborator configured", e.getCause().getMessage());
    }

    @Test
    void outOfRangeBounds_areClampedInsteadOfFailingStartup(@TempDir Path dir) {
        ParleyConfig config = new ConfigService(dir.resolve("missing.json")).loadConfig();
        config.getThreads().setCacheSize(0);
        config.getThreads().getAutoThreadWait().setMaxDelayMs(0);
        config.getDelivery().setRetryAttempts(0);
        config.getDelivery().setChunkLimit(-5);
        BotBeanConfig beans = new BotBeanConfig();
        DiscordRestClient platform = new DiscordRestClient(config);

        assertDoesNotThrow(() -> beans.threadResolver(platform, config));
        ResponseDelivery delivery = assertDoesNotThrow(() -> beans.responseDelivery(platform, config));
        assertFalse(delivery.plan("x".repeat(5000)).isEmpty());

        DedupeCache cache = BotBeanConfig.dedupeCache("messages", 1);
        assertEquals(BotBeanConfig.MIN_CACHE_SIZE, cache.maxSize());
    }

    @Test
    void boundsInRange_areKept() {
        assertEquals(500, BotBeanConfig.atLeast("threads.cacheSize", 500, 2));
    }
}
