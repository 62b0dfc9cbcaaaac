package com.parley.app.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.channel.discord.DiscordTypes.Attachment;
import com.parley.channel.discord.DiscordTypes.EventKind;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.dispatch.Collaborator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class JsonlExchangeStoreTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private static InboundEvent event(String id) {
        return InboundEvent.builder()
                .eventId(id)
                .authorId("author-1")
                .authorDisplayName("Ada")
                .channelId("chan-1")
                .guildId("guild-1")
                .kind(EventKind.MENTION)
                .content("<@bot> what happened today?")
                .build();
    }

    @Test
    void appendsOneLinePerExchange() throws Exception {
        Path file = tempDir.resolve("nested/dir/exchanges.jsonl");
        JsonlExchangeStore store = new JsonlExchangeStore(file, mapper);

        store.recordExchange(event("e1"), "what happened today?", "thread-1",
                new Collaborator.Reply("Lots.", List.of(new Attachment("chart.png", new byte[] { 1 }, "image/png"))));
        store.recordExchange(event("e2"), "and yesterday?", "chan-1", Collaborator.Reply.text("Less."));

        List<String> lines = Files.readAllLines(file);
        assertEquals(2, lines.size());

        JsonNode first = mapper.readTree(lines.get(0));
        assertEquals("e1", first.get("eventId").asText());
        assertEquals("author-1", first.get("authorId").asText());
        assertEquals("chan-1", first.get("channelId").asText());
        assertEquals("guild-1", first.get("guildId").asText());
        assertEquals("thread-1", first.get("destinationId").asText());
        assertEquals("MENTION", first.get("kind").asText());
        assertEquals("what happened today?", first.get("query").asText());
        assertEquals("Lots.", first.get("response").asText());
        assertEquals(1, first.get("visualizations").asInt());
        assertTrue(first.has("ts"));

        JsonNode second = mapper.readTree(lines.get(1));
        assertEquals("chan-1", second.get("destinationId").asText());
        assertEquals(0, second.get("visualizations").asInt());
    }

    @Test
    void omitsGuildForDirectMessages() throws Exception {
        Path file = tempDir.resolve("exchanges.jsonl");
        JsonlExchangeStore store = new JsonlExchangeStore(file, mapper);

        store.recordExchange(event("dm").toBuilder().guildId(null).build(), "hi", "chan-1",
                Collaborator.Reply.text("hello"));

        JsonNode node = mapper.readTree(Files.readAllLines(file).get(0));
        assertFalse(node.has("guildId"));
    }

    @Test
    void concurrentWritersProduceWholeLines() throws Exception {
        Path file = tempDir.resolve("exchanges.jsonl");
        JsonlExchangeStore store = new JsonlExchangeStore(file, mapper);
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(writers);
        try {
            for (int i = 0; i < writers; i++) {
                String id = "e" + i;
                pool.execute(() -> {
                    try {
                        store.recordExchange(event(id), "q", "chan-1", Collaborator.Reply.text("x".repeat(500)));
                    } catch (Exception e) {
                        fail(e);
                    } finally {
                        done.countDown();
                    }
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        List<String> lines = Files.readAllLines(file);
        assertEquals(writers, lines.size());
        for (String line : lines) {
            assertEquals(500, mapper.readTree(line).get("response").asText().length());
        }
    }
}
