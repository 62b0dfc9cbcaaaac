package com.parley.app.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.parley.channel.discord.DiscordTypes.InboundEvent;
import com.parley.channel.dispatch.Collaborator;
import com.parley.channel.dispatch.ExchangeStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only JSONL exchange log, one JSON object per line:
 * {@code {"ts":"...","eventId":"...","authorId":"...","channelId":"...",
 * "destinationId":"...","kind":"MENTION","query":"...","response":"...","visualizations":0}}
 */
@Slf4j
public class JsonlExchangeStore implements ExchangeStore {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonlExchangeStore(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public void recordExchange(InboundEvent event, String query, String destinationId,
            Collaborator.Reply reply) throws IOException {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("ts", Instant.now().toString());
        entry.put("eventId", event.eventId());
        entry.put("authorId", event.authorId());
        entry.put("channelId", event.channelId());
        if (event.guildId() != null)
            entry.put("guildId", event.guildId());
        entry.put("destinationId", destinationId);
        entry.put("kind", event.kind() != null ? event.kind().name() : null);
        entry.put("query", query);
        entry.put("response", reply.text());
        entry.put("visualizations", reply.visualizations().size());

        String line = mapper.writeValueAsString(entry) + "\n";
        synchronized (this) {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        }
        log.debug("Recorded exchange for event {} in {}", event.eventId(), file);
    }

    public Path getFile() {
        return file;
    }
}
