package com.parley.channel.discord;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class DiscordRestClientTest {

    private final DiscordRestClient client = new DiscordRestClient("token", "https://discord.test/api/v10/",
            Duration.ofSeconds(5), 1440, HttpClient.newHttpClient());

    @Test
    void messagePayload_allowsUserMentionsOnlyAndSuppressesEmbeds() {
        ObjectNode payload = client.messagePayload("hi <@1> @everyone");

        assertEquals("hi <@1> @everyone", payload.get("content").asText());
        assertEquals(1, payload.get("allowed_mentions").get("parse").size());
        assertEquals("users", payload.get("allowed_mentions").get("parse").get(0).asText());
        assertEquals(DiscordRestClient.SUPPRESS_EMBEDS_FLAG, payload.get("flags").asInt());
    }
}
