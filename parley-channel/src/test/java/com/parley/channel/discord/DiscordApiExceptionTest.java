package com.parley.channel.discord;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DiscordApiExceptionTest {

    @Nested
    class FromResponse {
        @Test
        void jsonBody_extractsCodeMessageAndRetryAfter() {
            var err = DiscordApiException.fromResponse("send message", 429,
                    "{\"message\": \"You are being rate limited.\", \"retry_after\": 1.5, \"code\": 0}");

            assertEquals(429, err.getStatus());
            assertEquals(0, err.getCode());
            assertEquals(1.5, err.getRetryAfterSeconds());
            assertEquals(1500, err.getRetryAfterMs());
            assertTrue(err.isRateLimited());
            assertTrue(err.getMessage().contains("You are being rate limited."));
        }

        @Test
        void plainBody_isKeptAsDetail() {
            var err = DiscordApiException.fromResponse("send message", 502, "Bad Gateway");

            assertNull(err.getCode());
            assertEquals(-1, err.getRetryAfterMs());
            assertFalse(err.isRateLimited());
            assertEquals("send message failed: HTTP 502 - Bad Gateway", err.getMessage());
        }

        @Test
        void status413_isPayloadTooLarge() {
            assertTrue(DiscordApiException.fromResponse("send message", 413, "").isPayloadTooLarge());
        }
    }

    @Nested
    class ThreadCreateClassification {
        @Test
        void alreadyCreatedCode_mapsToAlreadyExists() {
            var api = DiscordApiException.fromResponse("create thread", 400,
                    "{\"message\": \"A thread has already been created for this message\", \"code\": 160004}");
            assertEquals(ThreadCreateException.Reason.ALREADY_EXISTS, ThreadCreateException.from(api).getReason());
        }

        @Test
        void missingPermissions_mapsToForbidden() {
            var api = DiscordApiException.fromResponse("create thread", 403,
                    "{\"message\": \"Missing Permissions\", \"code\": 50013}");
            var err = ThreadCreateException.from(api);
            assertEquals(ThreadCreateException.Reason.FORBIDDEN, err.getReason());
            assertSame(api, err.getCause());
        }

        @Test
        void wrongChannelType_mapsToUnsupportedChannel() {
            var api = DiscordApiException.fromResponse("create thread", 400,
                    "{\"message\": \"Cannot execute action on this channel type\", \"code\": 50024}");
            assertEquals(ThreadCreateException.Reason.UNSUPPORTED_CHANNEL,
                    ThreadCreateException.from(api).getReason());
        }

        @Test
        void anythingElse_mapsToOther() {
            var api = DiscordApiException.fromResponse("create thread", 500, "oops");
            assertEquals(ThreadCreateException.Reason.OTHER, ThreadCreateException.from(api).getReason());
        }
    }
}
