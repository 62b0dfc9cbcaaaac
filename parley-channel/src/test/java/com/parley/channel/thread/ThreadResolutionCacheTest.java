package com.parley.channel.thread;

import com.parley.channel.discord.DiscordTypes.ThreadRef;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ThreadResolutionCacheTest {

    @Test
    void register_firstWriterWins() {
        var cache = new ThreadResolutionCache(10);
        ThreadRef first = new ThreadRef("t1", "a");

        assertSame(first, cache.register("E1", first));
        assertSame(first, cache.register("E1", new ThreadRef("t2", "b")));
        assertEquals("t1", cache.resolve("E1").orElseThrow().id());
    }

    @Test
    void resolve_unknownEvent_isEmpty() {
        assertTrue(new ThreadResolutionCache(10).resolve("nope").isEmpty());
    }

    @Test
    void overflow_keepsNewestHalf() {
        var cache = new ThreadResolutionCache(500);
        for (int i = 0; i <= 500; i++) {
            cache.register("E" + i, new ThreadRef("t" + i, null));
        }
        assertTrue(cache.size() <= 500);
        assertTrue(cache.resolve("E0").isEmpty());
        assertEquals("t500", cache.resolve("E500").orElseThrow().id());
        assertEquals("t250", cache.resolve("E250").orElseThrow().id());
    }
}
