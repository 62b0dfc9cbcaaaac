package com.parley.common.logging;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubsystemLoggerTest {

    @Test
    void formatMessage_prefixesSubsystemAndAppendsMeta() {
        SubsystemLogger log = SubsystemLogger.create("dispatch");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("eventId", "E1");
        meta.put("state", "DELIVERED");

        assertEquals("[dispatch] done {eventId=E1, state=DELIVERED}", log.formatMessage("done", meta));
        assertEquals("[dispatch] done", log.formatMessage("done", null));
    }

    @Test
    void child_extendsSubsystemPathAndLoggerName() {
        SubsystemLogger child = SubsystemLogger.create("dispatch").child("thread");

        assertEquals("dispatch/thread", child.getSubsystem());
        assertEquals("parley.dispatch.thread", child.getSlf4jLogger().getName());
    }

    @Test
    void logLevel_normalizesAliases() {
        assertEquals(LogLevel.WARN, LogLevel.normalize("warning"));
        assertEquals(LogLevel.INFO, LogLevel.normalize("bogus"));
        assertEquals("OFF", LogLevel.normalize("silent").toSlf4jLevel());
    }
}
