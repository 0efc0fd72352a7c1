package org.driftlens.obs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.bson.BsonDocument;
import org.junit.jupiter.api.Test;

class StructuredJsonLinesLoggerTest {
    private static final Clock FIXED_CLOCK = Clock.fixed(Instant.parse("2026-02-23T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void emitsCorrelationAndCustomFieldsAsJsonLines() {
        StringWriter output = new StringWriter();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, LogLevel.DEBUG, true);

        LogContext context = LogContext.builder("suite").runId("run-1").snapshotId("snap-7").build();
        logger.info("suite.run.start", context, Map.of("units", 3, "features", List.of("a", "b")));
        logger.warn("loader.timestamp.duplicate", LogContext.of("loader"), Map.of());
        logger.close();

        String[] lines = output.toString().trim().split("\\R");
        assertEquals(2, lines.length);

        BsonDocument first = BsonDocument.parse(lines[0]);
        assertEquals("2026-02-23T10:00:00Z", first.getString("timestamp").getValue());
        assertEquals("INFO", first.getString("level").getValue());
        assertEquals("suite.run.start", first.getString("message").getValue());
        assertEquals("suite", first.getString("component").getValue());
        assertEquals("run-1", first.getString("runId").getValue());
        assertEquals("snap-7", first.getString("snapshotId").getValue());
        assertFalse(first.containsKey("projectId"));
        assertEquals(3, first.getNumber("units").intValue());
        assertEquals(2, first.getArray("features").size());

        BsonDocument second = BsonDocument.parse(lines[1]);
        assertEquals("WARN", second.getString("level").getValue());
        assertEquals("loader", second.getString("component").getValue());
        assertFalse(second.containsKey("runId"));
    }

    @Test
    void dropsEventsBelowTheMinimumLevel() {
        StringWriter output = new StringWriter();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, LogLevel.WARN, true);

        logger.debug("suite.unit.computed", LogContext.of("suite"), Map.of());
        logger.info("suite.run.complete", LogContext.of("suite"));
        logger.error("suite.unit.failed", LogContext.of("suite"), Map.of("unit", "A{}"));

        String[] lines = output.toString().trim().split("\\R");
        assertEquals(1, lines.length);
        assertEquals("ERROR", BsonDocument.parse(lines[0]).getString("level").getValue());
    }

    @Test
    void contextFieldsWinOverCustomFieldsOfTheSameName() {
        StringWriter output = new StringWriter();
        StructuredJsonLinesLogger logger = new StructuredJsonLinesLogger(output, FIXED_CLOCK, LogLevel.INFO, true);

        logger.info("project.saved", LogContext.builder("project").projectId("p-1").build(),
            Map.of("projectId", "spoofed", "component", "other"));

        BsonDocument event = BsonDocument.parse(output.toString().trim());
        assertEquals("p-1", event.getString("projectId").getValue());
        assertEquals("project", event.getString("component").getValue());
    }

    @Test
    void rejectsLoggingAfterClose() {
        StructuredJsonLinesLogger logger =
            new StructuredJsonLinesLogger(new StringWriter(), FIXED_CLOCK, LogLevel.INFO, true);
        logger.close();

        assertThrows(IllegalStateException.class, () -> logger.info("late", LogContext.of("suite")));
    }

    @Test
    void parsesLevelNames() {
        assertEquals(LogLevel.WARN, LogLevel.parse("warning"));
        assertEquals(LogLevel.DEBUG, LogLevel.parse(" debug "));
        assertEquals(LogLevel.INFO, LogLevel.parse(null));
        assertThrows(IllegalArgumentException.class, () -> LogLevel.parse("verbose"));
    }
}
