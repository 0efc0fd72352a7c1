package org.driftlens.snapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.driftlens.error.CorruptSnapshotException;
import org.driftlens.unit.UnitResult;
import org.junit.jupiter.api.Test;

class SnapshotCodecTest {
    @Test
    void jsonFormKeepsEveryField() {
        Snapshot snapshot = new Snapshot(
            "snap-1",
            Instant.parse("2024-03-01T10:15:30Z"),
            SnapshotKind.TEST_SUITE,
            new BsonDocument("type", new BsonString("data_quality")),
            List.of("nightly", "batch"),
            BsonDocument.parse("{\"color_scheme\": \"dark\"}"),
            List.of(
                new SnapshotUnit("CountMetric", BsonDocument.parse("{\"column\": \"age\"}"), UnitResult.parse("{\"count\": 3}")),
                new SnapshotUnit("CountMetric", BsonDocument.parse("{\"column\": \"city\"}"), UnitResult.parse("{\"count\": 4}"))),
            List.of(1, 0, 1));

        Snapshot decoded = SnapshotCodec.fromJson(SnapshotCodec.toJson(snapshot));

        assertEquals("snap-1", decoded.id());
        assertEquals(snapshot.timestamp(), decoded.timestamp());
        assertEquals(SnapshotKind.TEST_SUITE, decoded.kind());
        assertEquals("data_quality", decoded.metadataValue("type").orElseThrow().asString().getValue());
        assertEquals(List.of("nightly", "batch"), decoded.tags());
        assertEquals("dark", decoded.options().getString("color_scheme").getValue());
        assertEquals(List.of(1, 0, 1), decoded.firstLevelIndices());
        assertEquals(snapshot.units().get(1).identity(), decoded.firstLevelUnits().get(0).identity());
        assertEquals(UnitResult.parse("{\"count\": 4}"), decoded.units().get(1).result());
    }

    @Test
    void truncatedJsonIsCorrupt() {
        CorruptSnapshotException error = assertThrows(CorruptSnapshotException.class,
            () -> SnapshotCodec.fromJson("{\"id\": \"snap-1\", \"units\": ["));

        assertTrue(error.getMessage().startsWith("corrupt snapshot: unparseable JSON"));
    }

    @Test
    void topLevelArrayIsCorrupt() {
        assertThrows(CorruptSnapshotException.class, () -> SnapshotCodec.fromJson("[1, 2]"));
    }

    @Test
    void everyMissingFieldIsReported() {
        CorruptSnapshotException error = assertThrows(CorruptSnapshotException.class, () -> SnapshotCodec.fromJson("{}"));

        assertEquals(List.of(
            "id is required",
            "timestamp is required",
            "metadata is required",
            "tags is required",
            "units is required",
            "first_level_indices is required"), error.problems());
        assertTrue(error.getMessage().startsWith("corrupt snapshot (6 issue(s))"));
    }

    @Test
    void kindDefaultsToReportAndLocalTimestampsAreUtc() {
        Snapshot snapshot = SnapshotCodec.fromJson("{"
            + "\"id\": \"legacy\","
            + "\"timestamp\": \"2024-03-01T10:15:30\","
            + "\"metadata\": {},"
            + "\"tags\": [],"
            + "\"units\": [],"
            + "\"first_level_indices\": []}");

        assertEquals(SnapshotKind.REPORT, snapshot.kind());
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), snapshot.timestamp());
        assertTrue(snapshot.options().isEmpty());
    }

    @Test
    void indexOutsideTheUnitListIsReported() {
        CorruptSnapshotException error = assertThrows(CorruptSnapshotException.class, () -> SnapshotCodec.fromJson("{"
            + "\"id\": \"snap-1\","
            + "\"timestamp\": \"2024-03-01T10:15:30Z\","
            + "\"metadata\": {},"
            + "\"tags\": [],"
            + "\"units\": [{\"type\": \"CountMetric\", \"args\": {}, \"result\": {\"count\": 1}}],"
            + "\"first_level_indices\": [0, 1]}"));

        assertEquals(List.of("first_level_indices[1] = 1 out of range [0, 1)"), error.problems());
    }

    @Test
    void malformedUnitsAndKindAreReportedTogether() {
        CorruptSnapshotException error = assertThrows(CorruptSnapshotException.class, () -> SnapshotCodec.fromJson("{"
            + "\"id\": \"snap-1\","
            + "\"timestamp\": \"yesterday\","
            + "\"kind\": \"dashboard\","
            + "\"metadata\": {},"
            + "\"tags\": [\"ok\", 3],"
            + "\"units\": [{\"type\": \"CountMetric\", \"args\": {}}, 7],"
            + "\"first_level_indices\": []}"));

        assertEquals(List.of(
            "timestamp is not an ISO-8601 date-time: yesterday",
            "unsupported snapshot kind: dashboard (expected: report|test_suite)",
            "tags[1] must be a string",
            "units[0].result is required",
            "units[1] must be an object"), error.problems());
    }

    @Test
    void constructorRejectsIndexOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> new Snapshot(
            "snap-1", Instant.EPOCH, SnapshotKind.REPORT, new BsonDocument(), List.of(), null, List.of(), List.of(0)));
    }

    @Test
    void blankUnitTypeIsReported() {
        CorruptSnapshotException error = assertThrows(CorruptSnapshotException.class, () -> SnapshotCodec.fromJson("{"
            + "\"id\": \"snap-1\","
            + "\"timestamp\": \"2024-03-01T10:15:30Z\","
            + "\"metadata\": {},"
            + "\"tags\": [],"
            + "\"units\": [{\"type\": \"\", \"args\": {}, \"result\": {}}, "
            + "{\"type\": \"  \", \"args\": {}, \"result\": {}}],"
            + "\"first_level_indices\": []}"));

        assertEquals(List.of(
            "units[0].type must not be blank",
            "units[1].type must not be blank"), error.problems());
    }
}
