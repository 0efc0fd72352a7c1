package org.driftlens.store;

import java.time.Instant;
import java.util.List;
import org.bson.BsonDocument;
import org.driftlens.builtin.ColumnQuantileMetric;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.snapshot.SnapshotUnit;
import org.driftlens.unit.UnitResult;

final class StoreFixtures {
    private StoreFixtures() {
    }

    static Snapshot medianSnapshot(String id, String timestamp, double median) {
        ColumnQuantileMetric metric = new ColumnQuantileMetric("age", 0.5);
        SnapshotUnit unit = new SnapshotUnit(metric.type(), metric.args(),
            UnitResult.parse("{\"column\": \"age\", \"quantile\": 0.5, \"current\": {\"value\": " + median + "}}"));
        return new Snapshot(id, Instant.parse(timestamp), SnapshotKind.REPORT,
            BsonDocument.parse("{\"type\": \"data_quality\"}"), List.of(), new BsonDocument(), List.of(unit), List.of(0));
    }

    static Snapshot emptyTestSuite(String id, String timestamp) {
        return new Snapshot(id, Instant.parse(timestamp), SnapshotKind.TEST_SUITE,
            new BsonDocument(), List.of(), new BsonDocument(), List.of(), List.of());
    }
}
