package org.driftlens.dashboard;

import java.time.Instant;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * One extracted value. Aggregated points carry the snapshot id of the last point they summarize.
 */
public record SeriesPoint(Instant timestamp, String snapshotId, BsonValue value) {
    public SeriesPoint {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(snapshotId, "snapshotId");
        Objects.requireNonNull(value, "value");
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
                .append("timestamp", new BsonString(timestamp.toString()))
                .append("snapshot_id", new BsonString(snapshotId))
                .append("value", value);
    }
}
