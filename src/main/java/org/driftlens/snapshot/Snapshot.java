package org.driftlens.snapshot;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.driftlens.unit.BsonValues;

/**
 * Immutable capture of a whole report run: every unit of the graph with its result, and which of them were
 * requested directly.
 */
public final class Snapshot {
    private final String id;
    private final Instant timestamp;
    private final SnapshotKind kind;
    private final BsonDocument metadata;
    private final List<String> tags;
    private final BsonDocument options;
    private final List<SnapshotUnit> units;
    private final List<Integer> firstLevelIndices;

    public Snapshot(
            final String id,
            final Instant timestamp,
            final SnapshotKind kind,
            final BsonDocument metadata,
            final List<String> tags,
            final BsonDocument options,
            final List<SnapshotUnit> units,
            final List<Integer> firstLevelIndices) {
        this.id = Objects.requireNonNull(id, "id");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.metadata = Objects.requireNonNull(metadata, "metadata").clone();
        this.tags = List.copyOf(tags);
        this.options = options == null ? new BsonDocument() : options.clone();
        this.units = List.copyOf(units);
        this.firstLevelIndices = List.copyOf(firstLevelIndices);
        for (final Integer index : this.firstLevelIndices) {
            if (index < 0 || index >= this.units.size()) {
                throw new IllegalArgumentException(
                        "first level index " + index + " out of range [0, " + this.units.size() + ")");
            }
        }
    }

    public String id() {
        return id;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public SnapshotKind kind() {
        return kind;
    }

    public BsonDocument metadata() {
        return metadata.clone();
    }

    public Optional<BsonValue> metadataValue(final String key) {
        return Optional.ofNullable(metadata.get(key)).map(BsonValues::copy);
    }

    public List<String> tags() {
        return tags;
    }

    public BsonDocument options() {
        return options.clone();
    }

    public List<SnapshotUnit> units() {
        return units;
    }

    /**
     * May contain the same index more than once when a unit was requested repeatedly.
     */
    public List<Integer> firstLevelIndices() {
        return firstLevelIndices;
    }

    public List<SnapshotUnit> firstLevelUnits() {
        return firstLevelIndices.stream().map(units::get).toList();
    }
}
