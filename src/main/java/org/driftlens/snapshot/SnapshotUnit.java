package org.driftlens.snapshot;

import java.util.Objects;
import org.bson.BsonDocument;
import org.driftlens.unit.UnitIdentity;
import org.driftlens.unit.UnitResult;

/**
 * One stored unit: enough to rebuild it through a registry, plus its computed result.
 */
public record SnapshotUnit(String type, BsonDocument args, UnitResult result) {
    public SnapshotUnit {
        Objects.requireNonNull(type, "type");
        args = Objects.requireNonNull(args, "args").clone();
        Objects.requireNonNull(result, "result");
    }

    @Override
    public BsonDocument args() {
        return args.clone();
    }

    public UnitIdentity identity() {
        return UnitIdentity.of(type, args);
    }
}
