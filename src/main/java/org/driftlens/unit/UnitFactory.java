package org.driftlens.unit;

import org.bson.BsonDocument;

/**
 * Rebuilds a unit from the arguments stored in a snapshot.
 */
@FunctionalInterface
public interface UnitFactory {
    ComputationalUnit create(BsonDocument args);
}
