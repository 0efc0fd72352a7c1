package org.driftlens.unit;

import java.util.List;
import org.bson.BsonDocument;
import org.driftlens.data.GeneratedFeature;
import org.driftlens.data.InputData;

/**
 * One executable check. Produces exactly one {@link UnitResult} per run.
 */
public interface ComputationalUnit {
    /**
     * Stable type tag; together with {@link #args()} it forms the unit identity.
     */
    String type();

    UnitKind kind();

    /**
     * Construction parameters, enough for a {@link UnitFactory} to rebuild an equal unit.
     */
    BsonDocument args();

    default UnitIdentity identity() {
        return UnitIdentity.of(type(), args());
    }

    /**
     * Units whose results this unit reads. They are registered, and therefore computed, first.
     */
    default List<ComputationalUnit> dependencies() {
        return List.of();
    }

    default List<GeneratedFeature> requiredFeatures() {
        return List.of();
    }

    UnitResult compute(InputData data, ResultContext context);

    /**
     * Points {@link #result()} at the context that holds (or will hold) this unit's result. An instance registered
     * in several suites follows the most recent binding.
     */
    void bindContext(ResultContext context);

    /**
     * @throws IllegalStateException if the unit is unbound or not computed yet
     */
    UnitResult result();
}
