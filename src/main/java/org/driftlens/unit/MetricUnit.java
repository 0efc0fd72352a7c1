package org.driftlens.unit;

/**
 * A unit that measures a property of the data.
 */
public abstract class MetricUnit extends AbstractUnit {
    @Override
    public final UnitKind kind() {
        return UnitKind.METRIC;
    }
}
