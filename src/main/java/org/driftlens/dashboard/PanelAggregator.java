package org.driftlens.dashboard;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.snapshot.SnapshotUnit;

/**
 * Extracts one panel series from a set of snapshots.
 */
public final class PanelAggregator {
    /**
     * Reads {@code value.fieldPath()} from every unit of every matching snapshot whose type and arguments fit the
     * value's template, orders the points by timestamp and applies the value's aggregation.
     *
     * <p>The whole unit graph of a snapshot is searched, dependencies included. A snapshot without a fitting unit
     * contributes nothing.
     *
     * @throws org.driftlens.error.FieldNotFoundException if a fitting unit's result lacks the field
     */
    public PanelSeries aggregate(final List<Snapshot> snapshots, final ReportFilter filter, final PanelValue value) {
        Objects.requireNonNull(snapshots, "snapshots");
        Objects.requireNonNull(filter, "filter");
        Objects.requireNonNull(value, "value");
        final List<SeriesPoint> points = new ArrayList<>();
        for (final Snapshot snapshot : snapshots) {
            if (!filter.matches(snapshot)) {
                continue;
            }
            for (final SnapshotUnit unit : snapshot.units()) {
                if (value.matches(unit)) {
                    points.add(new SeriesPoint(snapshot.timestamp(), snapshot.id(), unit.result().field(value.fieldPath())));
                }
            }
        }
        points.sort(Comparator.comparing(SeriesPoint::timestamp));
        return new PanelSeries(value, value.aggregation().apply(points));
    }
}
