package org.driftlens.dashboard;

import java.util.List;

/**
 * Reduction applied to a timestamp-ordered series.
 */
public interface Aggregation {
    String name();

    /**
     * @param points ordered by timestamp, never null
     * @return the reduced series, possibly empty
     */
    List<SeriesPoint> apply(List<SeriesPoint> points);
}
