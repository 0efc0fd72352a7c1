package org.driftlens.dashboard;

import java.util.List;
import org.bson.BsonDouble;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;

public enum StandardAggregation implements Aggregation {
    NONE {
        @Override
        public List<SeriesPoint> apply(final List<SeriesPoint> points) {
            return List.copyOf(points);
        }
    },
    LAST {
        @Override
        public List<SeriesPoint> apply(final List<SeriesPoint> points) {
            return points.isEmpty() ? List.of() : List.of(points.get(points.size() - 1));
        }
    },
    SUM {
        @Override
        public List<SeriesPoint> apply(final List<SeriesPoint> points) {
            return reduce(points, Reducer.SUM);
        }
    },
    MIN {
        @Override
        public List<SeriesPoint> apply(final List<SeriesPoint> points) {
            return reduce(points, Reducer.MIN);
        }
    },
    MAX {
        @Override
        public List<SeriesPoint> apply(final List<SeriesPoint> points) {
            return reduce(points, Reducer.MAX);
        }
    },
    MEAN {
        @Override
        public List<SeriesPoint> apply(final List<SeriesPoint> points) {
            final List<SeriesPoint> sum = reduce(points, Reducer.SUM);
            if (sum.isEmpty()) {
                return sum;
            }
            final SeriesPoint total = sum.get(0);
            final double mean = total.value().asDouble().getValue() / points.size();
            return List.of(new SeriesPoint(total.timestamp(), total.snapshotId(), new BsonDouble(mean)));
        }
    };

    private enum Reducer {
        SUM, MIN, MAX
    }

    /**
     * Folds every value into one point stamped with the last point's timestamp.
     */
    private static List<SeriesPoint> reduce(final List<SeriesPoint> points, final Reducer reducer) {
        if (points.isEmpty()) {
            return List.of();
        }
        double accumulated = switch (reducer) {
            case SUM -> 0.0;
            case MIN -> Double.POSITIVE_INFINITY;
            case MAX -> Double.NEGATIVE_INFINITY;
        };
        for (final SeriesPoint point : points) {
            final double value = numeric(point.value());
            accumulated = switch (reducer) {
                case SUM -> accumulated + value;
                case MIN -> Math.min(accumulated, value);
                case MAX -> Math.max(accumulated, value);
            };
        }
        final SeriesPoint last = points.get(points.size() - 1);
        return List.of(new SeriesPoint(last.timestamp(), last.snapshotId(), new BsonDouble(accumulated)));
    }

    private static double numeric(final BsonValue value) {
        if (value.isNumber()) {
            return value.asNumber().doubleValue();
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue() ? 1.0 : 0.0;
        }
        throw new ConfigurationException("numeric aggregation over non-numeric value " + value);
    }
}
