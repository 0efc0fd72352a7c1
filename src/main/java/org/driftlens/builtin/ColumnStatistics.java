package org.driftlens.builtin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.bson.BsonArray;
import org.bson.BsonInt32;

/**
 * Small numeric helpers shared by the reference units.
 */
final class ColumnStatistics {
    static final int HISTOGRAM_BINS = 10;

    private ColumnStatistics() {
    }

    static boolean isMissing(final Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    static int countMissing(final List<Object> values) {
        int missing = 0;
        for (final Object value : values) {
            if (isMissing(value)) {
                missing++;
            }
        }
        return missing;
    }

    /**
     * Non-missing numeric values, ascending.
     */
    static List<Double> sortedNumbers(final List<Object> values) {
        final List<Double> numbers = new ArrayList<>(values.size());
        for (final Object value : values) {
            if (!isMissing(value) && value instanceof Number number) {
                numbers.add(number.doubleValue());
            }
        }
        Collections.sort(numbers);
        return numbers;
    }

    /**
     * Linear interpolation between the two closest ranks.
     */
    static double quantile(final List<Double> sorted, final double q) {
        if (sorted.isEmpty()) {
            throw new IllegalArgumentException("quantile of an empty column");
        }
        final double position = q * (sorted.size() - 1);
        final int lower = (int) Math.floor(position);
        final int upper = (int) Math.ceil(position);
        final double low = sorted.get(lower);
        return low + (sorted.get(upper) - low) * (position - lower);
    }

    static BsonArray histogram(final List<Double> sorted) {
        final int[] counts = new int[HISTOGRAM_BINS];
        if (!sorted.isEmpty()) {
            final double min = sorted.get(0);
            final double width = (sorted.get(sorted.size() - 1) - min) / HISTOGRAM_BINS;
            for (final double value : sorted) {
                final int bin = width == 0.0 ? 0 : (int) ((value - min) / width);
                counts[Math.min(bin, HISTOGRAM_BINS - 1)]++;
            }
        }
        final BsonArray histogram = new BsonArray(HISTOGRAM_BINS);
        for (final int count : counts) {
            histogram.add(new BsonInt32(count));
        }
        return histogram;
    }
}
