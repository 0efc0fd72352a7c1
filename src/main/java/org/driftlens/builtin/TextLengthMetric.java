package org.driftlens.builtin;

import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonString;
import org.driftlens.data.GeneratedFeature;
import org.driftlens.data.InputData;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.ResultContext;

/**
 * Mean and maximum text length of a column, read from a generated feature.
 */
public final class TextLengthMetric extends MetricUnit {
    private final String column;
    private final TextLengthFeature feature;

    public TextLengthMetric(final String column) {
        this.column = Objects.requireNonNull(column, "column");
        this.feature = new TextLengthFeature(column);
    }

    static TextLengthMetric fromArgs(final BsonDocument args) {
        return new TextLengthMetric(args.getString("column").getValue());
    }

    @Override
    public BsonDocument args() {
        return new BsonDocument("column", new BsonString(column));
    }

    @Override
    public List<GeneratedFeature> requiredFeatures() {
        return List.of(feature);
    }

    @Override
    protected BsonDocument calculate(final InputData data, final ResultContext context) {
        final BsonDocument result = new BsonDocument()
                .append("column", new BsonString(column))
                .append("current", describe(data.currentColumn(feature.name())));
        data.referenceColumn(feature.name()).ifPresent(values -> result.append("reference", describe(values)));
        return result;
    }

    private static BsonDocument describe(final List<Object> lengths) {
        final List<Double> sorted = ColumnStatistics.sortedNumbers(lengths);
        double sum = 0.0;
        for (final double length : sorted) {
            sum += length;
        }
        return new BsonDocument()
                .append("mean_length", new BsonDouble(sorted.isEmpty() ? 0.0 : sum / sorted.size()))
                .append("max_length", new BsonDouble(sorted.isEmpty() ? 0.0 : sorted.get(sorted.size() - 1)));
    }
}
