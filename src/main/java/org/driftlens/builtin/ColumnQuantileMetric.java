package org.driftlens.builtin;

import java.util.List;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonString;
import org.driftlens.data.InputData;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.ResultContext;

/**
 * Quantile of one numeric column, with a histogram of the current values.
 */
public final class ColumnQuantileMetric extends MetricUnit {
    private final String column;
    private final double quantile;

    public ColumnQuantileMetric(final String column, final double quantile) {
        this.column = Objects.requireNonNull(column, "column");
        if (!(quantile >= 0.0 && quantile <= 1.0)) {
            throw new IllegalArgumentException("quantile must be between 0 and 1: " + quantile);
        }
        this.quantile = quantile;
    }

    static ColumnQuantileMetric fromArgs(final BsonDocument args) {
        return new ColumnQuantileMetric(
                args.getString("column").getValue(),
                args.getNumber("quantile").doubleValue());
    }

    public String column() {
        return column;
    }

    public double quantile() {
        return quantile;
    }

    @Override
    public BsonDocument args() {
        return new BsonDocument()
                .append("column", new BsonString(column))
                .append("quantile", new BsonDouble(quantile));
    }

    @Override
    protected BsonDocument calculate(final InputData data, final ResultContext context) {
        final List<Double> current = ColumnStatistics.sortedNumbers(data.currentColumn(column));
        final BsonDocument result = new BsonDocument()
                .append("column", new BsonString(column))
                .append("quantile", new BsonDouble(quantile))
                .append("current", new BsonDocument()
                        .append("value", new BsonDouble(ColumnStatistics.quantile(current, quantile)))
                        .append("histogram", ColumnStatistics.histogram(current)));
        data.referenceColumn(column).ifPresent(values -> result.append("reference", new BsonDocument(
                "value", new BsonDouble(ColumnStatistics.quantile(ColumnStatistics.sortedNumbers(values), quantile)))));
        return result;
    }
}
