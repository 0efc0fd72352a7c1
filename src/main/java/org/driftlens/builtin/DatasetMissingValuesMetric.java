package org.driftlens.builtin;

import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.driftlens.data.Dataset;
import org.driftlens.data.InputData;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.ResultContext;

/**
 * Missing values (null or NaN) over every column of each dataset.
 */
public final class DatasetMissingValuesMetric extends MetricUnit {
    @Override
    public BsonDocument args() {
        return new BsonDocument();
    }

    @Override
    protected BsonDocument calculate(final InputData data, final ResultContext context) {
        final BsonDocument result = new BsonDocument("current", describe(data.current()));
        data.reference().ifPresent(reference -> result.append("reference", describe(reference)));
        return result;
    }

    private static BsonDocument describe(final Dataset dataset) {
        final BsonDocument byColumn = new BsonDocument();
        int missing = 0;
        for (final String column : dataset.columnNames()) {
            final int count = ColumnStatistics.countMissing(dataset.column(column));
            byColumn.append(column, new BsonInt32(count));
            missing += count;
        }
        final long cells = (long) dataset.rowCount() * dataset.columnNames().size();
        return new BsonDocument()
                .append("number_of_rows", new BsonInt32(dataset.rowCount()))
                .append("number_of_columns", new BsonInt32(dataset.columnNames().size()))
                .append("number_of_missing_values", new BsonInt32(missing))
                .append("share_of_missing_values", new BsonDouble(cells == 0 ? 0.0 : (double) missing / cells))
                .append("number_of_missing_values_by_column", byColumn);
    }
}
