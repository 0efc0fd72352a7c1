package org.driftlens.builtin;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.driftlens.data.DataDefinition;
import org.driftlens.data.Dataset;
import org.driftlens.data.GeneratedFeature;

/**
 * Character length of each text value; missing values stay missing.
 */
public final class TextLengthFeature implements GeneratedFeature {
    private final String column;

    public TextLengthFeature(final String column) {
        this.column = Objects.requireNonNull(column, "column");
    }

    @Override
    public String name() {
        return column + "__text_length";
    }

    @Override
    public List<Object> generate(final Dataset dataset, final DataDefinition definition) {
        final List<Object> lengths = new ArrayList<>(dataset.rowCount());
        for (final Object value : dataset.column(column)) {
            lengths.add(ColumnStatistics.isMissing(value) ? null : String.valueOf(value).length());
        }
        return lengths;
    }
}
