package org.driftlens.builtin;

import java.util.List;
import org.driftlens.data.ColumnType;
import org.driftlens.data.DatasetColumns;
import org.driftlens.data.InputData;
import org.driftlens.unit.CheckItem;
import org.driftlens.unit.Preset;

/**
 * Missing values for the whole dataset, the median of every numerical column and text lengths of every text column.
 */
public final class DataQualityPreset implements Preset {
    @Override
    public List<CheckItem> generate(final InputData data, final DatasetColumns columns) {
        return List.of(
                CheckItem.unit(new DatasetMissingValuesMetric()),
                CheckItem.generator(new ColumnUnitGenerator(
                        "ColumnQuantileMetricGenerator", ColumnType.NUMERICAL,
                        column -> new ColumnQuantileMetric(column, 0.5))),
                CheckItem.generator(new ColumnUnitGenerator(
                        "TextLengthMetricGenerator", ColumnType.TEXT, TextLengthMetric::new)));
    }
}
