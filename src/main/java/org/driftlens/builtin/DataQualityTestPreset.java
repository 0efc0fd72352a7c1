package org.driftlens.builtin;

import java.util.List;
import org.driftlens.data.ColumnType;
import org.driftlens.data.DatasetColumns;
import org.driftlens.data.InputData;
import org.driftlens.unit.CheckItem;
import org.driftlens.unit.Preset;

/**
 * Missing-value threshold plus a median check per numerical column against the reference data.
 */
public final class DataQualityTestPreset implements Preset {
    static final double DEFAULT_MISSING_SHARE = 0.1;

    @Override
    public List<CheckItem> generate(final InputData data, final DatasetColumns columns) {
        return List.of(
                CheckItem.unit(new TestShareOfMissingValues(DEFAULT_MISSING_SHARE)),
                CheckItem.generator(new ColumnUnitGenerator(
                        "TestColumnQuantileGenerator", ColumnType.NUMERICAL,
                        column -> new TestColumnQuantile(column, 0.5))));
    }
}
