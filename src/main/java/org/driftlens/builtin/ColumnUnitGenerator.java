package org.driftlens.builtin;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import org.driftlens.data.ColumnType;
import org.driftlens.data.DatasetColumns;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.Generator;

/**
 * One unit per feature column of a type, in column order.
 */
public final class ColumnUnitGenerator implements Generator {
    private final String name;
    private final ColumnType columnType;
    private final Function<String, ? extends ComputationalUnit> factory;

    public ColumnUnitGenerator(
            final String name, final ColumnType columnType, final Function<String, ? extends ComputationalUnit> factory) {
        this.name = Objects.requireNonNull(name, "name");
        this.columnType = Objects.requireNonNull(columnType, "columnType");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<ComputationalUnit> generate(final DatasetColumns columns) {
        final List<ComputationalUnit> units = new ArrayList<>();
        for (final String column : columns.features(columnType)) {
            units.add(factory.apply(column));
        }
        return units;
    }
}
