package org.driftlens.unit;

import java.util.List;
import org.driftlens.data.DatasetColumns;
import org.driftlens.data.InputData;

/**
 * Named bundle that expands into units, possibly through nested generators.
 */
public interface Preset {
    default String name() {
        return getClass().getSimpleName();
    }

    /**
     * Elements must be {@link CheckItem.UnitItem} or {@link CheckItem.GeneratorItem}; presets do not nest.
     */
    List<CheckItem> generate(InputData data, DatasetColumns columns);
}
