package org.driftlens.unit;

import java.util.List;
import org.driftlens.data.DatasetColumns;

/**
 * Produces units from the dataset's column description, e.g. one check per numerical column.
 */
public interface Generator {
    default String name() {
        return getClass().getSimpleName();
    }

    List<? extends ComputationalUnit> generate(DatasetColumns columns);
}
