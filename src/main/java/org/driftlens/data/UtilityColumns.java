package org.driftlens.data;

import java.util.List;
import java.util.Optional;

/**
 * Role columns present in the current dataset.
 */
public record UtilityColumns(String target, List<String> prediction, String id, String datetime) {
    public UtilityColumns {
        prediction = prediction == null ? List.of() : List.copyOf(prediction);
    }

    public Optional<String> targetColumn() {
        return Optional.ofNullable(target);
    }

    public Optional<String> idColumn() {
        return Optional.ofNullable(id);
    }

    public Optional<String> datetimeColumn() {
        return Optional.ofNullable(datetime);
    }

    public boolean isUtility(final String column) {
        return column.equals(target) || column.equals(id) || column.equals(datetime) || prediction.contains(column);
    }
}
