package org.driftlens.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Column roles and types shared read-only by every unit of a run.
 */
public final class DataDefinition {
    private final Map<String, ColumnDefinition> columns;
    private final ColumnDefinition target;
    private final PredictionColumns predictionColumns;
    private final ColumnDefinition id;
    private final ColumnDefinition datetime;
    private final boolean referencePresent;

    public DataDefinition(
            final Map<String, ColumnDefinition> columns,
            final ColumnDefinition target,
            final PredictionColumns predictionColumns,
            final ColumnDefinition id,
            final ColumnDefinition datetime,
            final boolean referencePresent) {
        this.columns = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(columns, "columns")));
        this.target = target;
        this.predictionColumns = predictionColumns;
        this.id = id;
        this.datetime = datetime;
        this.referencePresent = referencePresent;
    }

    public Map<String, ColumnDefinition> columns() {
        return columns;
    }

    public Optional<ColumnDefinition> column(final String name) {
        return Optional.ofNullable(columns.get(name));
    }

    public List<ColumnDefinition> columnsOfType(final ColumnType type) {
        final List<ColumnDefinition> matching = new ArrayList<>();
        for (final ColumnDefinition definition : columns.values()) {
            if (definition.type() == type) {
                matching.add(definition);
            }
        }
        return List.copyOf(matching);
    }

    public Optional<ColumnDefinition> target() {
        return Optional.ofNullable(target);
    }

    public Optional<PredictionColumns> predictionColumns() {
        return Optional.ofNullable(predictionColumns);
    }

    public Optional<ColumnDefinition> id() {
        return Optional.ofNullable(id);
    }

    public Optional<ColumnDefinition> datetime() {
        return Optional.ofNullable(datetime);
    }

    public boolean referencePresent() {
        return referencePresent;
    }
}
