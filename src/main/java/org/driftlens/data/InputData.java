package org.driftlens.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a unit sees during computation. Shared read-only by all units of a run.
 */
public final class InputData {
    private final Dataset reference;
    private final Dataset current;
    private final ColumnMapping columnMapping;
    private final DataDefinition dataDefinition;
    private final DatasetColumns columns;
    private final Map<String, List<Object>> currentAdditional;
    private final Map<String, List<Object>> referenceAdditional;

    public InputData(
            final Dataset reference,
            final Dataset current,
            final ColumnMapping columnMapping,
            final DataDefinition dataDefinition,
            final DatasetColumns columns,
            final Map<String, List<Object>> currentAdditional,
            final Map<String, List<Object>> referenceAdditional) {
        this.reference = reference;
        this.current = Objects.requireNonNull(current, "current");
        this.columnMapping = Objects.requireNonNull(columnMapping, "columnMapping");
        this.dataDefinition = Objects.requireNonNull(dataDefinition, "dataDefinition");
        this.columns = Objects.requireNonNull(columns, "columns");
        this.currentAdditional = copy(currentAdditional);
        this.referenceAdditional = copy(referenceAdditional);
    }

    public static InputData of(
            final Dataset reference,
            final Dataset current,
            final ColumnMapping columnMapping,
            final DataDefinition dataDefinition,
            final DatasetColumns columns) {
        return new InputData(reference, current, columnMapping, dataDefinition, columns, Map.of(), Map.of());
    }

    public InputData withAdditionalFeatures(
            final Map<String, List<Object>> currentFeatures, final Map<String, List<Object>> referenceFeatures) {
        return new InputData(reference, current, columnMapping, dataDefinition, columns, currentFeatures, referenceFeatures);
    }

    public Optional<Dataset> reference() {
        return Optional.ofNullable(reference);
    }

    public Dataset current() {
        return current;
    }

    public ColumnMapping columnMapping() {
        return columnMapping;
    }

    public DataDefinition dataDefinition() {
        return dataDefinition;
    }

    public DatasetColumns columns() {
        return columns;
    }

    /**
     * Column of the current dataset, falling back to a generated feature of the same name.
     */
    public List<Object> currentColumn(final String name) {
        return lookup(current, currentAdditional, name, "current");
    }

    public Optional<List<Object>> referenceColumn(final String name) {
        if (reference == null) {
            return Optional.empty();
        }
        return Optional.of(lookup(reference, referenceAdditional, name, "reference"));
    }

    public Map<String, List<Object>> currentAdditionalFeatures() {
        return currentAdditional;
    }

    public Map<String, List<Object>> referenceAdditionalFeatures() {
        return referenceAdditional;
    }

    private static List<Object> lookup(
            final Dataset dataset, final Map<String, List<Object>> additional, final String name, final String side) {
        if (dataset.hasColumn(name)) {
            return dataset.column(name);
        }
        final List<Object> generated = additional.get(name);
        if (generated == null) {
            throw new IllegalArgumentException("column '" + name + "' is not present in " + side + " data");
        }
        return generated;
    }

    private static Map<String, List<Object>> copy(final Map<String, List<Object>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
