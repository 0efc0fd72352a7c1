package org.driftlens.data;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Normalized column description of the current dataset, computed once per run.
 */
public final class DatasetColumns {
    private final UtilityColumns utilityColumns;
    private final List<String> numericalFeatures;
    private final List<String> categoricalFeatures;
    private final List<String> datetimeFeatures;
    private final List<String> textFeatures;

    public DatasetColumns(
            final UtilityColumns utilityColumns,
            final List<String> numericalFeatures,
            final List<String> categoricalFeatures,
            final List<String> datetimeFeatures,
            final List<String> textFeatures) {
        this.utilityColumns = Objects.requireNonNull(utilityColumns, "utilityColumns");
        this.numericalFeatures = List.copyOf(numericalFeatures);
        this.categoricalFeatures = List.copyOf(categoricalFeatures);
        this.datetimeFeatures = List.copyOf(datetimeFeatures);
        this.textFeatures = List.copyOf(textFeatures);
    }

    public UtilityColumns utilityColumns() {
        return utilityColumns;
    }

    public List<String> numericalFeatures() {
        return numericalFeatures;
    }

    public List<String> categoricalFeatures() {
        return categoricalFeatures;
    }

    public List<String> datetimeFeatures() {
        return datetimeFeatures;
    }

    public List<String> textFeatures() {
        return textFeatures;
    }

    public List<String> features(final ColumnType type) {
        return switch (Objects.requireNonNull(type, "type")) {
            case NUMERICAL -> numericalFeatures;
            case CATEGORICAL -> categoricalFeatures;
            case DATETIME -> datetimeFeatures;
            case TEXT -> textFeatures;
        };
    }

    public List<String> allFeatures() {
        final List<String> all = new ArrayList<>();
        all.addAll(numericalFeatures);
        all.addAll(categoricalFeatures);
        all.addAll(datetimeFeatures);
        all.addAll(textFeatures);
        return List.copyOf(all);
    }
}
