package org.driftlens.data;

import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.driftlens.error.ConfigurationException;

/**
 * Derives the normalized column description and data definition from a dataset and its mapping.
 */
public final class ColumnInference {
    private ColumnInference() {
    }

    public static DatasetColumns processColumns(final Dataset current, final ColumnMapping mapping) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(mapping, "mapping");
        final UtilityColumns utility = utilityColumns(current, mapping);

        final List<String> numerical = explicitOrInferred(current, mapping.numericalFeatures(), utility, ColumnType.NUMERICAL, mapping);
        final List<String> categorical = explicitOrInferred(current, mapping.categoricalFeatures(), utility, ColumnType.CATEGORICAL, mapping);
        final List<String> datetime = explicitOrInferred(current, mapping.datetimeFeatures(), utility, ColumnType.DATETIME, mapping);
        final List<String> text = mapping.textFeatures().map(columns -> requirePresent(current, columns, "text")).orElse(List.of());
        return new DatasetColumns(utility, numerical, categorical, datetime, text);
    }

    public static DataDefinition createDataDefinition(
            final Dataset reference, final Dataset current, final ColumnMapping mapping) {
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(mapping, "mapping");
        final DatasetColumns columns = processColumns(current, mapping);
        final Map<String, ColumnDefinition> definitions = new LinkedHashMap<>();
        for (final ColumnType type : ColumnType.values()) {
            for (final String name : columns.features(type)) {
                definitions.put(name, new ColumnDefinition(name, type));
            }
        }

        final UtilityColumns utility = columns.utilityColumns();
        final ColumnDefinition target = utility.targetColumn()
                .map(name -> new ColumnDefinition(name, inferType(current.column(name))))
                .orElse(null);
        final ColumnDefinition id = utility.idColumn()
                .map(name -> new ColumnDefinition(name, ColumnType.CATEGORICAL))
                .orElse(null);
        final ColumnDefinition datetime = utility.datetimeColumn()
                .map(name -> new ColumnDefinition(name, ColumnType.DATETIME))
                .orElse(null);
        return new DataDefinition(definitions, target, predictionColumns(utility), id, datetime, reference != null);
    }

    /**
     * Numbers are numerical, temporal values are datetimes, everything else is categorical.
     */
    public static ColumnType inferType(final List<Object> values) {
        boolean sawValue = false;
        boolean allNumbers = true;
        boolean allTemporal = true;
        for (final Object value : values) {
            if (value == null) {
                continue;
            }
            sawValue = true;
            if (!(value instanceof Number)) {
                allNumbers = false;
            }
            if (!(value instanceof Temporal) && !(value instanceof Date)) {
                allTemporal = false;
            }
        }
        if (!sawValue) {
            return ColumnType.CATEGORICAL;
        }
        if (allNumbers) {
            return ColumnType.NUMERICAL;
        }
        if (allTemporal) {
            return ColumnType.DATETIME;
        }
        return ColumnType.CATEGORICAL;
    }

    private static UtilityColumns utilityColumns(final Dataset current, final ColumnMapping mapping) {
        final String target = presentOrNull(current, mapping.target());
        final List<String> prediction = new ArrayList<>();
        for (final String column : mapping.prediction()) {
            if (current.hasColumn(column)) {
                prediction.add(column);
            }
        }
        final String id = requireIfMapped(current, mapping.id(), "id");
        final String datetime = requireIfMapped(current, mapping.datetime(), "datetime");
        return new UtilityColumns(target, prediction, id, datetime);
    }

    private static PredictionColumns predictionColumns(final UtilityColumns utility) {
        final List<String> prediction = utility.prediction();
        if (prediction.isEmpty()) {
            return null;
        }
        if (prediction.size() == 1) {
            return new PredictionColumns(prediction.get(0), null);
        }
        return new PredictionColumns(null, prediction);
    }

    private static List<String> explicitOrInferred(
            final Dataset current,
            final Optional<List<String>> explicit,
            final UtilityColumns utility,
            final ColumnType type,
            final ColumnMapping mapping) {
        if (explicit.isPresent()) {
            return requirePresent(current, explicit.get(), type.name().toLowerCase());
        }
        final List<String> declaredElsewhere = new ArrayList<>();
        mapping.numericalFeatures().ifPresent(declaredElsewhere::addAll);
        mapping.categoricalFeatures().ifPresent(declaredElsewhere::addAll);
        mapping.datetimeFeatures().ifPresent(declaredElsewhere::addAll);
        mapping.textFeatures().ifPresent(declaredElsewhere::addAll);

        final List<String> inferred = new ArrayList<>();
        for (final String column : current.columnNames()) {
            if (utility.isUtility(column) || declaredElsewhere.contains(column)) {
                continue;
            }
            if (inferType(current.column(column)) == type) {
                inferred.add(column);
            }
        }
        return inferred;
    }

    private static List<String> requirePresent(final Dataset current, final List<String> columns, final String role) {
        for (final String column : columns) {
            if (!current.hasColumn(column)) {
                throw new ConfigurationException(role + " feature column '" + column + "' is not present in current data");
            }
        }
        return List.copyOf(columns);
    }

    private static String presentOrNull(final Dataset current, final Optional<String> column) {
        return column.filter(current::hasColumn).orElse(null);
    }

    private static String requireIfMapped(final Dataset current, final Optional<String> column, final String role) {
        if (column.isEmpty()) {
            return null;
        }
        if (!current.hasColumn(column.get())) {
            throw new ConfigurationException(role + " column '" + column.get() + "' is not present in current data");
        }
        return column.get();
    }
}
