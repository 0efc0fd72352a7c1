package org.driftlens.dashboard;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;
import org.driftlens.snapshot.SnapshotUnit;
import org.driftlens.unit.BsonValues;
import org.driftlens.unit.FieldPath;

/**
 * Selects units by type and argument template and reads one result field from each.
 *
 * <p>Template keys may be dotted paths into the unit arguments, so {@code {"column.name": "age"}} matches any unit
 * whose {@code column} argument has {@code name} equal to {@code age}. An empty template matches every unit of the
 * type.
 */
public record PanelValue(
        String unitType, BsonDocument unitArgs, FieldPath fieldPath, String legend, Aggregation aggregation) {
    public PanelValue {
        Objects.requireNonNull(unitType, "unitType");
        unitArgs = unitArgs == null ? new BsonDocument() : unitArgs.clone();
        Objects.requireNonNull(fieldPath, "fieldPath");
        legend = legend == null ? fieldPath.path() : legend;
        aggregation = aggregation == null ? StandardAggregation.NONE : aggregation;
    }

    public static PanelValue of(final String unitType, final String fieldPath, final String legend) {
        return new PanelValue(unitType, new BsonDocument(), FieldPath.parse(fieldPath), legend, StandardAggregation.NONE);
    }

    public static PanelValue of(
            final String unitType, final Map<String, ?> unitArgs, final String fieldPath, final String legend) {
        return new PanelValue(
                unitType, BsonValues.toDocument(unitArgs), FieldPath.parse(fieldPath), legend, StandardAggregation.NONE);
    }

    public PanelValue withAggregation(final Aggregation newAggregation) {
        return new PanelValue(unitType, unitArgs, fieldPath, legend, newAggregation);
    }

    @Override
    public BsonDocument unitArgs() {
        return unitArgs.clone();
    }

    public boolean matches(final SnapshotUnit unit) {
        if (!unitType.equals(unit.type())) {
            return false;
        }
        final BsonDocument args = unit.args();
        for (final Map.Entry<String, BsonValue> expected : unitArgs.entrySet()) {
            final Optional<BsonValue> actual = FieldPath.parse(expected.getKey()).find(args);
            if (actual.isEmpty() || !BsonValues.sameValue(expected.getValue(), actual.get())) {
                return false;
            }
        }
        return true;
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
                .append("unit_type", new BsonString(unitType))
                .append("unit_args", unitArgs.clone())
                .append("field_path", new BsonString(fieldPath.path()))
                .append("legend", new BsonString(legend))
                .append("aggregation", new BsonString(aggregation.name()));
    }

    public static PanelValue fromDocument(
            final BsonDocument document, final String path, final AggregationCatalog aggregations) {
        final String unitType = requireString(document, "unit_type", path);
        final String fieldPath = requireString(document, "field_path", path);
        final BsonValue args = document.get("unit_args");
        if (args != null && !args.isDocument()) {
            throw new ConfigurationException(path + ".unit_args must be an object");
        }
        final BsonValue legend = document.get("legend");
        final BsonValue aggregation = document.get("aggregation");
        return new PanelValue(
                unitType,
                args == null ? new BsonDocument() : args.asDocument(),
                FieldPath.parse(fieldPath),
                legend != null && legend.isString() ? legend.asString().getValue() : null,
                aggregation != null && aggregation.isString()
                        ? aggregations.resolve(aggregation.asString().getValue())
                        : StandardAggregation.NONE);
    }

    static String requireString(final BsonDocument document, final String key, final String path) {
        final BsonValue value = document.get(key);
        if (value == null || !value.isString() || value.asString().getValue().isBlank()) {
            throw new ConfigurationException(path + "." + key + " must be a non-empty string");
        }
        return value.asString().getValue();
    }
}
