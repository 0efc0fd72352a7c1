package org.driftlens.workspace;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;
import org.driftlens.dashboard.AggregationCatalog;
import org.driftlens.dashboard.DashboardConfig;
import org.driftlens.error.ConfigurationException;

/**
 * JSON form of {@code project.json}: project info plus dashboard config.
 */
final class ProjectCodec {
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .indent(true)
            .build();

    private ProjectCodec() {}

    static String toJson(final ProjectInfo info, final DashboardConfig dashboard) {
        return toDocument(info, dashboard).toJson(JSON_SETTINGS);
    }

    static BsonDocument toDocument(final ProjectInfo info, final DashboardConfig dashboard) {
        return new BsonDocument()
                .append("id", new BsonString(info.id()))
                .append("name", new BsonString(info.name()))
                .append("description", new BsonString(info.description()))
                .append("date_from", instant(info.dateFrom()))
                .append("date_to", instant(info.dateTo()))
                .append("dashboard", dashboard.toDocument());
    }

    static Decoded fromJson(final String json, final String sourceName, final AggregationCatalog aggregations) {
        final BsonDocument document;
        try {
            document = BsonDocument.parse(Objects.requireNonNull(json, "json"));
        } catch (final JsonParseException | BsonInvalidOperationException e) {
            throw new ConfigurationException(sourceName + " is not valid JSON: " + e.getMessage(), e);
        }
        return fromDocument(document, sourceName, aggregations);
    }

    static Decoded fromDocument(
            final BsonDocument document, final String sourceName, final AggregationCatalog aggregations) {
        final String id = string(document, "id", sourceName);
        final String name = string(document, "name", sourceName);
        final BsonValue description = document.get("description");
        final BsonValue dashboard = document.get("dashboard");
        if (dashboard == null || !dashboard.isDocument()) {
            throw new ConfigurationException(sourceName + ": dashboard must be an object");
        }
        final ProjectInfo info = new ProjectInfo(
                id,
                name,
                description != null && description.isString() ? description.asString().getValue() : "",
                parseInstant(document.get("date_from"), sourceName + ": date_from"),
                parseInstant(document.get("date_to"), sourceName + ": date_to"));
        return new Decoded(info, DashboardConfig.fromDocument(dashboard.asDocument(), sourceName + ": dashboard", aggregations));
    }

    private static String string(final BsonDocument document, final String key, final String sourceName) {
        final BsonValue value = document.get(key);
        if (value == null || !value.isString()) {
            throw new ConfigurationException(sourceName + ": " + key + " must be a string");
        }
        return value.asString().getValue();
    }

    private static BsonValue instant(final Instant value) {
        return value == null ? BsonNull.VALUE : new BsonString(value.toString());
    }

    private static Instant parseInstant(final BsonValue value, final String path) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isString()) {
            throw new ConfigurationException(path + " must be an ISO-8601 string");
        }
        try {
            return Instant.parse(value.asString().getValue());
        } catch (final DateTimeParseException e) {
            throw new ConfigurationException(path + " must be an ISO-8601 instant: " + value.asString().getValue(), e);
        }
    }

    record Decoded(ProjectInfo info, DashboardConfig dashboard) {
    }
}
