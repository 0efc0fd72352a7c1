package org.driftlens.snapshot;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonParseException;
import org.bson.json.JsonWriterSettings;
import org.driftlens.error.CorruptSnapshotException;
import org.driftlens.unit.UnitResult;

/**
 * JSON form of a {@link Snapshot}. Decoding reports every problem found, not just the first.
 */
public final class SnapshotCodec {
    private static final JsonWriterSettings JSON_SETTINGS = JsonWriterSettings.builder()
            .outputMode(JsonMode.RELAXED)
            .indent(true)
            .build();

    private SnapshotCodec() {}

    public static BsonDocument toDocument(final Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        final BsonArray units = new BsonArray(snapshot.units().size());
        for (final SnapshotUnit unit : snapshot.units()) {
            units.add(new BsonDocument()
                    .append("type", new BsonString(unit.type()))
                    .append("args", unit.args())
                    .append("result", unit.result().toDocument()));
        }
        final BsonArray tags = new BsonArray();
        snapshot.tags().forEach(tag -> tags.add(new BsonString(tag)));
        final BsonArray indices = new BsonArray();
        snapshot.firstLevelIndices().forEach(index -> indices.add(new BsonInt32(index)));
        return new BsonDocument()
                .append("id", new BsonString(snapshot.id()))
                .append("timestamp", new BsonString(snapshot.timestamp().toString()))
                .append("kind", new BsonString(snapshot.kind().value()))
                .append("metadata", snapshot.metadata())
                .append("tags", tags)
                .append("options", snapshot.options())
                .append("units", units)
                .append("first_level_indices", indices);
    }

    public static String toJson(final Snapshot snapshot) {
        return toDocument(snapshot).toJson(JSON_SETTINGS);
    }

    /**
     * @throws CorruptSnapshotException if the text is not a JSON object or the object is not a valid snapshot
     */
    public static Snapshot fromJson(final String json) {
        Objects.requireNonNull(json, "json");
        final BsonDocument document;
        try {
            document = BsonDocument.parse(json);
        } catch (JsonParseException | BsonInvalidOperationException e) {
            throw new CorruptSnapshotException("unparseable JSON: " + e.getMessage(), e);
        }
        return fromDocument(document);
    }

    public static Snapshot fromDocument(final BsonDocument document) {
        Objects.requireNonNull(document, "document");
        final List<String> problems = new ArrayList<>();

        final String id = requireString(document, "id", problems);
        if (id != null && id.isBlank()) {
            problems.add("id must not be blank");
        }
        final Instant timestamp = readTimestamp(document, problems);
        final SnapshotKind kind = readKind(document, problems);
        final BsonDocument metadata = requireDocument(document, "metadata", problems);
        final List<String> tags = readTags(document, problems);
        BsonDocument options = new BsonDocument();
        if (document.containsKey("options")) {
            options = requireDocument(document, "options", problems);
        }
        final List<SnapshotUnit> units = readUnits(document, problems);
        final List<Integer> indices = readIndices(document, units == null ? -1 : units.size(), problems);

        if (!problems.isEmpty()) {
            throw new CorruptSnapshotException(problems);
        }
        return new Snapshot(id, timestamp, kind, metadata, tags, options, units, indices);
    }

    private static Instant readTimestamp(final BsonDocument document, final List<String> problems) {
        final BsonValue value = document.get("timestamp");
        if (value == null) {
            problems.add("timestamp is required");
            return null;
        }
        if (value.isDateTime()) {
            return Instant.ofEpochMilli(value.asDateTime().getValue());
        }
        if (!value.isString()) {
            problems.add("timestamp must be a string (actual: " + value.getBsonType() + ")");
            return null;
        }
        final String text = value.asString().getValue();
        try {
            return Instant.parse(text);
        } catch (final DateTimeParseException notAnInstant) {
            try {
                return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            } catch (final DateTimeParseException notALocalTime) {
                problems.add("timestamp is not an ISO-8601 date-time: " + text);
                return null;
            }
        }
    }

    private static SnapshotKind readKind(final BsonDocument document, final List<String> problems) {
        final BsonValue value = document.get("kind");
        if (value == null) {
            return SnapshotKind.REPORT;
        }
        if (!value.isString()) {
            problems.add("kind must be a string (actual: " + value.getBsonType() + ")");
            return null;
        }
        try {
            return SnapshotKind.fromText(value.asString().getValue());
        } catch (final IllegalArgumentException e) {
            problems.add(e.getMessage());
            return null;
        }
    }

    private static List<String> readTags(final BsonDocument document, final List<String> problems) {
        final BsonArray array = requireArray(document, "tags", problems);
        if (array == null) {
            return null;
        }
        final List<String> tags = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            final BsonValue tag = array.get(i);
            if (!tag.isString()) {
                problems.add("tags[" + i + "] must be a string");
                continue;
            }
            tags.add(tag.asString().getValue());
        }
        return tags;
    }

    private static List<SnapshotUnit> readUnits(final BsonDocument document, final List<String> problems) {
        final BsonArray array = requireArray(document, "units", problems);
        if (array == null) {
            return null;
        }
        final List<SnapshotUnit> units = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            final String path = "units[" + i + "]";
            final BsonValue item = array.get(i);
            if (!item.isDocument()) {
                problems.add(path + " must be an object");
                continue;
            }
            final BsonDocument unit = item.asDocument();
            final int before = problems.size();
            final String type = requireString(unit, path + ".type", "type", problems);
            if (type != null && type.isBlank()) {
                problems.add(path + ".type must not be blank");
            }
            final BsonDocument args = requireDocument(unit, path + ".args", "args", problems);
            final BsonDocument result = requireDocument(unit, path + ".result", "result", problems);
            if (problems.size() == before) {
                units.add(new SnapshotUnit(type, args, UnitResult.of(result)));
            }
        }
        return units;
    }

    private static List<Integer> readIndices(
            final BsonDocument document, final int unitCount, final List<String> problems) {
        final BsonArray array = requireArray(document, "first_level_indices", problems);
        if (array == null) {
            return null;
        }
        final List<Integer> indices = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            final BsonValue value = array.get(i);
            if (!value.isInt32() && !value.isInt64()) {
                problems.add("first_level_indices[" + i + "] must be an integer");
                continue;
            }
            final long index = value.asNumber().longValue();
            if (unitCount >= 0 && (index < 0 || index >= unitCount)) {
                problems.add("first_level_indices[" + i + "] = " + index + " out of range [0, " + unitCount + ")");
                continue;
            }
            indices.add((int) index);
        }
        return indices;
    }

    private static String requireString(final BsonDocument document, final String key, final List<String> problems) {
        return requireString(document, key, key, problems);
    }

    private static String requireString(
            final BsonDocument document, final String path, final String key, final List<String> problems) {
        final BsonValue value = document.get(key);
        if (value == null) {
            problems.add(path + " is required");
            return null;
        }
        if (!value.isString()) {
            problems.add(path + " must be a string (actual: " + value.getBsonType() + ")");
            return null;
        }
        return value.asString().getValue();
    }

    private static BsonDocument requireDocument(
            final BsonDocument document, final String key, final List<String> problems) {
        return requireDocument(document, key, key, problems);
    }

    private static BsonDocument requireDocument(
            final BsonDocument document, final String path, final String key, final List<String> problems) {
        final BsonValue value = document.get(key);
        if (value == null) {
            problems.add(path + " is required");
            return null;
        }
        if (!value.isDocument()) {
            problems.add(path + " must be an object (actual: " + value.getBsonType() + ")");
            return null;
        }
        return value.asDocument();
    }

    private static BsonArray requireArray(final BsonDocument document, final String key, final List<String> problems) {
        final BsonValue value = document.get(key);
        if (value == null) {
            problems.add(key + " is required");
            return null;
        }
        if (!value.isArray()) {
            problems.add(key + " must be an array (actual: " + value.getBsonType() + ")");
            return null;
        }
        return value.asArray();
    }
}
