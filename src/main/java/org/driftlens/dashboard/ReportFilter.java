package org.driftlens.dashboard;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.unit.BsonValues;

/**
 * Keeps snapshots whose metadata contains every listed value and whose tags contain every listed tag.
 */
public record ReportFilter(BsonDocument metadataValues, List<String> tagValues) {
    public ReportFilter {
        metadataValues = Objects.requireNonNull(metadataValues, "metadataValues").clone();
        tagValues = List.copyOf(tagValues);
    }

    public static ReportFilter any() {
        return new ReportFilter(new BsonDocument(), List.of());
    }

    public static ReportFilter of(final Map<String, ?> metadataValues, final List<String> tagValues) {
        return new ReportFilter(BsonValues.toDocument(metadataValues), tagValues);
    }

    @Override
    public BsonDocument metadataValues() {
        return metadataValues.clone();
    }

    public boolean matches(final Snapshot snapshot) {
        for (final Map.Entry<String, BsonValue> expected : metadataValues.entrySet()) {
            final Optional<BsonValue> actual = snapshot.metadataValue(expected.getKey());
            if (actual.isEmpty() || !BsonValues.sameValue(expected.getValue(), actual.get())) {
                return false;
            }
        }
        return snapshot.tags().containsAll(tagValues);
    }

    public BsonDocument toDocument() {
        final BsonArray tags = new BsonArray();
        tagValues.forEach(tag -> tags.add(new BsonString(tag)));
        return new BsonDocument()
                .append("metadata_values", metadataValues.clone())
                .append("tag_values", tags);
    }

    public static ReportFilter fromDocument(final BsonDocument document, final String path) {
        final BsonValue metadata = document.get("metadata_values");
        if (metadata != null && !metadata.isDocument()) {
            throw new ConfigurationException(path + ".metadata_values must be an object");
        }
        final BsonValue tags = document.get("tag_values");
        if (tags != null && !tags.isArray()) {
            throw new ConfigurationException(path + ".tag_values must be an array");
        }
        final List<String> tagValues = new ArrayList<>();
        if (tags != null) {
            for (final BsonValue tag : tags.asArray()) {
                if (!tag.isString()) {
                    throw new ConfigurationException(path + ".tag_values must contain only strings");
                }
                tagValues.add(tag.asString().getValue());
            }
        }
        return new ReportFilter(metadata == null ? new BsonDocument() : metadata.asDocument(), tagValues);
    }
}
