package org.driftlens.render;

import java.util.Objects;
import java.util.Set;
import org.bson.BsonDocument;
import org.driftlens.unit.BsonValues;

/**
 * Top-level result fields to keep in a JSON render. An empty include set keeps everything not excluded.
 */
public record FieldSelection(Set<String> include, Set<String> exclude) {
    public static final FieldSelection ALL = new FieldSelection(Set.of(), Set.of());

    public FieldSelection {
        include = Set.copyOf(Objects.requireNonNull(include, "include"));
        exclude = Set.copyOf(Objects.requireNonNull(exclude, "exclude"));
    }

    public BsonDocument apply(final BsonDocument document) {
        final BsonDocument selected = new BsonDocument();
        for (final String key : document.keySet()) {
            if (!include.isEmpty() && !include.contains(key)) {
                continue;
            }
            if (exclude.contains(key)) {
                continue;
            }
            selected.append(key, BsonValues.copy(document.get(key)));
        }
        return selected;
    }
}
