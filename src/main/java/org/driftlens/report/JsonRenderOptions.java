package org.driftlens.report;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.driftlens.render.FieldSelection;

/**
 * Per unit id include/exclude lists of top-level result fields for {@link ReportBase#asDict(JsonRenderOptions)}.
 */
public final class JsonRenderOptions {
    private static final JsonRenderOptions NONE = builder().build();

    private final Map<String, Set<String>> include;
    private final Map<String, Set<String>> exclude;

    private JsonRenderOptions(final Builder builder) {
        this.include = copy(builder.include);
        this.exclude = copy(builder.exclude);
    }

    public static JsonRenderOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public FieldSelection selectionFor(final String unitId) {
        return new FieldSelection(
                include.getOrDefault(unitId, Set.of()),
                exclude.getOrDefault(unitId, Set.of()));
    }

    private static Map<String, Set<String>> copy(final Map<String, Set<String>> source) {
        final Map<String, Set<String>> copy = new LinkedHashMap<>();
        source.forEach((key, fields) -> copy.put(key, Set.copyOf(fields)));
        return Map.copyOf(copy);
    }

    public static final class Builder {
        private final Map<String, Set<String>> include = new LinkedHashMap<>();
        private final Map<String, Set<String>> exclude = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder include(final String unitId, final String... fields) {
            include.computeIfAbsent(Objects.requireNonNull(unitId, "unitId"), key -> new LinkedHashSet<>())
                    .addAll(Arrays.asList(fields));
            return this;
        }

        public Builder exclude(final String unitId, final String... fields) {
            exclude.computeIfAbsent(Objects.requireNonNull(unitId, "unitId"), key -> new LinkedHashSet<>())
                    .addAll(Arrays.asList(fields));
            return this;
        }

        public JsonRenderOptions build() {
            return new JsonRenderOptions(this);
        }
    }
}
