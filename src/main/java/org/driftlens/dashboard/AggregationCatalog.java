package org.driftlens.dashboard;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.driftlens.error.ConfigurationException;

/**
 * Aggregations by case-insensitive name. Starts from {@link StandardAggregation} and accepts custom entries.
 */
public final class AggregationCatalog {
    private final Map<String, Aggregation> aggregations;

    private AggregationCatalog(final Map<String, Aggregation> aggregations) {
        this.aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations));
    }

    public static AggregationCatalog standard() {
        final Map<String, Aggregation> aggregations = new LinkedHashMap<>();
        for (final StandardAggregation aggregation : StandardAggregation.values()) {
            aggregations.put(key(aggregation.name()), aggregation);
        }
        return new AggregationCatalog(aggregations);
    }

    /**
     * Returns a catalog that also knows {@code aggregation}.
     *
     * @throws IllegalArgumentException if the name is already taken
     */
    public AggregationCatalog with(final Aggregation aggregation) {
        Objects.requireNonNull(aggregation, "aggregation");
        final String key = key(aggregation.name());
        if (aggregations.containsKey(key)) {
            throw new IllegalArgumentException("duplicate aggregation: " + aggregation.name());
        }
        final Map<String, Aggregation> extended = new LinkedHashMap<>(aggregations);
        extended.put(key, aggregation);
        return new AggregationCatalog(extended);
    }

    /**
     * @throws ConfigurationException for an unknown name
     */
    public Aggregation resolve(final String name) {
        final Aggregation aggregation = aggregations.get(key(name));
        if (aggregation == null) {
            throw new ConfigurationException(
                    "unknown aggregation: " + name + " (expected one of: " + String.join("|", aggregations.keySet()) + ")");
        }
        return aggregation;
    }

    public Set<String> names() {
        return aggregations.keySet();
    }

    private static String key(final String name) {
        final String normalized = name == null ? "" : name.trim();
        if (normalized.isEmpty()) {
            throw new ConfigurationException("aggregation name must not be blank");
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
