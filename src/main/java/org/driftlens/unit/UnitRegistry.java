package org.driftlens.unit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.bson.BsonDocument;
import org.driftlens.error.NotFoundException;

/**
 * Explicit mapping from type tag to factory. Built once at startup and passed to whoever restores snapshots.
 */
public final class UnitRegistry {
    private final Map<String, UnitFactory> factories;

    private UnitRegistry(final Map<String, UnitFactory> factories) {
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> types() {
        return factories.keySet();
    }

    public boolean contains(final String type) {
        return factories.containsKey(type);
    }

    public Optional<UnitFactory> find(final String type) {
        return Optional.ofNullable(factories.get(type));
    }

    /**
     * @throws NotFoundException if no factory is registered for the type
     */
    public ComputationalUnit create(final String type, final BsonDocument args) {
        final UnitFactory factory = factories.get(type);
        if (factory == null) {
            throw new NotFoundException("unit type", type);
        }
        return Objects.requireNonNull(factory.create(args.clone()), "factory result for " + type);
    }

    public static final class Builder {
        private final Map<String, UnitFactory> factories = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(final String type, final UnitFactory factory) {
            final String normalized = Objects.requireNonNull(type, "type").trim();
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("type must not be blank");
            }
            if (factories.putIfAbsent(normalized, Objects.requireNonNull(factory, "factory")) != null) {
                throw new IllegalArgumentException("duplicate unit type: " + normalized);
            }
            return this;
        }

        public Builder registerAll(final UnitRegistry other) {
            other.factories.forEach(this::register);
            return this;
        }

        public UnitRegistry build() {
            return new UnitRegistry(factories);
        }
    }
}
