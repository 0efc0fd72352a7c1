package org.driftlens.render;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.driftlens.error.ConfigurationException;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.TestUnit;

/**
 * Explicit renderer lookup by unit class. The most specific registration along the class hierarchy wins:
 * the class itself, then its superclasses, then its interfaces.
 */
public final class RendererRegistry {
    private final Map<Class<?>, Renderer> renderers;

    private RendererRegistry(final Map<Class<?>, Renderer> renderers) {
        this.renderers = Collections.unmodifiableMap(new LinkedHashMap<>(renderers));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry with the generic metric and test renderers.
     */
    public static RendererRegistry standard() {
        return builder()
                .register(MetricUnit.class, new DefaultMetricRenderer())
                .register(TestUnit.class, new DefaultTestRenderer())
                .build();
    }

    /**
     * @throws ConfigurationException if nothing in the unit's class hierarchy has a renderer
     */
    public Renderer find(final Class<? extends ComputationalUnit> unitClass) {
        Objects.requireNonNull(unitClass, "unitClass");
        for (Class<?> current = unitClass; current != null; current = current.getSuperclass()) {
            final Renderer renderer = renderers.get(current);
            if (renderer != null) {
                return renderer;
            }
        }
        final Deque<Class<?>> pending = new ArrayDeque<>();
        final Set<Class<?>> seen = new HashSet<>();
        for (Class<?> current = unitClass; current != null; current = current.getSuperclass()) {
            Collections.addAll(pending, current.getInterfaces());
        }
        while (!pending.isEmpty()) {
            final Class<?> candidate = pending.removeFirst();
            if (!seen.add(candidate)) {
                continue;
            }
            final Renderer renderer = renderers.get(candidate);
            if (renderer != null) {
                return renderer;
            }
            Collections.addAll(pending, candidate.getInterfaces());
        }
        throw new ConfigurationException("no renderer registered for " + unitClass.getName());
    }

    public Renderer find(final ComputationalUnit unit) {
        return find(Objects.requireNonNull(unit, "unit").getClass());
    }

    public static final class Builder {
        private final Map<Class<?>, Renderer> renderers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(final Class<? extends ComputationalUnit> unitClass, final Renderer renderer) {
            renderers.put(Objects.requireNonNull(unitClass, "unitClass"), Objects.requireNonNull(renderer, "renderer"));
            return this;
        }

        public RendererRegistry build() {
            return new RendererRegistry(renderers);
        }
    }
}
