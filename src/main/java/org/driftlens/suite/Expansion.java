package org.driftlens.suite;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.UnitKind;

/**
 * Flat unit list produced from a check list, plus the preset and generator names in call order.
 */
public record Expansion(List<ComputationalUnit> units, List<String> presets, List<String> generators) {
    public Expansion {
        units = List.copyOf(units);
        presets = List.copyOf(presets);
        generators = List.copyOf(generators);
    }

    /**
     * Appends provenance to {@code <kind>_presets} and {@code <kind>_generators}, creating the lists on first use.
     */
    public void recordProvenance(final Map<String, Object> metadata, final UnitKind kind) {
        Objects.requireNonNull(metadata, "metadata");
        append(metadata, kind.presetsMetadataKey(), presets);
        append(metadata, kind.generatorsMetadataKey(), generators);
    }

    private static void append(final Map<String, Object> metadata, final String key, final List<String> names) {
        if (names.isEmpty()) {
            return;
        }
        final List<String> merged = new ArrayList<>();
        final Object existing = metadata.get(key);
        if (existing instanceof List<?> list) {
            for (final Object item : list) {
                merged.add(String.valueOf(item));
            }
        } else if (existing != null) {
            merged.add(String.valueOf(existing));
        }
        merged.addAll(names);
        metadata.put(key, List.copyOf(merged));
    }
}
