package org.driftlens.suite;

import java.util.List;
import java.util.Map;

/**
 * Derived columns computed for the second input-preparation pass.
 */
public record AdditionalFeatures(Map<String, List<Object>> current, Map<String, List<Object>> reference) {
    public AdditionalFeatures {
        current = Map.copyOf(current);
        reference = Map.copyOf(reference);
    }

    public static AdditionalFeatures none() {
        return new AdditionalFeatures(Map.of(), Map.of());
    }
}
