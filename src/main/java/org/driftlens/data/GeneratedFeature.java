package org.driftlens.data;

import java.util.List;

/**
 * A derived column that units may request. Generated once per run for each dataset, keyed by name.
 */
public interface GeneratedFeature {
    String name();

    List<Object> generate(Dataset dataset, DataDefinition definition);
}
