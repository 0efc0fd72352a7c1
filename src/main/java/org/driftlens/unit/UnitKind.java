package org.driftlens.unit;

/**
 * Whether a unit measures something or asserts a condition.
 */
public enum UnitKind {
    METRIC("metric"),
    TEST("test");

    private final String key;

    UnitKind(final String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public String presetsMetadataKey() {
        return key + "_presets";
    }

    public String generatorsMetadataKey() {
        return key + "_generators";
    }
}
