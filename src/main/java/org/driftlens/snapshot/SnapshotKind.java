package org.driftlens.snapshot;

import java.util.Locale;

/**
 * Which façade a snapshot was captured from.
 */
public enum SnapshotKind {
    REPORT("report"),
    TEST_SUITE("test_suite");

    private final String value;

    SnapshotKind(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SnapshotKind fromText(final String rawValue) {
        final String value = rawValue == null ? "" : rawValue.trim().toLowerCase(Locale.ROOT);
        for (final SnapshotKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("unsupported snapshot kind: " + rawValue + " (expected: report|test_suite)");
    }
}
