package org.driftlens.unit;

import java.util.Locale;

public enum TestStatus {
    SUCCESS,
    WARNING,
    FAIL,
    ERROR,
    SKIPPED;

    public static TestStatus parse(final String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("test status must not be blank");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
