package org.driftlens.obs;

import java.util.Locale;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR;

    public boolean enables(final LogLevel level) {
        return level.ordinal() >= ordinal();
    }

    public static LogLevel parse(final String value) {
        if (value == null || value.isBlank()) {
            return INFO;
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(normalized)) {
            return WARN;
        }
        return valueOf(normalized);
    }
}
