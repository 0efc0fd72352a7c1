package org.driftlens.obs;

import java.util.Map;

/**
 * Structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(LogLevel level, String message, LogContext context, Map<String, ?> fields);

    static JsonLinesLogger noop() {
        return NoopLogger.INSTANCE;
    }

    default void debug(final String message, final LogContext context, final Map<String, ?> fields) {
        log(LogLevel.DEBUG, message, context, fields);
    }

    default void info(final String message, final LogContext context, final Map<String, ?> fields) {
        log(LogLevel.INFO, message, context, fields);
    }

    default void info(final String message, final LogContext context) {
        log(LogLevel.INFO, message, context, Map.of());
    }

    default void warn(final String message, final LogContext context, final Map<String, ?> fields) {
        log(LogLevel.WARN, message, context, fields);
    }

    default void error(final String message, final LogContext context, final Map<String, ?> fields) {
        log(LogLevel.ERROR, message, context, fields);
    }

    @Override
    void close();

    final class NoopLogger implements JsonLinesLogger {
        private static final NoopLogger INSTANCE = new NoopLogger();

        private NoopLogger() {
        }

        @Override
        public void log(
                final LogLevel level, final String message, final LogContext context, final Map<String, ?> fields) {
        }

        @Override
        public void close() {
        }
    }
}
