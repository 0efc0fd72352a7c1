package org.driftlens.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.driftlens.unit.BsonValues;

/**
 * JSON-lines logger with a minimum level. Context fields win over custom fields of the same name.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private static final JsonWriterSettings LINE_SETTINGS =
            JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    private final Writer writer;
    private final Clock clock;
    private final LogLevel minimumLevel;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(final OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), LogLevel.INFO, true);
    }

    public StructuredJsonLinesLogger(final OutputStream outputStream, final LogLevel minimumLevel) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), minimumLevel, true);
    }

    public StructuredJsonLinesLogger(
            final Writer writer, final Clock clock, final LogLevel minimumLevel, final boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
        this.autoFlush = autoFlush;
        this.closed = false;
    }

    @Override
    public synchronized void log(
            final LogLevel level, final String message, final LogContext context, final Map<String, ?> fields) {
        ensureOpen();
        final LogLevel safeLevel = level == null ? LogLevel.INFO : level;
        if (!minimumLevel.enables(safeLevel)) {
            return;
        }
        final LogContext safeContext = Objects.requireNonNull(context, "context");

        final BsonDocument event = new BsonDocument()
                .append("timestamp", new BsonString(Instant.now(clock).toString()))
                .append("level", new BsonString(safeLevel.name()))
                .append("message", new BsonString(message == null ? "" : message));
        for (final Map.Entry<String, Object> entry : safeContext.asFields().entrySet()) {
            event.append(entry.getKey(), BsonValues.toBson(entry.getValue()));
        }
        if (fields != null) {
            for (final Map.Entry<String, ?> entry : fields.entrySet()) {
                final String key = entry.getKey();
                if (key == null || key.isBlank() || event.containsKey(key)) {
                    continue;
                }
                event.append(key, encodeField(entry.getValue()));
            }
        }
        writeLine(event.toJson(LINE_SETTINGS));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close logger writer", e);
        }
    }

    private static BsonValue encodeField(final Object value) {
        try {
            return BsonValues.toBson(value);
        } catch (IllegalArgumentException unsupported) {
            return new BsonString(String.valueOf(value));
        }
    }

    private void writeLine(final String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write log event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }
}
