package org.driftlens.obs;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;

/**
 * Fixed-capacity ring buffer of recent unit computations, for diagnosing slow or failing runs.
 */
public final class RunJournal {
    public static final int DEFAULT_CAPACITY = 512;

    private final int capacity;
    private final Deque<Entry> entries;
    private long nextSequence;
    private long droppedCount;

    public RunJournal() {
        this(DEFAULT_CAPACITY);
    }

    public RunJournal(final int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be greater than zero");
        }
        this.capacity = capacity;
        this.entries = new ArrayDeque<>(capacity);
        this.nextSequence = 1L;
        this.droppedCount = 0L;
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long droppedCount() {
        return droppedCount;
    }

    public synchronized List<Entry> entries() {
        return List.copyOf(entries);
    }

    public synchronized void record(final String unit, final long durationNanos, final String error) {
        final Entry entry = new Entry(nextSequence++, Objects.requireNonNull(unit, "unit"), durationNanos, normalize(error));
        if (entries.size() == capacity) {
            entries.removeFirst();
            droppedCount++;
        }
        entries.addLast(entry);
    }

    public synchronized void clear() {
        entries.clear();
        droppedCount = 0L;
    }

    public synchronized BsonDocument toDocument() {
        final BsonArray encoded = new BsonArray(entries.size());
        for (final Entry entry : entries) {
            final BsonDocument document = new BsonDocument()
                    .append("sequence", new BsonInt64(entry.sequence()))
                    .append("unit", new BsonString(entry.unit()))
                    .append("durationNanos", new BsonInt64(entry.durationNanos()))
                    .append("failed", BsonBoolean.valueOf(entry.failed()));
            if (entry.error() != null) {
                document.append("error", new BsonString(entry.error()));
            }
            encoded.add(document);
        }
        return new BsonDocument()
                .append("capacity", new BsonInt32(capacity))
                .append("size", new BsonInt32(entries.size()))
                .append("dropped", new BsonInt64(droppedCount))
                .append("entries", encoded);
    }

    private static String normalize(final String error) {
        if (error == null) {
            return null;
        }
        final String trimmed = error.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public record Entry(long sequence, String unit, long durationNanos, String error) {
        public boolean failed() {
            return error != null;
        }
    }
}
