package org.driftlens.unit;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.driftlens.error.FieldNotFoundException;

/**
 * Dot-separated path into nested result or argument documents. Numeric segments index arrays.
 */
public final class FieldPath {
    private final String path;
    private final List<String> segments;

    private FieldPath(final String path, final List<String> segments) {
        this.path = path;
        this.segments = segments;
    }

    public static FieldPath parse(final String path) {
        final String normalized = Objects.requireNonNull(path, "path").trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException("field path must not be blank");
        }
        final String[] parts = normalized.split("\\.", -1);
        for (final String part : parts) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("field path has an empty segment: " + normalized);
            }
        }
        return new FieldPath(normalized, List.of(parts));
    }

    public String path() {
        return path;
    }

    public List<String> segments() {
        return segments;
    }

    /**
     * Resolves the path, failing on the first segment that does not exist.
     */
    public BsonValue resolve(final BsonDocument root) {
        Objects.requireNonNull(root, "root");
        BsonValue current = root;
        for (final String segment : segments) {
            current = step(current, segment);
            if (current == null) {
                throw new FieldNotFoundException(path, segment);
            }
        }
        return current;
    }

    public Optional<BsonValue> find(final BsonDocument root) {
        Objects.requireNonNull(root, "root");
        BsonValue current = root;
        for (final String segment : segments) {
            current = step(current, segment);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    private static BsonValue step(final BsonValue current, final String segment) {
        if (current.isDocument()) {
            return current.asDocument().get(segment);
        }
        if (current.isArray()) {
            final BsonArray array = current.asArray();
            final int index = parseIndex(segment);
            if (index < 0 || index >= array.size()) {
                return null;
            }
            return array.get(index);
        }
        return null;
    }

    private static int parseIndex(final String segment) {
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        try {
            return Integer.parseInt(segment);
        } catch (final NumberFormatException numberFormatException) {
            return -1;
        }
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FieldPath)) {
            return false;
        }
        return path.equals(((FieldPath) other).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return path;
    }
}
