package org.driftlens.data;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Column-oriented dataset held in memory.
 */
public final class InMemoryDataset implements Dataset {
    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private InMemoryDataset(final Map<String, List<Object>> columns, final int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<String> columnNames() {
        return List.copyOf(columns.keySet());
    }

    @Override
    public int rowCount() {
        return rowCount;
    }

    @Override
    public boolean hasColumn(final String name) {
        return columns.containsKey(name);
    }

    @Override
    public List<Object> column(final String name) {
        final List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("unknown column: " + name);
        }
        return values;
    }

    /**
     * Rows {@code [from, to)} as a new dataset.
     */
    public InMemoryDataset slice(final int from, final int to) {
        if (from < 0 || to > rowCount || from > to) {
            throw new IndexOutOfBoundsException("invalid slice [" + from + ", " + to + ") of " + rowCount + " rows");
        }
        final Builder builder = builder();
        for (final Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            builder.column(entry.getKey(), entry.getValue().subList(from, to));
        }
        return builder.build();
    }

    public static final class Builder {
        private final Map<String, List<Object>> columns = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder column(final String name, final List<?> values) {
            final String normalized = Objects.requireNonNull(name, "name").trim();
            if (normalized.isEmpty()) {
                throw new IllegalArgumentException("column name must not be blank");
            }
            if (columns.containsKey(normalized)) {
                throw new IllegalArgumentException("duplicate column: " + normalized);
            }
            columns.put(normalized, Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(values, "values"))));
            return this;
        }

        public InMemoryDataset build() {
            int rows = -1;
            for (final Map.Entry<String, List<Object>> entry : columns.entrySet()) {
                final int size = entry.getValue().size();
                if (rows >= 0 && size != rows) {
                    throw new IllegalArgumentException(
                            "column " + entry.getKey() + " has " + size + " rows, expected " + rows);
                }
                rows = size;
            }
            return new InMemoryDataset(Collections.unmodifiableMap(new LinkedHashMap<>(columns)), Math.max(rows, 0));
        }
    }
}
