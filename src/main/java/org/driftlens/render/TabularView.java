package org.driftlens.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Rows of named cells. Column order is the order in which column names first appear.
 */
public final class TabularView {
    private final List<String> columns;
    private final List<Map<String, Object>> rows;

    public TabularView(final List<Map<String, Object>> rows) {
        Objects.requireNonNull(rows, "rows");
        final Set<String> names = new LinkedHashSet<>();
        final List<Map<String, Object>> copies = new ArrayList<>(rows.size());
        for (final Map<String, Object> row : rows) {
            names.addAll(row.keySet());
            copies.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        this.columns = List.copyOf(names);
        this.rows = Collections.unmodifiableList(copies);
    }

    public static TabularView concat(final List<TabularView> views) {
        final List<Map<String, Object>> rows = new ArrayList<>();
        for (final TabularView view : views) {
            rows.addAll(view.rows);
        }
        return new TabularView(rows);
    }

    public List<String> columns() {
        return columns;
    }

    public List<Map<String, Object>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public Object cell(final int row, final String column) {
        return rows.get(row).get(column);
    }
}
