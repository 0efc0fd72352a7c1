package org.driftlens.data;

import java.util.List;

/**
 * Opaque tabular input: named columns of equal length.
 */
public interface Dataset {
    List<String> columnNames();

    int rowCount();

    boolean hasColumn(String name);

    /**
     * Values of one column in row order; {@code null} marks a missing value.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    List<Object> column(String name);
}
