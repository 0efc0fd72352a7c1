package org.driftlens.data;

import java.util.Objects;

public record ColumnDefinition(String name, ColumnType type) {
    public ColumnDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }
}
