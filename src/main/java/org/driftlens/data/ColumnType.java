package org.driftlens.data;

public enum ColumnType {
    NUMERICAL,
    CATEGORICAL,
    DATETIME,
    TEXT
}
