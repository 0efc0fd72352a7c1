package org.driftlens.workspace;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Descriptive part of a project. The date range, when set, is the default window of the project dashboard.
 */
public record ProjectInfo(String id, String name, String description, Instant dateFrom, Instant dateTo) {
    public ProjectInfo {
        id = id == null ? UUID.randomUUID().toString() : id;
        name = requireText(name, "name");
        description = description == null ? "" : description;
        if (dateFrom != null && dateTo != null && dateFrom.isAfter(dateTo)) {
            throw new IllegalArgumentException("dateFrom " + dateFrom + " is after dateTo " + dateTo);
        }
    }

    public static ProjectInfo named(final String name, final String description) {
        return new ProjectInfo(null, name, description, null, null);
    }

    public ProjectInfo withDetails(
            final String newName, final String newDescription, final Instant newFrom, final Instant newTo) {
        return new ProjectInfo(id, newName, newDescription, newFrom, newTo);
    }

    public Optional<Instant> defaultFrom() {
        return Optional.ofNullable(dateFrom);
    }

    public Optional<Instant> defaultTo() {
        return Optional.ofNullable(dateTo);
    }

    private static String requireText(final String value, final String fieldName) {
        final String normalized = Objects.requireNonNull(value, fieldName).trim();
        if (normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}
