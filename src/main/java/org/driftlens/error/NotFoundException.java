package org.driftlens.error;

import java.util.Objects;

/**
 * Lookup of an unknown group, graph, project or snapshot.
 */
public final class NotFoundException extends RuntimeException {
    private final String entity;
    private final String key;

    public NotFoundException(final String entity, final Object key) {
        super(Objects.requireNonNull(entity, "entity") + " not found: " + key);
        this.entity = entity;
        this.key = String.valueOf(key);
    }

    public String entity() {
        return entity;
    }

    public String key() {
        return key;
    }
}
