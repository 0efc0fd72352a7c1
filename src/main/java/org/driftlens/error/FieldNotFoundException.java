package org.driftlens.error;

/**
 * A dotted field path does not resolve against a result document.
 */
public final class FieldNotFoundException extends RuntimeException {
    private final String path;
    private final String segment;

    public FieldNotFoundException(final String path, final String segment) {
        super("field '" + segment + "' of path '" + path + "' not found");
        this.path = path;
        this.segment = segment;
    }

    public String path() {
        return path;
    }

    public String segment() {
        return segment;
    }
}
