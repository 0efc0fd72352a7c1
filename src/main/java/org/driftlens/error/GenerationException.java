package org.driftlens.error;

/**
 * A preset or generator emitted an element the expander cannot register.
 */
public final class GenerationException extends ConfigurationException {
    private final String source;

    public GenerationException(final String source, final String message) {
        super(message);
        this.source = source;
    }

    /**
     * Name of the preset or generator that produced the invalid element.
     */
    public String source() {
        return source;
    }
}
