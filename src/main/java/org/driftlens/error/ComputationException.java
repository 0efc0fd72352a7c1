package org.driftlens.error;

import java.util.Objects;

/**
 * A unit failed while computing its result. Carries the unit identity so the failure is attributable.
 */
public final class ComputationException extends RuntimeException {
    private final String unitIdentity;

    public ComputationException(final String unitIdentity, final Throwable cause) {
        super("unit " + Objects.requireNonNull(unitIdentity, "unitIdentity") + " failed: " + describe(cause), cause);
        this.unitIdentity = unitIdentity;
    }

    public String unitIdentity() {
        return unitIdentity;
    }

    private static String describe(final Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        final String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getSimpleName();
        }
        return message;
    }
}
