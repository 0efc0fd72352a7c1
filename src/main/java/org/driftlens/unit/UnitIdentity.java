package org.driftlens.unit;

import java.util.Objects;
import org.bson.BsonDocument;

/**
 * Structural key of a unit: type tag plus canonicalized constructor arguments.
 *
 * <p>Two units built differently but with equal type and arguments share one identity and cannot be told
 * apart. The identity is the join key across snapshots.
 */
public final class UnitIdentity implements Comparable<UnitIdentity> {
    private final String type;
    private final BsonDocument args;
    private final String canonicalArgs;

    private UnitIdentity(final String type, final BsonDocument args) {
        this.type = requireText(type, "type");
        this.args = BsonValues.canonicalize(Objects.requireNonNull(args, "args")).asDocument();
        this.canonicalArgs = this.args.toJson();
    }

    public static UnitIdentity of(final String type, final BsonDocument args) {
        return new UnitIdentity(type, args);
    }

    public String type() {
        return type;
    }

    public BsonDocument args() {
        return args.clone();
    }

    public String canonicalArgs() {
        return canonicalArgs;
    }

    @Override
    public int compareTo(final UnitIdentity other) {
        final int byType = type.compareTo(other.type);
        if (byType != 0) {
            return byType;
        }
        return canonicalArgs.compareTo(other.canonicalArgs);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof UnitIdentity)) {
            return false;
        }
        final UnitIdentity that = (UnitIdentity) other;
        return type.equals(that.type) && canonicalArgs.equals(that.canonicalArgs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, canonicalArgs);
    }

    @Override
    public String toString() {
        return type + canonicalArgs;
    }

    private static String requireText(final String value, final String fieldName) {
        final String normalized = value == null ? null : value.trim();
        if (normalized == null || normalized.isEmpty()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }
}
