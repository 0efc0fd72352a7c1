package org.driftlens.unit;

import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Immutable result of one unit in one run.
 */
public final class UnitResult {
    private final BsonDocument document;

    private UnitResult(final BsonDocument document) {
        this.document = document;
    }

    public static UnitResult of(final BsonDocument document) {
        return new UnitResult(Objects.requireNonNull(document, "document").clone());
    }

    public static UnitResult parse(final String json) {
        return new UnitResult(BsonDocument.parse(Objects.requireNonNull(json, "json")));
    }

    /**
     * Reads the value at a dotted path such as {@code current.share_of_missing_values}.
     *
     * @throws org.driftlens.error.FieldNotFoundException if any segment is missing
     */
    public BsonValue field(final String path) {
        return BsonValues.copy(FieldPath.parse(path).resolve(document));
    }

    public BsonValue field(final FieldPath path) {
        return BsonValues.copy(Objects.requireNonNull(path, "path").resolve(document));
    }

    public boolean has(final String path) {
        return FieldPath.parse(path).find(document).isPresent();
    }

    public BsonDocument toDocument() {
        return document.clone();
    }

    public String toJson() {
        return document.toJson();
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof UnitResult)) {
            return false;
        }
        return BsonValues.sameValue(document, ((UnitResult) other).document);
    }

    @Override
    public int hashCode() {
        return BsonValues.canonicalize(document).hashCode();
    }

    @Override
    public String toString() {
        return document.toJson();
    }
}
