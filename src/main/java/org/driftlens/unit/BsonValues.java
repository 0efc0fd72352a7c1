package org.driftlens.unit;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.bson.BsonArray;
import org.bson.BsonBoolean;
import org.bson.BsonDecimal128;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.bson.types.Decimal128;

/**
 * Conversions between plain Java values and BSON values used by arguments, results and metadata.
 */
public final class BsonValues {
    private BsonValues() {
    }

    public static BsonValue toBson(final Object value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value instanceof BsonValue bsonValue) {
            return bsonValue;
        }
        if (value instanceof String s) {
            return new BsonString(s);
        }
        if (value instanceof Boolean b) {
            return BsonBoolean.valueOf(b);
        }
        if (value instanceof Integer n) {
            return new BsonInt32(n);
        }
        if (value instanceof Long n) {
            return new BsonInt64(n);
        }
        if (value instanceof Double n) {
            return new BsonDouble(n);
        }
        if (value instanceof Float n) {
            return new BsonDouble(n.doubleValue());
        }
        if (value instanceof Short n) {
            return new BsonInt32(n.intValue());
        }
        if (value instanceof Byte n) {
            return new BsonInt32(n.intValue());
        }
        if (value instanceof BigDecimal decimal) {
            return new BsonDecimal128(new Decimal128(decimal));
        }
        if (value instanceof Enum<?> constant) {
            return new BsonString(constant.name());
        }
        if (value instanceof Map<?, ?> map) {
            return toDocument(map);
        }
        if (value instanceof Collection<?> collection) {
            final BsonArray array = new BsonArray();
            for (final Object item : collection) {
                array.add(toBson(item));
            }
            return array;
        }
        throw new IllegalArgumentException("unsupported value type: " + value.getClass().getName());
    }

    /**
     * Deep copy of containers; scalar BSON values are immutable and returned as is.
     */
    public static BsonValue copy(final BsonValue value) {
        if (value == null) {
            return null;
        }
        if (value.isDocument()) {
            return value.asDocument().clone();
        }
        if (value.isArray()) {
            return value.asArray().clone();
        }
        return value;
    }

    public static BsonDocument toDocument(final Map<?, ?> source) {
        Objects.requireNonNull(source, "source");
        final BsonDocument document = new BsonDocument();
        for (final Map.Entry<?, ?> entry : source.entrySet()) {
            final Object key = Objects.requireNonNull(entry.getKey(), "document key");
            document.put(String.valueOf(key), toBson(entry.getValue()));
        }
        return document;
    }

    public static Object toJava(final BsonValue value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isDocument()) {
            return toJavaMap(value.asDocument());
        }
        if (value.isArray()) {
            final List<Object> results = new ArrayList<>();
            for (final BsonValue item : value.asArray()) {
                results.add(toJava(item));
            }
            return results;
        }
        if (value.isString()) {
            return value.asString().getValue();
        }
        if (value.isBoolean()) {
            return value.asBoolean().getValue();
        }
        if (value.isInt32()) {
            return value.asInt32().getValue();
        }
        if (value.isInt64()) {
            return value.asInt64().getValue();
        }
        if (value.isDouble()) {
            return value.asDouble().getValue();
        }
        if (value.isDecimal128()) {
            return value.asDecimal128().decimal128Value().bigDecimalValue();
        }
        if (value.isDateTime()) {
            return value.asDateTime().getValue();
        }
        return value.toString();
    }

    public static Map<String, Object> toJavaMap(final BsonDocument document) {
        Objects.requireNonNull(document, "document");
        final Map<String, Object> result = new LinkedHashMap<>();
        for (final Map.Entry<String, BsonValue> entry : document.entrySet()) {
            result.put(entry.getKey(), toJava(entry.getValue()));
        }
        return result;
    }

    /**
     * Returns a copy with keys sorted at every level and integral numbers widened to 64 bit, so that
     * structurally equal argument sets serialize identically.
     */
    public static BsonValue canonicalize(final BsonValue value) {
        if (value == null) {
            return BsonNull.VALUE;
        }
        if (value.isDocument()) {
            final TreeMap<String, BsonValue> sorted = new TreeMap<>();
            for (final Map.Entry<String, BsonValue> entry : value.asDocument().entrySet()) {
                sorted.put(entry.getKey(), canonicalize(entry.getValue()));
            }
            final BsonDocument canonical = new BsonDocument();
            sorted.forEach(canonical::put);
            return canonical;
        }
        if (value.isArray()) {
            final BsonArray canonical = new BsonArray();
            for (final BsonValue item : value.asArray()) {
                canonical.add(canonicalize(item));
            }
            return canonical;
        }
        if (value.isInt32()) {
            return new BsonInt64(value.asInt32().getValue());
        }
        return value;
    }

    /**
     * The Java value {@code value} reads back as after it is stored as BSON and parsed again: integral numbers are
     * {@code Long}, floating point numbers are {@code Double} and map keys are sorted.
     *
     * @throws IllegalArgumentException if the value has no BSON form
     */
    public static Object normalize(final Object value) {
        return toJava(canonicalize(toBson(value)));
    }

    /**
     * Structural equality that compares numbers by numeric value regardless of their BSON width.
     */
    public static boolean sameValue(final BsonValue left, final BsonValue right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left.isNumber() && right.isNumber()) {
            if (isIntegral(left) && isIntegral(right)) {
                return left.asNumber().longValue() == right.asNumber().longValue();
            }
            return Double.compare(left.asNumber().doubleValue(), right.asNumber().doubleValue()) == 0;
        }
        if (left.isDocument() && right.isDocument()) {
            final BsonDocument l = left.asDocument();
            final BsonDocument r = right.asDocument();
            if (!l.keySet().equals(r.keySet())) {
                return false;
            }
            for (final String key : l.keySet()) {
                if (!sameValue(l.get(key), r.get(key))) {
                    return false;
                }
            }
            return true;
        }
        if (left.isArray() && right.isArray()) {
            final BsonArray l = left.asArray();
            final BsonArray r = right.asArray();
            if (l.size() != r.size()) {
                return false;
            }
            for (int i = 0; i < l.size(); i++) {
                if (!sameValue(l.get(i), r.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return left.equals(right);
    }

    private static boolean isIntegral(final BsonValue value) {
        return value.isInt32() || value.isInt64();
    }
}
