package org.driftlens.unit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonInt64;
import org.driftlens.error.FieldNotFoundException;
import org.junit.jupiter.api.Test;

class UnitResultTest {
    private static final UnitResult RESULT = UnitResult.parse(
        "{\"current\": {\"share\": 0.25, \"values\": [1, 2, 3]}, \"column\": \"age\"}");

    @Test
    void resolvesNestedFieldsAndArrayIndexes() {
        assertEquals(0.25, RESULT.field("current.share").asDouble().getValue());
        assertEquals(2, RESULT.field("current.values.1").asInt32().getValue());
        assertEquals("age", RESULT.field("column").asString().getValue());
        assertTrue(RESULT.has("current.values.0"));
        assertFalse(RESULT.has("reference"));
    }

    @Test
    void missingFieldNamesTheFirstAbsentSegment() {
        FieldNotFoundException missing =
            assertThrows(FieldNotFoundException.class, () -> RESULT.field("current.missing.deep"));
        assertEquals("current.missing.deep", missing.path());
        assertEquals("missing", missing.segment());

        FieldNotFoundException throughScalar =
            assertThrows(FieldNotFoundException.class, () -> RESULT.field("current.share.value"));
        assertEquals("value", throughScalar.segment());

        FieldNotFoundException outOfRange =
            assertThrows(FieldNotFoundException.class, () -> RESULT.field("current.values.7"));
        assertEquals("7", outOfRange.segment());
    }

    @Test
    void rejectsMalformedPaths() {
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("current..share"));
        assertThrows(IllegalArgumentException.class, () -> FieldPath.parse("  "));
        assertEquals(List.of("a", "b", "0"), FieldPath.parse("a.b.0").segments());
    }

    @Test
    void returnedValuesDoNotAliasTheStoredResult() {
        BsonDocument current = RESULT.field("current").asDocument();
        current.put("share", new BsonInt64(99));

        assertEquals(0.25, RESULT.field("current.share").asDouble().getValue());
    }

    @Test
    void equalityComparesNumbersByValue() {
        UnitResult int32 = UnitResult.parse("{\"n\": 1, \"nested\": {\"m\": 2}}");
        UnitResult int64 = UnitResult.of(new BsonDocument("n", new BsonInt64(1))
            .append("nested", new BsonDocument("m", new BsonInt64(2))));

        assertEquals(int32, int64);
    }
}
