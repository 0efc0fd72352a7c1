package org.driftlens.unit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonInt64;
import org.bson.BsonString;
import org.junit.jupiter.api.Test;

class UnitIdentityTest {
    @Test
    void argumentOrderAndIntegerWidthDoNotChangeIdentity() {
        BsonDocument first = new BsonDocument()
            .append("quantile", new BsonDouble(0.5))
            .append("column", new BsonDocument("name", new BsonString("age")).append("bins", new BsonInt32(10)));
        BsonDocument second = new BsonDocument()
            .append("column", new BsonDocument("bins", new BsonInt64(10)).append("name", new BsonString("age")))
            .append("quantile", new BsonDouble(0.5));

        UnitIdentity left = UnitIdentity.of("ColumnQuantileMetric", first);
        UnitIdentity right = UnitIdentity.of("ColumnQuantileMetric", second);

        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertEquals(left.canonicalArgs(), right.canonicalArgs());
    }

    @Test
    void identitySurvivesJsonRoundTrip() {
        BsonDocument args = new BsonDocument()
            .append("lt", new BsonDouble(0.1))
            .append("columns", new BsonArray(List.of(new BsonString("a"), new BsonInt32(3))));
        UnitIdentity original = UnitIdentity.of("TestShareOfMissingValues", args);

        UnitIdentity decoded = UnitIdentity.of("TestShareOfMissingValues", BsonDocument.parse(args.toJson()));

        assertEquals(original, decoded);
    }

    @Test
    void differentTypeOrArgumentsMakeDifferentIdentities() {
        BsonDocument args = new BsonDocument("column", new BsonString("age"));

        assertNotEquals(UnitIdentity.of("A", args), UnitIdentity.of("B", args));
        assertNotEquals(
            UnitIdentity.of("A", args),
            UnitIdentity.of("A", new BsonDocument("column", new BsonString("education_num"))));
        assertTrue(UnitIdentity.of("A", args).compareTo(UnitIdentity.of("B", args)) < 0);
        assertTrue(UnitIdentity.of("A", args).toString().startsWith("A{"));
    }

    @Test
    void rejectsBlankType() {
        IllegalArgumentException error =
            assertThrows(IllegalArgumentException.class, () -> UnitIdentity.of(" ", new BsonDocument()));
        assertEquals("type must not be blank", error.getMessage());
    }
}
