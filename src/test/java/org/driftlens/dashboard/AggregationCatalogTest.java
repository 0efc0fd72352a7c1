package org.driftlens.dashboard;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.driftlens.error.ConfigurationException;
import org.junit.jupiter.api.Test;

class AggregationCatalogTest {
    @Test
    void standardNamesResolveIgnoringCase() {
        AggregationCatalog catalog = AggregationCatalog.standard();

        assertSame(StandardAggregation.MEAN, catalog.resolve("mean"));
        assertSame(StandardAggregation.LAST, catalog.resolve(" Last "));
        assertEquals(List.of("none", "last", "sum", "min", "max", "mean"), List.copyOf(catalog.names()));
    }

    @Test
    void unknownNameListsTheKnownOnes() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
            () -> AggregationCatalog.standard().resolve("median"));

        assertTrue(error.getMessage().contains("none|last|sum|min|max|mean"));
        assertThrows(ConfigurationException.class, () -> AggregationCatalog.standard().resolve(" "));
    }

    @Test
    void customAggregationIsAddedOnce() {
        Aggregation first = new Aggregation() {
            @Override
            public String name() {
                return "First";
            }

            @Override
            public List<SeriesPoint> apply(List<SeriesPoint> points) {
                return points.isEmpty() ? List.of() : List.of(points.get(0));
            }
        };

        AggregationCatalog catalog = AggregationCatalog.standard().with(first);

        assertSame(first, catalog.resolve("first"));
        assertThrows(IllegalArgumentException.class, () -> catalog.with(first));
        assertThrows(IllegalArgumentException.class, () -> catalog.with(StandardAggregation.SUM));
        assertThrows(ConfigurationException.class, () -> AggregationCatalog.standard().resolve("first"));
    }
}
