package org.driftlens.suite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.driftlens.data.ColumnInference;
import org.driftlens.data.ColumnMapping;
import org.driftlens.data.DatasetColumns;
import org.driftlens.data.InMemoryDataset;
import org.driftlens.data.InputData;
import org.driftlens.error.ConfigurationException;
import org.driftlens.error.GenerationException;
import org.driftlens.unit.CheckItem;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.Generator;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.Preset;
import org.driftlens.unit.ResultContext;
import org.driftlens.unit.TestUnit;
import org.driftlens.unit.UnitIdentity;
import org.driftlens.unit.UnitKind;
import org.junit.jupiter.api.Test;

class ItemExpanderTest {
    private static final InputData DATA = inputData();

    @Test
    void expandsUnitsPresetsAndGeneratorsInOrder() {
        List<CheckItem> items = List.of(
            CheckItem.unit(new ValueMetric("a", 1)),
            CheckItem.preset(new QualityPreset()),
            CheckItem.generator(new PerColumnGenerator()));

        Expansion expansion = new ItemExpander().expand(items, DATA, UnitKind.METRIC);

        assertEquals(
            List.of(
                new ValueMetric("a", 1).identity(),
                new ValueMetric("b", 1).identity(),
                new ValueMetric("age", 0).identity(),
                new ValueMetric("score", 0).identity(),
                new ValueMetric("age", 0).identity(),
                new ValueMetric("score", 0).identity()),
            identities(expansion.units()));
        assertEquals(List.of("QualityPreset"), expansion.presets());
        assertEquals(List.of("PerColumnGenerator"), expansion.generators());
    }

    @Test
    void expansionIsDeterministic() {
        List<CheckItem> items = List.of(CheckItem.preset(new QualityPreset()), CheckItem.unit(new ValueMetric("a", 1)));

        Expansion first = new ItemExpander().expand(items, DATA, UnitKind.METRIC);
        Expansion second = new ItemExpander().expand(items, DATA, UnitKind.METRIC);

        assertEquals(identities(first.units()), identities(second.units()));
    }

    @Test
    void recordsProvenanceUnderKindSpecificKeys() {
        Expansion expansion = new ItemExpander().expand(
            List.of(CheckItem.unit(new ValueMetric("a", 1)), CheckItem.preset(new QualityPreset())),
            DATA,
            UnitKind.METRIC);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("metric_presets", List.of("EarlierPreset"));

        expansion.recordProvenance(metadata, UnitKind.METRIC);

        assertEquals(List.of("EarlierPreset", "QualityPreset"), metadata.get("metric_presets"));
        assertFalse(metadata.containsKey("metric_generators"));
        assertFalse(metadata.containsKey("test_presets"));
    }

    @Test
    void generatorWithNullElementFails() {
        Generator broken = columns -> Arrays.asList(new ValueMetric("a", 1), null);

        GenerationException error = assertThrows(
            GenerationException.class,
            () -> new ItemExpander().expand(List.of(CheckItem.generator(broken)), DATA, UnitKind.METRIC));
        assertTrue(error.getMessage().contains("incorrect element"));
    }

    @Test
    void generatorProducingTheWrongKindFails() {
        Generator tests = columns -> List.of(new AlwaysPasses());

        assertThrows(
            GenerationException.class,
            () -> new ItemExpander().expand(List.of(CheckItem.generator(tests)), DATA, UnitKind.METRIC));
    }

    @Test
    void presetsDoNotNest() {
        Preset outer = new Preset() {
            @Override
            public String name() {
                return "Outer";
            }

            @Override
            public List<CheckItem> generate(InputData data, DatasetColumns columns) {
                return List.of(CheckItem.preset(new QualityPreset()));
            }
        };

        GenerationException error = assertThrows(
            GenerationException.class,
            () -> new ItemExpander().expand(List.of(CheckItem.preset(outer)), DATA, UnitKind.METRIC));
        assertEquals("Outer", error.source());
    }

    @Test
    void presetWithNullElementFails() {
        Preset nulls = (data, columns) -> Arrays.asList(CheckItem.unit(new ValueMetric("a", 1)), null);

        assertThrows(
            GenerationException.class,
            () -> new ItemExpander().expand(List.of(CheckItem.preset(nulls)), DATA, UnitKind.METRIC));
    }

    @Test
    void bareUnitOfTheWrongKindIsAConfigurationError() {
        ConfigurationException error = assertThrows(
            ConfigurationException.class,
            () -> new ItemExpander().expand(List.of(CheckItem.unit(new AlwaysPasses())), DATA, UnitKind.METRIC));
        assertEquals(ConfigurationException.class, error.getClass());
    }

    private static List<UnitIdentity> identities(List<ComputationalUnit> units) {
        return units.stream().map(ComputationalUnit::identity).toList();
    }

    private static InputData inputData() {
        InMemoryDataset current = InMemoryDataset.builder()
            .column("age", List.of(30.0, 40.0))
            .column("score", List.of(1, 2))
            .column("city", List.of("Oslo", "Lima"))
            .build();
        ColumnMapping mapping = ColumnMapping.defaults();
        return InputData.of(
            null,
            current,
            mapping,
            ColumnInference.createDataDefinition(null, current, mapping),
            ColumnInference.processColumns(current, mapping));
    }

    static final class ValueMetric extends MetricUnit {
        private final String label;
        private final int value;

        ValueMetric(String label, int value) {
            this.label = label;
            this.value = value;
        }

        @Override
        public BsonDocument args() {
            return new BsonDocument("label", new BsonString(label)).append("value", new BsonInt32(value));
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            return new BsonDocument("value", new BsonInt32(value));
        }
    }

    static final class AlwaysPasses extends TestUnit {
        @Override
        public BsonDocument args() {
            return new BsonDocument();
        }

        @Override
        public String name() {
            return "Always passes";
        }

        @Override
        protected Outcome check(InputData data, ResultContext context) {
            return Outcome.of(true, "ok", null);
        }
    }

    static final class QualityPreset implements Preset {
        @Override
        public List<CheckItem> generate(InputData data, DatasetColumns columns) {
            return List.of(CheckItem.unit(new ValueMetric("b", 1)), CheckItem.generator(new PerColumnGenerator()));
        }
    }

    static final class PerColumnGenerator implements Generator {
        @Override
        public List<? extends ComputationalUnit> generate(DatasetColumns columns) {
            return columns.numericalFeatures().stream().map(column -> new ValueMetric(column, 0)).toList();
        }
    }
}
