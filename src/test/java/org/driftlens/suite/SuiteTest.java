package org.driftlens.suite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.bson.BsonDocument;
import org.bson.BsonDouble;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.driftlens.data.ColumnInference;
import org.driftlens.data.ColumnMapping;
import org.driftlens.data.DataDefinition;
import org.driftlens.data.Dataset;
import org.driftlens.data.GeneratedFeature;
import org.driftlens.data.InMemoryDataset;
import org.driftlens.data.InputData;
import org.driftlens.error.ComputationException;
import org.driftlens.error.ConfigurationException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.RunJournal;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.ResultContext;
import org.driftlens.unit.UnitKind;
import org.driftlens.unit.UnitResult;
import org.junit.jupiter.api.Test;

class SuiteTest {
    private static final InMemoryDataset CURRENT = InMemoryDataset.builder()
        .column("value", Arrays.asList(1.0, 2.0, null))
        .build();

    @Test
    void sharedDependencyIsRegisteredAndComputedOnce() {
        AtomicInteger calls = new AtomicInteger();
        CountingMetric shared = new CountingMetric("shared", calls);
        DependentMetric left = new DependentMetric("left", shared);
        DependentMetric right = new DependentMetric("right", new CountingMetric("shared", calls));

        Suite suite = verifiedSuite();
        assertEquals(1, suite.register(left));
        assertEquals(2, suite.register(right));
        assertEquals(1, suite.register(new DependentMetric("left", shared)));
        suite.runCalculate(inputData());

        assertEquals(3, suite.units().size());
        assertEquals(1, calls.get());
        assertEquals(SuiteState.COMPLETE, suite.state());
        assertEquals("shared", left.result().field("from").asString().getValue());
        assertEquals("shared", right.result().field("from").asString().getValue());
        assertEquals(3, suite.journal().size());
    }

    @Test
    void protocolStepsMustRunInOrder() {
        Suite suite = new Suite("run-1");
        assertEquals(SuiteState.UNINITIALIZED, suite.state());
        assertThrows(IllegalStateException.class, () -> suite.register(new CountingMetric("a", new AtomicInteger())));

        suite.reset();
        assertEquals(SuiteState.RESET, suite.state());
        assertThrows(IllegalStateException.class, () -> suite.runCalculate(inputData()));

        ConfigurationException missingCurrent = assertThrows(ConfigurationException.class, () -> suite.verify(null));
        assertEquals("current dataset should be present", missingCurrent.getMessage());

        suite.verify(CURRENT);
        assertEquals(SuiteState.VERIFIED, suite.state());
    }

    @Test
    void failingUnitAbortsTheRunWithItsIdentity() {
        FailingMetric failing = new FailingMetric();
        AtomicInteger calls = new AtomicInteger();
        Suite suite = verifiedSuite();
        suite.register(failing);
        suite.register(new CountingMetric("after", calls));

        ComputationException error = assertThrows(ComputationException.class, () -> suite.runCalculate(inputData()));

        assertEquals(failing.identity().toString(), error.unitIdentity());
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(SuiteState.FAILED, suite.state());
        assertEquals(0, calls.get());
        RunJournal.Entry entry = suite.journal().entries().get(0);
        assertTrue(entry.failed());
        assertThrows(IllegalStateException.class, () -> suite.register(new CountingMetric("late", calls)));

        suite.reset();
        assertEquals(0, suite.units().size());
    }

    @Test
    void unitReturningNoResultFailsTheRun() {
        NullResultUnit silent = new NullResultUnit();
        Suite suite = verifiedSuite();
        suite.register(silent);

        ComputationException error = assertThrows(ComputationException.class, () -> suite.runCalculate(inputData()));

        assertEquals(silent.identity().toString(), error.unitIdentity());
        assertTrue(error.getMessage().endsWith("produced no result"));
        assertEquals(SuiteState.FAILED, suite.state());
        assertFalse(suite.context().contains(silent.identity()));
    }

    @Test
    void rejectsDependencyCycles() {
        CyclicMetric cyclic = new CyclicMetric("loop");
        Suite suite = verifiedSuite();

        assertThrows(ConfigurationException.class, () -> suite.register(cyclic));
    }

    @Test
    void requiredFeaturesAreGeneratedOncePerDataset() {
        AtomicInteger generated = new AtomicInteger();
        FeatureMetric first = new FeatureMetric("first", new DoublingFeature(generated));
        FeatureMetric second = new FeatureMetric("second", new DoublingFeature(generated));
        Suite suite = verifiedSuite();
        suite.register(first);
        suite.register(second);

        AdditionalFeatures features = suite.createAdditionalFeatures(CURRENT, CURRENT, definition());

        assertEquals(2, generated.get());
        assertEquals(Arrays.asList(2.0, 4.0, null), features.current().get("value__doubled"));
        assertEquals(features.current(), features.reference());

        InputData data = inputData().withAdditionalFeatures(features.current(), features.reference());
        suite.runCalculate(data);
        assertEquals(6.0, first.result().field("sum").asDouble().getValue());
    }

    @Test
    void featureOfTheWrongLengthIsRejected() {
        GeneratedFeature shortFeature = new GeneratedFeature() {
            @Override
            public String name() {
                return "short";
            }

            @Override
            public List<Object> generate(Dataset dataset, DataDefinition definition) {
                return List.of(1.0);
            }
        };
        Suite suite = verifiedSuite();
        suite.register(new FeatureMetric("short", shortFeature));

        assertThrows(ConfigurationException.class, () -> suite.createAdditionalFeatures(CURRENT, null, definition()));
    }

    @Test
    void restoredSuiteServesStoredResultsWithoutComputing() {
        FailingMetric failing = new FailingMetric();
        UnitResult stored = UnitResult.parse("{\"value\": 7}");

        Suite suite = Suite.restored("snap-1", List.of(failing), List.of(stored), JsonLinesLogger.noop());

        assertEquals(SuiteState.COMPLETE, suite.state());
        assertEquals(stored, failing.result());
        assertTrue(suite.contains(failing.identity()));
        assertFalse(suite.indexOf(new CountingMetric("x", new AtomicInteger()).identity()).isPresent());
    }

    @Test
    void contextNeverReplacesAResult() {
        Context context = new Context();
        CountingMetric unit = new CountingMetric("once", new AtomicInteger());
        context.restore(unit.identity(), UnitResult.parse("{\"a\": 1}"));

        assertThrows(IllegalStateException.class, () -> context.restore(unit.identity(), UnitResult.parse("{\"a\": 2}")));
        assertEquals(1, context.find(unit.identity()).orElseThrow().field("a").asInt32().getValue());
    }

    private static Suite verifiedSuite() {
        Suite suite = new Suite("run-1");
        suite.reset();
        suite.verify(CURRENT);
        return suite;
    }

    private static DataDefinition definition() {
        return ColumnInference.createDataDefinition(null, CURRENT, ColumnMapping.defaults());
    }

    private static InputData inputData() {
        ColumnMapping mapping = ColumnMapping.defaults();
        return InputData.of(null, CURRENT, mapping, definition(), ColumnInference.processColumns(CURRENT, mapping));
    }

    static final class CountingMetric extends MetricUnit {
        private final String label;
        private final AtomicInteger calls;

        CountingMetric(String label, AtomicInteger calls) {
            this.label = label;
            this.calls = calls;
        }

        @Override
        public BsonDocument args() {
            return new BsonDocument("label", new BsonString(label));
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            calls.incrementAndGet();
            return new BsonDocument("label", new BsonString(label));
        }
    }

    static final class DependentMetric extends MetricUnit {
        private final String label;
        private final ComputationalUnit dependency;

        DependentMetric(String label, ComputationalUnit dependency) {
            this.label = label;
            this.dependency = dependency;
        }

        @Override
        public BsonDocument args() {
            return new BsonDocument("label", new BsonString(label));
        }

        @Override
        public List<ComputationalUnit> dependencies() {
            return List.of(dependency);
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            return new BsonDocument("from", context.resultOf(dependency).field("label"));
        }
    }

    static final class FailingMetric extends MetricUnit {
        @Override
        public BsonDocument args() {
            return new BsonDocument();
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            throw new IllegalStateException("boom");
        }
    }

    static final class NullResultUnit implements ComputationalUnit {
        @Override
        public String type() {
            return "NullResultUnit";
        }

        @Override
        public UnitKind kind() {
            return UnitKind.METRIC;
        }

        @Override
        public BsonDocument args() {
            return new BsonDocument();
        }

        @Override
        public UnitResult compute(InputData data, ResultContext context) {
            return null;
        }

        @Override
        public void bindContext(ResultContext context) {
        }

        @Override
        public UnitResult result() {
            throw new IllegalStateException("never computed");
        }
    }

    static final class CyclicMetric extends MetricUnit {
        private final String label;

        CyclicMetric(String label) {
            this.label = label;
        }

        @Override
        public BsonDocument args() {
            return new BsonDocument("label", new BsonString(label));
        }

        @Override
        public List<ComputationalUnit> dependencies() {
            return List.of(new CyclicMetric(label));
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            return new BsonDocument("size", new BsonInt32(0));
        }
    }

    static final class DoublingFeature implements GeneratedFeature {
        private final AtomicInteger generated;

        DoublingFeature(AtomicInteger generated) {
            this.generated = generated;
        }

        @Override
        public String name() {
            return "value__doubled";
        }

        @Override
        public List<Object> generate(Dataset dataset, DataDefinition definition) {
            generated.incrementAndGet();
            return dataset.column("value").stream()
                .map(value -> value == null ? null : (Object) (((Double) value) * 2))
                .toList();
        }
    }

    static final class FeatureMetric extends MetricUnit {
        private final String label;
        private final GeneratedFeature feature;

        FeatureMetric(String label, GeneratedFeature feature) {
            this.label = label;
            this.feature = feature;
        }

        @Override
        public BsonDocument args() {
            return new BsonDocument("label", new BsonString(label));
        }

        @Override
        public List<GeneratedFeature> requiredFeatures() {
            return List.of(feature);
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            double sum = 0.0;
            for (Object value : data.currentColumn(feature.name())) {
                if (value != null) {
                    sum += (Double) value;
                }
            }
            return new BsonDocument("sum", new BsonDouble(sum));
        }
    }
}
