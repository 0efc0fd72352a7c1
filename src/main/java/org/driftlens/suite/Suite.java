package org.driftlens.suite;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;
import org.driftlens.data.DataDefinition;
import org.driftlens.data.Dataset;
import org.driftlens.data.GeneratedFeature;
import org.driftlens.data.InputData;
import org.driftlens.error.ComputationException;
import org.driftlens.error.ConfigurationException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.obs.RunJournal;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.UnitIdentity;
import org.driftlens.unit.UnitResult;

/**
 * Owns the ordered unit graph and its {@link Context}, and runs every unit exactly once in insertion order.
 *
 * <p>Single-flight: one run at a time per instance. Callers that run concurrently use one suite each.
 */
public final class Suite {
    private final List<ComputationalUnit> units = new ArrayList<>();
    private final Map<UnitIdentity, Integer> indexByIdentity = new HashMap<>();
    private final Context context = new Context();
    private final JsonLinesLogger logger;
    private final RunJournal journal;
    private final LogContext logContext;
    private SuiteState state = SuiteState.UNINITIALIZED;

    public Suite(final String runId) {
        this(runId, JsonLinesLogger.noop(), new RunJournal());
    }

    public Suite(final String runId, final JsonLinesLogger logger, final RunJournal journal) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.journal = Objects.requireNonNull(journal, "journal");
        this.logContext = LogContext.builder("suite").runId(runId).build();
    }

    /**
     * Builds a suite in {@link SuiteState#COMPLETE} from stored units and their results. No unit is computed.
     */
    public static Suite restored(
            final String runId,
            final List<? extends ComputationalUnit> units,
            final List<UnitResult> results,
            final JsonLinesLogger logger) {
        Objects.requireNonNull(units, "units");
        Objects.requireNonNull(results, "results");
        if (units.size() != results.size()) {
            throw new IllegalArgumentException(
                    "units and results differ in size: " + units.size() + " vs " + results.size());
        }
        final Suite suite = new Suite(runId, logger, new RunJournal());
        for (int i = 0; i < units.size(); i++) {
            final ComputationalUnit unit = units.get(i);
            final UnitIdentity identity = unit.identity();
            if (suite.indexByIdentity.putIfAbsent(identity, i) != null) {
                throw new IllegalArgumentException("duplicate unit " + identity + " at index " + i);
            }
            suite.units.add(unit);
            suite.context.restore(identity, results.get(i));
            unit.bindContext(suite.context);
        }
        suite.state = SuiteState.COMPLETE;
        return suite;
    }

    public void reset() {
        units.clear();
        indexByIdentity.clear();
        context.clear();
        journal.clear();
        state = SuiteState.RESET;
    }

    public void verify(final Dataset current) {
        requireState("verify", SuiteState.RESET);
        if (current == null) {
            throw new ConfigurationException("current dataset should be present");
        }
        state = SuiteState.VERIFIED;
    }

    /**
     * Registers the unit after its dependencies, skipping identities that are already present.
     *
     * @return index of the unit in the suite's unit list
     */
    public int register(final ComputationalUnit unit) {
        Objects.requireNonNull(unit, "unit");
        requireState("register", SuiteState.RESET, SuiteState.VERIFIED);
        return register(unit, new HashSet<>());
    }

    private int register(final ComputationalUnit unit, final Set<UnitIdentity> inProgress) {
        final UnitIdentity identity = unit.identity();
        final Integer existing = indexByIdentity.get(identity);
        if (existing != null) {
            unit.bindContext(context);
            return existing;
        }
        if (!inProgress.add(identity)) {
            throw new ConfigurationException("dependency cycle through unit " + identity);
        }
        for (final ComputationalUnit dependency : unit.dependencies()) {
            register(Objects.requireNonNull(dependency, "dependency of " + identity), inProgress);
        }
        inProgress.remove(identity);
        final int index = units.size();
        units.add(unit);
        indexByIdentity.put(identity, index);
        unit.bindContext(context);
        return index;
    }

    /**
     * Generates every feature required by a registered unit once, for both datasets.
     */
    public AdditionalFeatures createAdditionalFeatures(
            final Dataset current, final Dataset reference, final DataDefinition definition) {
        requireState("createAdditionalFeatures", SuiteState.VERIFIED);
        final Map<String, GeneratedFeature> required = new LinkedHashMap<>();
        for (final ComputationalUnit unit : units) {
            for (final GeneratedFeature feature : unit.requiredFeatures()) {
                required.putIfAbsent(feature.name(), feature);
            }
        }
        if (required.isEmpty()) {
            return AdditionalFeatures.none();
        }
        final Map<String, List<Object>> currentFeatures = new LinkedHashMap<>();
        final Map<String, List<Object>> referenceFeatures = new LinkedHashMap<>();
        for (final GeneratedFeature feature : required.values()) {
            currentFeatures.put(feature.name(), generate(feature, current, definition));
            if (reference != null) {
                referenceFeatures.put(feature.name(), generate(feature, reference, definition));
            }
        }
        logger.debug("suite.features.generated", logContext, Map.of("features", List.copyOf(required.keySet())));
        return new AdditionalFeatures(currentFeatures, referenceFeatures);
    }

    private static List<Object> generate(
            final GeneratedFeature feature, final Dataset dataset, final DataDefinition definition) {
        final List<Object> values = feature.generate(dataset, definition);
        if (values == null || values.size() != dataset.rowCount()) {
            throw new ConfigurationException("feature " + feature.name() + " must produce one value per row");
        }
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    public void runCalculate(final InputData data) {
        Objects.requireNonNull(data, "data");
        requireState("runCalculate", SuiteState.VERIFIED);
        state = SuiteState.RUNNING;
        logger.info("suite.run.start", logContext, Map.of("units", units.size()));
        for (final ComputationalUnit unit : units) {
            final long started = System.nanoTime();
            try {
                context.computeOnce(unit, data);
            } catch (ComputationException failure) {
                journal.record(unit.identity().toString(), System.nanoTime() - started, failure.getMessage());
                state = SuiteState.FAILED;
                logger.error("suite.unit.failed", logContext, Map.of(
                        "unit", failure.unitIdentity(),
                        "error", String.valueOf(failure.getCause())));
                throw failure;
            }
            final long elapsed = System.nanoTime() - started;
            journal.record(unit.identity().toString(), elapsed, null);
            logger.debug("suite.unit.computed", logContext, Map.of(
                    "unit", unit.identity().toString(),
                    "durationNanos", elapsed));
        }
        state = SuiteState.COMPLETE;
        logger.info("suite.run.complete", logContext, Map.of("units", units.size()));
    }

    public List<ComputationalUnit> units() {
        return Collections.unmodifiableList(units);
    }

    public ComputationalUnit unit(final int index) {
        if (index < 0 || index >= units.size()) {
            throw new IndexOutOfBoundsException("unit index " + index + " out of range [0, " + units.size() + ")");
        }
        return units.get(index);
    }

    public OptionalInt indexOf(final UnitIdentity identity) {
        final Integer index = indexByIdentity.get(identity);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean contains(final UnitIdentity identity) {
        return indexByIdentity.containsKey(identity);
    }

    public Context context() {
        return context;
    }

    public SuiteState state() {
        return state;
    }

    public RunJournal journal() {
        return journal;
    }

    private void requireState(final String operation, final SuiteState... allowed) {
        for (final SuiteState candidate : allowed) {
            if (state == candidate) {
                return;
            }
        }
        throw new IllegalStateException(operation + " is not allowed in state " + state);
    }
}
