package org.driftlens.report;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.driftlens.error.CorruptSnapshotException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.render.RenderOptions;
import org.driftlens.render.RendererRegistry;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.snapshot.SnapshotUnit;
import org.driftlens.suite.Suite;
import org.driftlens.suite.SuiteState;
import org.driftlens.unit.BsonValues;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.UnitFactory;
import org.driftlens.unit.UnitIdentity;
import org.driftlens.unit.UnitKind;
import org.driftlens.unit.UnitRegistry;
import org.driftlens.unit.UnitResult;

/**
 * Conversion between computed reports and {@link Snapshot}s. Restoring never recomputes a unit.
 */
public final class ReportSnapshots {
    private ReportSnapshots() {}

    public static Snapshot capture(final ReportBase report) {
        Objects.requireNonNull(report, "report");
        final Suite suite = report.suite();
        if (suite.state() != SuiteState.COMPLETE) {
            throw new IllegalStateException("report " + report.id() + " cannot be captured in state " + suite.state());
        }
        final List<SnapshotUnit> units = new ArrayList<>(suite.units().size());
        for (final ComputationalUnit unit : suite.units()) {
            units.add(new SnapshotUnit(unit.type(), unit.args(), suite.context().resultOf(unit)));
        }
        return new Snapshot(
                report.id(),
                report.timestamp(),
                report.snapshotKind(),
                BsonValues.toDocument(report.metadata()),
                report.tags(),
                report.options().toDocument(),
                units,
                report.firstLevelIndices());
    }

    public static ReportBase restore(
            final Snapshot snapshot, final UnitRegistry unitRegistry, final RendererRegistry rendererRegistry) {
        return restore(snapshot, unitRegistry, rendererRegistry, JsonLinesLogger.noop());
    }

    /**
     * Rebuilds the report a snapshot was captured from, as a {@link Report} or a {@link TestSuite} by kind.
     *
     * @throws CorruptSnapshotException if a unit type is unknown, a rebuilt unit does not reproduce its stored
     *     identity, an identity occurs twice, or a first-level unit is of the wrong kind
     */
    public static ReportBase restore(
            final Snapshot snapshot,
            final UnitRegistry unitRegistry,
            final RendererRegistry rendererRegistry,
            final JsonLinesLogger logger) {
        Objects.requireNonNull(snapshot, "snapshot");
        Objects.requireNonNull(unitRegistry, "unitRegistry");
        Objects.requireNonNull(rendererRegistry, "rendererRegistry");
        Objects.requireNonNull(logger, "logger");

        final List<String> problems = new ArrayList<>();
        final List<ComputationalUnit> units = new ArrayList<>(snapshot.units().size());
        final List<UnitResult> results = new ArrayList<>(snapshot.units().size());
        final Map<UnitIdentity, Integer> seen = new HashMap<>();
        for (int i = 0; i < snapshot.units().size(); i++) {
            final SnapshotUnit stored = snapshot.units().get(i);
            final String path = "units[" + i + "]";
            final UnitIdentity storedIdentity;
            try {
                storedIdentity = stored.identity();
            } catch (final IllegalArgumentException e) {
                problems.add(path + " has no valid identity: " + e.getMessage());
                continue;
            }
            final Integer previous = seen.putIfAbsent(storedIdentity, i);
            if (previous != null) {
                problems.add(path + " repeats unit " + storedIdentity + " first stored at units[" + previous + "]");
                continue;
            }
            final Optional<UnitFactory> factory = unitRegistry.find(stored.type());
            if (factory.isEmpty()) {
                problems.add(path + " has unknown unit type '" + stored.type() + "'");
                continue;
            }
            final ComputationalUnit unit;
            try {
                unit = Objects.requireNonNull(factory.get().create(stored.args()), "factory result");
            } catch (final RuntimeException e) {
                problems.add(path + " cannot be rebuilt from its args: " + e.getMessage());
                continue;
            }
            if (!storedIdentity.equals(unit.identity())) {
                problems.add(path + " rebuilds as " + unit.identity() + " instead of " + storedIdentity);
                continue;
            }
            units.add(unit);
            results.add(stored.result());
        }

        final UnitKind expectedKind = snapshot.kind() == SnapshotKind.TEST_SUITE ? UnitKind.TEST : UnitKind.METRIC;
        if (problems.isEmpty()) {
            for (final Integer index : snapshot.firstLevelIndices()) {
                final ComputationalUnit unit = units.get(index);
                if (unit.kind() != expectedKind) {
                    problems.add("first level unit " + unit.identity() + " is a " + unit.kind().key()
                            + " in a " + snapshot.kind().value() + " snapshot");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new CorruptSnapshotException(problems);
        }

        final ReportBase report = snapshot.kind() == SnapshotKind.TEST_SUITE
                ? describe(TestSuite.builder(), snapshot, rendererRegistry, logger)
                : describe(Report.builder(), snapshot, rendererRegistry, logger);
        report.restoreFrom(Suite.restored(snapshot.id(), units, results, logger), snapshot.firstLevelIndices());
        logger.debug("report.snapshot.restored", LogContext.builder("report").snapshotId(snapshot.id()).build(),
                Map.of("units", units.size(), "kind", snapshot.kind().value()));
        return report;
    }

    private static <R extends ReportBase, B extends ReportBase.Builder<R, B>> R describe(
            final B builder,
            final Snapshot snapshot,
            final RendererRegistry rendererRegistry,
            final JsonLinesLogger logger) {
        return builder
                .id(snapshot.id())
                .timestamp(snapshot.timestamp())
                .metadata(BsonValues.toJavaMap(snapshot.metadata()))
                .tags(snapshot.tags())
                .options(RenderOptions.fromDocument(snapshot.options()))
                .renderers(rendererRegistry)
                .logger(logger)
                .build();
    }

    public static Report restoreReport(
            final Snapshot snapshot, final UnitRegistry unitRegistry, final RendererRegistry rendererRegistry) {
        requireKind(snapshot, SnapshotKind.REPORT);
        return (Report) restore(snapshot, unitRegistry, rendererRegistry);
    }

    public static TestSuite restoreTestSuite(
            final Snapshot snapshot, final UnitRegistry unitRegistry, final RendererRegistry rendererRegistry) {
        requireKind(snapshot, SnapshotKind.TEST_SUITE);
        return (TestSuite) restore(snapshot, unitRegistry, rendererRegistry);
    }

    private static void requireKind(final Snapshot snapshot, final SnapshotKind expected) {
        if (Objects.requireNonNull(snapshot, "snapshot").kind() != expected) {
            throw new IllegalArgumentException(
                    "snapshot " + snapshot.id() + " is a " + snapshot.kind().value() + ", expected " + expected.value());
        }
    }
}
