package org.driftlens.store;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.render.RendererRegistry;
import org.driftlens.report.ReportBase;
import org.driftlens.report.ReportSnapshots;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.suite.Context;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.UnitIdentity;
import org.driftlens.unit.UnitRegistry;
import org.driftlens.unit.UnitResult;

/**
 * Loads a directory of snapshots as reports ordered by timestamp. Both bounds are inclusive and an absent bound
 * is open.
 */
public final class TimeSeriesLoader {
    private final UnitRegistry unitRegistry;
    private final RendererRegistry rendererRegistry;
    private final JsonLinesLogger logger;
    private final LogContext logContext;

    public TimeSeriesLoader(final UnitRegistry unitRegistry, final RendererRegistry rendererRegistry) {
        this(unitRegistry, rendererRegistry, JsonLinesLogger.noop());
    }

    public TimeSeriesLoader(
            final UnitRegistry unitRegistry,
            final RendererRegistry rendererRegistry,
            final JsonLinesLogger logger) {
        this.unitRegistry = Objects.requireNonNull(unitRegistry, "unitRegistry");
        this.rendererRegistry = Objects.requireNonNull(rendererRegistry, "rendererRegistry");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.logContext = LogContext.of("loader");
    }

    /**
     * Every snapshot of the given kind in the window, restored. Files of the other kind are skipped; a file that
     * does not decode fails the whole load. When two snapshots share a timestamp the later file wins.
     */
    public NavigableMap<Instant, ReportBase> loadSeries(
            final Path directory, final SnapshotKind kind, final Instant from, final Instant to) {
        Objects.requireNonNull(directory, "directory");
        Objects.requireNonNull(kind, "kind");
        final NavigableMap<Instant, ReportBase> series = new TreeMap<>();
        if (from != null && to != null && from.isAfter(to)) {
            return series;
        }
        final List<Snapshot> snapshots = new FileSnapshotStore(directory, logger).loadAll();
        int skipped = 0;
        for (final Snapshot snapshot : snapshots) {
            if (snapshot.kind() != kind) {
                skipped++;
                continue;
            }
            if (!within(snapshot.timestamp(), from, to)) {
                continue;
            }
            final ReportBase report = ReportSnapshots.restore(snapshot, unitRegistry, rendererRegistry, logger);
            final ReportBase replaced = series.put(snapshot.timestamp(), report);
            if (replaced != null) {
                logger.warn("loader.timestamp.duplicate", logContext, Map.of(
                        "timestamp", snapshot.timestamp().toString(),
                        "kept", snapshot.id(),
                        "dropped", replaced.id()));
            }
        }
        logger.info("loader.series.loaded", logContext, Map.of(
                "directory", directory.toString(),
                "kind", kind.value(),
                "loaded", series.size(),
                "skipped", skipped));
        return series;
    }

    public NavigableMap<Instant, ReportBase> loadSeries(final Path directory, final SnapshotKind kind) {
        return loadSeries(directory, kind, null, null);
    }

    /**
     * Per unit identity, the unit's result at each report timestamp.
     *
     * <p>With {@code units} null, every first-level unit of every report contributes. Otherwise only reports whose
     * unit list contains a requested identity contribute to it, and the requested unit instance is bound to that
     * report's context while its result is read, so it stays bound to the last report read.
     */
    public Map<UnitIdentity, NavigableMap<Instant, UnitResult>> loadMetricTimeSeries(
            final Path directory, final Instant from, final Instant to, final List<? extends ComputationalUnit> units) {
        final NavigableMap<Instant, ReportBase> reports = loadSeries(directory, SnapshotKind.REPORT, from, to);
        final Map<UnitIdentity, NavigableMap<Instant, UnitResult>> series = new LinkedHashMap<>();
        for (final Map.Entry<Instant, ReportBase> entry : reports.entrySet()) {
            final ReportBase report = entry.getValue();
            if (units == null) {
                for (final ComputationalUnit unit : report.firstLevelUnits()) {
                    series.computeIfAbsent(unit.identity(), key -> new TreeMap<>())
                            .put(entry.getKey(), report.resultOf(unit));
                }
                continue;
            }
            final Context context = report.suite().context();
            for (final ComputationalUnit unit : units) {
                final UnitIdentity identity = unit.identity();
                if (!report.suite().contains(identity)) {
                    continue;
                }
                unit.bindContext(context);
                series.computeIfAbsent(identity, key -> new TreeMap<>()).put(entry.getKey(), unit.result());
            }
        }
        return Collections.unmodifiableMap(series);
    }

    public Map<UnitIdentity, NavigableMap<Instant, UnitResult>> loadMetricTimeSeries(
            final Path directory, final Instant from, final Instant to) {
        return loadMetricTimeSeries(directory, from, to, null);
    }

    private static boolean within(final Instant timestamp, final Instant from, final Instant to) {
        if (from != null && timestamp.isBefore(from)) {
            return false;
        }
        return to == null || !timestamp.isAfter(to);
    }
}
