package org.driftlens.workspace;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.driftlens.dashboard.DashboardConfig;
import org.driftlens.dashboard.DashboardPanel;
import org.driftlens.dashboard.PanelAggregator;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.render.DashboardInfo;
import org.driftlens.render.RendererRegistry;
import org.driftlens.report.ReportBase;
import org.driftlens.report.ReportSnapshots;
import org.driftlens.snapshot.Snapshot;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.store.FileSnapshotStore;
import org.driftlens.unit.UnitRegistry;

/**
 * A named set of snapshots with a dashboard, stored as {@code <workspace>/<id>/project.json} plus
 * {@code <workspace>/<id>/snapshots/<snapshotId>.json}.
 */
public final class Project {
    static final String PROJECT_FILE = "project.json";
    static final String SNAPSHOTS_DIRECTORY = "snapshots";

    private final Path directory;
    private final DashboardConfig dashboard;
    private final FileSnapshotStore snapshots;
    private final UnitRegistry unitRegistry;
    private final RendererRegistry rendererRegistry;
    private final JsonLinesLogger logger;
    private ProjectInfo info;

    Project(
            final Path directory,
            final ProjectInfo info,
            final DashboardConfig dashboard,
            final UnitRegistry unitRegistry,
            final RendererRegistry rendererRegistry,
            final JsonLinesLogger logger) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.info = Objects.requireNonNull(info, "info");
        this.dashboard = Objects.requireNonNull(dashboard, "dashboard");
        this.unitRegistry = Objects.requireNonNull(unitRegistry, "unitRegistry");
        this.rendererRegistry = Objects.requireNonNull(rendererRegistry, "rendererRegistry");
        this.logger = Objects.requireNonNull(logger, "logger");
        this.snapshots = new FileSnapshotStore(directory.resolve(SNAPSHOTS_DIRECTORY), logger);
    }

    public String id() {
        return info.id();
    }

    public String name() {
        return info.name();
    }

    public ProjectInfo info() {
        return info;
    }

    public DashboardConfig dashboard() {
        return dashboard;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Appends a panel. Call {@link #save()} to persist it.
     */
    public void addPanel(final DashboardPanel panel) {
        dashboard.addPanel(panel);
    }

    public void save() {
        final Path target = directory.resolve(PROJECT_FILE);
        try {
            Files.createDirectories(directory);
            final Path temp = Files.createTempFile(directory, "." + PROJECT_FILE, ".tmp");
            Files.writeString(temp, ProjectCodec.toJson(info, dashboard), StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException atomicMoveNotSupported) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to write project " + target, e);
        }
        logger.debug("project.saved", logContext(), Map.of("path", target.toString()));
    }

    /**
     * Replaces name, description and default date range, then saves.
     */
    public ProjectInfo updateInfo(
            final String name, final String description, final Instant dateFrom, final Instant dateTo) {
        info = info.withDetails(name, description, dateFrom, dateTo);
        save();
        return info;
    }

    public void addSnapshot(final Snapshot snapshot) {
        snapshots.save(snapshot);
        logger.info("project.snapshot.added", logContext(), Map.of(
                "snapshotId", snapshot.id(),
                "kind", snapshot.kind().value()));
    }

    /**
     * Report snapshots ordered by timestamp.
     */
    public List<Snapshot> reports() {
        return snapshotsOf(SnapshotKind.REPORT);
    }

    /**
     * Test suite snapshots ordered by timestamp.
     */
    public List<Snapshot> testSuites() {
        return snapshotsOf(SnapshotKind.TEST_SUITE);
    }

    public List<Snapshot> allSnapshots() {
        return snapshots.loadAll().stream()
                .sorted(Comparator.comparing(Snapshot::timestamp))
                .toList();
    }

    /**
     * @throws org.driftlens.error.NotFoundException if the project has no such snapshot
     */
    public Snapshot getSnapshot(final String snapshotId) {
        return snapshots.load(snapshotId);
    }

    public ReportBase restoreSnapshot(final String snapshotId) {
        return ReportSnapshots.restore(getSnapshot(snapshotId), unitRegistry, rendererRegistry, logger);
    }

    /**
     * Payload of one additional graph of a stored report.
     *
     * @throws org.driftlens.error.NotFoundException if the snapshot or the graph does not exist
     */
    public BsonDocument graphData(final String snapshotId, final String graphId) {
        return restoreSnapshot(snapshotId).asDashboard().graph(graphId);
    }

    /**
     * Dashboard over the snapshots in {@code [from, to]}; a null bound falls back to the project's default range.
     */
    public DashboardInfo buildDashboard(final Instant from, final Instant to) {
        final Instant effectiveFrom = from == null ? info.dateFrom() : from;
        final Instant effectiveTo = to == null ? info.dateTo() : to;
        return dashboard.build(allSnapshots(), effectiveFrom, effectiveTo, new PanelAggregator(), logger, logContext());
    }

    private List<Snapshot> snapshotsOf(final SnapshotKind kind) {
        return allSnapshots().stream().filter(snapshot -> snapshot.kind() == kind).toList();
    }

    private LogContext logContext() {
        return LogContext.builder("project").projectId(info.id()).build();
    }
}
