package org.driftlens.dashboard;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;
import org.driftlens.error.FieldNotFoundException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.render.DashboardInfo;
import org.driftlens.render.WidgetInfo;
import org.driftlens.snapshot.Snapshot;

/**
 * Named, ordered list of panels of a project dashboard.
 */
public final class DashboardConfig {
    private final String name;
    private final List<DashboardPanel> panels;

    public DashboardConfig(final String name, final List<DashboardPanel> panels) {
        this.name = Objects.requireNonNull(name, "name");
        this.panels = new ArrayList<>(panels);
    }

    public static DashboardConfig empty(final String name) {
        return new DashboardConfig(name, List.of());
    }

    public String name() {
        return name;
    }

    public List<DashboardPanel> panels() {
        return Collections.unmodifiableList(panels);
    }

    public void addPanel(final DashboardPanel panel) {
        panels.add(Objects.requireNonNull(panel, "panel"));
    }

    public DashboardInfo build(final List<Snapshot> snapshots, final Instant from, final Instant to) {
        return build(snapshots, from, to, new PanelAggregator(), JsonLinesLogger.noop(), LogContext.of("dashboard"));
    }

    /**
     * Renders every panel over the snapshots inside {@code [from, to]} (either bound may be null). A panel whose
     * field path does not resolve becomes an error widget; the other panels are unaffected.
     */
    public DashboardInfo build(
            final List<Snapshot> snapshots,
            final Instant from,
            final Instant to,
            final PanelAggregator aggregator,
            final JsonLinesLogger logger,
            final LogContext logContext) {
        Objects.requireNonNull(snapshots, "snapshots");
        final List<Snapshot> window = new ArrayList<>();
        for (final Snapshot snapshot : snapshots) {
            if (from != null && snapshot.timestamp().isBefore(from)) {
                continue;
            }
            if (to != null && snapshot.timestamp().isAfter(to)) {
                continue;
            }
            window.add(snapshot);
        }
        final List<WidgetInfo> widgets = new ArrayList<>(panels.size());
        for (final DashboardPanel panel : panels) {
            try {
                widgets.add(panel.build(window, aggregator));
            } catch (final FieldNotFoundException e) {
                logger.warn("dashboard.panel.failed", logContext, Map.of(
                        "panelId", panel.id(),
                        "path", e.path(),
                        "segment", e.segment()));
                widgets.add(new WidgetInfo(panel.id(), "error", panel.title(), panel.size(), new BsonDocument()
                        .append("message", new BsonString(e.getMessage()))
                        .append("path", new BsonString(e.path()))
                        .append("segment", new BsonString(e.segment())), List.of()));
            }
        }
        logger.debug("dashboard.built", logContext, Map.of("panels", panels.size(), "snapshots", window.size()));
        return new DashboardInfo(name, widgets);
    }

    public BsonDocument toDocument() {
        final BsonArray encoded = new BsonArray(panels.size());
        panels.forEach(panel -> encoded.add(panel.toDocument()));
        return new BsonDocument()
                .append("name", new BsonString(name))
                .append("panels", encoded);
    }

    public static DashboardConfig fromDocument(
            final BsonDocument document, final String path, final AggregationCatalog aggregations) {
        final String name = PanelValue.requireString(document, "name", path);
        final BsonValue rawPanels = document.get("panels");
        final List<DashboardPanel> panels = new ArrayList<>();
        if (rawPanels != null) {
            if (!rawPanels.isArray()) {
                throw new ConfigurationException(path + ".panels must be an array");
            }
            for (int i = 0; i < rawPanels.asArray().size(); i++) {
                final BsonValue panel = rawPanels.asArray().get(i);
                final String panelPath = path + ".panels[" + i + "]";
                if (!panel.isDocument()) {
                    throw new ConfigurationException(panelPath + " must be an object");
                }
                panels.add(DashboardPanel.fromDocument(panel.asDocument(), panelPath, aggregations));
            }
        }
        return new DashboardConfig(name, panels);
    }
}
