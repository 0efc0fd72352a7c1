package org.driftlens.dashboard;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;
import org.driftlens.render.WidgetInfo;
import org.driftlens.snapshot.Snapshot;

/**
 * One widget of a project dashboard, computed from the project's snapshots.
 */
public abstract class DashboardPanel {
    private final String id;
    private final String title;
    private final int size;
    private final ReportFilter filter;

    protected DashboardPanel(final String id, final String title, final int size, final ReportFilter filter) {
        this.id = id == null ? UUID.randomUUID().toString() : id;
        this.title = Objects.requireNonNull(title, "title");
        if (size != WidgetInfo.HALF_WIDTH && size != WidgetInfo.FULL_WIDTH) {
            throw new ConfigurationException("panel size must be 1 or 2: " + size);
        }
        this.size = size;
        this.filter = filter == null ? ReportFilter.any() : filter;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public int size() {
        return size;
    }

    public ReportFilter filter() {
        return filter;
    }

    /**
     * Type tag written to the persisted form.
     */
    public abstract String panelType();

    /**
     * @throws org.driftlens.error.FieldNotFoundException if a selected unit lacks a requested field
     */
    public abstract WidgetInfo build(List<Snapshot> snapshots, PanelAggregator aggregator);

    protected abstract void appendDetails(BsonDocument document);

    public final BsonDocument toDocument() {
        final BsonDocument document = new BsonDocument()
                .append("id", new BsonString(id))
                .append("type", new BsonString(panelType()))
                .append("title", new BsonString(title))
                .append("size", new BsonInt32(size))
                .append("filter", filter.toDocument());
        appendDetails(document);
        return document;
    }

    protected final WidgetInfo widget(final String widgetType, final BsonDocument params) {
        return new WidgetInfo(id, widgetType, title, size, params, List.of());
    }

    /**
     * @throws ConfigurationException naming {@code path} when the document is not a valid panel
     */
    public static DashboardPanel fromDocument(
            final BsonDocument document, final String path, final AggregationCatalog aggregations) {
        Objects.requireNonNull(document, "document");
        final String type = PanelValue.requireString(document, "type", path).toLowerCase(Locale.ROOT);
        final String title = PanelValue.requireString(document, "title", path);
        final BsonValue idValue = document.get("id");
        final String id = idValue != null && idValue.isString() ? idValue.asString().getValue() : null;
        final BsonValue sizeValue = document.get("size");
        final int size = sizeValue == null ? WidgetInfo.FULL_WIDTH : requireInt(sizeValue, path + ".size");
        final BsonValue filterValue = document.get("filter");
        if (filterValue != null && !filterValue.isDocument()) {
            throw new ConfigurationException(path + ".filter must be an object");
        }
        final ReportFilter filter = filterValue == null
                ? ReportFilter.any()
                : ReportFilter.fromDocument(filterValue.asDocument(), path + ".filter");
        return switch (type) {
            case PlotPanel.TYPE -> PlotPanel.fromDocument(id, title, size, filter, document, path, aggregations);
            case CounterPanel.TYPE -> CounterPanel.fromDocument(id, title, size, filter, document, path, aggregations);
            default -> throw new ConfigurationException(
                    path + ".type must be one of: plot|counter (actual: " + type + ")");
        };
    }

    static int requireInt(final BsonValue value, final String path) {
        if (!value.isNumber()) {
            throw new ConfigurationException(path + " must be a number");
        }
        return value.asNumber().intValue();
    }
}
