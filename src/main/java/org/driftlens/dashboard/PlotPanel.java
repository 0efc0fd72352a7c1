package org.driftlens.dashboard;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;
import org.driftlens.render.WidgetInfo;
import org.driftlens.snapshot.Snapshot;

/**
 * Chart with one series per panel value.
 */
public final class PlotPanel extends DashboardPanel {
    static final String TYPE = "plot";

    public enum PlotType {
        LINE, BAR, SCATTER, HISTOGRAM;

        static PlotType fromText(final String value, final String path) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (final IllegalArgumentException e) {
                throw new ConfigurationException(
                        path + " must be one of: line|bar|scatter|histogram (actual: " + value + ")", e);
            }
        }
    }

    private final List<PanelValue> values;
    private final PlotType plotType;

    public PlotPanel(
            final String id,
            final String title,
            final int size,
            final ReportFilter filter,
            final List<PanelValue> values,
            final PlotType plotType) {
        super(id, title, size, filter);
        this.values = List.copyOf(values);
        if (this.values.isEmpty()) {
            throw new ConfigurationException("plot panel '" + title + "' needs at least one value");
        }
        this.plotType = plotType == null ? PlotType.LINE : plotType;
    }

    public PlotPanel(final String title, final ReportFilter filter, final List<PanelValue> values, final PlotType plotType) {
        this(null, title, WidgetInfo.FULL_WIDTH, filter, values, plotType);
    }

    public List<PanelValue> values() {
        return values;
    }

    public PlotType plotType() {
        return plotType;
    }

    @Override
    public String panelType() {
        return TYPE;
    }

    @Override
    public WidgetInfo build(final List<Snapshot> snapshots, final PanelAggregator aggregator) {
        final BsonArray series = new BsonArray(values.size());
        for (final PanelValue value : values) {
            series.add(aggregator.aggregate(snapshots, filter(), value).toDocument());
        }
        return widget("plot", new BsonDocument()
                .append("plot_type", new BsonString(plotType.name().toLowerCase(Locale.ROOT)))
                .append("series", series));
    }

    @Override
    protected void appendDetails(final BsonDocument document) {
        final BsonArray encoded = new BsonArray(values.size());
        values.forEach(value -> encoded.add(value.toDocument()));
        document.append("plot_type", new BsonString(plotType.name().toLowerCase(Locale.ROOT)))
                .append("values", encoded);
    }

    static PlotPanel fromDocument(
            final String id,
            final String title,
            final int size,
            final ReportFilter filter,
            final BsonDocument document,
            final String path,
            final AggregationCatalog aggregations) {
        final BsonValue rawValues = document.get("values");
        if (rawValues == null || !rawValues.isArray()) {
            throw new ConfigurationException(path + ".values must be an array");
        }
        final List<PanelValue> values = new ArrayList<>();
        for (int i = 0; i < rawValues.asArray().size(); i++) {
            final BsonValue value = rawValues.asArray().get(i);
            final String valuePath = path + ".values[" + i + "]";
            if (!value.isDocument()) {
                throw new ConfigurationException(valuePath + " must be an object");
            }
            values.add(PanelValue.fromDocument(value.asDocument(), valuePath, aggregations));
        }
        final BsonValue plotType = document.get("plot_type");
        return new PlotPanel(
                id,
                title,
                size,
                filter,
                values,
                plotType != null && plotType.isString()
                        ? PlotType.fromText(plotType.asString().getValue(), path + ".plot_type")
                        : PlotType.LINE);
    }
}
