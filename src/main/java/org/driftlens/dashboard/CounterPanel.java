package org.driftlens.dashboard;

import java.util.List;
import org.bson.BsonDocument;
import org.bson.BsonNull;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.error.ConfigurationException;
import org.driftlens.render.WidgetInfo;
import org.driftlens.snapshot.Snapshot;

/**
 * Single-number panel. With {@link StandardAggregation#NONE} it shows only its text.
 */
public final class CounterPanel extends DashboardPanel {
    static final String TYPE = "counter";

    private final String text;
    private final PanelValue value;
    private final Aggregation aggregation;

    public CounterPanel(
            final String id,
            final String title,
            final int size,
            final ReportFilter filter,
            final String text,
            final PanelValue value,
            final Aggregation aggregation) {
        super(id, title, size, filter);
        this.text = text == null ? "" : text;
        this.aggregation = aggregation == null ? StandardAggregation.NONE : aggregation;
        if (this.aggregation != StandardAggregation.NONE && value == null) {
            throw new ConfigurationException(
                    "counter panel '" + title + "' aggregates with " + this.aggregation.name() + " but has no value");
        }
        this.value = value;
    }

    public static CounterPanel text(final String title, final String text) {
        return new CounterPanel(null, title, WidgetInfo.FULL_WIDTH, ReportFilter.any(), text, null, StandardAggregation.NONE);
    }

    public String text() {
        return text;
    }

    public PanelValue value() {
        return value;
    }

    public Aggregation aggregation() {
        return aggregation;
    }

    @Override
    public String panelType() {
        return TYPE;
    }

    @Override
    public WidgetInfo build(final List<Snapshot> snapshots, final PanelAggregator aggregator) {
        final BsonDocument params = new BsonDocument("label", new BsonString(text));
        if (aggregation == StandardAggregation.NONE) {
            return widget("counter", params.append("value", new BsonString("")));
        }
        final PanelSeries series = aggregator.aggregate(snapshots, filter(), value.withAggregation(aggregation));
        final BsonValue counter = series.points().isEmpty()
                ? BsonNull.VALUE
                : series.points().get(series.points().size() - 1).value();
        return widget("counter", params.append("value", counter).append("legend", new BsonString(value.legend())));
    }

    @Override
    protected void appendDetails(final BsonDocument document) {
        document.append("text", new BsonString(text))
                .append("aggregation", new BsonString(aggregation.name()));
        if (value != null) {
            document.append("value", value.toDocument());
        }
    }

    static CounterPanel fromDocument(
            final String id,
            final String title,
            final int size,
            final ReportFilter filter,
            final BsonDocument document,
            final String path,
            final AggregationCatalog aggregations) {
        final BsonValue text = document.get("text");
        final BsonValue rawValue = document.get("value");
        if (rawValue != null && !rawValue.isDocument()) {
            throw new ConfigurationException(path + ".value must be an object");
        }
        final BsonValue aggregation = document.get("aggregation");
        return new CounterPanel(
                id,
                title,
                size,
                filter,
                text != null && text.isString() ? text.asString().getValue() : "",
                rawValue == null ? null : PanelValue.fromDocument(rawValue.asDocument(), path + ".value", aggregations),
                aggregation != null && aggregation.isString()
                        ? aggregations.resolve(aggregation.asString().getValue())
                        : StandardAggregation.NONE);
    }
}
