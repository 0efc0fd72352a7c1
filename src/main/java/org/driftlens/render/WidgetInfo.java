package org.driftlens.render;

import java.util.List;
import java.util.Objects;
import java.util.UUID;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonInt32;
import org.bson.BsonString;

/**
 * One display widget of a report or project dashboard.
 */
public final class WidgetInfo {
    public static final int HALF_WIDTH = 1;
    public static final int FULL_WIDTH = 2;

    private final String id;
    private final String type;
    private final String title;
    private final int size;
    private final BsonDocument params;
    private final List<AdditionalGraph> additionalGraphs;

    public WidgetInfo(
            final String id,
            final String type,
            final String title,
            final int size,
            final BsonDocument params,
            final List<AdditionalGraph> additionalGraphs) {
        this.id = Objects.requireNonNull(id, "id");
        this.type = Objects.requireNonNull(type, "type");
        this.title = title == null ? "" : title;
        if (size != HALF_WIDTH && size != FULL_WIDTH) {
            throw new IllegalArgumentException("widget size must be 1 or 2: " + size);
        }
        this.size = size;
        this.params = Objects.requireNonNull(params, "params").clone();
        this.additionalGraphs = List.copyOf(additionalGraphs);
    }

    public static WidgetInfo of(final String type, final String title, final int size, final BsonDocument params) {
        return new WidgetInfo(UUID.randomUUID().toString(), type, title, size, params, List.of());
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    public String title() {
        return title;
    }

    public int size() {
        return size;
    }

    public BsonDocument params() {
        return params.clone();
    }

    public List<AdditionalGraph> additionalGraphs() {
        return additionalGraphs;
    }

    public WidgetInfo withAdditionalGraphs(final List<AdditionalGraph> graphs) {
        return new WidgetInfo(id, type, title, size, params, graphs);
    }

    /**
     * Graph payloads are not embedded; only their ids are listed.
     */
    public BsonDocument toDocument() {
        final BsonArray graphIds = new BsonArray();
        for (final AdditionalGraph graph : additionalGraphs) {
            if (graph.id() != null) {
                graphIds.add(new BsonString(graph.id()));
            }
        }
        return new BsonDocument()
                .append("id", new BsonString(id))
                .append("type", new BsonString(type))
                .append("title", new BsonString(title))
                .append("size", new BsonInt32(size))
                .append("params", params.clone())
                .append("additionalGraphs", graphIds);
    }
}
