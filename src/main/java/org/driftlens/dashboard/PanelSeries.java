package org.driftlens.dashboard;

import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

public record PanelSeries(PanelValue value, List<SeriesPoint> points) {
    public PanelSeries {
        Objects.requireNonNull(value, "value");
        points = List.copyOf(points);
    }

    public BsonDocument toDocument() {
        final BsonArray encoded = new BsonArray(points.size());
        points.forEach(point -> encoded.add(point.toDocument()));
        return new BsonDocument()
                .append("legend", new BsonString(value.legend()))
                .append("unit_type", new BsonString(value.unitType()))
                .append("field_path", new BsonString(value.fieldPath().path()))
                .append("aggregation", new BsonString(value.aggregation().name()))
                .append("points", encoded);
    }
}
