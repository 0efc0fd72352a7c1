package org.driftlens.render;

import java.util.List;
import java.util.Objects;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;

public record DashboardInfo(String name, List<WidgetInfo> widgets) {
    public DashboardInfo {
        Objects.requireNonNull(name, "name");
        widgets = List.copyOf(widgets);
    }

    public BsonDocument toDocument() {
        final BsonArray encoded = new BsonArray(widgets.size());
        for (final WidgetInfo widget : widgets) {
            encoded.add(widget.toDocument());
        }
        return new BsonDocument()
                .append("name", new BsonString(name))
                .append("widgets", encoded);
    }
}
