package org.driftlens.render;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;
import org.driftlens.unit.BsonValues;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.UnitResult;

/**
 * Generic metric rendering: scalar leaves go into the widget, non-empty arrays become additional graphs.
 */
public class DefaultMetricRenderer implements Renderer {
    @Override
    public BsonDocument renderJson(final ComputationalUnit unit, final UnitResult result, final FieldSelection selection) {
        return selection.apply(result.toDocument());
    }

    @Override
    public TabularView renderTable(final ComputationalUnit unit, final UnitResult result) {
        final Map<String, Object> row = new LinkedHashMap<>();
        row.put("metric", unit.type());
        for (final Map.Entry<String, BsonValue> leaf : ResultDocuments.flatten(result.toDocument()).entrySet()) {
            if (!leaf.getValue().isArray()) {
                row.put(leaf.getKey(), BsonValues.toJava(leaf.getValue()));
            }
        }
        return new TabularView(List.of(row));
    }

    @Override
    public List<WidgetInfo> renderWidgets(
            final ComputationalUnit unit, final UnitResult result, final RenderOptions options) {
        final BsonDocument fields = new BsonDocument();
        final List<AdditionalGraph> graphs = new ArrayList<>();
        for (final Map.Entry<String, BsonValue> leaf : ResultDocuments.flatten(result.toDocument()).entrySet()) {
            final BsonValue value = leaf.getValue();
            if (value.isArray()) {
                if (options.additionalGraphs() && !value.asArray().isEmpty()) {
                    graphs.add(AdditionalGraph.unassigned(new BsonDocument()
                            .append("field", new BsonString(leaf.getKey()))
                            .append("values", new BsonArray(value.asArray().getValues()))));
                }
                continue;
            }
            fields.append(leaf.getKey(), value);
        }
        final BsonDocument params = new BsonDocument()
                .append("unit", new BsonString(unit.identity().toString()))
                .append("colorScheme", new BsonString(options.colorScheme()))
                .append("fields", fields);
        return List.of(WidgetInfo.of("metric", unit.type(), WidgetInfo.FULL_WIDTH, params).withAdditionalGraphs(graphs));
    }
}
