package org.driftlens.render;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.TestUnit;
import org.driftlens.unit.UnitResult;

public class DefaultTestRenderer implements Renderer {
    @Override
    public BsonDocument renderJson(
            final ComputationalUnit unit, final UnitResult unitResult, final FieldSelection selection) {
        final BsonDocument result = unitResult.toDocument();
        final BsonDocument rendered = new BsonDocument()
                .append(TestUnit.NAME_FIELD, result.get(TestUnit.NAME_FIELD))
                .append(TestUnit.STATUS_FIELD, result.get(TestUnit.STATUS_FIELD))
                .append(TestUnit.DESCRIPTION_FIELD, result.get(TestUnit.DESCRIPTION_FIELD));
        final BsonDocument parameters = result.getDocument(TestUnit.PARAMETERS_FIELD, new BsonDocument());
        return rendered.append(TestUnit.PARAMETERS_FIELD, selection.apply(parameters));
    }

    @Override
    public TabularView renderTable(final ComputationalUnit unit, final UnitResult unitResult) {
        final BsonDocument result = unitResult.toDocument();
        final Map<String, Object> row = new LinkedHashMap<>();
        row.put("test", unit.type());
        row.put("name", result.getString(TestUnit.NAME_FIELD).getValue());
        row.put("status", result.getString(TestUnit.STATUS_FIELD).getValue());
        row.put("description", result.getString(TestUnit.DESCRIPTION_FIELD).getValue());
        return new TabularView(List.of(row));
    }

    @Override
    public List<WidgetInfo> renderWidgets(
            final ComputationalUnit unit, final UnitResult unitResult, final RenderOptions options) {
        final BsonDocument result = unitResult.toDocument();
        final BsonDocument params = new BsonDocument()
                .append("unit", new BsonString(unit.identity().toString()))
                .append("colorScheme", new BsonString(options.colorScheme()))
                .append("status", result.get(TestUnit.STATUS_FIELD))
                .append("description", result.get(TestUnit.DESCRIPTION_FIELD))
                .append("parameters", result.getDocument(TestUnit.PARAMETERS_FIELD, new BsonDocument()));
        final String title = result.getString(TestUnit.NAME_FIELD).getValue();
        return List.of(WidgetInfo.of("test", title, WidgetInfo.HALF_WIDTH, params));
    }
}
