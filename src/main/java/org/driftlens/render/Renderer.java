package org.driftlens.render;

import java.util.List;
import org.bson.BsonDocument;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.UnitResult;

/**
 * Turns a computed unit into its JSON, tabular and widget forms. The result is passed in by the caller, which
 * reads it from the context of the run being rendered.
 */
public interface Renderer {
    BsonDocument renderJson(ComputationalUnit unit, UnitResult result, FieldSelection selection);

    TabularView renderTable(ComputationalUnit unit, UnitResult result);

    List<WidgetInfo> renderWidgets(ComputationalUnit unit, UnitResult result, RenderOptions options);
}
