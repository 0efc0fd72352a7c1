package org.driftlens.render;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.bson.BsonDocument;
import org.driftlens.data.InputData;
import org.driftlens.error.ConfigurationException;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.MetricUnit;
import org.driftlens.unit.ResultContext;
import org.driftlens.unit.UnitResult;
import org.junit.jupiter.api.Test;

class RendererRegistryTest {
    @Test
    void mostSpecificRegistrationWins() {
        DefaultMetricRenderer generic = new DefaultMetricRenderer();
        DefaultMetricRenderer special = new DefaultMetricRenderer();
        RendererRegistry registry = RendererRegistry.builder()
            .register(MetricUnit.class, generic)
            .register(HistogramMetric.class, special)
            .build();

        assertSame(special, registry.find(HistogramMetric.class));
        assertSame(generic, registry.find(PlainMetric.class));
    }

    @Test
    void interfaceRegistrationIsFoundAfterTheClassChain() {
        DefaultMetricRenderer viaInterface = new DefaultMetricRenderer();
        RendererRegistry registry = RendererRegistry.builder()
            .register(ComputationalUnit.class, viaInterface)
            .build();

        assertSame(viaInterface, registry.find(PlainMetric.class));
    }

    @Test
    void missingRendererIsAConfigurationError() {
        RendererRegistry registry = RendererRegistry.builder().build();

        ConfigurationException error = assertThrows(ConfigurationException.class, () -> registry.find(PlainMetric.class));
        assertTrue(error.getMessage().contains("PlainMetric"));
    }

    @Test
    void defaultMetricRendererSplitsScalarsFromArrays() {
        HistogramMetric unit = new HistogramMetric();
        UnitResult result = UnitResult.parse("{\"current\": {\"value\": 2.5, \"histogram\": [1, 3, 0]}, \"empty\": []}");
        Renderer renderer = RendererRegistry.standard().find(unit);

        List<WidgetInfo> widgets = renderer.renderWidgets(unit, result, RenderOptions.defaults());

        assertEquals(1, widgets.size());
        WidgetInfo widget = widgets.get(0);
        assertEquals("metric", widget.type());
        assertEquals("HistogramMetric", widget.title());
        BsonDocument fields = widget.params().getDocument("fields");
        assertEquals(2.5, fields.getDouble("current.value").getValue());
        assertFalse(fields.containsKey("current.histogram"));
        assertEquals(1, widget.additionalGraphs().size());
        AdditionalGraph graph = widget.additionalGraphs().get(0);
        assertNull(graph.id());
        assertEquals("current.histogram", graph.params().getString("field").getValue());
        assertEquals(3, graph.params().getArray("values").size());
    }

    @Test
    void graphsAreOmittedWhenDisabled() {
        UnitResult result = UnitResult.parse("{\"histogram\": [1, 2]}");

        List<WidgetInfo> widgets =
            new DefaultMetricRenderer().renderWidgets(new HistogramMetric(), result, new RenderOptions(null, false));

        assertTrue(widgets.get(0).additionalGraphs().isEmpty());
        assertEquals(RenderOptions.DEFAULT_COLOR_SCHEME, widgets.get(0).params().getString("colorScheme").getValue());
    }

    @Test
    void tableRowCarriesFlattenedScalarLeaves() {
        UnitResult result = UnitResult.parse("{\"column\": \"age\", \"current\": {\"value\": 2.5, \"histogram\": [1]}}");

        TabularView table = new DefaultMetricRenderer().renderTable(new HistogramMetric(), result);

        assertEquals(List.of("metric", "column", "current.value"), table.columns());
        assertEquals("HistogramMetric", table.cell(0, "metric"));
        assertEquals("age", table.cell(0, "column"));
        assertEquals(2.5, table.cell(0, "current.value"));
    }

    @Test
    void jsonRenderKeepsSelectedTopLevelFields() {
        HistogramMetric unit = new HistogramMetric();
        UnitResult result = UnitResult.parse("{\"a\": 1, \"b\": 2, \"c\": 3}");
        Renderer renderer = new DefaultMetricRenderer();

        BsonDocument included = renderer.renderJson(unit, result, new FieldSelection(Set.of("a", "b"), Set.of("b")));
        BsonDocument all = renderer.renderJson(unit, result, FieldSelection.ALL);

        assertEquals(BsonDocument.parse("{\"a\": 1}"), included);
        assertEquals(3, all.size());
    }

    @Test
    void widgetRejectsUnknownSize() {
        assertThrows(IllegalArgumentException.class, () -> WidgetInfo.of("metric", "t", 3, new BsonDocument()));
        WidgetInfo widget = WidgetInfo.of("metric", null, WidgetInfo.HALF_WIDTH, new BsonDocument());
        assertEquals("", widget.title());
        assertInstanceOf(BsonDocument.class, widget.toDocument().get("params"));
    }

    @Test
    void optionsSurviveTheirDocumentForm() {
        RenderOptions options = new RenderOptions("dark", false);

        assertEquals(options, RenderOptions.fromDocument(options.toDocument()));
        assertEquals(RenderOptions.defaults(), RenderOptions.fromDocument(new BsonDocument()));
    }

    static class PlainMetric extends MetricUnit {
        @Override
        public BsonDocument args() {
            return new BsonDocument();
        }

        @Override
        protected BsonDocument calculate(InputData data, ResultContext context) {
            return new BsonDocument();
        }
    }

    static final class HistogramMetric extends PlainMetric {
    }
}
