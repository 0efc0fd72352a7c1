package org.driftlens.report;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.bson.BsonArray;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.driftlens.data.ColumnInference;
import org.driftlens.data.ColumnMapping;
import org.driftlens.data.DataDefinition;
import org.driftlens.data.Dataset;
import org.driftlens.data.DatasetColumns;
import org.driftlens.data.InputData;
import org.driftlens.error.ConfigurationException;
import org.driftlens.error.NotFoundException;
import org.driftlens.obs.JsonLinesLogger;
import org.driftlens.obs.LogContext;
import org.driftlens.obs.RunJournal;
import org.driftlens.render.AdditionalGraph;
import org.driftlens.render.DashboardInfo;
import org.driftlens.render.RenderOptions;
import org.driftlens.render.Renderer;
import org.driftlens.render.RendererRegistry;
import org.driftlens.render.TabularView;
import org.driftlens.render.WidgetInfo;
import org.driftlens.snapshot.SnapshotKind;
import org.driftlens.suite.AdditionalFeatures;
import org.driftlens.suite.Expansion;
import org.driftlens.suite.ItemExpander;
import org.driftlens.suite.Suite;
import org.driftlens.suite.SuiteState;
import org.driftlens.unit.BsonValues;
import org.driftlens.unit.CheckItem;
import org.driftlens.unit.ComputationalUnit;
import org.driftlens.unit.Generator;
import org.driftlens.unit.Preset;
import org.driftlens.unit.UnitKind;
import org.driftlens.unit.UnitResult;

/**
 * Shared façade of {@link Report} and {@link TestSuite}: runs a check list through a {@link Suite} and exposes the
 * first-level units in the order they were requested.
 */
public abstract class ReportBase {
    public static final String BATCH_SIZE = "batch_size";
    public static final String MODEL_ID = "model_id";
    public static final String REFERENCE_ID = "reference_id";
    public static final String DATASET_ID = "dataset_id";

    private final String id;
    private final Instant timestamp;
    private final Map<String, Object> metadata;
    private final List<String> tags;
    private final RenderOptions options;
    private final RendererRegistry renderers;
    private final JsonLinesLogger logger;
    private final List<CheckItem> items;
    private final LogContext logContext;
    private Suite suite;
    private List<Integer> firstLevelIndices = List.of();

    protected ReportBase(final Builder<?, ?> builder) {
        this.id = builder.id == null ? UUID.randomUUID().toString() : builder.id;
        this.timestamp = builder.timestamp == null ? Instant.now(builder.clock) : builder.timestamp;
        this.metadata = new LinkedHashMap<>(builder.metadata);
        this.tags = List.copyOf(builder.tags);
        this.options = builder.options;
        this.renderers = builder.renderers;
        this.logger = builder.logger;
        this.items = List.copyOf(builder.items);
        this.logContext = LogContext.builder("report").runId(id).build();
        this.suite = new Suite(id, logger, new RunJournal());
    }

    /**
     * Kind of unit this façade accepts.
     */
    public abstract UnitKind unitKind();

    public abstract SnapshotKind snapshotKind();

    protected abstract String dashboardName();

    protected abstract String collectionKey();

    /**
     * Adds façade-specific fields to the output of {@link #asDict(JsonRenderOptions)}.
     */
    protected void completeDict(final BsonDocument dict) {
    }

    /**
     * Expands the check list, registers every unit and computes them all.
     *
     * @throws ConfigurationException if {@code current} is null or the check list cannot be expanded
     */
    public void run(final Dataset reference, final Dataset current, final ColumnMapping mapping) {
        if (current == null) {
            throw new ConfigurationException("current dataset should be present");
        }
        final ColumnMapping columnMapping = mapping == null ? ColumnMapping.defaults() : mapping;
        final DatasetColumns columns = ColumnInference.processColumns(current, columnMapping);
        final DataDefinition definition = ColumnInference.createDataDefinition(reference, current, columnMapping);
        final InputData data = InputData.of(reference, current, columnMapping, definition, columns);

        firstLevelIndices = List.of();
        suite.reset();
        suite.verify(current);
        final Expansion expansion = new ItemExpander().expand(items, data, unitKind());
        final List<Integer> indices = new ArrayList<>(expansion.units().size());
        for (final ComputationalUnit unit : expansion.units()) {
            indices.add(suite.register(unit));
        }
        firstLevelIndices = List.copyOf(indices);
        expansion.recordProvenance(metadata, unitKind());
        logger.info("report.run.start", logContext, Map.of(
                "kind", snapshotKind().value(),
                "firstLevelUnits", indices.size(),
                "units", suite.units().size()));

        final AdditionalFeatures features = suite.createAdditionalFeatures(current, reference, definition);
        suite.runCalculate(data.withAdditionalFeatures(features.current(), features.reference()));
        logger.info("report.run.complete", logContext);
    }

    void restoreFrom(final Suite restored, final List<Integer> indices) {
        this.suite = Objects.requireNonNull(restored, "restored");
        this.firstLevelIndices = List.copyOf(indices);
    }

    public BsonDocument asDict() {
        return asDict(JsonRenderOptions.none());
    }

    public BsonDocument asDict(final JsonRenderOptions renderOptions) {
        Objects.requireNonNull(renderOptions, "renderOptions");
        final BsonArray entries = new BsonArray();
        for (final ComputationalUnit unit : firstLevelUnits()) {
            final Renderer renderer = renderers.find(unit);
            final BsonDocument rendered =
                    renderer.renderJson(unit, resultOf(unit), renderOptions.selectionFor(unit.type()));
            entries.add(new BsonDocument()
                    .append(unitKind().key(), new BsonString(unit.type()))
                    .append("result", rendered));
        }
        final BsonDocument dict = new BsonDocument(collectionKey(), entries);
        completeDict(dict);
        return dict;
    }

    /**
     * All first-level tables concatenated.
     */
    public TabularView asTable() {
        return TabularView.concat(new ArrayList<>(asTables().values()));
    }

    /**
     * One table per unit id, in first-level order.
     */
    public Map<String, TabularView> asTables() {
        final Map<String, List<TabularView>> grouped = new LinkedHashMap<>();
        for (final ComputationalUnit unit : firstLevelUnits()) {
            final TabularView table = renderers.find(unit).renderTable(unit, resultOf(unit));
            grouped.computeIfAbsent(unit.type(), key -> new ArrayList<>()).add(table);
        }
        final Map<String, TabularView> tables = new LinkedHashMap<>();
        grouped.forEach((group, views) -> tables.put(group, TabularView.concat(views)));
        return Collections.unmodifiableMap(tables);
    }

    /**
     * @throws NotFoundException if no first-level unit has the given id
     */
    public TabularView asTable(final String group) {
        final TabularView table = asTables().get(group);
        if (table == null) {
            throw new NotFoundException(unitKind().key() + " group", group);
        }
        return table;
    }

    /**
     * Graphs without an id get {@code graph_<position>_<n>}, where position is the unit's place in the first-level
     * list, so the same report always yields the same graph ids.
     */
    public DashboardView asDashboard() {
        final List<WidgetInfo> widgets = new ArrayList<>();
        final Map<String, BsonDocument> graphs = new LinkedHashMap<>();
        final List<ComputationalUnit> units = firstLevelUnits();
        for (int position = 0; position < units.size(); position++) {
            final ComputationalUnit unit = units.get(position);
            int n = 0;
            for (final WidgetInfo widget : renderers.find(unit).renderWidgets(unit, resultOf(unit), options)) {
                final List<AdditionalGraph> assigned = new ArrayList<>(widget.additionalGraphs().size());
                for (final AdditionalGraph graph : widget.additionalGraphs()) {
                    final String graphId = graph.id() == null ? "graph_" + position + "_" + n++ : graph.id();
                    if (graphs.putIfAbsent(graphId, graph.params()) != null) {
                        throw new IllegalStateException("duplicate additional graph id " + graphId);
                    }
                    assigned.add(graph.withId(graphId));
                }
                widgets.add(widget.withAdditionalGraphs(assigned));
            }
        }
        final String dashboardId = "dashboard_" + UUID.randomUUID().toString().replace("-", "");
        return new DashboardView(dashboardId, new DashboardInfo(dashboardName(), widgets), graphs);
    }

    public List<ComputationalUnit> firstLevelUnits() {
        requireCompleted();
        final List<ComputationalUnit> units = new ArrayList<>(firstLevelIndices.size());
        for (final Integer index : firstLevelIndices) {
            units.add(suite.unit(index));
        }
        return Collections.unmodifiableList(units);
    }

    /**
     * Result of a unit as computed by this report's own run. A unit instance shared with another report may be
     * bound to that report's context, so views never read through {@link ComputationalUnit#result()}.
     */
    public UnitResult resultOf(final ComputationalUnit unit) {
        Objects.requireNonNull(unit, "unit");
        requireCompleted();
        return suite.context().resultOf(unit);
    }

    public List<Integer> firstLevelIndices() {
        return firstLevelIndices;
    }

    public Suite suite() {
        return suite;
    }

    public String id() {
        return id;
    }

    public Instant timestamp() {
        return timestamp;
    }

    public Map<String, Object> metadata() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public List<String> tags() {
        return tags;
    }

    public RenderOptions options() {
        return options;
    }

    public RendererRegistry renderers() {
        return renderers;
    }

    public ReportBase setBatchSize(final String batchSize) {
        metadata.put(BATCH_SIZE, Objects.requireNonNull(batchSize, "batchSize"));
        return this;
    }

    public ReportBase setModelId(final String modelId) {
        metadata.put(MODEL_ID, Objects.requireNonNull(modelId, "modelId"));
        return this;
    }

    public ReportBase setReferenceId(final String referenceId) {
        metadata.put(REFERENCE_ID, Objects.requireNonNull(referenceId, "referenceId"));
        return this;
    }

    public ReportBase setDatasetId(final String datasetId) {
        metadata.put(DATASET_ID, Objects.requireNonNull(datasetId, "datasetId"));
        return this;
    }

    private void requireCompleted() {
        if (suite.state() != SuiteState.COMPLETE) {
            throw new IllegalStateException("report " + id + " has no computed results (state " + suite.state() + ")");
        }
    }

    /**
     * Builder shared by both façades.
     */
    public abstract static class Builder<R extends ReportBase, B extends Builder<R, B>> {
        private String id;
        private Instant timestamp;
        private Clock clock = Clock.systemUTC();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private final List<String> tags = new ArrayList<>();
        private RenderOptions options = RenderOptions.defaults();
        private RendererRegistry renderers = RendererRegistry.standard();
        private JsonLinesLogger logger = JsonLinesLogger.noop();
        private final List<CheckItem> items = new ArrayList<>();

        protected Builder() {
        }

        protected abstract B self();

        public abstract R build();

        public B id(final String id) {
            this.id = id;
            return self();
        }

        public B timestamp(final Instant timestamp) {
            this.timestamp = timestamp;
            return self();
        }

        public B clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return self();
        }

        public B metadata(final Map<String, ?> metadata) {
            Objects.requireNonNull(metadata, "metadata").forEach(this::metadata);
            return self();
        }

        /**
         * Values are stored in the form they read back as from a snapshot, see {@link BsonValues#normalize}.
         */
        public B metadata(final String key, final Object value) {
            this.metadata.put(Objects.requireNonNull(key, "key"), BsonValues.normalize(value));
            return self();
        }

        public B tags(final List<String> tags) {
            this.tags.addAll(Objects.requireNonNull(tags, "tags"));
            return self();
        }

        public B tag(final String tag) {
            this.tags.add(Objects.requireNonNull(tag, "tag"));
            return self();
        }

        public B options(final RenderOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return self();
        }

        public B renderers(final RendererRegistry renderers) {
            this.renderers = Objects.requireNonNull(renderers, "renderers");
            return self();
        }

        public B logger(final JsonLinesLogger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return self();
        }

        public B item(final CheckItem item) {
            this.items.add(Objects.requireNonNull(item, "item"));
            return self();
        }

        public B items(final List<CheckItem> items) {
            for (final CheckItem item : Objects.requireNonNull(items, "items")) {
                item(item);
            }
            return self();
        }

        public B unit(final ComputationalUnit unit) {
            return item(CheckItem.unit(unit));
        }

        public B preset(final Preset preset) {
            return item(CheckItem.preset(preset));
        }

        public B generator(final Generator generator) {
            return item(CheckItem.generator(generator));
        }
    }
}
