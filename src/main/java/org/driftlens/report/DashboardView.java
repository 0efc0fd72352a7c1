package org.driftlens.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.driftlens.error.NotFoundException;
import org.driftlens.render.DashboardInfo;

/**
 * Widgets of a report plus the side table of additional graph payloads, keyed by graph id.
 */
public record DashboardView(String id, DashboardInfo info, Map<String, BsonDocument> graphs) {
    public DashboardView {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(info, "info");
        graphs = Collections.unmodifiableMap(new LinkedHashMap<>(graphs));
    }

    /**
     * @throws NotFoundException for an id that is not in the side table
     */
    public BsonDocument graph(final String graphId) {
        final BsonDocument graph = graphs.get(graphId);
        if (graph == null) {
            throw new NotFoundException("graph", graphId);
        }
        return graph.clone();
    }
}
