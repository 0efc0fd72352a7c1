package org.driftlens.render;

import java.util.Objects;
import org.bson.BsonDocument;

/**
 * A heavy widget payload served separately from the main view. The id is assigned when the dashboard is built.
 */
public record AdditionalGraph(String id, BsonDocument params) {
    public AdditionalGraph {
        params = Objects.requireNonNull(params, "params").clone();
    }

    public static AdditionalGraph unassigned(final BsonDocument params) {
        return new AdditionalGraph(null, params);
    }

    public AdditionalGraph withId(final String newId) {
        return new AdditionalGraph(Objects.requireNonNull(newId, "newId"), params);
    }

    @Override
    public BsonDocument params() {
        return params.clone();
    }
}
