package org.driftlens.render;

import java.util.Objects;
import org.bson.BsonBoolean;
import org.bson.BsonDocument;
import org.bson.BsonString;
import org.bson.BsonValue;

/**
 * Presentation settings carried by a report and stored with its snapshot.
 */
public record RenderOptions(String colorScheme, boolean additionalGraphs) {
    public static final String DEFAULT_COLOR_SCHEME = "default";

    public RenderOptions {
        colorScheme = colorScheme == null || colorScheme.isBlank() ? DEFAULT_COLOR_SCHEME : colorScheme.trim();
    }

    public static RenderOptions defaults() {
        return new RenderOptions(DEFAULT_COLOR_SCHEME, true);
    }

    public BsonDocument toDocument() {
        return new BsonDocument()
                .append("color_scheme", new BsonString(colorScheme))
                .append("additional_graphs", BsonBoolean.valueOf(additionalGraphs));
    }

    public static RenderOptions fromDocument(final BsonDocument document) {
        Objects.requireNonNull(document, "document");
        final BsonValue scheme = document.get("color_scheme");
        final BsonValue graphs = document.get("additional_graphs");
        return new RenderOptions(
                scheme != null && scheme.isString() ? scheme.asString().getValue() : DEFAULT_COLOR_SCHEME,
                graphs == null || !graphs.isBoolean() || graphs.asBoolean().getValue());
    }
}
