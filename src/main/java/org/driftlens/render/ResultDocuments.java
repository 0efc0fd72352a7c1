package org.driftlens.render;

import java.util.LinkedHashMap;
import java.util.Map;
import org.bson.BsonDocument;
import org.bson.BsonValue;

/**
 * Flattening of nested result documents into dotted leaf paths.
 */
final class ResultDocuments {
    private ResultDocuments() {
    }

    static Map<String, BsonValue> flatten(final BsonDocument document) {
        final Map<String, BsonValue> leaves = new LinkedHashMap<>();
        collect("", document, leaves);
        return leaves;
    }

    private static void collect(final String prefix, final BsonDocument document, final Map<String, BsonValue> leaves) {
        for (final Map.Entry<String, BsonValue> entry : document.entrySet()) {
            final String path = prefix.isEmpty() ? entry.getKey() : prefix + "." + entry.getKey();
            final BsonValue value = entry.getValue();
            if (value.isDocument()) {
                collect(path, value.asDocument(), leaves);
            } else {
                leaves.put(path, value);
            }
        }
    }
}
