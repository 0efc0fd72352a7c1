package org.driftlens.workspace;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.bson.BsonDocument;
import org.bson.BsonInvalidOperationException;
import org.bson.BsonValue;
import org.bson.json.JsonParseException;
import org.driftlens.dashboard.AggregationCatalog;
import org.driftlens.dashboard.DashboardConfig;
import org.driftlens.error.ConfigurationException;
import org.driftlens.unit.BsonValues;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads a project definition (name, description, dashboard panels) from a JSON or YAML file.
 */
public final class ProjectConfigLoader {
    private final AggregationCatalog aggregations;

    public ProjectConfigLoader() {
        this(AggregationCatalog.standard());
    }

    public ProjectConfigLoader(final AggregationCatalog aggregations) {
        this.aggregations = Objects.requireNonNull(aggregations, "aggregations");
    }

    public ProjectConfig load(final Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath");
        final Path normalized = configPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new IllegalArgumentException("project config path does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("project config path must be a file: " + normalized);
        }
        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        return parse(content, normalized.getFileName().toString());
    }

    ProjectConfig parse(final String content, final String sourceName) {
        Objects.requireNonNull(content, "content");
        final String normalizedName = Objects.requireNonNull(sourceName, "sourceName")
                .trim()
                .toLowerCase(Locale.ROOT);
        final BsonDocument root;
        if (normalizedName.endsWith(".yaml") || normalizedName.endsWith(".yml")) {
            root = parseYaml(content, sourceName);
        } else {
            try {
                root = BsonDocument.parse(content);
            } catch (final JsonParseException | BsonInvalidOperationException e) {
                throw new ConfigurationException(sourceName + " is not valid JSON: " + e.getMessage(), e);
            }
        }
        return fromDocument(root, sourceName);
    }

    private ProjectConfig fromDocument(final BsonDocument root, final String sourceName) {
        final BsonValue name = root.get("name");
        if (name == null || !name.isString() || name.asString().getValue().isBlank()) {
            throw new ConfigurationException(sourceName + ": name must be a non-empty string");
        }
        final BsonValue description = root.get("description");
        final BsonValue dashboard = root.get("dashboard");
        if (dashboard == null || !dashboard.isDocument()) {
            throw new ConfigurationException(sourceName + ": dashboard must be an object");
        }
        return new ProjectConfig(
                name.asString().getValue(),
                description != null && description.isString() ? description.asString().getValue() : "",
                DashboardConfig.fromDocument(dashboard.asDocument(), sourceName + ": dashboard", aggregations));
    }

    private static BsonDocument parseYaml(final String content, final String sourceName) {
        final Object root;
        try {
            root = new Yaml().load(content);
        } catch (final YAMLException e) {
            throw new ConfigurationException(sourceName + " is not valid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new ConfigurationException(sourceName + " is empty");
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new ConfigurationException(sourceName + ": root must be an object");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        try {
            return BsonValues.toDocument(normalized);
        } catch (final IllegalArgumentException e) {
            throw new ConfigurationException(sourceName + ": " + e.getMessage(), e);
        }
    }
}
