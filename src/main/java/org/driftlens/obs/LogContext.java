package org.driftlens.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation fields emitted with every structured log event.
 */
public final class LogContext {
    private final String component;
    private final String runId;
    private final String projectId;
    private final String snapshotId;

    private LogContext(final Builder builder) {
        this.component = requireText(builder.component, "component");
        this.runId = normalize(builder.runId);
        this.projectId = normalize(builder.projectId);
        this.snapshotId = normalize(builder.snapshotId);
    }

    public static LogContext of(final String component) {
        return builder(component).build();
    }

    public static Builder builder(final String component) {
        return new Builder(component);
    }

    public String component() {
        return component;
    }

    public Optional<String> runId() {
        return Optional.ofNullable(runId);
    }

    public Optional<String> projectId() {
        return Optional.ofNullable(projectId);
    }

    public Optional<String> snapshotId() {
        return Optional.ofNullable(snapshotId);
    }

    public Map<String, Object> asFields() {
        final Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("component", component);
        if (runId != null) {
            fields.put("runId", runId);
        }
        if (projectId != null) {
            fields.put("projectId", projectId);
        }
        if (snapshotId != null) {
            fields.put("snapshotId", snapshotId);
        }
        return fields;
    }

    private static String requireText(final String value, final String fieldName) {
        final String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(final String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String component;
        private String runId;
        private String projectId;
        private String snapshotId;

        private Builder(final String component) {
            this.component = Objects.requireNonNull(component, "component");
        }

        public Builder runId(final Object runId) {
            this.runId = runId == null ? null : runId.toString();
            return this;
        }

        public Builder projectId(final Object projectId) {
            this.projectId = projectId == null ? null : projectId.toString();
            return this;
        }

        public Builder snapshotId(final Object snapshotId) {
            this.snapshotId = snapshotId == null ? null : snapshotId.toString();
            return this;
        }

        public LogContext build() {
            return new LogContext(this);
        }
    }
}
