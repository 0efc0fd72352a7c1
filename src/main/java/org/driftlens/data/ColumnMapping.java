package org.driftlens.data;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declares which dataset columns play which role. Unset feature lists are inferred from the data.
 */
public final class ColumnMapping {
    public static final String DEFAULT_TARGET = "target";
    public static final String DEFAULT_PREDICTION = "prediction";

    private final String target;
    private final List<String> prediction;
    private final String id;
    private final String datetime;
    private final List<String> numericalFeatures;
    private final List<String> categoricalFeatures;
    private final List<String> datetimeFeatures;
    private final List<String> textFeatures;

    private ColumnMapping(final Builder builder) {
        this.target = builder.target;
        this.prediction = builder.prediction == null ? List.of() : List.copyOf(builder.prediction);
        this.id = builder.id;
        this.datetime = builder.datetime;
        this.numericalFeatures = copyOrNull(builder.numericalFeatures);
        this.categoricalFeatures = copyOrNull(builder.categoricalFeatures);
        this.datetimeFeatures = copyOrNull(builder.datetimeFeatures);
        this.textFeatures = copyOrNull(builder.textFeatures);
    }

    public static ColumnMapping defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> target() {
        return Optional.ofNullable(target);
    }

    /**
     * One column holds predicted values; several columns hold per-class probabilities.
     */
    public List<String> prediction() {
        return prediction;
    }

    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    public Optional<String> datetime() {
        return Optional.ofNullable(datetime);
    }

    public Optional<List<String>> numericalFeatures() {
        return Optional.ofNullable(numericalFeatures);
    }

    public Optional<List<String>> categoricalFeatures() {
        return Optional.ofNullable(categoricalFeatures);
    }

    public Optional<List<String>> datetimeFeatures() {
        return Optional.ofNullable(datetimeFeatures);
    }

    public Optional<List<String>> textFeatures() {
        return Optional.ofNullable(textFeatures);
    }

    private static List<String> copyOrNull(final List<String> values) {
        return values == null ? null : List.copyOf(values);
    }

    public static final class Builder {
        private String target = DEFAULT_TARGET;
        private List<String> prediction = List.of(DEFAULT_PREDICTION);
        private String id;
        private String datetime;
        private List<String> numericalFeatures;
        private List<String> categoricalFeatures;
        private List<String> datetimeFeatures;
        private List<String> textFeatures;

        private Builder() {
        }

        public Builder target(final String target) {
            this.target = target;
            return this;
        }

        public Builder prediction(final String prediction) {
            this.prediction = prediction == null ? List.of() : List.of(prediction);
            return this;
        }

        public Builder predictionProbas(final List<String> probabilityColumns) {
            this.prediction = List.copyOf(Objects.requireNonNull(probabilityColumns, "probabilityColumns"));
            return this;
        }

        public Builder id(final String id) {
            this.id = id;
            return this;
        }

        public Builder datetime(final String datetime) {
            this.datetime = datetime;
            return this;
        }

        public Builder numericalFeatures(final List<String> numericalFeatures) {
            this.numericalFeatures = numericalFeatures;
            return this;
        }

        public Builder categoricalFeatures(final List<String> categoricalFeatures) {
            this.categoricalFeatures = categoricalFeatures;
            return this;
        }

        public Builder datetimeFeatures(final List<String> datetimeFeatures) {
            this.datetimeFeatures = datetimeFeatures;
            return this;
        }

        public Builder textFeatures(final List<String> textFeatures) {
            this.textFeatures = textFeatures;
            return this;
        }

        public ColumnMapping build() {
            return new ColumnMapping(this);
        }
    }
}
