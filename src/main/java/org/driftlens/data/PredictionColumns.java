package org.driftlens.data;

import java.util.List;
import java.util.Optional;

public record PredictionColumns(String predictedValues, List<String> predictionProbas) {
    public PredictionColumns {
        predictionProbas = predictionProbas == null ? null : List.copyOf(predictionProbas);
    }

    public Optional<String> predictedValuesColumn() {
        return Optional.ofNullable(predictedValues);
    }

    public Optional<List<String>> probas() {
        return Optional.ofNullable(predictionProbas);
    }
}
