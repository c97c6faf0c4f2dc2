package com.tony.baseballAnalytics.model.training;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Une ligne de la table d'entraînement : features numériques nommées + tactique principale.
 */
public record TrainingRow(Map<String, Double> features, String label) {

    public TrainingRow {
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public double value(String feature) {
        Double v = features.get(feature);
        return v != null ? v : 0.0;
    }
}
