package com.tony.baseballAnalytics.model;

import lombok.Value;

import java.util.Map;

/**
 * Scores heuristiques par tactique (non normalisés, ordre d'insertion de la taxonomie) et tactique retenue comme label.
 */
@Value
public class TacticProbabilities {
    Map<String, Double> probabilities;
    String primaryTactic;
}
