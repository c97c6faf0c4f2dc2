package com.tony.baseballAnalytics.model.training;

import java.util.List;
import java.util.Map;

/**
 * Résultat d'une validation croisée stratifiée. Les intervalles sont moyenne ± 2 écarts-types.
 */
public record CrossValidationSummary(List<Double> foldAccuracies,
                                     List<Double> foldWeightedF1,
                                     double meanAccuracy,
                                     double stdAccuracy,
                                     double meanWeightedF1,
                                     double stdWeightedF1,
                                     Map<String, Double> meanF1ByClass) {
}
