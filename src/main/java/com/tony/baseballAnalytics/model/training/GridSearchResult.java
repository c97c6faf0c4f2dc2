package com.tony.baseballAnalytics.model.training;

import java.util.Map;

/**
 * @param scores        F1 pondéré moyen par configuration évaluée (ordre de la grille)
 * @param completedFits nombre de couples (configuration, fold) effectivement terminés
 */
public record GridSearchResult(Hyperparameters best, double bestScore,
                               Map<Hyperparameters, Double> scores, int completedFits) {
}
