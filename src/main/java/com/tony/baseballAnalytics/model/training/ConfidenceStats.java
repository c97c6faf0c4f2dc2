package com.tony.baseballAnalytics.model.training;

import java.util.Map;

/**
 * Distribution de la confiance (probabilité de la classe prédite) sur le jeu de test.
 *
 * @param aboveThresholds part (%) des prédictions au-dessus de 0.5 / 0.7 / 0.9
 * @param meanByClass     confiance moyenne par classe prédite
 */
public record ConfidenceStats(double mean, double median, double std,
                              Map<Double, Double> aboveThresholds,
                              Map<String, Double> meanByClass) {
}
