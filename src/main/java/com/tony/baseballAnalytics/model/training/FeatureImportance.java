package com.tony.baseballAnalytics.model.training;

/**
 * Importance par permutation : perte d'accuracy quand la colonne est mélangée.
 */
public record FeatureImportance(String feature, double importance) {
}
