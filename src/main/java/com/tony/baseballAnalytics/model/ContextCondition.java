package com.tony.baseballAnalytics.model;

/**
 * Clause du prédicat de contexte d'une tactique : un champ de la situation doit tomber dans [lower, upper] (bornes incluses).
 * Toutes les formes (min_*, max_*, égalité booléenne, plage de score) se ramènent à cet intervalle.
 */
public record ContextCondition(String key, SituationField field, double lower, double upper) {

    public static ContextCondition atLeast(String key, SituationField field, double threshold) {
        return new ContextCondition(key, field, threshold, Double.POSITIVE_INFINITY);
    }

    public static ContextCondition atMost(String key, SituationField field, double threshold) {
        return new ContextCondition(key, field, Double.NEGATIVE_INFINITY, threshold);
    }

    public static ContextCondition is(String key, SituationField field, boolean expected) {
        double value = expected ? 1.0 : 0.0;
        return new ContextCondition(key, field, value, value);
    }

    public static ContextCondition between(String key, SituationField field, double lower, double upper) {
        return new ContextCondition(key, field, lower, upper);
    }

    public boolean matches(Situation situation) {
        double value = field.read(situation);
        return value >= lower && value <= upper;
    }
}
