package com.tony.baseballAnalytics.service.ml;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Liste ordonnée des features figée à l'entraînement.
 * À l'inférence : colonne absente = 0, colonne inconnue ignorée, ordre imposé. Jamais d'erreur.
 */
public record FeatureSchema(List<String> names) {

    private static final List<List<String>> ORDERED_GROUPS = List.of(
            FeatureVectorizer.BASE_COLUMNS,
            FeatureVectorizer.BATTER_COLUMNS,
            FeatureVectorizer.PITCHER_COLUMNS,
            FeatureVectorizer.MATCHUP_COLUMNS);

    public FeatureSchema {
        names = List.copyOf(names);
    }

    /**
     * Ordre canonique : colonnes numériques connues dans leur ordre déclaré, puis le reste (one-hot) par ordre alphabétique.
     */
    public static FeatureSchema fromColumns(Collection<String> columns) {
        Set<String> remaining = new TreeSet<>(columns);
        List<String> ordered = new ArrayList<>();
        for (List<String> group : ORDERED_GROUPS) {
            for (String column : group) {
                if (remaining.remove(column)) ordered.add(column);
            }
        }
        ordered.addAll(remaining);
        return new FeatureSchema(ordered);
    }

    public double[] align(Map<String, Double> features) {
        double[] values = new double[names.size()];
        for (int i = 0; i < values.length; i++) {
            Double v = features.get(names.get(i));
            values[i] = (v != null && Double.isFinite(v)) ? v : 0.0;
        }
        return values;
    }

    public String[] namesArray() {
        return names.toArray(new String[0]);
    }

    public int size() {
        return names.size();
    }

    public boolean contains(String column) {
        return names.contains(column);
    }

    /** Colonnes présentes dans les features mais inconnues du schéma (ignorées à l'alignement). */
    public Set<String> unknownColumns(Map<String, Double> features) {
        Set<String> extra = new LinkedHashSet<>(features.keySet());
        names.forEach(extra::remove);
        return extra;
    }
}
