package com.tony.baseballAnalytics.model.training;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Table d'entraînement ordonnée (ordre des actions de jeu conservé).
 */
public record TrainingDataset(List<TrainingRow> rows) {

    // Pseudo-classe exclue de l'apprentissage
    public static final String OTHER_LABEL = "other";

    public TrainingDataset {
        rows = List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /** Union des colonnes de toutes les lignes, dans l'ordre de première apparition. */
    public Set<String> columns() {
        Set<String> columns = new LinkedHashSet<>();
        rows.forEach(r -> columns.addAll(r.features().keySet()));
        return columns;
    }

    /** Effectif par label, trié par nom de label. */
    public Map<String, Long> labelCounts() {
        return rows.stream().collect(Collectors.groupingBy(TrainingRow::label, TreeMap::new, Collectors.counting()));
    }

    public TrainingDataset withoutLabel(String label) {
        return new TrainingDataset(rows.stream().filter(r -> !label.equals(r.label())).toList());
    }

    public List<String> labels() {
        return rows.stream().map(TrainingRow::label).toList();
    }
}
