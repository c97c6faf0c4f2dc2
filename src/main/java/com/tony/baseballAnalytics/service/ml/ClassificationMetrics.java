package com.tony.baseballAnalytics.service.ml;

import com.tony.baseballAnalytics.model.training.ClassMetrics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Métriques de classification multi-classes calculées sur des listes (réel, prédit) alignées.
 */
public final class ClassificationMetrics {

    private ClassificationMetrics() {
    }

    public static double accuracy(List<String> actual, List<String> predicted) {
        if (actual.isEmpty()) return 0.0;
        int correct = 0;
        for (int i = 0; i < actual.size(); i++) {
            if (actual.get(i).equals(predicted.get(i))) correct++;
        }
        return (double) correct / actual.size();
    }

    /**
     * Rapport par classe (précision, rappel, F1, support), classes triées par nom.
     * Une division par zéro donne 0.
     */
    public static Map<String, ClassMetrics> report(List<String> actual, List<String> predicted) {
        TreeSet<String> labels = new TreeSet<>(actual);
        labels.addAll(predicted);

        Map<String, ClassMetrics> report = new LinkedHashMap<>();
        for (String label : labels) {
            long tp = 0, fp = 0, fn = 0;
            for (int i = 0; i < actual.size(); i++) {
                boolean isActual = label.equals(actual.get(i));
                boolean isPredicted = label.equals(predicted.get(i));
                if (isActual && isPredicted) tp++;
                else if (isPredicted) fp++;
                else if (isActual) fn++;
            }
            double precision = safeDivide(tp, tp + fp);
            double recall = safeDivide(tp, tp + fn);
            double f1 = (precision + recall) > 0 ? 2 * precision * recall / (precision + recall) : 0.0;
            report.put(label, new ClassMetrics(label, precision, recall, f1, tp + fn));
        }
        return report;
    }

    /** F1 moyen pondéré par le support réel de chaque classe. */
    public static double weightedF1(List<String> actual, List<String> predicted) {
        if (actual.isEmpty()) return 0.0;
        double sum = 0.0;
        for (ClassMetrics m : report(actual, predicted).values()) {
            sum += m.f1() * m.support();
        }
        return sum / actual.size();
    }

    /** Matrice de confusion : lignes = réel, colonnes = prédit, dans l'ordre de {@code labels}. */
    public static long[][] confusionMatrix(List<String> labels, List<String> actual, List<String> predicted) {
        long[][] matrix = new long[labels.size()][labels.size()];
        for (int i = 0; i < actual.size(); i++) {
            int row = labels.indexOf(actual.get(i));
            int col = labels.indexOf(predicted.get(i));
            if (row >= 0 && col >= 0) matrix[row][col]++;
        }
        return matrix;
    }

    private static double safeDivide(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
