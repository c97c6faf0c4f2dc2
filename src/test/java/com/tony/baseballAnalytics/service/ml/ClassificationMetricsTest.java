package com.tony.baseballAnalytics.service.ml;

import com.tony.baseballAnalytics.model.training.ClassMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ClassificationMetricsTest {

    private final List<String> actual = List.of("a", "a", "a", "b", "b", "c");
    private final List<String> predicted = List.of("a", "a", "b", "b", "c", "c");

    @Test
    @DisplayName("Accuracy : part des prédictions exactes")
    void accuracy() {
        assertThat(ClassificationMetrics.accuracy(actual, predicted)).isCloseTo(4.0 / 6.0, within(1e-9));
        assertThat(ClassificationMetrics.accuracy(List.of(), List.of())).isZero();
    }

    @Test
    @DisplayName("Rapport par classe : précision, rappel, F1 et support")
    void perClassReport() {
        Map<String, ClassMetrics> report = ClassificationMetrics.report(actual, predicted);

        assertThat(report.keySet()).containsExactly("a", "b", "c");
        ClassMetrics a = report.get("a");
        assertThat(a.precision()).isEqualTo(1.0);
        assertThat(a.recall()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(a.support()).isEqualTo(3);

        ClassMetrics c = report.get("c");
        assertThat(c.precision()).isEqualTo(0.5);
        assertThat(c.recall()).isEqualTo(1.0);
        assertThat(c.f1()).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    @DisplayName("Classe jamais prédite ni observée correctement : F1 nul sans division par zéro")
    void zeroDivisionGivesZero() {
        Map<String, ClassMetrics> report = ClassificationMetrics.report(List.of("a", "b"), List.of("b", "b"));

        assertThat(report.get("a").precision()).isZero();
        assertThat(report.get("a").f1()).isZero();
    }

    @Test
    @DisplayName("F1 pondéré par le support")
    void weightedF1() {
        // a : F1 0.8 (x3), b : F1 0.5 (x2), c : F1 2/3 (x1)
        double expected = (0.8 * 3 + 0.5 * 2 + 2.0 / 3.0) / 6.0;
        assertThat(ClassificationMetrics.weightedF1(actual, predicted)).isCloseTo(expected, within(1e-9));
    }

    @Test
    @DisplayName("Matrice de confusion : lignes = réel, colonnes = prédit")
    void confusionMatrix() {
        long[][] matrix = ClassificationMetrics.confusionMatrix(List.of("a", "b", "c"), actual, predicted);

        assertThat(matrix[0]).containsExactly(2, 1, 0);
        assertThat(matrix[1]).containsExactly(0, 1, 1);
        assertThat(matrix[2]).containsExactly(0, 0, 1);
    }
}
