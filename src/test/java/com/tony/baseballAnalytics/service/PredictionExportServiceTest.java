package com.tony.baseballAnalytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.baseballAnalytics.model.ContextAnalysis;
import com.tony.baseballAnalytics.model.MomentumAnalysis;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Recommendation;
import com.tony.baseballAnalytics.model.TacticCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PredictionExportServiceTest {

    private PredictionExportService exportService;
    private PredictionResult result;

    @BeforeEach
    void setUp() {
        exportService = new PredictionExportService(new ObjectMapper());

        Map<TacticCategory, Map<String, Double>> probabilities = new EnumMap<>(TacticCategory.class);
        probabilities.put(TacticCategory.OFFENSIVE, new LinkedHashMap<>(Map.of("power_hitting", 60.0)));
        probabilities.put(TacticCategory.BASERUNNING, new LinkedHashMap<>());
        probabilities.put(TacticCategory.DEFENSIVE, new LinkedHashMap<>(Map.of("defensive_outs", 25.5)));

        result = PredictionResult.builder()
                .tacticalProbabilities(probabilities)
                .topTactics(new LinkedHashMap<>(Map.of("power_hitting", 60.0)))
                .contextAnalysis(new ContextAnalysis(
                        new ContextAnalysis.GameSituation(8, 1, 0, 2.0),
                        new ContextAnalysis.RunnerSituation(1, true)))
                .recommendations(List.of(Recommendation.builder()
                        .tactic("power_hitting")
                        .probability(60.0)
                        .reasoning("Fin de match | Match serré")
                        .specificActions(List.of("Home Run", "Double", "Triple"))
                        .build()))
                .build();
    }

    @Test
    @DisplayName("Document à plat : clés pointées et indices de liste")
    void flatDocumentKeys() {
        Map<String, Object> flat = exportService.toFlatDocument(result);

        assertThat(flat)
                .containsEntry("tacticalProbabilities.OFFENSIVE.power_hitting", 60.0)
                .containsEntry("tacticalProbabilities.DEFENSIVE.defensive_outs", 25.5)
                .containsEntry("recommendations[0].tactic", "power_hitting")
                .containsEntry("recommendations[0].specificActions[2]", "Triple")
                .containsEntry("contextAnalysis.gameSituation.inning", 8)
                .containsEntry("contextAnalysis.runnerSituation.scoringPosition", true);
    }

    @Test
    @DisplayName("Enrichissements absents : aucune clé correspondante")
    void absentEnrichmentsAreOmitted() {
        Map<String, Object> flat = exportService.toFlatDocument(result);

        assertThat(flat.keySet()).noneMatch(k -> k.startsWith("momentumAnalysis"));
        assertThat(flat.keySet()).noneMatch(k -> k.startsWith("playerAnalysis"));
    }

    @Test
    @DisplayName("JSON à plat lisible par un collaborateur en aval")
    void flatJson() throws JsonProcessingException {
        String json = exportService.toFlatJson(result);

        assertThat(json).contains("\"recommendations[0].probability\":60.0");
    }

    @Test
    @DisplayName("Rapport texte : probabilités, recommandations, situation et momentum")
    void textReport() {
        result.setMomentumAnalysis(new MomentumAnalysis(
                new MomentumAnalysis.SideMomentum(0.8, 0.5),
                new MomentumAnalysis.SideMomentum(0.2, 0.0)));

        String report = exportService.toTextReport(result);

        assertThat(report)
                .startsWith("Rapport d'analyse tactique")
                .contains("power_hitting")
                .contains("60.00%")
                .contains("Raisons : Fin de match | Match serré")
                .contains("  - Home Run")
                .contains("Indice de pression : 2.00")
                .contains("Position de marquer : Oui")
                .contains("Attaque : 0.80")
                .doesNotContain("BASERUNNING")
                .doesNotContain("Situations similaires");
    }
}
