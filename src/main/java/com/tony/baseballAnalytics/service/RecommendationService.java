package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.model.ContextAnalysis;
import com.tony.baseballAnalytics.model.Recommendation;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.TacticCategory;
import com.tony.baseballAnalytics.model.TacticalTaxonomy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Résumé de contexte, classement des tactiques et recommandations argumentées (règles simples).
 */
@Service
@RequiredArgsConstructor
public class RecommendationService {

    private static final int LATE_INNING = 7;
    private static final int CLOSE_GAME_MARGIN = 2;
    private static final String SEPARATOR = " | ";

    private final TacticsProperties properties;

    public ContextAnalysis analyzeContext(Situation s) {
        return new ContextAnalysis(
                new ContextAnalysis.GameSituation(s.getInning(), s.getOuts(), s.getScoreDiff(), round(s.getPressureIndex())),
                new ContextAnalysis.RunnerSituation(s.getNumRunners(), s.isScoringPosition()));
    }

    /**
     * Les N tactiques les plus probables toutes catégories confondues (ordre décroissant, stable à égalité).
     */
    public Map<String, Double> topTactics(Map<TacticCategory, Map<String, Double>> probabilities) {
        Map<String, Double> all = new LinkedHashMap<>();
        probabilities.values().forEach(all::putAll);

        Map<String, Double> top = new LinkedHashMap<>();
        all.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(properties.getInference().getTopTactics())
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    public List<Recommendation> recommend(Map<String, Double> topTactics, ContextAnalysis context) {
        List<Recommendation> recommendations = new ArrayList<>();
        topTactics.forEach((tactic, probability) -> recommendations.add(Recommendation.builder()
                .tactic(tactic)
                .probability(probability)
                .reasoning(reasoning(tactic, context))
                .specificActions(TacticalTaxonomy.actionsOf(tactic))
                .build()));
        return recommendations;
    }

    String reasoning(String tactic, ContextAnalysis context) {
        ContextAnalysis.GameSituation game = context.getGameSituation();
        ContextAnalysis.RunnerSituation runners = context.getRunnerSituation();
        double highPressure = properties.getInference().getHighPressureThreshold();

        List<String> reasons = new ArrayList<>();
        if (game.getInning() >= LATE_INNING) reasons.add("Fin de match");
        if (game.getPressureIndex() > highPressure) reasons.add("Situation à forte pression");
        if (runners.isScoringPosition()) reasons.add("Coureurs en position de marquer");

        // scoreDiff = visiteurs - locaux
        if (Math.abs(game.getScoreDiff()) <= CLOSE_GAME_MARGIN) reasons.add("Match serré");
        else if (game.getScoreDiff() > 0) reasons.add("Visiteurs devant de plusieurs points");
        else reasons.add("Locaux devant de plusieurs points");

        TacticCategory category = TacticalTaxonomy.categoryOf(tactic).orElse(null);
        if (category == TacticCategory.OFFENSIVE && runners.isScoringPosition()) {
            reasons.add("Bonne opportunité de marquer");
        } else if (category == TacticCategory.DEFENSIVE && game.getPressureIndex() > highPressure) {
            reasons.add("Situation défensive critique");
        }

        return reasons.isEmpty() ? "Basé sur la situation générale du match" : String.join(SEPARATOR, reasons);
    }

    private double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
