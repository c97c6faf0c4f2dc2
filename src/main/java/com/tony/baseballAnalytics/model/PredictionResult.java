package com.tony.baseballAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class PredictionResult {

    // Probabilités (%) par catégorie, >= 5%, triées par ordre décroissant
    @Builder.Default
    private Map<TacticCategory, Map<String, Double>> tacticalProbabilities = new EnumMap<>(TacticCategory.class);

    // Top 3 toutes catégories confondues
    @Builder.Default
    private Map<String, Double> topTactics = new LinkedHashMap<>();

    private ContextAnalysis contextAnalysis;

    @Builder.Default
    private List<Recommendation> recommendations = new ArrayList<>();

    // --- Enrichissements optionnels ---
    private MomentumAnalysis momentumAnalysis;
    private HistoricalPatterns historicalPatterns;
    private PlayerAnalysis playerAnalysis;
}
