package com.tony.baseballAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HistoricalPatterns {

    // Taux de réussite (%) par tactique de la taxonomie (0 sans échantillon)
    @Builder.Default
    private Map<TacticCategory, Map<String, Double>> successRates = new EnumMap<>(TacticCategory.class);

    // Nombre de situations similaires par tactique employée
    @Builder.Default
    private Map<String, Integer> sampleCounts = new LinkedHashMap<>();

    private int sampleSize;

    private SimilarSituationSummary summary; // null si aucune situation similaire

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SimilarSituationSummary {
        private int totalCount;
        private long successCount;
        private double averagePressure;
        private String mostCommonTactic;
    }
}
