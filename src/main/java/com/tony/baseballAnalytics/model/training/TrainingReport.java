package com.tony.baseballAnalytics.model.training;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class TrainingReport {
    int trainSize;
    int testSize;
    int featureCount;
    Map<String, Long> classCounts;
    Map<String, Double> classWeights;
    Hyperparameters hyperparameters;
    GridSearchResult gridSearch;   // null si optimize = false
    ModelEvaluation evaluation;    // null si l'évaluation est désactivée
}
