package com.tony.baseballAnalytics.model.training;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ModelEvaluation {
    double accuracy;
    double weightedF1;
    Map<String, ClassMetrics> classReport;
    List<String> confusionLabels;
    long[][] confusionMatrix; // lignes = réel, colonnes = prédit
    List<FeatureImportance> topFeatures;
    ConfidenceStats confidence;
    CrossValidationSummary crossValidation;
}
