package com.tony.baseballAnalytics.model.training;

public record ClassMetrics(String label, double precision, double recall, double f1, long support) {
}
