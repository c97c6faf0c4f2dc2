package com.tony.baseballAnalytics.model;

public record LabeledSituation(Situation situation, TacticProbabilities tactics) {

    public String primaryTactic() {
        return tactics.getPrimaryTactic();
    }
}
