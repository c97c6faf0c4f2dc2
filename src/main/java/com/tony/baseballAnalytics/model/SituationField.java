package com.tony.baseballAnalytics.model;

import java.util.function.ToDoubleFunction;

/**
 * Champs numériques d'une {@link Situation} interrogeables par les conditions de contexte des tactiques.
 * Les booléens valent 1.0 (vrai) ou 0.0 (faux).
 */
public enum SituationField {
    NUM_RUNNERS(Situation::getNumRunners),
    OUTS(Situation::getOuts),
    BALLS(Situation::getBalls),
    STRIKES(Situation::getStrikes),
    SCORE_DIFF(Situation::getScoreDiff),
    SCORING_POSITION(s -> s.isScoringPosition() ? 1.0 : 0.0),
    PRESSURE_INDEX(Situation::getPressureIndex),
    OFFENSIVE_OPPORTUNITY(Situation::getOffensiveOpportunity),
    DEFENSIVE_PRESSURE(Situation::getDefensivePressure);

    private final ToDoubleFunction<Situation> extractor;

    SituationField(ToDoubleFunction<Situation> extractor) {
        this.extractor = extractor;
    }

    public double read(Situation situation) {
        return extractor.applyAsDouble(situation);
    }
}
