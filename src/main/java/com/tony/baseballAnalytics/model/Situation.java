package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * État d'une action de jeu, aplati et enrichi des métriques dérivées.
 * Construit une seule fois par le {@code SituationFeatureExtractor}, immuable ensuite.
 */
@Value
@Builder(toBuilder = true)
public class Situation {

    // --- Contexte brut ---
    int inning;
    String halfInning; // "top" ou "bottom"
    int outs;
    int balls;
    int strikes;
    int scoreHome;
    int scoreAway;
    String result;

    // --- Identifiants (exclus des features) ---
    String battingTeam;
    Long batterId;
    Long pitcherId;

    // --- Score ---
    int scoreDiff;       // visiteur - domicile
    boolean closeGame;   // |scoreDiff| <= 2

    // --- Coureurs ---
    int numRunners;
    boolean scoringPosition;
    int runsScored;
    boolean runnerOnFirst;
    boolean runnerOnSecond;
    boolean runnerOnThird;

    // --- Métriques dérivées ---
    double pressureIndex;      // [0, 2]
    double gameStage;          // [0, 1]
    double runExpectancy;
    double leverageIndex;      // [0, 3]
    double winProbabilityAdded;
    double offensiveOpportunity;
    double defensivePressure;
    double countLeverage;
    double scoringThreat;

    // --- Stats joueurs (null si aucune source n'a été interrogée) ---
    BatterStats batterStats;
    PitcherStats pitcherStats;
    MatchupStats matchupStats;
}
