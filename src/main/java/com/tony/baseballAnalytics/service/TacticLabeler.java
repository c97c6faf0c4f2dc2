package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.ContextCondition;
import com.tony.baseballAnalytics.model.LabeledSituation;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.Tactic;
import com.tony.baseballAnalytics.model.TacticProbabilities;
import com.tony.baseballAnalytics.model.TacticalTaxonomy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Étiquetage heuristique : score chaque tactique candidate pour l'action observée et retient la meilleure.
 * Les scores ne sont PAS normalisés (ils peuvent dépasser 1, et le repli vaut 100).
 */
@Service
@Slf4j
public class TacticLabeler {

    private static final double BASE_PROBABILITY = 0.4;
    private static final double CONTEXT_WEIGHT = 0.6;
    private static final double MIN_PROBABILITY = 0.05;
    private static final double FALLBACK_PROBABILITY = 100.0;

    // --- Boosts situationnels ---
    private static final double HIGH_PRESSURE = 1.5;
    private static final double HIGH_PRESSURE_STRONG_BOOST = 1.2;
    private static final double HIGH_PRESSURE_LIGHT_BOOST = 1.1;

    // --- Boosts joueurs ---
    private static final double POWER_BATTER_OPS = 0.800;
    private static final double CONTACT_BATTER_AVG = 0.300;
    private static final double STRIKEOUT_PITCHER_K9 = 9.0;
    private static final double GROUND_BALL_PITCHER_RATE = 0.5;
    private static final int MIN_MATCHUP_AT_BATS = 10;
    private static final double HOT_MATCHUP_OPS = 0.800;
    private static final double COLD_MATCHUP_OPS = 0.600;
    private static final double MATCHUP_BOOST = 1.15;

    public TacticProbabilities label(Situation situation) {
        List<Tactic> candidates = TacticalTaxonomy.tacticsFor(situation.getResult());
        if (candidates.isEmpty()) {
            return fallback();
        }

        Map<String, Double> probabilities = new LinkedHashMap<>();
        for (Tactic tactic : candidates) {
            double prob = BASE_PROBABILITY + CONTEXT_WEIGHT * contextMatchFraction(tactic, situation);
            prob *= pressureBoost(tactic, situation);
            prob *= playerBoost(tactic, situation);

            if (prob >= MIN_PROBABILITY) {
                probabilities.put(tactic.getCode(), prob);
            }
        }

        if (probabilities.isEmpty()) {
            return fallback();
        }
        return new TacticProbabilities(Collections.unmodifiableMap(probabilities), argMax(probabilities));
    }

    public LabeledSituation labelSituation(Situation situation) {
        return new LabeledSituation(situation, label(situation));
    }

    public List<LabeledSituation> labelAll(List<Situation> situations) {
        List<LabeledSituation> labeled = situations.stream().map(this::labelSituation).toList();
        log.debug("Étiquetage : {} situations", labeled.size());
        return labeled;
    }

    // Fraction des clauses de contexte satisfaites (chacune évaluée indépendamment)
    static double contextMatchFraction(Tactic tactic, Situation situation) {
        List<ContextCondition> contexts = tactic.getContexts();
        if (contexts.isEmpty()) return 0.0;
        long matched = contexts.stream().filter(c -> c.matches(situation)).count();
        return (double) matched / contexts.size();
    }

    private double pressureBoost(Tactic tactic, Situation s) {
        if (s.getPressureIndex() < HIGH_PRESSURE) return 1.0;
        switch (tactic) {
            case POWER_HITTING:
            case PATIENT_HITTING:
                return HIGH_PRESSURE_STRONG_BOOST;
            case CONTACT_HITTING:
            case DEFENSIVE_OUTS:
                return HIGH_PRESSURE_LIGHT_BOOST;
            default:
                return 1.0;
        }
    }

    private double playerBoost(Tactic tactic, Situation s) {
        double boost = 1.0;

        BatterStats batter = s.getBatterStats();
        if (batter != null) {
            if (tactic == Tactic.POWER_HITTING && batter.getOps() > POWER_BATTER_OPS) boost *= 1.2;
            else if (tactic == Tactic.CONTACT_HITTING && batter.getAvg() > CONTACT_BATTER_AVG) boost *= 1.1;
        }

        PitcherStats pitcher = s.getPitcherStats();
        if (pitcher != null) {
            if (tactic == Tactic.STRIKEOUT_PITCHING && pitcher.getStrikeoutsPerNine() > STRIKEOUT_PITCHER_K9) boost *= 1.2;
            else if (tactic == Tactic.DEFENSIVE_OUTS && pitcher.getGroundBallRate() > GROUND_BALL_PITCHER_RATE) boost *= 1.1;
        }

        MatchupStats matchup = s.getMatchupStats();
        if (matchup != null && matchup.getAtBats() > MIN_MATCHUP_AT_BATS) {
            if (matchup.getOps() > HOT_MATCHUP_OPS) {
                if (tactic == Tactic.POWER_HITTING || tactic == Tactic.CONTACT_HITTING) boost *= MATCHUP_BOOST;
            } else if (matchup.getOps() < COLD_MATCHUP_OPS) {
                if (tactic == Tactic.DEFENSIVE_OUTS || tactic == Tactic.STRIKEOUT_PITCHING) boost *= MATCHUP_BOOST;
            }
        }
        return boost;
    }

    // Premier maximum rencontré : l'ordre d'insertion (celui de la taxonomie) départage les égalités
    private static String argMax(Map<String, Double> probabilities) {
        String best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, Double> e : probabilities.entrySet()) {
            if (e.getValue() > bestValue) {
                best = e.getKey();
                bestValue = e.getValue();
            }
        }
        return best;
    }

    private static TacticProbabilities fallback() {
        return new TacticProbabilities(Map.of(TacticalTaxonomy.FALLBACK_TACTIC, FALLBACK_PROBABILITY),
                TacticalTaxonomy.FALLBACK_TACTIC);
    }
}
