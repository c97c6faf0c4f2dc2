package com.tony.baseballAnalytics.service.ml;

import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;
import com.tony.baseballAnalytics.model.Situation;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aplatit une {@link Situation} en features numériques nommées.
 * Identifiants (équipe, frappeur, lanceur) exclus ; catégories encodées en one-hot ; booléens en 0/1.
 */
@Component
public class FeatureVectorizer {

    public static final String HALF_INNING_PREFIX = "half_inning_";
    public static final String RESULT_PREFIX = "result_";

    public static final List<String> BASE_COLUMNS = List.of(
            "inning", "outs", "balls", "strikes",
            "score_home", "score_away", "score_diff", "is_close_game",
            "num_runners", "scoring_position", "runs_scored",
            "runner_on_first", "runner_on_second", "runner_on_third",
            "pressure_index", "game_stage", "run_expectancy", "leverage_index",
            "win_probability_added", "offensive_opportunity", "defensive_pressure",
            "count_leverage", "scoring_threat");

    public static final List<String> BATTER_COLUMNS = List.of(
            "batter_avg", "batter_obp", "batter_slg", "batter_ops",
            "batter_hr", "batter_so", "batter_bb", "batter_risp_avg", "batter_clutch_ops");

    public static final List<String> PITCHER_COLUMNS = List.of(
            "pitcher_era", "pitcher_whip", "pitcher_k_per_9", "pitcher_bb_per_9",
            "pitcher_h_per_9", "pitcher_gb_rate", "pitcher_k_rate", "pitcher_bb_rate");

    public static final List<String> MATCHUP_COLUMNS = List.of(
            "matchup_avg", "matchup_ops", "matchup_abs", "matchup_hr", "matchup_so", "matchup_bb");

    // Colonnes sans lesquelles un entraînement n'a pas de sens
    public static final List<String> REQUIRED_COLUMNS = List.of(
            "inning", "outs", "num_runners", "scoring_position", "pressure_index");

    public Map<String, Double> vectorize(Situation s) {
        Map<String, Double> f = new LinkedHashMap<>();
        put(f, "inning", s.getInning());
        put(f, "outs", s.getOuts());
        put(f, "balls", s.getBalls());
        put(f, "strikes", s.getStrikes());
        put(f, "score_home", s.getScoreHome());
        put(f, "score_away", s.getScoreAway());
        put(f, "score_diff", s.getScoreDiff());
        put(f, "is_close_game", flag(s.isCloseGame()));
        put(f, "num_runners", s.getNumRunners());
        put(f, "scoring_position", flag(s.isScoringPosition()));
        put(f, "runs_scored", s.getRunsScored());
        put(f, "runner_on_first", flag(s.isRunnerOnFirst()));
        put(f, "runner_on_second", flag(s.isRunnerOnSecond()));
        put(f, "runner_on_third", flag(s.isRunnerOnThird()));
        put(f, "pressure_index", s.getPressureIndex());
        put(f, "game_stage", s.getGameStage());
        put(f, "run_expectancy", s.getRunExpectancy());
        put(f, "leverage_index", s.getLeverageIndex());
        put(f, "win_probability_added", s.getWinProbabilityAdded());
        put(f, "offensive_opportunity", s.getOffensiveOpportunity());
        put(f, "defensive_pressure", s.getDefensivePressure());
        put(f, "count_leverage", s.getCountLeverage());
        put(f, "scoring_threat", s.getScoringThreat());

        BatterStats b = s.getBatterStats();
        if (b != null) {
            put(f, "batter_avg", b.getAvg());
            put(f, "batter_obp", b.getObp());
            put(f, "batter_slg", b.getSlg());
            put(f, "batter_ops", b.getOps());
            put(f, "batter_hr", b.getHomeRuns());
            put(f, "batter_so", b.getStrikeouts());
            put(f, "batter_bb", b.getWalks());
            put(f, "batter_risp_avg", b.getRispAvg());
            put(f, "batter_clutch_ops", b.getClutchOps());
        }

        PitcherStats p = s.getPitcherStats();
        if (p != null) {
            put(f, "pitcher_era", p.getEra());
            put(f, "pitcher_whip", p.getWhip());
            put(f, "pitcher_k_per_9", p.getStrikeoutsPerNine());
            put(f, "pitcher_bb_per_9", p.getWalksPerNine());
            put(f, "pitcher_h_per_9", p.getHitsPerNine());
            put(f, "pitcher_gb_rate", p.getGroundBallRate());
            put(f, "pitcher_k_rate", p.getStrikeoutRate());
            put(f, "pitcher_bb_rate", p.getWalkRate());
        }

        MatchupStats m = s.getMatchupStats();
        if (m != null) {
            put(f, "matchup_avg", m.getAvg());
            put(f, "matchup_ops", m.getOps());
            put(f, "matchup_abs", m.getAtBats());
            put(f, "matchup_hr", m.getHomeRuns());
            put(f, "matchup_so", m.getStrikeouts());
            put(f, "matchup_bb", m.getWalks());
        }

        // One-hot, triées après les colonnes numériques
        Map<String, Double> dummies = new TreeMap<>();
        if (s.getHalfInning() != null) dummies.put(HALF_INNING_PREFIX + s.getHalfInning(), 1.0);
        if (s.getResult() != null) dummies.put(RESULT_PREFIX + s.getResult(), 1.0);
        f.putAll(dummies);
        return f;
    }

    private static void put(Map<String, Double> features, String name, double value) {
        features.put(name, Double.isFinite(value) ? value : 0.0);
    }

    private static double flag(boolean value) {
        return value ? 1.0 : 0.0;
    }
}
