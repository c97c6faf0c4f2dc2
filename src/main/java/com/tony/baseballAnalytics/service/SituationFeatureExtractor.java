package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.exception.FeatureExtractionException;
import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.TacticalTaxonomy;
import com.tony.baseballAnalytics.model.dto.RawPlay;
import com.tony.baseballAnalytics.service.stats.PlayerStatsProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transforme une action brute du flux play-by-play en {@link Situation} enrichie des métriques situationnelles.
 * Fonction pure : mêmes entrées, mêmes sorties (pas d'aléa, pas d'état).
 */
@Service
@Slf4j
public class SituationFeatureExtractor {

    public static final String TOP = "top";
    public static final String BOTTOM = "bottom";
    public static final String SCORE = "score";

    // --- Pression ---
    private static final int LATE_INNING = 7;
    private static final double LATE_INNING_FACTOR = 1.5;
    private static final double PER_OUT_FACTOR = 0.2;
    private static final double SCORING_POSITION_FACTOR = 1.3;
    private static final double MAX_PRESSURE = 2.0;

    // --- Levier ---
    private static final int CLOSE_GAME_MARGIN = 2;
    private static final double CLOSE_GAME_FACTOR = 2.0;
    private static final double LATE_STAGE = 0.7;
    private static final double LATE_STAGE_FACTOR = 1.5;
    private static final double MAX_LEVERAGE = 3.0;

    // --- Espérance de points ---
    private static final double RUN_VALUE_SCORING_POSITION = 0.5;
    private static final double RUN_VALUE_DEFAULT = 0.3;

    private static final int REGULATION_INNINGS = 9;
    private static final int EXTRA_INNINGS_START = 10;

    private enum Base { FIRST, SECOND, THIRD }

    /**
     * Extrait toutes les situations exploitables d'une liste d'actions, dans l'ordre du flux.
     * Les actions hors vocabulaire tactique sont écartées ; une action mal formée interrompt l'extraction.
     */
    public List<Situation> extractAll(List<RawPlay> plays, PlayerStatsProvider statsProvider) {
        List<Situation> situations = new ArrayList<>();
        if (plays == null) return situations;

        for (RawPlay play : plays) {
            extract(play, statsProvider).ifPresent(situations::add);
        }
        log.debug("Extraction : {} situations retenues sur {} actions", situations.size(), plays.size());
        return situations;
    }

    public List<Situation> extractAll(List<RawPlay> plays) {
        return extractAll(plays, null);
    }

    /**
     * @param statsProvider facultatif ; interrogé seulement si le frappeur et le lanceur sont identifiés
     * @return vide si l'action ne relève d'aucune tactique connue
     * @throws FeatureExtractionException champ obligatoire absent ou valeur hors bornes
     */
    public Optional<Situation> extract(RawPlay play, PlayerStatsProvider statsProvider) {
        validate(play);

        String action = play.getEvent();
        if (!TacticalTaxonomy.isKnownAction(action)) {
            log.debug("Action ignorée (hors vocabulaire) : {}", action);
            return Optional.empty();
        }

        int inning = play.getInning();
        int outs = play.getOuts();
        int balls = valueOrZero(play.getBalls());
        int strikes = valueOrZero(play.getStrikes());
        int scoreHome = valueOrZero(play.getHomeScore());
        int scoreAway = valueOrZero(play.getAwayScore());

        // 1. SCORE
        int scoreDiff = scoreAway - scoreHome;
        boolean closeGame = Math.abs(scoreDiff) <= CLOSE_GAME_MARGIN;

        // 2. COUREURS (bases occupées au départ de l'action)
        Set<Base> occupied = EnumSet.noneOf(Base.class);
        int runsScored = 0;
        for (RawPlay.Runner runner : play.getRunners() == null ? List.<RawPlay.Runner>of() : play.getRunners()) {
            if (runner == null || runner.getMovement() == null) continue;
            toBase(runner.getMovement().getStart()).ifPresent(occupied::add);
            if (SCORE.equals(runner.getMovement().getEnd())) runsScored++;
        }
        int numRunners = occupied.size();
        boolean scoringPosition = occupied.contains(Base.SECOND) || occupied.contains(Base.THIRD);

        // 3. MÉTRIQUES DÉRIVÉES
        double pressure = pressureIndex(inning, outs, scoringPosition);
        double gameStage = gameStage(inning, outs);
        double outsLeft = (3.0 - outs) / 3.0;

        double runExpectancy = numRunners * (scoringPosition ? RUN_VALUE_SCORING_POSITION : RUN_VALUE_DEFAULT) * outsLeft;

        double leverage = pressure;
        if (closeGame) leverage *= CLOSE_GAME_FACTOR;
        if (gameStage > LATE_STAGE) leverage *= LATE_STAGE_FACTOR;
        leverage = Math.min(leverage, MAX_LEVERAGE);

        double offensiveOpportunity = numRunners * (scoringPosition ? 1.5 : 1.0) * outsLeft;
        double defensivePressure = numRunners * pressure * (outs + 1) / 3.0;
        double countLeverage = (balls / 4.0) * (1.0 - strikes / 3.0);
        double scoringThreat = offensiveOpportunity * pressure * (closeGame ? 2.0 : 1.0);

        Situation.SituationBuilder builder = Situation.builder()
                .inning(inning)
                .halfInning(play.getHalfInning())
                .outs(outs)
                .balls(balls)
                .strikes(strikes)
                .scoreHome(scoreHome)
                .scoreAway(scoreAway)
                .result(action)
                .battingTeam(play.getBattingTeam())
                .batterId(batterId(play))
                .pitcherId(pitcherId(play))
                .scoreDiff(scoreDiff)
                .closeGame(closeGame)
                .numRunners(numRunners)
                .scoringPosition(scoringPosition)
                .runsScored(runsScored)
                .runnerOnFirst(occupied.contains(Base.FIRST))
                .runnerOnSecond(occupied.contains(Base.SECOND))
                .runnerOnThird(occupied.contains(Base.THIRD))
                .pressureIndex(pressure)
                .gameStage(gameStage)
                .runExpectancy(runExpectancy)
                .leverageIndex(leverage)
                .winProbabilityAdded(winProbabilityAdded(inning, scoreDiff))
                .offensiveOpportunity(offensiveOpportunity)
                .defensivePressure(defensivePressure)
                .countLeverage(countLeverage)
                .scoringThreat(scoringThreat);

        // 4. STATS JOUEURS (collaborateur externe, jamais bloquant)
        Long batterId = batterId(play);
        Long pitcherId = pitcherId(play);
        if (statsProvider != null && batterId != null && pitcherId != null) {
            builder.batterStats(statsProvider.findBatterStats(batterId).orElseGet(BatterStats::empty))
                    .pitcherStats(statsProvider.findPitcherStats(pitcherId).orElseGet(PitcherStats::empty))
                    .matchupStats(statsProvider.findMatchupStats(batterId, pitcherId).orElseGet(MatchupStats::empty));
        }

        return Optional.of(builder.build());
    }

    public Optional<Situation> extract(RawPlay play) {
        return extract(play, null);
    }

    // =========================================================================
    // FORMULES
    // =========================================================================

    static double pressureIndex(int inning, int outs, boolean scoringPosition) {
        double pressure = 1.0;
        if (inning >= LATE_INNING) pressure *= LATE_INNING_FACTOR;
        pressure *= (1.0 + PER_OUT_FACTOR * outs);
        if (scoringPosition) pressure *= SCORING_POSITION_FACTOR;
        return Math.min(pressure, MAX_PRESSURE);
    }

    static double gameStage(int inning, int outs) {
        return (Math.min(inning, REGULATION_INNINGS) - 1 + outs / 3.0) / REGULATION_INNINGS;
    }

    static double winProbabilityAdded(int inning, int scoreDiff) {
        if (inning >= EXTRA_INNINGS_START) {
            return 0.5 + 0.1 * scoreDiff / 2.0;
        }
        return 0.5 + 0.1 * scoreDiff / Math.max(EXTRA_INNINGS_START - inning, 1);
    }

    // =========================================================================
    // VALIDATION
    // =========================================================================

    private void validate(RawPlay play) {
        if (play == null) throw new FeatureExtractionException("Action de jeu absente");
        if (play.getInning() == null) throw missing("inning");
        if (play.getHalfInning() == null) throw missing("halfInning");
        if (play.getOuts() == null) throw missing("outs");
        if (play.getEvent() == null) throw missing("event");

        if (play.getInning() < 1) {
            throw new FeatureExtractionException("Manche invalide : " + play.getInning());
        }
        if (!TOP.equals(play.getHalfInning()) && !BOTTOM.equals(play.getHalfInning())) {
            throw new FeatureExtractionException("Demi-manche inconnue : " + play.getHalfInning());
        }
        checkRange("outs", play.getOuts(), 0, 3);
        if (play.getBalls() != null) checkRange("balls", play.getBalls(), 0, 4);
        if (play.getStrikes() != null) checkRange("strikes", play.getStrikes(), 0, 3);
        if (play.getHomeScore() != null && play.getHomeScore() < 0) {
            throw new FeatureExtractionException("Score domicile négatif : " + play.getHomeScore());
        }
        if (play.getAwayScore() != null && play.getAwayScore() < 0) {
            throw new FeatureExtractionException("Score visiteur négatif : " + play.getAwayScore());
        }
    }

    private static void checkRange(String field, int value, int min, int max) {
        if (value < min || value > max) {
            throw new FeatureExtractionException(
                    String.format("%s hors bornes : %d (attendu entre %d et %d)", field, value, min, max));
        }
    }

    private static FeatureExtractionException missing(String field) {
        return new FeatureExtractionException("Champ obligatoire manquant : " + field);
    }

    // =========================================================================
    // OUTILS
    // =========================================================================

    private static Optional<Base> toBase(String code) {
        if (code == null) return Optional.empty();
        switch (code) {
            case "1B": return Optional.of(Base.FIRST);
            case "2B": return Optional.of(Base.SECOND);
            case "3B": return Optional.of(Base.THIRD);
            default: return Optional.empty();
        }
    }

    private static Long batterId(RawPlay play) {
        RawPlay.Matchup m = play.getMatchup();
        return (m != null && m.getBatter() != null) ? m.getBatter().getId() : null;
    }

    private static Long pitcherId(RawPlay play) {
        RawPlay.Matchup m = play.getMatchup();
        return (m != null && m.getPitcher() != null) ? m.getPitcher().getId() : null;
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
