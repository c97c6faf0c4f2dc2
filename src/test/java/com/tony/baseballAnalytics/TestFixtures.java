package com.tony.baseballAnalytics;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.model.dto.RawPlay;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Jeux de données de test partagés.
 */
public final class TestFixtures {

    private static final List<String> EVENTS = List.of(
            "Single", "Double", "Home Run", "Triple", "Walk", "Strikeout", "Groundout", "Flyout",
            "Sac Bunt", "Grounded Into DP", "Stolen Base 2B", "Field Error", "Pickoff");

    private TestFixtures() {
    }

    /**
     * @param runnerStarts bases occupées au départ de l'action ("1B", "2B", "3B")
     */
    public static RawPlay play(int inning, String half, int outs, int balls, int strikes,
                               int home, int away, String event, String... runnerStarts) {
        List<RawPlay.Runner> runners = new ArrayList<>();
        for (String start : runnerStarts) {
            runners.add(new RawPlay.Runner(new RawPlay.Movement(start, null)));
        }
        return RawPlay.builder()
                .inning(inning)
                .halfInning(half)
                .outs(outs)
                .balls(balls)
                .strikes(strikes)
                .homeScore(home)
                .awayScore(away)
                .event(event)
                .battingTeam(half.equals("top") ? "away" : "home")
                .matchup(new RawPlay.Matchup(new RawPlay.PlayerRef(660271L), new RawPlay.PlayerRef(543037L)))
                .runners(runners)
                .build();
    }

    /** Match synthétique reproductible (graine fixe). */
    public static List<RawPlay> randomGame(int plays, long seed) {
        Random random = new Random(seed);
        List<RawPlay> game = new ArrayList<>();
        String[] bases = {"1B", "2B", "3B"};
        for (int i = 0; i < plays; i++) {
            List<String> occupied = new ArrayList<>();
            for (String base : bases) {
                if (random.nextDouble() < 0.35) occupied.add(base);
            }
            game.add(play(
                    1 + random.nextInt(9),
                    random.nextBoolean() ? "top" : "bottom",
                    random.nextInt(3),
                    random.nextInt(4),
                    random.nextInt(3),
                    random.nextInt(6),
                    random.nextInt(6),
                    EVENTS.get(random.nextInt(EVENTS.size())),
                    occupied.toArray(new String[0])));
        }
        return game;
    }

    /** Petite forêt pour garder des tests rapides. */
    public static TacticsProperties fastProperties() {
        TacticsProperties properties = new TacticsProperties();
        TacticsProperties.ForestParameters defaults = properties.getTraining().getDefaults();
        defaults.setTrees(10);
        defaults.setMaxDepth(6);
        defaults.setMinLeafWeight(1f);
        defaults.setFeatureFraction(0.5f);
        defaults.setMinImpurityDecrease(0f);
        properties.getTraining().setCvFolds(3);
        properties.getTraining().setEvaluate(false);
        properties.getTraining().setGridSearchThreads(2);
        return properties;
    }
}
