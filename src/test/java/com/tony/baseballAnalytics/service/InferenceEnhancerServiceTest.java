package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.TestFixtures;
import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.model.HistoricalPatterns;
import com.tony.baseballAnalytics.model.HistoricalSituation;
import com.tony.baseballAnalytics.model.MomentumAnalysis;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.TacticCategory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tony.baseballAnalytics.TestFixtures.play;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class InferenceEnhancerServiceTest {

    private SituationFeatureExtractor extractor;
    private InferenceEnhancerService enhancer;
    private Situation current;

    @BeforeEach
    void setUp() {
        TacticsProperties properties = TestFixtures.fastProperties();
        extractor = new SituationFeatureExtractor();
        enhancer = new InferenceEnhancerService(new RecommendationService(properties), properties);
        // Manche 8, 1 retrait, coureur en 2e : pression 2.0
        current = extractor.extract(play(8, "bottom", 1, 1, 1, 3, 3, "Single", "2B")).orElseThrow();
    }

    private PredictionResult baseResult(double power, double contact, double defensiveOuts) {
        Map<TacticCategory, Map<String, Double>> probabilities = new EnumMap<>(TacticCategory.class);
        Map<String, Double> offensive = new LinkedHashMap<>();
        offensive.put("power_hitting", power);
        offensive.put("contact_hitting", contact);
        probabilities.put(TacticCategory.OFFENSIVE, offensive);
        probabilities.put(TacticCategory.BASERUNNING, new LinkedHashMap<>());
        probabilities.put(TacticCategory.DEFENSIVE, new LinkedHashMap<>(Map.of("defensive_outs", defensiveOuts)));
        return PredictionResult.builder().tacticalProbabilities(probabilities).build();
    }

    private List<Situation> recentPlays(String... events) {
        List<Situation> plays = new ArrayList<>();
        for (String event : events) {
            plays.add(extractor.extract(play(5, "top", 1, 0, 2, 0, 0, event)).orElseThrow());
        }
        return plays;
    }

    private HistoricalSituation sample(int inning, int outs, double pressure, String tactic, boolean success) {
        return HistoricalSituation.builder()
                .inning(inning).outs(outs).pressureIndex(pressure).tactic(tactic).success(success).build();
    }

    @Test
    @DisplayName("Momentum : 4 coups sûrs et 1 retrait sur prises sur les 5 dernières actions")
    void momentumOverLastFivePlays() {
        MomentumAnalysis momentum = enhancer.analyzeMomentum(
                recentPlays("Single", "Double", "Strikeout", "Home Run", "Single"));

        assertThat(momentum.getBattingTeam().getRecentSuccess()).isCloseTo(0.8, within(1e-9));
        assertThat(momentum.getPitchingTeam().getRecentSuccess()).isCloseTo(0.2, within(1e-9));
        assertThat(enhancer.momentumFactor(momentum, "power_hitting")).isCloseTo(0.09, within(1e-9));
        assertThat(enhancer.momentumFactor(momentum, "small_ball")).isCloseTo(0.06, within(1e-9));
        assertThat(enhancer.momentumFactor(momentum, "patient_hitting")).isCloseTo(-0.06, within(1e-9));
    }

    @Test
    @DisplayName("Momentum : les tactiques sans poids dédié prennent le poids par défaut 0.1")
    void unlistedTacticsUseDefaultMomentumWeight() {
        MomentumAnalysis momentum = enhancer.analyzeMomentum(
                recentPlays("Single", "Double", "Strikeout", "Home Run", "Single"));

        for (String tactic : List.of("defensive_outs", "double_play", "aggressive_baserunning", "contact_hitting",
                "strikeout_pitching", "field_defense", "conservative_baserunning")) {
            assertThat(enhancer.momentumFactor(momentum, tactic)).as(tactic).isCloseTo(0.06, within(1e-9));
        }
    }

    @Test
    @DisplayName("Momentum : seules les dernières actions de la fenêtre comptent")
    void momentumWindowIsBounded() {
        MomentumAnalysis momentum = enhancer.analyzeMomentum(recentPlays(
                "Strikeout", "Strikeout", "Groundout", "Flyout", "Strikeout",
                "Single", "Walk", "Double", "Single", "Home Run"));

        assertThat(momentum.getBattingTeam().getRecentSuccess()).isEqualTo(1.0);
        assertThat(momentum.getPitchingTeam().getRecentSuccess()).isEqualTo(0.0);
    }

    @Test
    @DisplayName("Aucune situation historique similaire : seul le momentum ajuste les probabilités")
    void noSimilarHistoryLeavesOnlyMomentum() {
        List<HistoricalSituation> history = List.of(sample(3, 0, 1.0, "power_hitting", true));

        PredictionResult result = enhancer.enhance(baseResult(40.0, 30.0, 20.0), current,
                recentPlays("Single", "Double", "Strikeout", "Home Run", "Single"), history);

        // diff 0.6 : power x(1 + 0.09), contact x(1 + 0.06), defensive_outs x(1 + 0.06)
        assertThat(result.getTacticalProbabilities().get(TacticCategory.OFFENSIVE))
                .containsEntry("power_hitting", 43.6)
                .containsEntry("contact_hitting", 31.8);
        assertThat(result.getTacticalProbabilities().get(TacticCategory.DEFENSIVE))
                .containsEntry("defensive_outs", 21.2);
        assertThat(result.getHistoricalPatterns().getSampleSize()).isZero();
        assertThat(result.getHistoricalPatterns().getSummary()).isNull();
    }

    @Test
    @DisplayName("Sans momentum ni historique : probabilités inchangées")
    void noEnhancementDataIsIdentity() {
        PredictionResult base = baseResult(40.0, 30.0, 20.0);

        PredictionResult result = enhancer.enhance(base, current, null, List.of());

        assertThat(result.getTacticalProbabilities()).isEqualTo(base.getTacticalProbabilities());
        assertThat(result.getMomentumAnalysis()).isNull();
        assertThat(result.getHistoricalPatterns()).isNull();
        assertThat(result.getTopTactics().keySet()).containsExactly("power_hitting", "contact_hitting", "defensive_outs");
    }

    @Test
    @DisplayName("Historique similaire : taux de réussite appliqué, tactiques sans échantillon inchangées")
    void historicalSuccessRatesAdjustProbabilities() {
        List<HistoricalSituation> history = List.of(
                sample(8, 1, 2.0, "power_hitting", true),
                sample(8, 1, 1.85, "power_hitting", true),
                sample(8, 1, 2.0, "power_hitting", true),
                sample(8, 1, 2.0, "power_hitting", false),
                sample(8, 1, 2.0, "defensive_outs", false),
                sample(8, 1, 2.0, "defensive_outs", false),
                // écartées : pression trop éloignée, autre manche, autres retraits, tactique absente
                sample(8, 1, 1.7, "contact_hitting", true),
                sample(7, 1, 2.0, "contact_hitting", true),
                sample(8, 2, 2.0, "contact_hitting", true),
                sample(8, 1, 2.0, null, true));

        PredictionResult result = enhancer.enhance(baseResult(40.0, 30.0, 20.0), current, List.of(), history);

        Map<String, Double> offensive = result.getTacticalProbabilities().get(TacticCategory.OFFENSIVE);
        assertThat(offensive).containsEntry("power_hitting", 50.0).containsEntry("contact_hitting", 30.0);
        assertThat(result.getTacticalProbabilities().get(TacticCategory.DEFENSIVE)).containsEntry("defensive_outs", 10.0);

        HistoricalPatterns patterns = result.getHistoricalPatterns();
        assertThat(patterns.getSampleSize()).isEqualTo(6);
        assertThat(patterns.getSampleCounts()).containsEntry("power_hitting", 4).containsEntry("defensive_outs", 2);
        assertThat(patterns.getSuccessRates().get(TacticCategory.OFFENSIVE))
                .containsEntry("power_hitting", 75.0)
                .containsEntry("contact_hitting", 0.0);
        assertThat(patterns.getSummary().getMostCommonTactic()).isEqualTo("power_hitting");
        assertThat(patterns.getSummary().getSuccessCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Ajustement borné à 100, tactiques passées sous 5% retirées, classement recalculé")
    void clampDropAndRerank() {
        List<HistoricalSituation> history = List.of(
                sample(8, 1, 2.0, "contact_hitting", true),
                sample(8, 1, 2.0, "contact_hitting", true),
                sample(8, 1, 2.0, "defensive_outs", false));

        PredictionResult result = enhancer.enhance(baseResult(40.0, 35.0, 6.0), current, null, history);

        assertThat(result.getTacticalProbabilities().get(TacticCategory.OFFENSIVE).keySet())
                .containsExactly("contact_hitting", "power_hitting");
        assertThat(result.getTacticalProbabilities().get(TacticCategory.DEFENSIVE)).isEmpty();
        assertThat(result.getTopTactics().keySet()).containsExactly("contact_hitting", "power_hitting");
        assertThat(result.getRecommendations()).hasSize(2);

        HistoricalPatterns certain = enhancer.findHistoricalPatterns(current, List.of(sample(8, 1, 2.0, "power_hitting", true)));
        assertThat(enhancer.adjust(95.0, "power_hitting", null, certain)).isEqualTo(100.0);
    }
}
