package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.model.ContextAnalysis;
import com.tony.baseballAnalytics.model.HistoricalPatterns;
import com.tony.baseballAnalytics.model.HistoricalSituation;
import com.tony.baseballAnalytics.model.MomentumAnalysis;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.Tactic;
import com.tony.baseballAnalytics.model.TacticCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Ajuste les probabilités du classifieur avec la forme récente (momentum) et les situations historiques similaires.
 * Chaque enrichissement absent vaut l'identité : sans données, on renvoie les probabilités d'origine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InferenceEnhancerService {

    // --- Sensibilité au momentum ; les tactiques non listées prennent DEFAULT_MOMENTUM_WEIGHT ---
    private static final Map<String, Double> MOMENTUM_WEIGHTS = Map.of(
            "power_hitting", 0.15,
            "patient_hitting", -0.1,
            "small_ball", 0.1);
    private static final double DEFAULT_MOMENTUM_WEIGHT = 0.1;

    private static final Set<String> HITS = Set.of("Single", "Double", "Triple", "Home Run");
    private static final Set<String> WALKS = Set.of("Walk", "Hit By Pitch", "Intent Walk");
    private static final Set<String> STRIKEOUTS = Set.of("Strikeout", "Strikeout Double Play");
    private static final Set<String> OUTS = Set.of("Groundout", "Flyout", "Lineout", "Pop Out", "Forceout",
            "Sac Fly", "Sac Bunt", "Bunt Groundout");
    private static final Set<String> DOUBLE_PLAYS = Set.of("Double Play", "Grounded Into DP", "Triple Play",
            "Strikeout Double Play");

    private static final Predicate<Situation> BATTING_SUCCESS =
            s -> HITS.contains(s.getResult()) || WALKS.contains(s.getResult()) || s.getRunsScored() > 0;
    private static final Predicate<Situation> PITCHING_SUCCESS =
            s -> STRIKEOUTS.contains(s.getResult()) || OUTS.contains(s.getResult()) || DOUBLE_PLAYS.contains(s.getResult());

    private final RecommendationService recommendationService;
    private final TacticsProperties properties;

    /**
     * @param current     situation analysée (sert au rapprochement historique)
     * @param recentPlays actions précédentes dans l'ordre du match, peut être vide ou null
     * @param history     corpus de situations passées, peut être vide ou null
     */
    public PredictionResult enhance(PredictionResult base, Situation current,
                                    List<Situation> recentPlays, List<HistoricalSituation> history) {
        MomentumAnalysis momentum = analyzeMomentum(recentPlays);
        HistoricalPatterns patterns = findHistoricalPatterns(current, history);

        Map<TacticCategory, Map<String, Double>> adjusted = new EnumMap<>(TacticCategory.class);
        base.getTacticalProbabilities().forEach((category, tactics) -> {
            Map<String, Double> values = new LinkedHashMap<>();
            tactics.forEach((tactic, probability) -> {
                double value = adjust(probability, tactic, momentum, patterns);
                if (value >= properties.getInference().getMinProbability()) values.put(tactic, value);
            });
            adjusted.put(category, sortDescending(values));
        });

        ContextAnalysis context = base.getContextAnalysis() != null
                ? base.getContextAnalysis()
                : recommendationService.analyzeContext(current);
        Map<String, Double> top = recommendationService.topTactics(adjusted);

        return base.toBuilder()
                .tacticalProbabilities(adjusted)
                .topTactics(top)
                .contextAnalysis(context)
                .recommendations(recommendationService.recommend(top, context))
                .momentumAnalysis(momentum)
                .historicalPatterns(patterns)
                .build();
    }

    /**
     * final = base * (1 + (historique - 50) / 100) * (1 + momentum), borné à [0, 100].
     * Terme historique neutre si la tactique n'a aucun échantillon similaire.
     */
    double adjust(double probability, String tactic, MomentumAnalysis momentum, HistoricalPatterns patterns) {
        double historicalFactor = 1.0;
        if (patterns != null && sampleCount(patterns, tactic) > 0) {
            historicalFactor = 1.0 + (successRate(patterns, tactic) - 50.0) / 100.0;
        }
        double momentumFactor = momentum != null ? momentumFactor(momentum, tactic) : 0.0;

        double value = probability * historicalFactor * (1.0 + momentumFactor);
        return round(Math.max(0.0, Math.min(100.0, value)));
    }

    // =========================================================================
    // MOMENTUM
    // =========================================================================

    public MomentumAnalysis analyzeMomentum(List<Situation> recentPlays) {
        if (recentPlays == null || recentPlays.isEmpty()) return null;

        int window = properties.getInference().getMomentumWindow();
        List<Situation> recent = recentPlays.subList(Math.max(0, recentPlays.size() - window), recentPlays.size());
        double highPressure = properties.getInference().getHighPressureThreshold();
        List<Situation> pressured = recent.stream().filter(s -> s.getPressureIndex() > highPressure).toList();

        MomentumAnalysis analysis = new MomentumAnalysis(
                new MomentumAnalysis.SideMomentum(ratio(recent, BATTING_SUCCESS), ratio(pressured, BATTING_SUCCESS)),
                new MomentumAnalysis.SideMomentum(ratio(recent, PITCHING_SUCCESS), ratio(pressured, PITCHING_SUCCESS)));
        log.debug("Momentum sur {} actions : attaque {} / défense {}", recent.size(),
                analysis.getBattingTeam().getRecentSuccess(), analysis.getPitchingTeam().getRecentSuccess());
        return analysis;
    }

    public double momentumFactor(MomentumAnalysis momentum, String tactic) {
        double diff = momentum.getBattingTeam().getRecentSuccess() - momentum.getPitchingTeam().getRecentSuccess();
        return diff * MOMENTUM_WEIGHTS.getOrDefault(tactic, DEFAULT_MOMENTUM_WEIGHT);
    }

    private static double ratio(List<Situation> plays, Predicate<Situation> indicator) {
        if (plays.isEmpty()) return 0.0;
        return (double) plays.stream().filter(indicator).count() / plays.size();
    }

    // =========================================================================
    // HISTORIQUE
    // =========================================================================

    public HistoricalPatterns findHistoricalPatterns(Situation current, List<HistoricalSituation> history) {
        if (current == null || history == null || history.isEmpty()) return null;

        double tolerance = properties.getInference().getPressureTolerance();
        List<HistoricalSituation> similar = history.stream()
                .filter(h -> h.getTactic() != null)
                .filter(h -> h.getInning() == current.getInning())
                .filter(h -> h.getOuts() == current.getOuts())
                .filter(h -> Math.abs(h.getPressureIndex() - current.getPressureIndex()) < tolerance)
                .toList();

        Map<String, List<HistoricalSituation>> byTactic = similar.stream()
                .collect(Collectors.groupingBy(HistoricalSituation::getTactic, LinkedHashMap::new, Collectors.toList()));

        Map<TacticCategory, Map<String, Double>> rates = new EnumMap<>(TacticCategory.class);
        for (Tactic tactic : Tactic.values()) {
            List<HistoricalSituation> samples = byTactic.getOrDefault(tactic.getCode(), List.of());
            double rate = samples.isEmpty() ? 0.0
                    : round(100.0 * samples.stream().filter(HistoricalSituation::isSuccess).count() / samples.size());
            rates.computeIfAbsent(tactic.getCategory(), c -> new LinkedHashMap<>()).put(tactic.getCode(), rate);
        }

        HistoricalPatterns.SimilarSituationSummary summary = null;
        if (!similar.isEmpty()) {
            String mostCommon = null;
            int best = 0;
            for (Map.Entry<String, List<HistoricalSituation>> e : byTactic.entrySet()) {
                if (e.getValue().size() > best) {
                    mostCommon = e.getKey();
                    best = e.getValue().size();
                }
            }
            summary = new HistoricalPatterns.SimilarSituationSummary(
                    similar.size(),
                    similar.stream().filter(HistoricalSituation::isSuccess).count(),
                    round(similar.stream().mapToDouble(HistoricalSituation::getPressureIndex).average().orElse(0.0)),
                    mostCommon);
        }

        log.debug("Historique : {} situations similaires sur {}", similar.size(), history.size());
        return HistoricalPatterns.builder()
                .successRates(rates)
                .sampleSize(similar.size())
                .summary(summary)
                .sampleCounts(byTactic.entrySet().stream()
                        .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().size(), (a, b) -> a, LinkedHashMap::new)))
                .build();
    }

    private static int sampleCount(HistoricalPatterns patterns, String tactic) {
        return patterns.getSampleCounts().getOrDefault(tactic, 0);
    }

    private static double successRate(HistoricalPatterns patterns, String tactic) {
        return patterns.getSuccessRates().values().stream()
                .filter(m -> m.containsKey(tactic))
                .mapToDouble(m -> m.get(tactic))
                .findFirst()
                .orElse(0.0);
    }

    // =========================================================================
    // OUTILS
    // =========================================================================

    private static Map<String, Double> sortDescending(Map<String, Double> values) {
        Map<String, Double> sorted = new LinkedHashMap<>();
        values.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return sorted;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
