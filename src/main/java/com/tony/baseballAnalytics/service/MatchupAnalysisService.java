package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;
import com.tony.baseballAnalytics.model.PlayerAnalysis;
import com.tony.baseballAnalytics.model.Tactic;
import com.tony.baseballAnalytics.service.stats.PlayerStatsProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class MatchupAnalysisService {

    /**
     * Lecture du duel frappeur / lanceur. Vide si un des deux joueurs n'est pas identifié ou sans source de stats.
     */
    public Optional<PlayerAnalysis> analyze(Long batterId, Long pitcherId, PlayerStatsProvider statsProvider) {
        if (batterId == null || pitcherId == null || statsProvider == null) return Optional.empty();

        BatterStats batter = statsProvider.findBatterStats(batterId).orElse(null);
        PitcherStats pitcher = statsProvider.findPitcherStats(pitcherId).orElse(null);
        MatchupStats matchup = statsProvider.findMatchupStats(batterId, pitcherId).orElse(null);

        return Optional.of(PlayerAnalysis.builder()
                .batter(batter)
                .pitcher(pitcher)
                .matchup(matchup)
                .advantage(determineAdvantage(batter, pitcher))
                .keyFactors(keyFactors(batter, pitcher))
                .recommendations(recommendations(batter, pitcher))
                .build());
    }

    PlayerAnalysis.Advantage determineAdvantage(BatterStats batter, PitcherStats pitcher) {
        if (batter == null || pitcher == null) return PlayerAnalysis.Advantage.NEUTRAL;

        if (batter.getOps() > 0.900 && pitcher.getEra() > 4.50) return PlayerAnalysis.Advantage.BATTER;
        if (batter.getOps() < 0.700 && pitcher.getEra() < 3.50) return PlayerAnalysis.Advantage.PITCHER;
        return PlayerAnalysis.Advantage.NEUTRAL;
    }

    private List<PlayerAnalysis.KeyFactor> keyFactors(BatterStats batter, PitcherStats pitcher) {
        List<PlayerAnalysis.KeyFactor> factors = new ArrayList<>();
        if (batter == null || pitcher == null) return factors;

        if (batter.getSlg() > 0.500) {
            factors.add(new PlayerAnalysis.KeyFactor("power_threat", "Le frappeur a une vraie menace de puissance"));
        }
        if (pitcher.getStrikeoutsPerNine() > 9.0) {
            factors.add(new PlayerAnalysis.KeyFactor("strikeout_pitcher", "Lanceur à fort taux de retraits sur prises"));
        }
        return factors;
    }

    private List<PlayerAnalysis.MatchupRecommendation> recommendations(BatterStats batter, PitcherStats pitcher) {
        List<PlayerAnalysis.MatchupRecommendation> recommendations = new ArrayList<>();
        if (batter == null || pitcher == null) return recommendations;

        if (batter.getOps() > 0.800) {
            recommendations.add(new PlayerAnalysis.MatchupRecommendation(Tactic.POWER_HITTING.getCode(),
                    "Frappeur en grande forme offensive"));
        }
        if (pitcher.getWalksPerNine() > 4.0) {
            recommendations.add(new PlayerAnalysis.MatchupRecommendation(Tactic.PATIENT_HITTING.getCode(),
                    "Lanceur en difficulté de contrôle"));
        }
        return recommendations;
    }
}
