package com.tony.baseballAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Lecture du duel frappeur / lanceur à partir de leurs stats de saison.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerAnalysis {

    public enum Advantage { BATTER, PITCHER, NEUTRAL }

    private BatterStats batter;
    private PitcherStats pitcher;
    private MatchupStats matchup;
    private Advantage advantage;

    @Builder.Default
    private List<KeyFactor> keyFactors = new ArrayList<>();

    @Builder.Default
    private List<MatchupRecommendation> recommendations = new ArrayList<>();

    public record KeyFactor(String factor, String description) {}

    public record MatchupRecommendation(String tactic, String reason) {}
}
