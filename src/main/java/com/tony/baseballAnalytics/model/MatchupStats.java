package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Historique frappeur contre lanceur.
 */
@Value
@Builder
public class MatchupStats {
    double avg;
    double ops;
    int atBats;
    int homeRuns;
    int strikeouts;
    int walks;

    public static MatchupStats empty() {
        return MatchupStats.builder().build();
    }
}
