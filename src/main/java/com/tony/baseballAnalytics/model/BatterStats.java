package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BatterStats {
    double avg;
    double obp;
    double slg;
    double ops;
    int homeRuns;
    int strikeouts;
    int walks;
    double rispAvg;   // Pas de split RISP côté source : on reprend la moyenne
    double clutchOps; // Idem avec l'OPS

    /** Valeurs neutres utilisées quand aucune source n'a de stats pour le frappeur. */
    public static BatterStats empty() {
        return BatterStats.builder().build();
    }
}
