package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

/**
 * Situation passée avec la tactique employée et son issue, servant au rapprochement historique.
 */
@Value
@Builder
public class HistoricalSituation {
    int inning;
    int outs;
    double pressureIndex;
    String tactic;
    boolean success;
}
