package com.tony.baseballAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContextAnalysis {
    private GameSituation gameSituation;
    private RunnerSituation runnerSituation;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameSituation {
        private int inning;
        private int outs;
        private int scoreDiff;
        private double pressureIndex;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RunnerSituation {
        private int runners;
        private boolean scoringPosition;
    }
}
