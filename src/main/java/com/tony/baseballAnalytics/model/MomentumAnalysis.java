package com.tony.baseballAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Forme récente (fenêtre des dernières actions) de l'attaque et de la défense.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MomentumAnalysis {
    private SideMomentum battingTeam;
    private SideMomentum pitchingTeam;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SideMomentum {
        private double recentSuccess;    // [0, 1]
        private double pressureHandling; // [0, 1], sur les actions à pression > 1.5
    }
}
