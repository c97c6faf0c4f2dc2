package com.tony.baseballAnalytics.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PitcherStats {
    double era;
    double whip;
    double strikeoutsPerNine;
    double walksPerNine;
    double hitsPerNine;
    double groundBallRate; // groundOuts / (groundOuts + airOuts)
    double strikeoutRate;  // K / (H + BB + K)
    double walkRate;

    public static PitcherStats empty() {
        return PitcherStats.builder().build();
    }
}
