package com.tony.baseballAnalytics.model;

public enum TacticCategory {
    OFFENSIVE,
    BASERUNNING,
    DEFENSIVE
}
