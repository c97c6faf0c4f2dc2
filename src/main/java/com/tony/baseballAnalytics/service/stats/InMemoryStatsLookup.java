package com.tony.baseballAnalytics.service.stats;

import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Stats préchargées pour une saison et un type de match donnés (ex : 2024 / "R").
 */
public class InMemoryStatsLookup implements StatsLookupStrategy {

    private final int season;
    private final String gameType;
    private final Map<Long, BatterStats> batters = new HashMap<>();
    private final Map<Long, PitcherStats> pitchers = new HashMap<>();
    private final Map<String, MatchupStats> matchups = new HashMap<>();

    public InMemoryStatsLookup(int season, String gameType) {
        this.season = season;
        this.gameType = gameType;
    }

    public InMemoryStatsLookup withBatter(long batterId, BatterStats stats) {
        batters.put(batterId, stats);
        return this;
    }

    public InMemoryStatsLookup withPitcher(long pitcherId, PitcherStats stats) {
        pitchers.put(pitcherId, stats);
        return this;
    }

    public InMemoryStatsLookup withMatchup(long batterId, long pitcherId, MatchupStats stats) {
        matchups.put(matchupKey(batterId, pitcherId), stats);
        return this;
    }

    @Override
    public String name() {
        return season + "/" + gameType;
    }

    @Override
    public Optional<BatterStats> findBatterStats(long batterId) {
        return Optional.ofNullable(batters.get(batterId));
    }

    @Override
    public Optional<PitcherStats> findPitcherStats(long pitcherId) {
        return Optional.ofNullable(pitchers.get(pitcherId));
    }

    @Override
    public Optional<MatchupStats> findMatchupStats(long batterId, long pitcherId) {
        return Optional.ofNullable(matchups.get(matchupKey(batterId, pitcherId)));
    }

    private static String matchupKey(long batterId, long pitcherId) {
        return batterId + "-" + pitcherId;
    }
}
