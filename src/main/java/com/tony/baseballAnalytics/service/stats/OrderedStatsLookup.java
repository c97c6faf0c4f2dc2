package com.tony.baseballAnalytics.service.stats;

import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Interroge les stratégies dans l'ordre et retient la première qui a des données.
 * Une stratégie en échec est journalisée puis ignorée : l'extraction ne doit jamais tomber à cause des stats.
 */
@Slf4j
public class OrderedStatsLookup implements PlayerStatsProvider {

    private final List<StatsLookupStrategy> strategies;

    public OrderedStatsLookup(List<StatsLookupStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    @Override
    public Optional<BatterStats> findBatterStats(long batterId) {
        return firstAvailable("frappeur " + batterId, s -> s.findBatterStats(batterId));
    }

    @Override
    public Optional<PitcherStats> findPitcherStats(long pitcherId) {
        return firstAvailable("lanceur " + pitcherId, s -> s.findPitcherStats(pitcherId));
    }

    @Override
    public Optional<MatchupStats> findMatchupStats(long batterId, long pitcherId) {
        return firstAvailable("duel " + batterId + "/" + pitcherId, s -> s.findMatchupStats(batterId, pitcherId));
    }

    private <T> Optional<T> firstAvailable(String subject, Function<StatsLookupStrategy, Optional<T>> lookup) {
        for (StatsLookupStrategy strategy : strategies) {
            try {
                Optional<T> found = lookup.apply(strategy);
                if (found.isPresent()) {
                    log.debug("Stats {} trouvées via {}", subject, strategy.name());
                    return found;
                }
            } catch (RuntimeException e) {
                log.warn("Source de stats '{}' en échec pour {} : {}", strategy.name(), subject, e.getMessage());
            }
        }
        log.debug("Aucune stat disponible pour {}", subject);
        return Optional.empty();
    }
}
