package com.tony.baseballAnalytics.service.stats;

import com.tony.baseballAnalytics.model.BatterStats;
import com.tony.baseballAnalytics.model.MatchupStats;
import com.tony.baseballAnalytics.model.PitcherStats;

import java.util.Optional;

/**
 * Point d'entrée vers les statistiques joueurs (collaborateur externe).
 * Un résultat vide signifie "pas de données", jamais une erreur.
 */
public interface PlayerStatsProvider {

    Optional<BatterStats> findBatterStats(long batterId);

    Optional<PitcherStats> findPitcherStats(long pitcherId);

    Optional<MatchupStats> findMatchupStats(long batterId, long pitcherId);
}
