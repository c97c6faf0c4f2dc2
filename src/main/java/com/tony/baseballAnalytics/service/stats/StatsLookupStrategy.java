package com.tony.baseballAnalytics.service.stats;

/**
 * Une source de stats parmi d'autres (saison courante, saison précédente, tous types de matchs...).
 */
public interface StatsLookupStrategy extends PlayerStatsProvider {

    String name();
}
