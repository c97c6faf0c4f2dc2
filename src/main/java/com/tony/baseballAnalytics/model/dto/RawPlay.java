package com.tony.baseballAnalytics.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Action de jeu telle que livrée par le flux play-by-play.
 * Les champs obligatoires sont en types objets pour détecter leur absence.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawPlay {
    private Integer inning;
    private String halfInning;
    private Integer outs;
    private Integer balls;
    private Integer strikes;
    private Integer homeScore;
    private Integer awayScore;
    private String event;
    private String battingTeam;
    private Matchup matchup;

    @Builder.Default
    private List<Runner> runners = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Matchup {
        private PlayerRef batter;
        private PlayerRef pitcher;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlayerRef {
        private Long id;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Runner {
        private Movement movement;
    }

    /** Codes de base : "1B", "2B", "3B", "score" (null = marbre, départ du frappeur). */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Movement {
        private String start;
        private String end;
    }
}
