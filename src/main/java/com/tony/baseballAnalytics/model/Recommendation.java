package com.tony.baseballAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Recommendation {
    private String tactic;
    private double probability;
    private String reasoning;
    private List<String> specificActions;
}
