package com.tony.baseballAnalytics.service.ml;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Poids anti-déséquilibre : n / (k * effectif), puis x1.5 pour les classes rares (effectif < 20% de la médiane).
 */
@Component
@Slf4j
public class ClassWeightCalculator {

    private static final double RARE_CLASS_RATIO = 0.2;
    private static final double RARE_CLASS_BOOST = 1.5;

    public Map<String, Double> compute(Collection<String> labels) {
        Map<String, Long> counts = labels.stream()
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
        if (counts.isEmpty()) return Map.of();

        int n = labels.size();
        int k = counts.size();
        double median = new Median().evaluate(counts.values().stream().mapToDouble(Long::doubleValue).toArray());

        Map<String, Double> weights = new LinkedHashMap<>();
        counts.forEach((label, count) -> {
            double weight = (double) n / (k * count);
            if (count < RARE_CLASS_RATIO * median) {
                weight *= RARE_CLASS_BOOST;
                log.debug("Classe rare '{}' ({} exemples, médiane {}) : poids renforcé", label, count, median);
            }
            weights.put(label, weight);
        });
        return weights;
    }
}
