package com.tony.baseballAnalytics.service.ml;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Découpages stratifiés (holdout et k-fold) reproductibles à graine fixe.
 * Travaille sur les indices des lignes ; les listes renvoyées sont triées.
 */
@Component
public class StratifiedSplitter {

    public record Split(List<Integer> train, List<Integer> test) {
    }

    public Split split(List<String> labels, double testFraction, long seed) {
        Random random = new Random(seed);
        List<Integer> train = new ArrayList<>();
        List<Integer> test = new ArrayList<>();

        for (List<Integer> group : groupByLabel(labels).values()) {
            Collections.shuffle(group, random);
            int nTest = (int) Math.round(group.size() * testFraction);
            // Toujours au moins un exemple de chaque classe côté entraînement
            nTest = Math.min(nTest, group.size() - 1);
            test.addAll(group.subList(0, nTest));
            train.addAll(group.subList(nTest, group.size()));
        }
        Collections.sort(train);
        Collections.sort(test);
        return new Split(train, test);
    }

    /**
     * K folds stratifiés : chaque classe est répartie en tourniquet sur les folds.
     * Les folds sans exemple de test (très petits jeux) sont omis.
     */
    public List<Split> kFold(List<String> labels, int folds, long seed) {
        Random random = new Random(seed);
        List<List<Integer>> buckets = new ArrayList<>();
        for (int i = 0; i < folds; i++) buckets.add(new ArrayList<>());

        int offset = 0;
        for (List<Integer> group : groupByLabel(labels).values()) {
            Collections.shuffle(group, random);
            for (int i = 0; i < group.size(); i++) {
                buckets.get((offset + i) % folds).add(group.get(i));
            }
            offset = (offset + group.size()) % folds;
        }

        List<Split> splits = new ArrayList<>();
        for (int f = 0; f < folds; f++) {
            List<Integer> test = new ArrayList<>(buckets.get(f));
            if (test.isEmpty()) continue;
            List<Integer> train = new ArrayList<>();
            for (int other = 0; other < folds; other++) {
                if (other != f) train.addAll(buckets.get(other));
            }
            Collections.sort(train);
            Collections.sort(test);
            splits.add(new Split(train, test));
        }
        return splits;
    }

    private static Map<String, List<Integer>> groupByLabel(List<String> labels) {
        Map<String, List<Integer>> groups = new TreeMap<>();
        for (int i = 0; i < labels.size(); i++) {
            groups.computeIfAbsent(labels.get(i), l -> new ArrayList<>()).add(i);
        }
        return groups;
    }
}
