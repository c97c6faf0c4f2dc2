package com.tony.baseballAnalytics.model.training;

import java.io.Serializable;

/**
 * Configuration d'une forêt aléatoire.
 *
 * @param trees               nombre d'arbres
 * @param maxDepth            profondeur maximale
 * @param minLeafWeight       poids minimal d'un noeud enfant (équivalent de min_samples_leaf avec pondération)
 * @param featureFraction     fraction des features tirées à chaque split, strictement inférieure à 1
 * @param minImpurityDecrease gain d'impureté minimal pour découper (élagage)
 */
public record Hyperparameters(int trees, int maxDepth, float minLeafWeight, float featureFraction,
                              float minImpurityDecrease) implements Serializable {

    @Override
    public String toString() {
        return String.format("trees=%d, depth=%d, minLeaf=%.1f, features=%.2f, minImpurity=%.3f",
                trees, maxDepth, minLeafWeight, featureFraction, minImpurityDecrease);
    }
}
