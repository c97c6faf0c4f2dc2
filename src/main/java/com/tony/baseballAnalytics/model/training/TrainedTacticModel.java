package com.tony.baseballAnalytics.model.training;

import org.tribuo.Model;
import org.tribuo.classification.Label;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;

/**
 * Artefact persisté d'un seul bloc : le classifieur et la liste ordonnée des features vues à l'entraînement.
 */
public record TrainedTacticModel(Model<Label> classifier,
                                 List<String> featureNames,
                                 Hyperparameters hyperparameters) implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    public TrainedTacticModel {
        featureNames = featureNames != null ? List.copyOf(featureNames) : null;
    }
}
