package com.tony.baseballAnalytics.service.ml;

import com.oracle.labs.mlrg.olcut.config.PropertyException;
import com.tony.baseballAnalytics.exception.TrainingException;
import com.tony.baseballAnalytics.model.training.Hyperparameters;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import org.springframework.stereotype.Component;
import org.tribuo.Example;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.Prediction;
import org.tribuo.Trainer;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;
import org.tribuo.classification.dtree.CARTClassificationTrainer;
import org.tribuo.classification.dtree.impurity.GiniIndex;
import org.tribuo.classification.ensemble.FullyWeightedVotingCombiner;
import org.tribuo.common.tree.RandomForestTrainer;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.impl.ArrayExample;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pont vers Tribuo : construction des datasets pondérés, des forêts aléatoires et lecture des scores.
 * Chaque appel crée ses propres objets, ce qui permet des entraînements concurrents.
 */
@Component
public class TribuoForestFactory {

    private final LabelFactory labelFactory = new LabelFactory();

    public Trainer<Label> newTrainer(Hyperparameters h, long seed) {
        CARTClassificationTrainer tree = new CARTClassificationTrainer(
                h.maxDepth(),
                h.minLeafWeight(),
                h.minImpurityDecrease(),
                h.featureFraction(),
                false,
                new GiniIndex(),
                seed);
        return new RandomForestTrainer<>(tree, new FullyWeightedVotingCombiner(), h.trees(), seed);
    }

    /**
     * @param classWeights poids par label appliqués à chaque exemple (1.0 si absent)
     */
    public MutableDataset<Label> dataset(List<TrainingRow> rows, FeatureSchema schema,
                                         Map<String, Double> classWeights, String description) {
        MutableDataset<Label> dataset = new MutableDataset<>(
                new SimpleDataSourceProvenance(description, labelFactory), labelFactory);
        String[] names = schema.namesArray();
        for (TrainingRow row : rows) {
            ArrayExample<Label> example = new ArrayExample<>(new Label(row.label()), names, schema.align(row.features()));
            example.setWeight(classWeights.getOrDefault(row.label(), 1.0).floatValue());
            dataset.add(example);
        }
        return dataset;
    }

    /**
     * @throws TrainingException si Tribuo refuse la configuration (ex. fraction de features égale à 1)
     */
    public Model<Label> train(List<TrainingRow> rows, FeatureSchema schema, Map<String, Double> classWeights,
                              Hyperparameters h, long seed) {
        try {
            return newTrainer(h, seed).train(dataset(rows, schema, classWeights, "tactical-situations"));
        } catch (PropertyException e) {
            throw new TrainingException("Configuration de forêt refusée (" + h + ") : " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new TrainingException("Entraînement impossible (" + h + ") : " + e.getMessage(), e);
        }
    }

    public Example<Label> example(double[] values, FeatureSchema schema) {
        return new ArrayExample<>(LabelFactory.UNKNOWN_LABEL, schema.namesArray(), values);
    }

    /** Probabilité (0..1) par label. */
    public Map<String, Double> scores(Model<Label> model, Example<Label> example) {
        Prediction<Label> prediction = model.predict(example);
        Map<String, Double> scores = new HashMap<>();
        prediction.getOutputScores().forEach((label, output) -> scores.put(label, output.getScore()));
        return scores;
    }

    public String predictLabel(Model<Label> model, Example<Label> example) {
        return model.predict(example).getOutput().getLabel();
    }
}
