package com.tony.baseballAnalytics.service.ml;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.model.training.ClassMetrics;
import com.tony.baseballAnalytics.model.training.ConfidenceStats;
import com.tony.baseballAnalytics.model.training.CrossValidationSummary;
import com.tony.baseballAnalytics.model.training.FeatureImportance;
import com.tony.baseballAnalytics.model.training.Hyperparameters;
import com.tony.baseballAnalytics.model.training.ModelEvaluation;
import com.tony.baseballAnalytics.model.training.TrainedTacticModel;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.springframework.stereotype.Service;
import org.tribuo.Model;
import org.tribuo.classification.Label;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Diagnostics post-entraînement. N'influence pas le modèle retenu ; reproductible à graine fixe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelEvaluationService {

    private static final int TOP_FEATURES = 10;
    private static final double[] CONFIDENCE_THRESHOLDS = {0.5, 0.7, 0.9};

    private final TribuoForestFactory forestFactory;
    private final StratifiedSplitter splitter;
    private final ClassWeightCalculator weightCalculator;
    private final TacticsProperties properties;

    public ModelEvaluation evaluate(TrainedTacticModel trained, List<TrainingRow> test, List<TrainingRow> all) {
        FeatureSchema schema = new FeatureSchema(trained.featureNames());
        Model<Label> model = trained.classifier();

        List<String> actual = test.stream().map(TrainingRow::label).toList();
        List<Map<String, Double>> scores = test.stream()
                .map(r -> forestFactory.scores(model, forestFactory.example(schema.align(r.features()), schema)))
                .toList();
        List<String> predicted = scores.stream().map(ModelEvaluationService::argMax).toList();

        List<String> labels = new ArrayList<>(new TreeSet<>(actual));
        predicted.stream().filter(p -> !labels.contains(p)).distinct().sorted().forEach(labels::add);

        ModelEvaluation evaluation = ModelEvaluation.builder()
                .accuracy(ClassificationMetrics.accuracy(actual, predicted))
                .weightedF1(ClassificationMetrics.weightedF1(actual, predicted))
                .classReport(ClassificationMetrics.report(actual, predicted))
                .confusionLabels(labels)
                .confusionMatrix(ClassificationMetrics.confusionMatrix(labels, actual, predicted))
                .topFeatures(permutationImportance(model, schema, test))
                .confidence(confidence(scores, predicted))
                .crossValidation(crossValidate(all, schema, trained.hyperparameters()))
                .build();

        printReport(evaluation);
        return evaluation;
    }

    // =========================================================================
    // IMPORTANCE PAR PERMUTATION
    // =========================================================================

    List<FeatureImportance> permutationImportance(Model<Label> model, FeatureSchema schema, List<TrainingRow> test) {
        if (test.isEmpty()) return List.of();

        double[][] matrix = test.stream().map(r -> schema.align(r.features())).toArray(double[][]::new);
        List<String> actual = test.stream().map(TrainingRow::label).toList();
        double baseline = ClassificationMetrics.accuracy(actual, predictAll(model, schema, matrix));

        Random random = new Random(properties.getTraining().getSeed());
        List<FeatureImportance> importances = new ArrayList<>();
        for (int col = 0; col < schema.size(); col++) {
            List<Double> column = new ArrayList<>();
            for (double[] row : matrix) column.add(row[col]);
            Collections.shuffle(column, random);

            double[][] permuted = new double[matrix.length][];
            for (int i = 0; i < matrix.length; i++) {
                permuted[i] = matrix[i].clone();
                permuted[i][col] = column.get(i);
            }
            double drop = baseline - ClassificationMetrics.accuracy(actual, predictAll(model, schema, permuted));
            importances.add(new FeatureImportance(schema.names().get(col), drop));
        }

        return importances.stream()
                .sorted(Comparator.comparingDouble(FeatureImportance::importance).reversed())
                .limit(TOP_FEATURES)
                .toList();
    }

    private List<String> predictAll(Model<Label> model, FeatureSchema schema, double[][] matrix) {
        List<String> predicted = new ArrayList<>(matrix.length);
        for (double[] values : matrix) {
            predicted.add(forestFactory.predictLabel(model, forestFactory.example(values, schema)));
        }
        return predicted;
    }

    // =========================================================================
    // CONFIANCE
    // =========================================================================

    ConfidenceStats confidence(List<Map<String, Double>> scores, List<String> predicted) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        Map<String, DescriptiveStatistics> byClass = new TreeMap<>();
        for (int i = 0; i < scores.size(); i++) {
            double max = scores.get(i).values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
            stats.addValue(max);
            byClass.computeIfAbsent(predicted.get(i), l -> new DescriptiveStatistics()).addValue(max);
        }

        Map<Double, Double> above = new LinkedHashMap<>();
        for (double threshold : CONFIDENCE_THRESHOLDS) {
            long count = Arrays.stream(stats.getValues()).filter(v -> v > threshold).count();
            above.put(threshold, stats.getN() == 0 ? 0.0 : 100.0 * count / stats.getN());
        }

        Map<String, Double> meanByClass = new LinkedHashMap<>();
        byClass.forEach((label, s) -> meanByClass.put(label, s.getMean()));

        if (stats.getN() == 0) {
            return new ConfidenceStats(0.0, 0.0, 0.0, above, meanByClass);
        }
        return new ConfidenceStats(stats.getMean(), stats.getPercentile(50),
                Math.sqrt(stats.getPopulationVariance()), above, meanByClass);
    }

    // =========================================================================
    // VALIDATION CROISÉE
    // =========================================================================

    CrossValidationSummary crossValidate(List<TrainingRow> rows, FeatureSchema schema, Hyperparameters h) {
        TacticsProperties.Training cfg = properties.getTraining();
        List<StratifiedSplitter.Split> folds = splitter.kFold(rows.stream().map(TrainingRow::label).toList(),
                cfg.getCvFolds(), cfg.getSeed());

        List<Double> accuracies = new ArrayList<>();
        List<Double> weightedF1 = new ArrayList<>();
        Map<String, DescriptiveStatistics> f1ByClass = new TreeMap<>();

        for (StratifiedSplitter.Split split : folds) {
            List<TrainingRow> train = split.train().stream().map(rows::get).toList();
            List<TrainingRow> test = split.test().stream().map(rows::get).toList();
            Map<String, Double> weights = weightCalculator.compute(train.stream().map(TrainingRow::label).toList());

            Model<Label> model = forestFactory.train(train, schema, weights, h, cfg.getSeed());
            List<String> actual = test.stream().map(TrainingRow::label).toList();
            List<String> predicted = predictAll(model, schema,
                    test.stream().map(r -> schema.align(r.features())).toArray(double[][]::new));

            accuracies.add(ClassificationMetrics.accuracy(actual, predicted));
            weightedF1.add(ClassificationMetrics.weightedF1(actual, predicted));
            ClassificationMetrics.report(actual, predicted).forEach((label, m) ->
                    f1ByClass.computeIfAbsent(label, l -> new DescriptiveStatistics()).addValue(m.f1()));
        }

        DescriptiveStatistics acc = describe(accuracies);
        DescriptiveStatistics f1 = describe(weightedF1);
        Map<String, Double> meanF1ByClass = new LinkedHashMap<>();
        f1ByClass.forEach((label, s) -> meanF1ByClass.put(label, s.getMean()));

        return new CrossValidationSummary(accuracies, weightedF1,
                mean(acc), populationStd(acc), mean(f1), populationStd(f1), meanF1ByClass);
    }

    private static DescriptiveStatistics describe(List<Double> values) {
        DescriptiveStatistics stats = new DescriptiveStatistics();
        values.forEach(stats::addValue);
        return stats;
    }

    private static double mean(DescriptiveStatistics stats) {
        return stats.getN() == 0 ? 0.0 : stats.getMean();
    }

    private static double populationStd(DescriptiveStatistics stats) {
        return stats.getN() == 0 ? 0.0 : Math.sqrt(stats.getPopulationVariance());
    }

    static String argMax(Map<String, Double> scores) {
        return scores.entrySet().stream()
                .max(Map.Entry.<String, Double>comparingByValue().thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    // =========================================================================
    // RAPPORT
    // =========================================================================

    private void printReport(ModelEvaluation e) {
        log.info("📊 --- ÉVALUATION DU MODÈLE ---");
        log.info("🎯 Accuracy : {}", String.format("%.3f", e.getAccuracy()));
        log.info("📐 F1 pondéré : {}", String.format("%.3f", e.getWeightedF1()));

        log.info(String.format("%-26s | %-9s | %-9s | %-9s | %-7s", "Tactique", "Précision", "Rappel", "F1", "Support"));
        log.info("-------------------------------------------------------------------------");
        for (ClassMetrics m : e.getClassReport().values()) {
            log.info(String.format("%-26s | %-9.3f | %-9.3f | %-9.3f | %-7d",
                    m.label(), m.precision(), m.recall(), m.f1(), m.support()));
        }

        log.info("🧮 Matrice de confusion (lignes = réel, colonnes = prédit) :");
        List<String> labels = e.getConfusionLabels();
        for (int i = 0; i < labels.size(); i++) {
            StringBuilder line = new StringBuilder(String.format("%-26s |", labels.get(i)));
            for (long cell : e.getConfusionMatrix()[i]) line.append(String.format(" %5d", cell));
            log.info(line.toString());
        }

        log.info("🔝 Top features (perte d'accuracy par permutation) :");
        for (FeatureImportance f : e.getTopFeatures()) {
            log.info(String.format("%-30s %6.2f%%", f.feature(), f.importance() * 100));
        }

        ConfidenceStats c = e.getConfidence();
        log.info("🔮 Confiance : moyenne {} | médiane {} | écart-type {}",
                String.format("%.3f", c.mean()), String.format("%.3f", c.median()), String.format("%.3f", c.std()));
        c.aboveThresholds().forEach((t, pct) -> log.info("   > {} : {}%", t, String.format("%.1f", pct)));

        CrossValidationSummary cv = e.getCrossValidation();
        log.info("🔁 CV {} folds : accuracy {} (+/- {}) | F1 pondéré {} (+/- {})",
                cv.foldAccuracies().size(),
                String.format("%.3f", cv.meanAccuracy()), String.format("%.3f", 2 * cv.stdAccuracy()),
                String.format("%.3f", cv.meanWeightedF1()), String.format("%.3f", 2 * cv.stdWeightedF1()));
        cv.meanF1ByClass().forEach((label, f1) -> log.info(String.format("   %-26s F1 = %.3f", label, f1)));
    }
}
