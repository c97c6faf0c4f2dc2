package com.tony.baseballAnalytics.service.ml;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.exception.TrainingException;
import com.tony.baseballAnalytics.model.training.GridSearchResult;
import com.tony.baseballAnalytics.model.training.Hyperparameters;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.classification.Label;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Grid search parallèle : une tâche par couple (configuration, fold), résultats collectés au fil de l'eau.
 * Aucun accumulateur partagé : seuls les folds terminés sont notés, une interruption ne fausse pas la sélection.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HyperparameterGridSearch {

    private final TribuoForestFactory forestFactory;
    private final StratifiedSplitter splitter;
    private final TacticsProperties properties;

    private record FoldScore(int configIndex, int fold, double weightedF1) {
    }

    public GridSearchResult search(List<TrainingRow> rows, FeatureSchema schema, Map<String, Double> classWeights) {
        return search(rows, schema, classWeights, properties.getTraining().getGrid().combinations());
    }

    public GridSearchResult search(List<TrainingRow> rows, FeatureSchema schema, Map<String, Double> classWeights,
                                   List<Hyperparameters> grid) {
        TacticsProperties.Training cfg = properties.getTraining();
        List<StratifiedSplitter.Split> folds = splitter.kFold(rows.stream().map(TrainingRow::label).toList(),
                cfg.getCvFolds(), cfg.getSeed());

        int threads = cfg.getGridSearchThreads() > 0 ? cfg.getGridSearchThreads() : Runtime.getRuntime().availableProcessors();
        log.info("🔎 Grid search : {} configurations x {} folds sur {} threads", grid.size(), folds.size(), threads);

        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CompletionService<FoldScore> completion = new ExecutorCompletionService<>(executor);
        List<Future<FoldScore>> pending = new ArrayList<>();

        List<List<Double>> foldScores = new ArrayList<>();
        grid.forEach(h -> foldScores.add(new ArrayList<>()));
        int completed = 0;

        try {
            for (int c = 0; c < grid.size(); c++) {
                for (int f = 0; f < folds.size(); f++) {
                    pending.add(completion.submit(foldTask(rows, schema, classWeights, grid.get(c), c, f, folds.get(f), cfg.getSeed())));
                }
            }

            for (int i = 0; i < pending.size(); i++) {
                try {
                    FoldScore score = completion.take().get();
                    foldScores.get(score.configIndex()).add(score.weightedF1());
                    completed++;
                } catch (ExecutionException e) {
                    log.warn("⚠️ Fold en échec, ignoré dans la sélection : {}", e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            log.warn("Grid search interrompue après {} folds terminés", completed);
            Thread.currentThread().interrupt();
        } finally {
            pending.forEach(p -> p.cancel(true));
            executor.shutdownNow();
        }

        return select(grid, foldScores, completed);
    }

    private Callable<FoldScore> foldTask(List<TrainingRow> rows, FeatureSchema schema, Map<String, Double> classWeights,
                                         Hyperparameters h, int configIndex, int fold,
                                         StratifiedSplitter.Split split, long seed) {
        return () -> {
            List<TrainingRow> train = split.train().stream().map(rows::get).toList();
            List<TrainingRow> test = split.test().stream().map(rows::get).toList();

            Model<Label> model = forestFactory.train(train, schema, classWeights, h, seed);
            List<String> actual = new ArrayList<>();
            List<String> predicted = new ArrayList<>();
            for (TrainingRow row : test) {
                actual.add(row.label());
                predicted.add(forestFactory.predictLabel(model, forestFactory.example(schema.align(row.features()), schema)));
            }
            return new FoldScore(configIndex, fold, ClassificationMetrics.weightedF1(actual, predicted));
        };
    }

    // Meilleure moyenne sur les folds terminés ; à égalité, la première configuration de la grille
    private GridSearchResult select(List<Hyperparameters> grid, List<List<Double>> foldScores, int completed) {
        Map<Hyperparameters, Double> means = new LinkedHashMap<>();
        Hyperparameters best = null;
        double bestScore = Double.NEGATIVE_INFINITY;

        for (int c = 0; c < grid.size(); c++) {
            List<Double> scores = foldScores.get(c);
            if (scores.isEmpty()) continue;
            double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            means.put(grid.get(c), mean);
            if (mean > bestScore) {
                best = grid.get(c);
                bestScore = mean;
            }
        }

        if (best == null) {
            throw new TrainingException("Grid search : aucune configuration n'a terminé de fold");
        }
        log.info("🏆 Meilleure configuration ({}) : F1 pondéré CV = {}", best, String.format("%.4f", bestScore));
        return new GridSearchResult(best, bestScore, means, completed);
    }
}
