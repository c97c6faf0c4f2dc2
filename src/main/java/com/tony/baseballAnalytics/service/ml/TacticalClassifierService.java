package com.tony.baseballAnalytics.service.ml;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.exception.ModelNotLoadedException;
import com.tony.baseballAnalytics.exception.ModelPersistenceException;
import com.tony.baseballAnalytics.exception.TrainingException;
import com.tony.baseballAnalytics.model.ContextAnalysis;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.TacticCategory;
import com.tony.baseballAnalytics.model.TacticalTaxonomy;
import com.tony.baseballAnalytics.model.training.GridSearchResult;
import com.tony.baseballAnalytics.model.training.Hyperparameters;
import com.tony.baseballAnalytics.model.training.ModelEvaluation;
import com.tony.baseballAnalytics.model.training.TrainedTacticModel;
import com.tony.baseballAnalytics.model.training.TrainingDataset;
import com.tony.baseballAnalytics.model.training.TrainingReport;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import com.tony.baseballAnalytics.service.RecommendationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.tribuo.Model;
import org.tribuo.classification.Label;

import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputFilter;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Classifieur tactique : entraînement pondéré (forêt aléatoire), prédiction par catégorie, persistance.
 * Le modèle courant est remplacé d'un bloc (jamais modifié en place).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TacticalClassifierService {

    private static final double MIN_REPORTED_SCORE = 0.05;

    // Classes acceptées à la lecture d'un artefact : Tribuo, OLCUT (provenance), JDK et le projet
    static final ObjectInputFilter MODEL_FILTER = ObjectInputFilter.Config.createFilter(
            "org.tribuo.**;com.oracle.labs.mlrg.olcut.**;java.**;com.tony.baseballAnalytics.**;!*");

    private final FeatureVectorizer vectorizer;
    private final ClassWeightCalculator weightCalculator;
    private final StratifiedSplitter splitter;
    private final TribuoForestFactory forestFactory;
    private final HyperparameterGridSearch gridSearch;
    private final ModelEvaluationService evaluationService;
    private final RecommendationService recommendationService;
    private final TacticsProperties properties;

    private final AtomicReference<TrainedTacticModel> current = new AtomicReference<>();

    // =========================================================================
    // ENTRAÎNEMENT
    // =========================================================================

    public TrainingReport train(TrainingDataset dataset, boolean optimize) {
        TrainingDataset filtered = dataset.withoutLabel(TrainingDataset.OTHER_LABEL);
        if (filtered.isEmpty()) {
            throw new TrainingException("Jeu d'entraînement vide après filtrage");
        }

        Set<String> columns = filtered.columns();
        List<String> missing = FeatureVectorizer.REQUIRED_COLUMNS.stream().filter(c -> !columns.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new TrainingException("Colonnes obligatoires absentes : " + missing);
        }

        Map<String, Long> classCounts = filtered.labelCounts();
        if (classCounts.size() < 2) {
            throw new TrainingException("Au moins 2 tactiques distinctes sont nécessaires, trouvé : " + classCounts.keySet());
        }

        TacticsProperties.Training cfg = properties.getTraining();
        FeatureSchema schema = FeatureSchema.fromColumns(columns);
        List<TrainingRow> rows = filtered.rows();

        StratifiedSplitter.Split split = splitter.split(filtered.labels(), cfg.getTestFraction(), cfg.getSeed());
        List<TrainingRow> train = split.train().stream().map(rows::get).toList();
        List<TrainingRow> test = split.test().stream().map(rows::get).toList();

        log.info("🧠 Entraînement sur {} situations ({} train / {} test), {} features, {} classes",
                rows.size(), train.size(), test.size(), schema.size(), classCounts.size());
        classCounts.forEach((label, count) -> log.info(String.format("   %-26s %6d", label, count)));

        Map<String, Double> classWeights = weightCalculator.compute(filtered.labels());

        GridSearchResult search = null;
        Hyperparameters hyperparameters = cfg.getDefaults().toHyperparameters();
        if (optimize) {
            search = gridSearch.search(train, schema, classWeights);
            hyperparameters = search.best();
        }

        Model<Label> model = forestFactory.train(train, schema, classWeights, hyperparameters, cfg.getSeed());
        TrainedTacticModel trained = new TrainedTacticModel(model, schema.names(), hyperparameters);
        current.set(trained);
        log.info("✅ Modèle entraîné ({})", hyperparameters);

        ModelEvaluation evaluation = null;
        if (cfg.isEvaluate() && !test.isEmpty()) {
            evaluation = evaluationService.evaluate(trained, test, rows);
        }

        return TrainingReport.builder()
                .trainSize(train.size())
                .testSize(test.size())
                .featureCount(schema.size())
                .classCounts(classCounts)
                .classWeights(classWeights)
                .hyperparameters(hyperparameters)
                .gridSearch(search)
                .evaluation(evaluation)
                .build();
    }

    // =========================================================================
    // INFÉRENCE
    // =========================================================================

    /**
     * Probabilités (%) par catégorie, seulement celles >= 5%, triées par ordre décroissant dans chaque catégorie.
     */
    public Map<TacticCategory, Map<String, Double>> predictProba(Situation situation) {
        TrainedTacticModel trained = requireModel();
        FeatureSchema schema = new FeatureSchema(trained.featureNames());

        Map<String, Double> features = vectorizer.vectorize(situation);
        if (log.isDebugEnabled()) {
            Set<String> ignored = schema.unknownColumns(features);
            if (!ignored.isEmpty()) log.debug("Features inconnues du modèle ignorées : {}", ignored);
        }

        Map<String, Double> scores = forestFactory.scores(trained.classifier(),
                forestFactory.example(schema.align(features), schema));

        Map<TacticCategory, Map<String, Double>> byCategory = new EnumMap<>(TacticCategory.class);
        for (TacticCategory category : TacticCategory.values()) {
            byCategory.put(category, new LinkedHashMap<>());
        }

        scores.entrySet().stream()
                .filter(e -> e.getValue() >= MIN_REPORTED_SCORE)
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> {
                    Optional<TacticCategory> category = TacticalTaxonomy.categoryOf(e.getKey());
                    if (category.isEmpty()) {
                        log.debug("Tactique hors taxonomie ignorée : {}", e.getKey());
                        return;
                    }
                    byCategory.get(category.get()).put(e.getKey(), round(e.getValue() * 100.0));
                });
        return byCategory;
    }

    public PredictionResult analyzeSituation(Situation situation) {
        Map<TacticCategory, Map<String, Double>> probabilities = predictProba(situation);
        ContextAnalysis context = recommendationService.analyzeContext(situation);
        Map<String, Double> top = recommendationService.topTactics(probabilities);

        return PredictionResult.builder()
                .tacticalProbabilities(probabilities)
                .topTactics(top)
                .contextAnalysis(context)
                .recommendations(recommendationService.recommend(top, context))
                .build();
    }

    // =========================================================================
    // PERSISTANCE
    // =========================================================================

    /**
     * Écrit le modèle et ses features d'un seul bloc (fichier temporaire puis déplacement atomique).
     */
    public void saveModel(Path path) {
        TrainedTacticModel trained = requireModel();
        Path target = path.toAbsolutePath();
        Path tmp = null;
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp);
                 ObjectOutputStream oos = new ObjectOutputStream(out)) {
                oos.writeObject(trained);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("💾 Modèle sauvegardé : {}", target);
        } catch (IOException e) {
            ModelPersistenceException failure = new ModelPersistenceException("Échec de la sauvegarde du modèle : " + target, e);
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    failure.addSuppressed(cleanup);
                }
            }
            throw failure;
        }
    }

    public void loadModel(Path path) {
        Object loaded;
        try (InputStream in = Files.newInputStream(path);
             ObjectInputStream ois = new ObjectInputStream(in)) {
            ois.setObjectInputFilter(MODEL_FILTER);
            loaded = ois.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new ModelPersistenceException("Échec du chargement du modèle : " + path, e);
        }

        if (!(loaded instanceof TrainedTacticModel trained)) {
            throw new ModelPersistenceException("Artefact inattendu dans " + path);
        }
        if (trained.classifier() == null) {
            throw new ModelPersistenceException("Artefact sans classifieur : " + path);
        }
        if (trained.featureNames() == null || trained.featureNames().isEmpty()) {
            throw new ModelPersistenceException("Artefact sans liste de features : " + path);
        }

        current.set(trained);
        log.info("📦 Modèle chargé : {} ({} features, {})", path, trained.featureNames().size(), trained.hyperparameters());
    }

    public boolean isModelLoaded() {
        return current.get() != null;
    }

    public Optional<TrainedTacticModel> currentModel() {
        return Optional.ofNullable(current.get());
    }

    private TrainedTacticModel requireModel() {
        TrainedTacticModel trained = current.get();
        if (trained == null) throw new ModelNotLoadedException();
        return trained;
    }

    private double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
