package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.exception.FeatureExtractionException;
import com.tony.baseballAnalytics.model.HistoricalSituation;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.dto.RawPlay;
import com.tony.baseballAnalytics.model.training.TrainingDataset;
import com.tony.baseballAnalytics.model.training.TrainingReport;
import com.tony.baseballAnalytics.repository.TrainingDatasetCsvRepository;
import com.tony.baseballAnalytics.service.ml.TacticalClassifierService;
import com.tony.baseballAnalytics.service.stats.PlayerStatsProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TacticalAnalysisOrchestrator {

    private final SituationFeatureExtractor extractor;
    private final TrainingDatasetService datasetService;
    private final TacticalClassifierService classifier;
    private final InferenceEnhancerService enhancer;
    private final MatchupAnalysisService matchupService;
    private final TrainingDatasetCsvRepository csvRepository;
    private final TacticsProperties properties;

    /**
     * Chaîne complète d'entraînement : extraction, étiquetage, validation, apprentissage puis sauvegarde du modèle.
     */
    public TrainingReport trainFromGames(List<List<RawPlay>> games, PlayerStatsProvider statsProvider, boolean optimize) {
        log.info("🚀 Orchestrator: entraînement sur {} matchs (optimisation : {})", games.size(), optimize);
        TrainingDataset dataset = datasetService.build(games, statsProvider);
        datasetService.validate(dataset);

        TrainingReport report = classifier.train(dataset, optimize);
        classifier.saveModel(Path.of(properties.getModel().getPath()));
        return report;
    }

    public TrainingDataset exportTrainingData(List<List<RawPlay>> games, PlayerStatsProvider statsProvider, Path csv)
            throws IOException {
        TrainingDataset dataset = datasetService.build(games, statsProvider);
        csvRepository.save(dataset, csv);
        return dataset;
    }

    /**
     * Analyse la dernière action exploitable du match, enrichie du momentum, de l'historique et du duel frappeur/lanceur.
     *
     * @param history corpus de situations passées, peut être null
     */
    public PredictionResult analyzeGame(List<RawPlay> plays, PlayerStatsProvider statsProvider,
                                        List<HistoricalSituation> history) {
        List<Situation> situations = extractor.extractAll(plays, statsProvider);
        if (situations.isEmpty()) {
            throw new FeatureExtractionException("Aucune action exploitable dans le match");
        }

        Situation current = situations.get(situations.size() - 1);
        log.info("🔮 Analyse tactique : manche {} ({}), {} retrait(s), pression {}",
                current.getInning(), current.getHalfInning(), current.getOuts(),
                String.format("%.2f", current.getPressureIndex()));

        PredictionResult base = classifier.analyzeSituation(current);
        PredictionResult enhanced = enhancer.enhance(base, current, situations, history);
        matchupService.analyze(current.getBatterId(), current.getPitcherId(), statsProvider)
                .ifPresent(enhanced::setPlayerAnalysis);
        return enhanced;
    }
}
