package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.config.TacticsProperties;
import com.tony.baseballAnalytics.exception.FeatureExtractionException;
import com.tony.baseballAnalytics.model.HistoricalSituation;
import com.tony.baseballAnalytics.model.PlayerAnalysis;
import com.tony.baseballAnalytics.model.PredictionResult;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.dto.RawPlay;
import com.tony.baseballAnalytics.model.training.TrainingDataset;
import com.tony.baseballAnalytics.model.training.TrainingReport;
import com.tony.baseballAnalytics.repository.TrainingDatasetCsvRepository;
import com.tony.baseballAnalytics.service.ml.TacticalClassifierService;
import com.tony.baseballAnalytics.service.stats.InMemoryStatsLookup;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static com.tony.baseballAnalytics.TestFixtures.play;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TacticalAnalysisOrchestratorTest {

    @Mock
    private SituationFeatureExtractor extractor;

    @Mock
    private TrainingDatasetService datasetService;

    @Mock
    private TacticalClassifierService classifier;

    @Mock
    private InferenceEnhancerService enhancer;

    @Mock
    private MatchupAnalysisService matchupService;

    @Mock
    private TrainingDatasetCsvRepository csvRepository;

    @Mock
    private TacticsProperties properties;

    @InjectMocks
    private TacticalAnalysisOrchestrator orchestrator;

    private final InMemoryStatsLookup stats = new InMemoryStatsLookup(2024, "R");

    @Test
    void analyzeGame_ShouldAnalyzeLastSituationAndEnrichIt() {
        // ARRANGE
        List<RawPlay> plays = List.of(play(8, "top", 0, 0, 0, 2, 2, "Single"), play(8, "top", 1, 0, 0, 2, 2, "Flyout"));
        Situation first = Situation.builder().inning(8).outs(0).result("Single").build();
        Situation last = Situation.builder().inning(8).outs(1).result("Flyout").batterId(660271L).pitcherId(543037L).build();
        List<Situation> situations = List.of(first, last);
        List<HistoricalSituation> history = List.of();

        PredictionResult base = PredictionResult.builder().build();
        PredictionResult enhanced = PredictionResult.builder().build();
        PlayerAnalysis analysis = PlayerAnalysis.builder().advantage(PlayerAnalysis.Advantage.NEUTRAL).build();

        when(extractor.extractAll(plays, stats)).thenReturn(situations);
        when(classifier.analyzeSituation(last)).thenReturn(base);
        when(enhancer.enhance(base, last, situations, history)).thenReturn(enhanced);
        when(matchupService.analyze(660271L, 543037L, stats)).thenReturn(Optional.of(analysis));

        // ACT
        PredictionResult result = orchestrator.analyzeGame(plays, stats, history);

        // ASSERT
        // 1. Le résultat enrichi est renvoyé avec le duel frappeur / lanceur
        assertThat(result).isSameAs(enhanced);
        assertThat(result.getPlayerAnalysis()).isEqualTo(analysis);

        // 2. Seule la dernière action est analysée par le classifieur
        verify(classifier, times(1)).analyzeSituation(last);
        verify(classifier, never()).analyzeSituation(first);
    }

    @Test
    void analyzeGame_WithoutUsablePlays_ShouldFail() {
        when(extractor.extractAll(any(), any())).thenReturn(List.of());

        assertThatThrownBy(() -> orchestrator.analyzeGame(List.of(), stats, null))
                .isInstanceOf(FeatureExtractionException.class);
        verifyNoInteractions(classifier, enhancer);
    }

    @Test
    void trainFromGames_ShouldBuildValidateTrainThenSave() {
        // ARRANGE
        List<List<RawPlay>> games = List.of(List.of(play(1, "top", 0, 0, 0, 0, 0, "Single")));
        TrainingDataset dataset = new TrainingDataset(List.of());
        TrainingReport report = TrainingReport.builder().trainSize(1).build();
        TacticsProperties.Model model = new TacticsProperties.Model();
        model.setPath("target/models/test-model.ser");

        when(datasetService.build(games, stats)).thenReturn(dataset);
        when(classifier.train(dataset, true)).thenReturn(report);
        when(properties.getModel()).thenReturn(model);

        // ACT
        TrainingReport result = orchestrator.trainFromGames(games, stats, true);

        // ASSERT
        assertThat(result).isSameAs(report);
        InOrder order = inOrder(datasetService, classifier);
        order.verify(datasetService).build(games, stats);
        order.verify(datasetService).validate(dataset);
        order.verify(classifier).train(dataset, true);
        order.verify(classifier).saveModel(Path.of("target/models/test-model.ser"));
    }

    @Test
    void exportTrainingData_ShouldWriteTheBuiltDataset() throws IOException {
        List<List<RawPlay>> games = List.of();
        TrainingDataset dataset = new TrainingDataset(List.of());
        Path csv = Path.of("target/export.csv");
        when(datasetService.build(games, null)).thenReturn(dataset);

        TrainingDataset exported = orchestrator.exportTrainingData(games, null, csv);

        assertThat(exported).isSameAs(dataset);
        verify(csvRepository, times(1)).save(dataset, csv);
        verify(datasetService, never()).validate(any());
    }
}
