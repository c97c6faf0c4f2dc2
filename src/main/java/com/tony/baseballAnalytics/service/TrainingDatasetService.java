package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.exception.TrainingException;
import com.tony.baseballAnalytics.model.LabeledSituation;
import com.tony.baseballAnalytics.model.Situation;
import com.tony.baseballAnalytics.model.dto.RawPlay;
import com.tony.baseballAnalytics.model.training.TrainingDataset;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import com.tony.baseballAnalytics.service.ml.FeatureVectorizer;
import com.tony.baseballAnalytics.service.stats.PlayerStatsProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Construit la table d'entraînement (extraction + étiquetage) et la contrôle avant apprentissage.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrainingDatasetService {

    private static final int MAX_INNING = 20;
    private static final Set<String> VALID_HALF_INNINGS = Set.of(
            FeatureVectorizer.HALF_INNING_PREFIX + SituationFeatureExtractor.TOP,
            FeatureVectorizer.HALF_INNING_PREFIX + SituationFeatureExtractor.BOTTOM);

    private final SituationFeatureExtractor extractor;
    private final TacticLabeler labeler;
    private final FeatureVectorizer vectorizer;

    /**
     * @param games une liste d'actions par match, dans l'ordre
     */
    public TrainingDataset build(List<List<RawPlay>> games, PlayerStatsProvider statsProvider) {
        List<TrainingRow> rows = new ArrayList<>();
        int gameCount = 0;
        for (List<RawPlay> plays : games) {
            List<Situation> situations = extractor.extractAll(plays, statsProvider);
            for (LabeledSituation labeled : labeler.labelAll(situations)) {
                rows.add(new TrainingRow(vectorizer.vectorize(labeled.situation()), labeled.primaryTactic()));
            }
            gameCount++;
        }
        log.info("📚 Table d'entraînement : {} situations issues de {} matchs", rows.size(), gameCount);
        return new TrainingDataset(rows);
    }

    /**
     * Contrôles de cohérence avant entraînement : colonnes obligatoires, bornes de outs et d'inning, demi-manches.
     *
     * @throws TrainingException au premier contrôle en échec
     */
    public void validate(TrainingDataset dataset) {
        if (dataset.isEmpty()) {
            throw new TrainingException("Jeu d'entraînement vide");
        }

        Set<String> columns = dataset.columns();
        List<String> missing = FeatureVectorizer.REQUIRED_COLUMNS.stream().filter(c -> !columns.contains(c)).toList();
        if (!missing.isEmpty()) {
            throw new TrainingException("Colonnes obligatoires absentes : " + missing);
        }

        for (int i = 0; i < dataset.size(); i++) {
            TrainingRow row = dataset.rows().get(i);
            if (row.label() == null || row.label().isBlank()) {
                throw new TrainingException("Ligne " + i + " sans tactique principale");
            }
            double outs = row.value("outs");
            if (outs < 0 || outs > 3) {
                throw new TrainingException("Ligne " + i + " : outs invalide (" + outs + ")");
            }
            double inning = row.value("inning");
            if (inning < 1 || inning > MAX_INNING) {
                throw new TrainingException("Ligne " + i + " : inning invalide (" + inning + ")");
            }
            for (Map.Entry<String, Double> e : row.features().entrySet()) {
                if (e.getKey().startsWith(FeatureVectorizer.HALF_INNING_PREFIX)
                        && e.getValue() != 0.0 && !VALID_HALF_INNINGS.contains(e.getKey())) {
                    throw new TrainingException("Ligne " + i + " : demi-manche invalide (" + e.getKey() + ")");
                }
            }
        }
        log.info("✅ Validation du jeu d'entraînement OK ({} lignes, {} classes)", dataset.size(), dataset.labelCounts().size());
    }
}
