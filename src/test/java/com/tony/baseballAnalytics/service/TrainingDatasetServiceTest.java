package com.tony.baseballAnalytics.service;

import com.tony.baseballAnalytics.exception.TrainingException;
import com.tony.baseballAnalytics.model.training.TrainingDataset;
import com.tony.baseballAnalytics.model.training.TrainingRow;
import com.tony.baseballAnalytics.service.ml.FeatureVectorizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.tony.baseballAnalytics.TestFixtures.play;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrainingDatasetServiceTest {

    private TrainingDatasetService service;

    @BeforeEach
    void setUp() {
        service = new TrainingDatasetService(new SituationFeatureExtractor(), new TacticLabeler(), new FeatureVectorizer());
    }

    private Map<String, Double> validFeatures() {
        Map<String, Double> features = new HashMap<>();
        features.put("inning", 3.0);
        features.put("outs", 1.0);
        features.put("num_runners", 0.0);
        features.put("scoring_position", 0.0);
        features.put("pressure_index", 1.2);
        features.put("half_inning_top", 1.0);
        return features;
    }

    @Test
    @DisplayName("Une ligne par action exploitable, tous matchs confondus, avec sa tactique principale")
    void buildFromGames() {
        TrainingDataset dataset = service.build(List.of(
                List.of(play(1, "top", 0, 0, 0, 0, 0, "Single"), play(1, "top", 0, 0, 0, 0, 0, "Game Advisory")),
                List.of(play(9, "bottom", 2, 0, 2, 4, 4, "Strikeout"))), null);

        assertThat(dataset.size()).isEqualTo(2);
        assertThat(dataset.labels()).containsExactly("contact_hitting", "strikeout_pitching");
        assertThat(dataset.columns()).contains("pressure_index", "result_Single", "result_Strikeout", "half_inning_bottom");
        assertThatCode(() -> service.validate(dataset)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Jeu vide ou colonne obligatoire absente : refusé")
    void emptyOrIncompleteDataset() {
        assertThatThrownBy(() -> service.validate(new TrainingDataset(List.of())))
                .isInstanceOf(TrainingException.class);

        Map<String, Double> features = validFeatures();
        features.remove("scoring_position");
        assertThatThrownBy(() -> service.validate(new TrainingDataset(List.of(new TrainingRow(features, "small_ball")))))
                .isInstanceOf(TrainingException.class)
                .hasMessageContaining("scoring_position");
    }

    @Test
    @DisplayName("Valeurs hors bornes : outs, inning, demi-manche")
    void outOfRangeValues() {
        Map<String, Double> badOuts = validFeatures();
        badOuts.put("outs", 4.0);
        Map<String, Double> badInning = validFeatures();
        badInning.put("inning", 25.0);
        Map<String, Double> badHalf = validFeatures();
        badHalf.put("half_inning_middle", 1.0);

        assertThatThrownBy(() -> service.validate(new TrainingDataset(List.of(new TrainingRow(badOuts, "small_ball")))))
                .hasMessageContaining("outs");
        assertThatThrownBy(() -> service.validate(new TrainingDataset(List.of(new TrainingRow(badInning, "small_ball")))))
                .hasMessageContaining("inning");
        assertThatThrownBy(() -> service.validate(new TrainingDataset(List.of(new TrainingRow(badHalf, "small_ball")))))
                .hasMessageContaining("demi-manche");
    }

    @Test
    @DisplayName("Ligne sans tactique : refusée")
    void blankLabel() {
        assertThatThrownBy(() -> service.validate(new TrainingDataset(List.of(new TrainingRow(validFeatures(), " ")))))
                .isInstanceOf(TrainingException.class);
    }
}
