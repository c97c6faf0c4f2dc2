package com.tony.baseballAnalytics.config;

import com.tony.baseballAnalytics.model.training.Hyperparameters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "tactics")
@Validated
@Data
public class TacticsProperties {

    @Valid
    private Model model = new Model();

    @Valid
    private Training training = new Training();

    @Valid
    private Inference inference = new Inference();

    @Data
    public static class Model {
        @NotBlank
        private String path = "models/tactical-predictor.ser";
        private boolean loadOnStartup = true;
    }

    @Data
    public static class Training {
        private long seed = 42L;

        @DecimalMin("0.0")
        @DecimalMax("0.5")
        private double testFraction = 0.2;

        @Min(2)
        private int cvFolds = 5;

        // Diagnostics post-entraînement (rapport, matrice de confusion, CV)
        private boolean evaluate = true;

        // 0 = nombre de coeurs disponibles
        @Min(0)
        private int gridSearchThreads = 0;

        @Valid
        private ForestParameters defaults = new ForestParameters();

        @Valid
        private Grid grid = new Grid();
    }

    // --- Configuration fixe (optimize = false) ---
    @Data
    public static class ForestParameters {
        @Min(1)
        private int trees = 200;
        @Min(1)
        private int maxDepth = 8;
        private float minLeafWeight = 30f;
        // Tribuo exige une fraction strictement entre 0 et 1 pour une forêt
        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax(value = "1.0", inclusive = false)
        private float featureFraction = 0.5f;
        private float minImpurityDecrease = 0.01f;

        public Hyperparameters toHyperparameters() {
            return new Hyperparameters(trees, maxDepth, minLeafWeight, featureFraction, minImpurityDecrease);
        }
    }

    // --- Axes de la grid search ---
    @Data
    public static class Grid {
        @NotEmpty
        private List<Integer> trees = new ArrayList<>(List.of(100, 200));
        @NotEmpty
        private List<Integer> maxDepth = new ArrayList<>(List.of(8, 10));
        @NotEmpty
        private List<Float> minLeafWeight = new ArrayList<>(List.of(30f, 50f));
        @NotEmpty
        private List<@DecimalMin(value = "0.0", inclusive = false) @DecimalMax(value = "1.0", inclusive = false) Float> featureFraction =
                new ArrayList<>(List.of(0.5f, 0.3f));
        @NotEmpty
        private List<Float> minImpurityDecrease = new ArrayList<>(List.of(0.01f, 0.02f));

        /**
         * Produit cartésien des axes, dans un ordre stable (sert à départager les égalités de score).
         */
        public List<Hyperparameters> combinations() {
            List<Hyperparameters> combos = new ArrayList<>();
            for (int t : trees)
                for (int d : maxDepth)
                    for (float leaf : minLeafWeight)
                        for (float ff : featureFraction)
                            for (float imp : minImpurityDecrease)
                                combos.add(new Hyperparameters(t, d, leaf, ff, imp));
            return combos;
        }
    }

    @Data
    public static class Inference {
        // Seuil d'affichage d'une tactique (en %)
        private double minProbability = 5.0;
        @Min(1)
        private int topTactics = 3;
        @Min(1)
        private int momentumWindow = 5;
        private double pressureTolerance = 0.2;
        private double highPressureThreshold = 1.5;
    }
}
