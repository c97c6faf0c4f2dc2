package com.tony.baseballAnalytics.config;

import com.tony.baseballAnalytics.exception.ModelPersistenceException;
import com.tony.baseballAnalytics.service.ml.TacticalClassifierService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Charge le modèle tactique au démarrage s'il a déjà été entraîné.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ModelInitializer implements CommandLineRunner {

    private final TacticalClassifierService classifier;
    private final TacticsProperties properties;

    @Override
    public void run(String... args) {
        if (!properties.getModel().isLoadOnStartup()) return;

        Path path = Path.of(properties.getModel().getPath());
        if (!Files.exists(path)) {
            log.info("🌱 Aucun modèle tactique trouvé ({}) : entraînement nécessaire avant prédiction", path);
            return;
        }

        try {
            classifier.loadModel(path);
        } catch (ModelPersistenceException e) {
            // Démarrage sans modèle : les prédictions lèveront ModelNotLoadedException
            log.error("❌ Modèle illisible ({}), démarrage sans modèle", path, e);
        }
    }
}
