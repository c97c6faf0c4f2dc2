package com.tony.baseballAnalytics.config;

import com.tony.baseballAnalytics.exception.ModelPersistenceException;
import com.tony.baseballAnalytics.service.ml.TacticalClassifierService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ModelInitializerTest {

    @Mock
    private TacticalClassifierService classifier;

    @TempDir
    Path tempDir;

    private TacticsProperties properties;
    private ModelInitializer initializer;

    @BeforeEach
    void setUp() {
        properties = new TacticsProperties();
        initializer = new ModelInitializer(classifier, properties);
    }

    @Test
    void run_WithoutModelFile_ShouldNotLoad() {
        properties.getModel().setPath(tempDir.resolve("absent.ser").toString());

        initializer.run();

        verifyNoInteractions(classifier);
    }

    @Test
    void run_WithExistingModel_ShouldLoadIt() throws IOException {
        Path model = Files.writeString(tempDir.resolve("model.ser"), "x");
        properties.getModel().setPath(model.toString());

        initializer.run();

        verify(classifier, times(1)).loadModel(model);
    }

    @Test
    void run_WithCorruptModel_ShouldStartAnyway() throws IOException {
        Path model = Files.writeString(tempDir.resolve("model.ser"), "x");
        properties.getModel().setPath(model.toString());
        doThrow(new ModelPersistenceException("illisible")).when(classifier).loadModel(model);

        assertThatCode(() -> initializer.run()).doesNotThrowAnyException();
    }

    @Test
    void run_WhenDisabled_ShouldDoNothing() {
        properties.getModel().setLoadOnStartup(false);

        initializer.run();

        verifyNoInteractions(classifier);
    }
}
