package com.analyticsplatform.analysis.config;

import com.analyticsplatform.analysis.artifact.JsonModelArtifactLoader;
import com.analyticsplatform.analysis.artifact.ModelArtifactLoader;
import com.analyticsplatform.analysis.engine.EnsembleStrategy;
import com.analyticsplatform.analysis.engine.ModelExecutionEngine;
import com.analyticsplatform.analysis.engine.WeightedMeanEnsembleStrategy;
import com.analyticsplatform.analysis.feature.FeatureTable;
import com.analyticsplatform.analysis.feature.FeatureTableLoader;
import com.analyticsplatform.analysis.model.ModelCatalog;
import com.analyticsplatform.analysis.registry.ModelRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class AnalysisEngineConfig {

    @Value("${analytics.models.directory:./model_pack}")
    private String modelDirectory;

    @Value("${analytics.models.manifest:models.json}")
    private String manifestFile;

    @Value("${analytics.models.accuracy-window:3}")
    private int accuracyWindow;

    @Value("${analytics.features.table:./model_pack/features.json}")
    private String featureTablePath;

    @Bean
    public ModelCatalog modelCatalog(ObjectMapper objectMapper) {
        return ModelCatalog.load(Path.of(modelDirectory).resolve(manifestFile), objectMapper, accuracyWindow);
    }

    @Bean
    public ModelArtifactLoader modelArtifactLoader(ObjectMapper objectMapper) {
        return new JsonModelArtifactLoader(Path.of(modelDirectory), objectMapper);
    }

    @Bean
    public ModelRegistry modelRegistry(ModelCatalog modelCatalog, ModelArtifactLoader modelArtifactLoader) {
        return new ModelRegistry(modelCatalog, modelArtifactLoader);
    }

    @Bean
    public EnsembleStrategy ensembleStrategy() {
        return new WeightedMeanEnsembleStrategy();
    }

    @Bean
    public ModelExecutionEngine modelExecutionEngine(ModelCatalog modelCatalog, ModelRegistry modelRegistry,
                                                     EnsembleStrategy ensembleStrategy) {
        return new ModelExecutionEngine(modelCatalog, modelRegistry, ensembleStrategy);
    }

    @Bean
    public FeatureTable featureTable(ObjectMapper objectMapper) {
        return FeatureTableLoader.load(Path.of(featureTablePath), objectMapper);
    }
}
