package com.campus.insight.config;

import com.campus.insight.ml.MlModels.ForestSettings;
import com.campus.insight.ml.ModelRegistry;
import com.campus.insight.ml.PerformanceRegressor;
import com.campus.insight.ml.RiskClassifier;
import com.campus.insight.sentiment.PolarityLexicon;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class InsightConfiguration {
    static final String LEXICON_RESOURCE = "sentiment/lexicon.tsv";

    @Bean
    public PolarityLexicon polarityLexicon() {
        return PolarityLexicon.fromClasspath(LEXICON_RESOURCE);
    }

    @Bean
    public ModelRegistry modelRegistry(InsightProperties properties) {
        InsightProperties.Ml ml = properties.ml();
        return new ModelRegistry(
                new PerformanceRegressor(new ForestSettings(ml.numTrees(), ml.regressorMaxDepth(), ml.seed(), ml.testFraction())),
                new RiskClassifier(new ForestSettings(ml.numTrees(), ml.classifierMaxDepth(), ml.seed(), ml.testFraction())),
                Path.of(ml.modelDir()));
    }
}
