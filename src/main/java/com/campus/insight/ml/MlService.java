package com.campus.insight.ml;

import com.campus.insight.config.InsightProperties;
import com.campus.insight.exception.ModelPersistenceException;
import com.campus.insight.features.FeatureAggregator;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.RiskLevel;
import com.campus.insight.ml.MlModels.BatchPrediction;
import com.campus.insight.ml.MlModels.BatchPredictionResult;
import com.campus.insight.ml.MlModels.ModelDescriptor;
import com.campus.insight.ml.MlModels.ModelInfo;
import com.campus.insight.ml.MlModels.PerformancePrediction;
import com.campus.insight.ml.MlModels.RiskOutcome;
import com.campus.insight.ml.MlModels.RiskPrediction;
import com.campus.insight.ml.MlModels.TrainingReport;
import com.campus.insight.sentiment.SentimentAnalyzer;
import com.campus.insight.sentiment.SentimentModels.SentimentAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Service
public class MlService {
    private static final Logger log = LoggerFactory.getLogger(MlService.class);

    private final ModelRegistry registry;
    private final FeatureAggregator aggregator;
    private final SentimentAnalyzer sentimentAnalyzer;
    private final boolean loadOnStartup;

    @Autowired
    public MlService(ModelRegistry registry,
                     FeatureAggregator aggregator,
                     SentimentAnalyzer sentimentAnalyzer,
                     InsightProperties properties) {
        this(registry, aggregator, sentimentAnalyzer, properties.ml().loadOnStartup());
    }

    MlService(ModelRegistry registry, FeatureAggregator aggregator, SentimentAnalyzer sentimentAnalyzer, boolean loadOnStartup) {
        this.registry = registry;
        this.aggregator = aggregator;
        this.sentimentAnalyzer = sentimentAnalyzer;
        this.loadOnStartup = loadOnStartup;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (loadOnStartup) loadModels();
    }

    public TrainingReport trainModels() {
        return registry.train(aggregator.buildTrainingSet());
    }

    public boolean loadModels() {
        try {
            boolean loaded = registry.load();
            log.info("Model artifacts in {} {}", registry.modelDir(), loaded ? "restored" : "not available, models stay untrained");
            return loaded;
        } catch (ModelPersistenceException e) {
            log.warn("Could not restore model artifacts, models stay untrained", e);
            return false;
        }
    }

    public Optional<PerformancePrediction> predictPerformance(long studentId) {
        Optional<FeatureVector> features = aggregator.tryAggregate(studentId);
        if (features.isEmpty()) return Optional.empty();
        ensureTrained();

        PerformanceRegressor regressor = registry.regressor();
        double score = round2(regressor.predict(features.get()));
        return Optional.of(new PerformancePrediction(studentId, score, features.get(),
                regressor.featureImportance(), interpretPerformance(score)));
    }

    public Optional<RiskPrediction> classifyRisk(long studentId) {
        Optional<FeatureVector> features = aggregator.tryAggregate(studentId);
        if (features.isEmpty()) return Optional.empty();
        ensureTrained();

        RiskClassifier classifier = registry.classifier();
        RiskOutcome outcome = classifier.predict(features.get());
        return Optional.of(new RiskPrediction(studentId, outcome.riskLevel(), outcome.probabilities(), features.get(),
                classifier.featureImportance(), interpretRisk(outcome.riskLevel(), outcome.probabilities())));
    }

    public BatchPredictionResult batchPredict(Collection<Long> studentIds) {
        List<BatchPrediction> predictions = new ArrayList<>();
        for (Long id : studentIds) {
            Optional<PerformancePrediction> performance = predictPerformance(id);
            Optional<RiskPrediction> risk = classifyRisk(id);
            if (performance.isEmpty() || risk.isEmpty()) {
                log.debug("Skipping student {} in batch prediction: no academic records", id);
                continue;
            }
            predictions.add(new BatchPrediction(id, performance.get().predictedScore(),
                    risk.get().riskLevel(), risk.get().probabilities()));
        }
        return new BatchPredictionResult(Collections.unmodifiableList(predictions), predictions.size());
    }

    public SentimentAnalysis analyzeSentiment(String text) {
        return sentimentAnalyzer.analyzeWithScore(text);
    }

    public ModelInfo modelInfo() {
        return new ModelInfo(
                new ModelDescriptor(registry.regressorStatus(), registry.regressor().modelType(), registry.regressor().featureImportance()),
                new ModelDescriptor(registry.classifierStatus(), registry.classifier().modelType(), registry.classifier().featureImportance()),
                registry.lastReport(),
                registry.trainingRuns());
    }

    private void ensureTrained() {
        registry.ensureTrained(aggregator::buildTrainingSet);
    }

    static String interpretPerformance(double score) {
        if (score >= 80) return "Excellent performance expected. Keep up the great work!";
        if (score >= 60) return "Good performance expected. Consider focusing on weaker areas.";
        if (score >= 40) return "Average performance expected. Additional effort and support recommended.";
        return "Below average performance predicted. Immediate intervention recommended.";
    }

    static String interpretRisk(RiskLevel level, Map<RiskLevel, Double> probabilities) {
        double confidence = probabilities.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        String pct = String.format(Locale.US, "%.1f%%", confidence * 100);
        return switch (level) {
            case HIGH -> "High risk detected with " + pct + " confidence. Immediate attention required.";
            case MEDIUM -> "Medium risk detected with " + pct + " confidence. Monitor progress closely.";
            case LOW -> "Low risk with " + pct + " confidence. Student is performing well.";
        };
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
