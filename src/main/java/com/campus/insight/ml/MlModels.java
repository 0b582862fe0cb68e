package com.campus.insight.ml;

import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.RiskLevel;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public class MlModels {
    public enum ModelStatus { UNTRAINED, TRAINING, TRAINED }

    public record ForestSettings(int numTrees, int maxDepth, int seed, double testFraction) {}

    public record RegressionMetrics(double mse, double rmse, double r2Score, int trainSize, int testSize) {}

    public record ClassMetrics(double precision, double recall, double f1Score, long support) {}

    public record ClassificationMetrics(double accuracy,
                                        Map<RiskLevel, ClassMetrics> perClass,
                                        int trainSize,
                                        int testSize) {}

    public record TrainingReport(RegressionMetrics performancePredictor,
                                 ClassificationMetrics riskClassifier,
                                 int trainingRows,
                                 Instant trainedAt) {}

    public record RiskOutcome(RiskLevel riskLevel, Map<RiskLevel, Double> probabilities) {}

    public record PerformancePrediction(long studentId,
                                        double predictedScore,
                                        FeatureVector currentFeatures,
                                        Map<String, Double> featureImportance,
                                        String interpretation) {}

    public record RiskPrediction(long studentId,
                                 RiskLevel riskLevel,
                                 Map<RiskLevel, Double> probabilities,
                                 FeatureVector currentFeatures,
                                 Map<String, Double> featureImportance,
                                 String interpretation) {}

    public record BatchPrediction(long studentId,
                                  double predictedScore,
                                  RiskLevel riskLevel,
                                  Map<RiskLevel, Double> riskProbabilities) {}

    public record BatchPredictionResult(List<BatchPrediction> predictions, int totalProcessed) {}

    public record ModelDescriptor(ModelStatus status, String modelType, Map<String, Double> featureImportance) {}

    public record ModelInfo(ModelDescriptor performancePredictor,
                            ModelDescriptor riskClassifier,
                            TrainingReport trainingMetrics,
                            int trainingRuns) {}
}
