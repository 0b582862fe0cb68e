package com.campus.insight.ml;

import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.ml.MlModels.ForestSettings;
import com.campus.insight.ml.MlModels.RegressionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Attribute;

/**
 * Predicts a student's average marks from the feature vector. Predictions are clamped to [0, 100].
 */
public class PerformanceRegressor extends ForestModel<double[], RegressionMetrics, Double> {
    private static final Logger log = LoggerFactory.getLogger(PerformanceRegressor.class);

    public PerformanceRegressor(ForestSettings settings) {
        super(settings);
    }

    @Override
    public String name() {
        return "performance_predictor";
    }

    @Override
    public String modelType() {
        return "RandomForestRegressor";
    }

    @Override
    public RegressionMetrics train(double[][] features, double[] marks) {
        requireRows(features, marks == null ? 0 : marks.length);
        DatasetSplitter.Split split = DatasetSplitter.random(features.length, settings.testFraction(), settings.seed());
        fit(features, marks, split.train());

        int[] evalRows = split.test();
        if (evalRows.length == 0) {
            log.warn("{}: test split is empty for {} rows, reporting training-split metrics", name(), features.length);
            evalRows = split.train();
        }
        double[] actual = new double[evalRows.length];
        double[] predicted = new double[evalRows.length];
        for (int i = 0; i < evalRows.length; i++) {
            actual[i] = marks[evalRows[i]];
            predicted[i] = output(features[evalRows[i]])[0];
        }
        double mse = meanSquaredError(actual, predicted);
        RegressionMetrics metrics = new RegressionMetrics(mse, Math.sqrt(mse), r2(actual, predicted),
                split.train().length, split.test().length);
        log.info("{} trained: mse={} rmse={} r2={}", name(), metrics.mse(), metrics.rmse(), metrics.r2Score());
        return metrics;
    }

    @Override
    public Double predict(FeatureVector features) {
        double raw = output(features)[0];
        return Math.max(0.0, Math.min(100.0, raw));
    }

    @Override
    protected Attribute targetAttribute() {
        return new Attribute("avg_marks");
    }

    @Override
    protected String artifactName() {
        return "performance_predictor.model";
    }

    @Override
    protected double loss(double[] output, double target) {
        double diff = output[0] - target;
        return diff * diff;
    }

    static double meanSquaredError(double[] actual, double[] predicted) {
        double sum = 0;
        for (int i = 0; i < actual.length; i++) {
            double d = actual[i] - predicted[i];
            sum += d * d;
        }
        return actual.length == 0 ? 0.0 : sum / actual.length;
    }

    /**
     * Coefficient of determination; with a constant target it is 1 for a perfect fit and 0 otherwise.
     */
    static double r2(double[] actual, double[] predicted) {
        double mean = 0;
        for (double a : actual) mean += a;
        mean /= actual.length;
        double ssRes = 0;
        double ssTot = 0;
        for (int i = 0; i < actual.length; i++) {
            ssRes += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            ssTot += (actual[i] - mean) * (actual[i] - mean);
        }
        if (ssTot == 0) return ssRes == 0 ? 1.0 : 0.0;
        return 1 - ssRes / ssTot;
    }
}
