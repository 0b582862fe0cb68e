package com.campus.insight.ml;

import com.campus.insight.exception.InvalidInputException;
import com.campus.insight.exception.NotTrainedException;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.RiskLevel;
import com.campus.insight.ml.MlModels.ClassificationMetrics;
import com.campus.insight.ml.MlModels.ForestSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PredictiveModelTest {
    private static final ForestSettings SETTINGS = new ForestSettings(10, 6, 42, 0.2);
    private static final FeatureVector SAMPLE = new FeatureVector(80, 70, 75, 4, 5, 7);

    @Test
    void predictBeforeTrainingFails() {
        assertThrows(NotTrainedException.class, () -> new PerformanceRegressor(SETTINGS).predict(SAMPLE));
        assertThrows(NotTrainedException.class, () -> new RiskClassifier(SETTINGS).predict(SAMPLE));
    }

    @Test
    void trainingRejectsMismatchedShapes() {
        PerformanceRegressor regressor = new PerformanceRegressor(SETTINGS);

        assertThrows(InvalidInputException.class, () -> regressor.train(new double[0][], new double[0]));
        assertThrows(InvalidInputException.class, () -> regressor.train(new double[][]{{1, 2, 3}}, new double[]{50}));
        assertThrows(InvalidInputException.class,
                () -> regressor.train(new double[][]{{1, 2, 3, 4, 5, 6}}, new double[]{50, 60}));
    }

    @Test
    void singleRowStillProducesTrainedModel() {
        RiskClassifier classifier = new RiskClassifier(SETTINGS);
        ClassificationMetrics metrics = classifier.train(new double[][]{SAMPLE.toArray()}, List.of(RiskLevel.LOW));

        assertTrue(classifier.isTrained());
        assertEquals(1, metrics.trainSize());
        assertEquals(0, metrics.testSize());
    }

    @Test
    void classificationMetricsPerClass() {
        int[] actual = {0, 0, 1, 1, 2, 2};
        int[] predicted = {0, 1, 1, 1, 2, 0};

        ClassificationMetrics metrics = RiskClassifier.evaluate(actual, predicted, 24, 6);

        assertEquals(4.0 / 6, metrics.accuracy(), 1e-9);
        assertEquals(0.5, metrics.perClass().get(RiskLevel.LOW).precision(), 1e-9);
        assertEquals(0.5, metrics.perClass().get(RiskLevel.LOW).recall(), 1e-9);
        assertEquals(2.0 / 3, metrics.perClass().get(RiskLevel.MEDIUM).precision(), 1e-9);
        assertEquals(1.0, metrics.perClass().get(RiskLevel.MEDIUM).recall(), 1e-9);
        assertEquals(0.8, metrics.perClass().get(RiskLevel.MEDIUM).f1Score(), 1e-9);
        assertEquals(2, metrics.perClass().get(RiskLevel.HIGH).support());
    }

    @Test
    void regressionMetricHelpers() {
        double[] actual = {50, 60, 70};

        assertEquals(0.0, PerformanceRegressor.meanSquaredError(actual, actual));
        assertEquals(1.0, PerformanceRegressor.r2(actual, actual), 1e-9);
        assertEquals(100.0 / 3, PerformanceRegressor.meanSquaredError(actual, new double[]{40, 60, 70}), 1e-9);
    }
}
