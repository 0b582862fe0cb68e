package com.campus.insight.ml;

import com.campus.insight.features.FeatureModels.FeatureVector;

import java.nio.file.Path;
import java.util.Map;

/**
 * Shared contract of the estimators trained on {@link FeatureVector}s.
 *
 * @param <L> training labels
 * @param <M> evaluation metrics reported by {@link #train}
 * @param <P> prediction for a single feature vector
 */
public interface PredictiveModel<L, M, P> {
    String name();

    String modelType();

    M train(double[][] features, L labels);

    /**
     * @throws com.campus.insight.exception.NotTrainedException before a successful train or load
     */
    P predict(FeatureVector features);

    /** Empty until trained. */
    Map<String, Double> featureImportance();

    boolean isTrained();

    void save(Path directory);

    /**
     * @return false when no artifact exists; the model is left as it was
     */
    boolean load(Path directory);
}
