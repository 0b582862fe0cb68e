package com.campus.insight.ml;

import com.campus.insight.exception.InvalidInputException;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.RiskLevel;
import com.campus.insight.ml.MlModels.ClassMetrics;
import com.campus.insight.ml.MlModels.ClassificationMetrics;
import com.campus.insight.ml.MlModels.ForestSettings;
import com.campus.insight.ml.MlModels.RiskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.core.Attribute;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Three-class risk classifier (Low/Medium/High) with a stratified train/test split.
 */
public class RiskClassifier extends ForestModel<List<RiskLevel>, ClassificationMetrics, RiskOutcome> {
    private static final Logger log = LoggerFactory.getLogger(RiskClassifier.class);
    private static final RiskLevel[] CLASSES = RiskLevel.values();

    public RiskClassifier(ForestSettings settings) {
        super(settings);
    }

    @Override
    public String name() {
        return "risk_classifier";
    }

    @Override
    public String modelType() {
        return "RandomForestClassifier";
    }

    @Override
    public ClassificationMetrics train(double[][] features, List<RiskLevel> labels) {
        requireRows(features, labels == null ? 0 : labels.size());
        int[] classIndex = labels.stream().mapToInt(RiskLevel::ordinal).toArray();
        double[] targets = Arrays.stream(classIndex).asDoubleStream().toArray();

        DatasetSplitter.Split split = DatasetSplitter.stratified(classIndex, settings.testFraction(), settings.seed());
        fit(features, targets, split.train());

        int[] evalRows = split.test();
        if (evalRows.length == 0) {
            log.warn("{}: test split is empty for {} rows, reporting training-split metrics", name(), features.length);
            evalRows = split.train();
        }
        int[] actual = new int[evalRows.length];
        int[] predicted = new int[evalRows.length];
        for (int i = 0; i < evalRows.length; i++) {
            actual[i] = classIndex[evalRows[i]];
            predicted[i] = argmax(output(features[evalRows[i]]));
        }
        ClassificationMetrics metrics = evaluate(actual, predicted, split.train().length, split.test().length);
        log.info("{} trained: accuracy={}", name(), metrics.accuracy());
        return metrics;
    }

    @Override
    public RiskOutcome predict(FeatureVector features) {
        double[] distribution = output(features);
        if (distribution.length != CLASSES.length) {
            throw new InvalidInputException("classifier returned " + distribution.length + " class probabilities");
        }
        double total = Arrays.stream(distribution).sum();
        Map<RiskLevel, Double> probabilities = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : CLASSES) {
            double p = total > 0 ? distribution[level.ordinal()] / total : 1.0 / CLASSES.length;
            probabilities.put(level, p);
        }
        return new RiskOutcome(CLASSES[argmax(distribution)], Collections.unmodifiableMap(probabilities));
    }

    @Override
    protected Attribute targetAttribute() {
        return new Attribute("risk_level", Arrays.stream(CLASSES).map(RiskLevel::label).toList());
    }

    @Override
    protected String artifactName() {
        return "risk_classifier.model";
    }

    @Override
    protected double loss(double[] output, double target) {
        return 1.0 - output[(int) target];
    }

    static ClassificationMetrics evaluate(int[] actual, int[] predicted, int trainSize, int testSize) {
        int correct = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] == predicted[i]) correct++;
        }
        Map<RiskLevel, ClassMetrics> perClass = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : CLASSES) {
            int c = level.ordinal();
            long tp = 0, fp = 0, fn = 0, support = 0;
            for (int i = 0; i < actual.length; i++) {
                if (actual[i] == c) support++;
                if (predicted[i] == c && actual[i] == c) tp++;
                if (predicted[i] == c && actual[i] != c) fp++;
                if (predicted[i] != c && actual[i] == c) fn++;
            }
            double precision = tp + fp == 0 ? 0.0 : (double) tp / (tp + fp);
            double recall = tp + fn == 0 ? 0.0 : (double) tp / (tp + fn);
            double f1 = precision + recall == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
            perClass.put(level, new ClassMetrics(precision, recall, f1, support));
        }
        double accuracy = actual.length == 0 ? 0.0 : (double) correct / actual.length;
        return new ClassificationMetrics(accuracy, Collections.unmodifiableMap(perClass), trainSize, testSize);
    }

    private static int argmax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) best = i;
        }
        return best;
    }
}
