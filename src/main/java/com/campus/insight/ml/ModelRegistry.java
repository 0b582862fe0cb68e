package com.campus.insight.ml;

import com.campus.insight.exception.ModelPersistenceException;
import com.campus.insight.features.FeatureModels.TrainingSet;
import com.campus.insight.ml.MlModels.ClassificationMetrics;
import com.campus.insight.ml.MlModels.ModelStatus;
import com.campus.insight.ml.MlModels.RegressionMetrics;
import com.campus.insight.ml.MlModels.TrainingReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Owns both predictive models, their artifacts and their lifecycle.
 *
 * <p>Each model moves UNTRAINED -> TRAINING -> TRAINED. Training, loading and the lazy
 * train-on-first-use path share one lock, so concurrent callers wait for the in-flight run
 * instead of starting their own.
 */
public class ModelRegistry {
    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);
    static final String STAGING_DIR = ".staging";

    private final PerformanceRegressor regressor;
    private final RiskClassifier classifier;
    private final Path modelDir;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicInteger trainingRuns = new AtomicInteger();

    private volatile ModelStatus regressorStatus = ModelStatus.UNTRAINED;
    private volatile ModelStatus classifierStatus = ModelStatus.UNTRAINED;
    private volatile TrainingReport lastReport;

    public ModelRegistry(PerformanceRegressor regressor, RiskClassifier classifier, Path modelDir) {
        this.regressor = regressor;
        this.classifier = classifier;
        this.modelDir = modelDir;
    }

    public PerformanceRegressor regressor() {
        return regressor;
    }

    public RiskClassifier classifier() {
        return classifier;
    }

    public Path modelDir() {
        return modelDir;
    }

    public ModelStatus regressorStatus() {
        return regressorStatus;
    }

    public ModelStatus classifierStatus() {
        return classifierStatus;
    }

    public boolean allTrained() {
        return regressorStatus == ModelStatus.TRAINED && classifierStatus == ModelStatus.TRAINED;
    }

    public int trainingRuns() {
        return trainingRuns.get();
    }

    public TrainingReport lastReport() {
        return lastReport;
    }

    /**
     * Retrains both models from scratch, replacing any fitted parameters, and persists them.
     *
     * <p>If either model fails to train or either artifact fails to write, both models keep their
     * previous parameters, the run is not counted and the last report stays in place. Artifacts are
     * staged first, so a failed write leaves the published ones in {@link #modelDir()} as they were.
     */
    public TrainingReport train(TrainingSet trainingSet) {
        lock.lock();
        ForestModel.ModelState previousRegressor = regressor.snapshot();
        ForestModel.ModelState previousClassifier = classifier.snapshot();
        try {
            regressorStatus = ModelStatus.TRAINING;
            classifierStatus = ModelStatus.TRAINING;
            log.info("Training models on {} rows", trainingSet.size());

            double[][] matrix = trainingSet.featureMatrix();
            RegressionMetrics regression = regressor.train(matrix, trainingSet.marksLabels());
            ClassificationMetrics classification = classifier.train(matrix, trainingSet.riskLabels());
            publishArtifacts();

            TrainingReport report = new TrainingReport(regression, classification, trainingSet.size(), Instant.now());
            lastReport = report;
            trainingRuns.incrementAndGet();
            return report;
        } catch (RuntimeException e) {
            log.warn("Training failed, keeping previous model parameters", e);
            regressor.restore(previousRegressor);
            classifier.restore(previousClassifier);
            throw e;
        } finally {
            refreshStatus();
            lock.unlock();
        }
    }

    /**
     * Writes both artifacts to a staging directory, then moves them into place.
     */
    private void publishArtifacts() {
        Path staging = modelDir.resolve(STAGING_DIR);
        regressor.save(staging);
        classifier.save(staging);
        try {
            for (String artifact : List.of(regressor.artifactName(), classifier.artifactName())) {
                Files.move(staging.resolve(artifact), modelDir.resolve(artifact),
                        StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            }
            Files.deleteIfExists(staging);
        } catch (IOException e) {
            throw new ModelPersistenceException("Cannot publish model artifacts to " + modelDir, e);
        }
    }

    /**
     * Trains both models with the supplied training set unless both are already trained.
     *
     * @return true when this call ran a training pass
     */
    public boolean ensureTrained(Supplier<TrainingSet> trainingSet) {
        if (allTrained()) return false;
        lock.lock();
        try {
            if (allTrained()) return false;
            log.info("Models not trained, training on demand");
            train(trainingSet.get());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Restores both artifacts from {@link #modelDir()}.
     *
     * @return true when both models are trained afterwards
     */
    public boolean load() {
        lock.lock();
        try {
            regressor.load(modelDir);
            classifier.load(modelDir);
            return regressor.isTrained() && classifier.isTrained();
        } finally {
            refreshStatus();
            lock.unlock();
        }
    }

    private void refreshStatus() {
        regressorStatus = regressor.isTrained() ? ModelStatus.TRAINED : ModelStatus.UNTRAINED;
        classifierStatus = classifier.isTrained() ? ModelStatus.TRAINED : ModelStatus.UNTRAINED;
    }
}
