package com.campus.insight.ml;

import com.campus.insight.exception.InsightException;
import com.campus.insight.exception.InvalidInputException;
import com.campus.insight.exception.ModelPersistenceException;
import com.campus.insight.exception.NotTrainedException;
import com.campus.insight.features.FeatureModels;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.ml.MlModels.ForestSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import weka.classifiers.trees.RandomForest;
import weka.core.Attribute;
import weka.core.DenseInstance;
import weka.core.Instance;
import weka.core.Instances;
import weka.core.SerializationHelper;
import weka.core.Utils;

import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Weka random forest over standardized feature vectors. Subclasses define the target attribute,
 * the evaluation metrics and the shape of a prediction.
 */
abstract class ForestModel<L, M, P> implements PredictiveModel<L, M, P> {
    private static final Logger log = LoggerFactory.getLogger(ForestModel.class);

    protected final ForestSettings settings;
    private volatile ModelState state;

    record ModelState(RandomForest forest,
                      FeatureScaler scaler,
                      Instances header,
                      Map<String, Double> featureImportance,
                      boolean trained) implements Serializable {
        private static final long serialVersionUID = 1L;
    }

    protected ForestModel(ForestSettings settings) {
        this.settings = settings;
    }

    protected abstract Attribute targetAttribute();

    protected abstract String artifactName();

    /** Per-row loss used for permutation importance; lower is better. */
    protected abstract double loss(double[] output, double target);

    @Override
    public String modelType() {
        return "RandomForest";
    }

    @Override
    public boolean isTrained() {
        ModelState s = state;
        return s != null && s.trained();
    }

    @Override
    public Map<String, Double> featureImportance() {
        ModelState s = state;
        return s == null ? Map.of() : s.featureImportance();
    }

    /**
     * Fits scaler and forest on the given training rows and installs the result.
     */
    protected final void fit(double[][] features, double[] targets, int[] trainRows) {
        double[][] trainX = new double[trainRows.length][];
        for (int i = 0; i < trainRows.length; i++) trainX[i] = features[trainRows[i]];
        FeatureScaler scaler = FeatureScaler.fit(trainX);

        Instances header = header();
        Instances data = new Instances(header, trainRows.length);
        for (int row : trainRows) {
            data.add(instance(header, scaler.transform(features[row]), targets[row]));
        }

        RandomForest forest = new RandomForest();
        forest.setNumIterations(settings.numTrees());
        forest.setMaxDepth(settings.maxDepth());
        forest.setSeed(settings.seed());
        try {
            forest.buildClassifier(data);
        } catch (Exception e) {
            throw new InsightException(name() + " training failed", e);
        }

        ModelState fitted = new ModelState(forest, scaler, header, Map.of(), true);
        Map<String, Double> importance = permutationImportance(fitted, features, targets, trainRows);
        state = new ModelState(forest, scaler, header, importance, true);
    }

    protected final double[] output(FeatureVector features) {
        return output(requireState(), features.toArray());
    }

    protected final double[] output(double[] raw) {
        return output(requireState(), raw);
    }

    protected static void requireRows(double[][] features, int labelCount) {
        if (features == null || features.length == 0) {
            throw new InvalidInputException("training requires at least one row");
        }
        if (features.length != labelCount) {
            throw new InvalidInputException("got " + features.length + " feature rows but " + labelCount + " labels");
        }
        for (double[] row : features) {
            if (row == null || row.length != FeatureModels.FEATURE_NAMES.size()) {
                throw new InvalidInputException("every feature row must have " + FeatureModels.FEATURE_NAMES.size() + " values");
            }
        }
    }

    @Override
    public void save(Path directory) {
        ModelState s = requireState();
        Path target = directory.resolve(artifactName());
        try {
            Files.createDirectories(directory);
            SerializationHelper.write(target.toString(), s);
        } catch (Exception e) {
            throw new ModelPersistenceException("Cannot write " + target, e);
        }
        log.info("Saved {} to {}", name(), target);
    }

    @Override
    public boolean load(Path directory) {
        Path source = directory.resolve(artifactName());
        if (!Files.exists(source)) {
            log.info("No artifact for {} at {}", name(), source);
            return false;
        }
        Object restored;
        try {
            restored = SerializationHelper.read(source.toString());
        } catch (Exception e) {
            throw new ModelPersistenceException("Cannot read " + source, e);
        }
        if (!(restored instanceof ModelState loaded)) {
            throw new ModelPersistenceException("Unexpected artifact content in " + source, null);
        }
        state = loaded;
        log.info("Loaded {} from {} (trained={})", name(), source, loaded.trained());
        return true;
    }

    ModelState snapshot() {
        return state;
    }

    void restore(ModelState previous) {
        state = previous;
    }

    private ModelState requireState() {
        ModelState s = state;
        if (s == null || !s.trained()) {
            throw new NotTrainedException(name());
        }
        return s;
    }

    private double[] output(ModelState s, double[] raw) {
        Instance inst = instance(s.header(), s.scaler().transform(raw), Utils.missingValue());
        try {
            return s.forest().distributionForInstance(inst);
        } catch (Exception e) {
            throw new InsightException(name() + " prediction failed", e);
        }
    }

    private Instances header() {
        ArrayList<Attribute> attributes = new ArrayList<>();
        for (String feature : FeatureModels.FEATURE_NAMES) {
            attributes.add(new Attribute(feature));
        }
        attributes.add(targetAttribute());
        Instances header = new Instances(name(), attributes, 0);
        header.setClassIndex(attributes.size() - 1);
        return header;
    }

    private static Instance instance(Instances header, double[] scaled, double target) {
        double[] values = new double[scaled.length + 1];
        System.arraycopy(scaled, 0, values, 0, scaled.length);
        values[scaled.length] = target;
        Instance inst = new DenseInstance(1.0, values);
        inst.setDataset(header);
        return inst;
    }

    /**
     * Mean increase in loss when one feature column is shuffled, normalized to sum to 1.
     */
    private Map<String, Double> permutationImportance(ModelState fitted, double[][] features, double[] targets, int[] rows) {
        double baseline = meanLoss(fitted, features, targets, rows, -1, null);
        double[] increase = new double[FeatureModels.FEATURE_NAMES.size()];
        for (int f = 0; f < increase.length; f++) {
            ArrayList<Integer> permutation = new ArrayList<>();
            for (int row : rows) permutation.add(row);
            Collections.shuffle(permutation, new Random(settings.seed() + f));
            increase[f] = Math.max(0.0, meanLoss(fitted, features, targets, rows, f, permutation) - baseline);
        }
        double total = 0;
        for (double v : increase) total += v;

        Map<String, Double> out = new LinkedHashMap<>();
        for (int f = 0; f < increase.length; f++) {
            out.put(FeatureModels.FEATURE_NAMES.get(f), total == 0 ? 0.0 : increase[f] / total);
        }
        return Collections.unmodifiableMap(out);
    }

    private double meanLoss(ModelState fitted, double[][] features, double[] targets, int[] rows,
                            int permutedFeature, ArrayList<Integer> permutation) {
        double sum = 0;
        for (int i = 0; i < rows.length; i++) {
            double[] raw = features[rows[i]].clone();
            if (permutedFeature >= 0) raw[permutedFeature] = features[permutation.get(i)][permutedFeature];
            sum += loss(output(fitted, raw), targets[rows[i]]);
        }
        return sum / rows.length;
    }
}
