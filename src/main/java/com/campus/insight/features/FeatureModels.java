package com.campus.insight.features;

import com.campus.insight.domain.StudentRecords.Student;
import com.campus.insight.exception.InvalidInputException;

import java.util.List;

public class FeatureModels {
    public static final List<String> FEATURE_NAMES = List.of(
            "avg_attendance", "avg_assignment", "avg_internal",
            "avg_mood", "avg_study_hours", "avg_sleep_hours");

    public static final double DEFAULT_MOOD = 3.0;
    public static final double DEFAULT_STUDY_HOURS = 5.0;
    public static final double DEFAULT_SLEEP_HOURS = 6.0;

    /**
     * Six-field model input, in {@link #FEATURE_NAMES} order. {@code avgInternal} is the mean of
     * the student's marks, which is also the regression target.
     */
    public record FeatureVector(double avgAttendance,
                                double avgAssignment,
                                double avgInternal,
                                double avgMood,
                                double avgStudyHours,
                                double avgSleepHours) {

        public static FeatureVector fromArray(double[] values) {
            if (values == null || values.length != FEATURE_NAMES.size()) {
                throw new InvalidInputException("feature vector must have exactly " + FEATURE_NAMES.size() + " values");
            }
            return new FeatureVector(values[0], values[1], values[2], values[3], values[4], values[5]);
        }

        public double[] toArray() {
            return new double[]{avgAttendance, avgAssignment, avgInternal, avgMood, avgStudyHours, avgSleepHours};
        }

        public double avgMarks() {
            return avgInternal;
        }

        public RiskLevel riskLevel() {
            return RiskLevel.classify(avgMarks(), avgMood);
        }
    }

    public record StudentFeatures(Student student, FeatureVector features) {}

    public record TrainingSet(List<Long> studentIds,
                              List<FeatureVector> features,
                              double[] marksLabels,
                              List<RiskLevel> riskLabels) {
        public int size() {
            return features.size();
        }

        public double[][] featureMatrix() {
            return features.stream().map(FeatureVector::toArray).toArray(double[][]::new);
        }
    }
}
