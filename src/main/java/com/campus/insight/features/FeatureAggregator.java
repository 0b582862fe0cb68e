package com.campus.insight.features;

import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.domain.StudentRecords.Role;
import com.campus.insight.domain.StudentRecords.Student;
import com.campus.insight.exception.NoDataException;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.FeatureModels.StudentFeatures;
import com.campus.insight.features.FeatureModels.TrainingSet;
import com.campus.insight.repository.StudentRecordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

@Component
public class FeatureAggregator {
    private static final Logger log = LoggerFactory.getLogger(FeatureAggregator.class);

    private final StudentRecordSource records;

    public FeatureAggregator(StudentRecordSource records) {
        this.records = records;
    }

    public FeatureVector aggregate(long studentId) {
        return aggregate(studentId, records.academicRecords(studentId), records.behaviorRecords(studentId));
    }

    public Optional<FeatureVector> tryAggregate(long studentId) {
        try {
            return Optional.of(aggregate(studentId));
        } catch (NoDataException e) {
            log.debug("No feature vector for student {}: {}", studentId, e.getMessage());
            return Optional.empty();
        }
    }

    public static FeatureVector aggregate(long studentId, List<AcademicRecord> academics, List<BehaviorRecord> behavior) {
        if (academics == null || academics.isEmpty()) {
            throw new NoDataException("No academic records for student " + studentId);
        }
        boolean noBehavior = behavior == null || behavior.isEmpty();
        return new FeatureVector(
                mean(academics, AcademicRecord::attendance),
                mean(academics, AcademicRecord::assignmentScore),
                mean(academics, AcademicRecord::marks),
                noBehavior ? FeatureModels.DEFAULT_MOOD : mean(behavior, BehaviorRecord::moodScore),
                noBehavior ? FeatureModels.DEFAULT_STUDY_HOURS : mean(behavior, BehaviorRecord::studyHours),
                noBehavior ? FeatureModels.DEFAULT_SLEEP_HOURS : mean(behavior, BehaviorRecord::sleepHours));
    }

    /**
     * Every student (optionally of one department) that has academic records, with its feature vector.
     */
    public List<StudentFeatures> aggregateStudents(String department) {
        List<StudentFeatures> out = new ArrayList<>();
        for (Student student : records.students(Role.STUDENT, department)) {
            tryAggregate(student.id()).ifPresent(fv -> out.add(new StudentFeatures(student, fv)));
        }
        return out;
    }

    public TrainingSet buildTrainingSet() {
        List<StudentFeatures> rows = aggregateStudents(null);
        if (rows.isEmpty()) {
            throw new NoDataException("No students with academic records to train on");
        }
        List<Long> ids = new ArrayList<>(rows.size());
        List<FeatureVector> features = new ArrayList<>(rows.size());
        List<RiskLevel> riskLabels = new ArrayList<>(rows.size());
        double[] marks = new double[rows.size()];
        for (int i = 0; i < rows.size(); i++) {
            FeatureVector fv = rows.get(i).features();
            ids.add(rows.get(i).student().id());
            features.add(fv);
            marks[i] = fv.avgMarks();
            riskLabels.add(fv.riskLevel());
        }
        log.info("Built training set with {} students", rows.size());
        return new TrainingSet(List.copyOf(ids), List.copyOf(features), marks, List.copyOf(riskLabels));
    }

    private static <T> double mean(List<T> rows, ToDoubleFunction<T> fn) {
        return rows.stream().mapToDouble(fn).average().orElse(0.0);
    }
}
