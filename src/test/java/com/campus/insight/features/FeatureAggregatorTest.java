package com.campus.insight.features;

import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.exception.InvalidInputException;
import com.campus.insight.exception.NoDataException;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.FeatureModels.TrainingSet;
import com.campus.insight.repository.InMemoryStudentRecordSource;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureAggregatorTest {
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void missingBehaviorFallsBackToDefaults() {
        FeatureVector fv = FeatureAggregator.aggregate(7, List.of(
                new AcademicRecord(7, 80, 90, 70, T0),
                new AcademicRecord(7, 60, 70, 50, T0)), List.of());

        assertEquals(80.0, fv.avgAttendance());
        assertEquals(60.0, fv.avgAssignment());
        assertEquals(70.0, fv.avgInternal());
        assertEquals(3.0, fv.avgMood());
        assertEquals(5.0, fv.avgStudyHours());
        assertEquals(6.0, fv.avgSleepHours());
    }

    @Test
    void behaviorFieldsAreAveraged() {
        FeatureVector fv = FeatureAggregator.aggregate(7,
                List.of(new AcademicRecord(7, 80, 90, 70, T0)),
                List.of(new BehaviorRecord(7, 4, 8, 3, null, T0), new BehaviorRecord(7, 2, 6, 5, "tired", T0)));

        assertEquals(3.0, fv.avgMood());
        assertEquals(4.0, fv.avgStudyHours());
        assertEquals(7.0, fv.avgSleepHours());
    }

    @Test
    void noAcademicRecordsMeansNoData() {
        assertThrows(NoDataException.class, () -> FeatureAggregator.aggregate(7, List.of(),
                List.of(new BehaviorRecord(7, 4, 8, 3, null, T0))));
    }

    @Test
    void featureVectorKeepsFixedOrder() {
        FeatureVector fv = new FeatureVector(1, 2, 3, 4, 5, 6);

        assertArrayEquals(new double[]{1, 2, 3, 4, 5, 6}, fv.toArray());
        assertEquals(fv, FeatureVector.fromArray(fv.toArray()));
        assertThrows(InvalidInputException.class, () -> FeatureVector.fromArray(new double[]{1, 2, 3}));
    }

    @Test
    void trainingSetSkipsStudentsWithoutAcademics() {
        InMemoryStudentRecordSource source = new InMemoryStudentRecordSource();
        source.addStudent(1, "CS");
        source.addStudent(2, "CS");
        source.addStudent(3, "Math");
        source.saveAcademicRecord(new AcademicRecord(1, 85, 95, 90, T0));
        source.saveBehaviorRecord(new BehaviorRecord(1, 5, 8, 6, null, T0), null);
        source.saveAcademicRecord(new AcademicRecord(3, 40, 60, 45, T0));

        TrainingSet set = new FeatureAggregator(source).buildTrainingSet();

        assertEquals(List.of(1L, 3L), set.studentIds());
        assertArrayEquals(new double[]{85, 40}, set.marksLabels());
        assertEquals(List.of(RiskLevel.LOW, RiskLevel.HIGH), set.riskLabels());
        assertEquals(6, set.featureMatrix()[0].length);
    }

    @Test
    void emptyPopulationCannotBuildTrainingSet() {
        FeatureAggregator aggregator = new FeatureAggregator(new InMemoryStudentRecordSource());

        assertThrows(NoDataException.class, aggregator::buildTrainingSet);
        assertTrue(aggregator.tryAggregate(42).isEmpty());
    }
}
