package com.campus.insight.analytics;

import com.campus.insight.analytics.AnalyticsModels.*;
import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.features.FeatureAggregator;
import com.campus.insight.features.RiskLevel;
import com.campus.insight.repository.InMemoryStudentRecordSource;
import com.campus.insight.sentiment.PolarityLexicon;
import com.campus.insight.sentiment.SentimentAnalyzer;
import com.campus.insight.sentiment.SentimentModels.Sentiment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnalyticsServiceTest {
    private static final Instant DAY_1 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Instant DAY_2 = Instant.parse("2024-03-02T09:30:00Z");

    private InMemoryStudentRecordSource source;
    private AnalyticsService analyticsService;

    @BeforeEach
    void setUp() {
        source = new InMemoryStudentRecordSource();
        analyticsService = new AnalyticsService(source, new FeatureAggregator(source),
                new SentimentAnalyzer(PolarityLexicon.fromClasspath("sentiment/lexicon.tsv"), 100));

        source.addStudent(1, "CS");
        source.addStudent(2, "CS");
        source.addStudent(3, "CS");
        source.addStudent(4, "CS");
        source.addStudent(5, "Math");

        source.saveAcademicRecord(new AcademicRecord(1, "Algebra", 85, 95, 90, DAY_1));
        source.saveAcademicRecord(new AcademicRecord(2, "Algebra", 40, 55, 45, DAY_1));
        source.saveAcademicRecord(new AcademicRecord(3, "Physics", 65, 80, 70, DAY_1));
        source.saveAcademicRecord(new AcademicRecord(5, "Algebra", 30, 50, 35, DAY_1));

        source.saveBehaviorRecord(new BehaviorRecord(1, 5, 8, 6, "I feel happy and motivated", DAY_1), null);
        source.saveBehaviorRecord(new BehaviorRecord(2, 2, 4, 2, "I am stressed and overwhelmed", DAY_1), null);
        source.saveBehaviorRecord(new BehaviorRecord(3, 3, 7, 4, null, DAY_2), null);
        source.saveBehaviorRecord(new BehaviorRecord(5, 1, 5, 1, "hopeless and failing", DAY_1), null);
    }

    @Test
    void classAnalyticsForDepartment() {
        ClassAnalytics analytics = analyticsService.classAnalytics("CS").orElseThrow();

        assertEquals(3, analytics.statistics().totalStudents());
        assertEquals(1L, analytics.performanceDistribution().get(PerformanceCategory.EXCELLENT));
        assertEquals(1L, analytics.performanceDistribution().get(PerformanceCategory.GOOD));
        assertEquals(1L, analytics.performanceDistribution().get(PerformanceCategory.AVERAGE));
        assertNull(analytics.performanceDistribution().get(PerformanceCategory.POOR));
        assertEquals(1L, analytics.riskDistribution().get(RiskLevel.HIGH));
        assertEquals(List.of(2L), analytics.atRiskStudents().stream().map(AtRiskStudent::studentId).toList());
        assertEquals(190.0 / 3, analytics.statistics().avgMarks(), 1e-9);
        assertEquals(22.546, analytics.statistics().marksStd(), 1e-3);
    }

    @Test
    void classAnalyticsWithoutDataIsEmpty() {
        assertTrue(analyticsService.classAnalytics("History").isEmpty());
        assertEquals(4, analyticsService.classAnalytics(null).orElseThrow().statistics().totalStudents());
        assertEquals(4, analyticsService.classAnalytics(" ").orElseThrow().statistics().totalStudents());
    }

    @Test
    void attendanceCorrelationBucketsByRange() {
        AttendanceMarksCorrelation report = analyticsService.attendanceMarksCorrelation();

        assertTrue(report.correlationCoefficient() > 0.7);
        assertEquals("Strong positive correlation", report.interpretation());
        assertEquals(List.of("90-100%", "75-89%", "<60%"), List.copyOf(report.rangeWiseAverage().keySet()));
        assertEquals(35.0, report.rangeWiseAverage().get("<60%"), 1e-9);
        assertEquals(4, report.dataPoints().size());
    }

    @Test
    void attendanceCorrelationSamplesAtMostOneHundredPoints() {
        for (int i = 0; i < 120; i++) {
            source.saveAcademicRecord(new AcademicRecord(1, 50 + i % 40, 60 + i % 30, 50, DAY_2));
        }

        assertEquals(100, analyticsService.attendanceMarksCorrelation().dataPoints().size());
    }

    @Test
    void wellbeingCorrelationProducesInsights() {
        WellbeingCorrelation report = analyticsService.stressMarksCorrelation();

        assertEquals(List.of("mood_vs_marks", "sleep_vs_marks", "study_vs_marks", "mood_vs_attendance"),
                List.copyOf(report.correlations().keySet()));
        assertTrue(report.correlations().get("mood_vs_marks") > 0.3);
        assertEquals("Strong positive correlation", report.interpretations().get("mood_vs_marks"));
        assertTrue(report.insights().get(0).startsWith("Students with higher mood scores"));
    }

    @Test
    void wellbeingCorrelationWithoutDataFallsBackToMonitoringInsight() {
        AnalyticsService empty = new AnalyticsService(new InMemoryStudentRecordSource(),
                new FeatureAggregator(new InMemoryStudentRecordSource()),
                new SentimentAnalyzer(PolarityLexicon.fromClasspath("sentiment/lexicon.tsv"), 10));

        WellbeingCorrelation report = empty.stressMarksCorrelation();

        assertEquals(0.0, report.correlations().get("mood_vs_marks"));
        assertEquals(List.of("Continue monitoring patterns as more data becomes available for deeper insights."), report.insights());
    }

    @Test
    void mentalHealthTrendsForDepartment() {
        MentalHealthTrends trends = analyticsService.mentalHealthTrends("CS").orElseThrow();

        assertEquals(1L, trends.sentimentDistribution().get(Sentiment.POSITIVE));
        assertEquals(1L, trends.sentimentDistribution().get(Sentiment.NEGATIVE));
        assertEquals(1L, trends.sentimentDistribution().get(Sentiment.NEUTRAL));
        assertEquals(List.of(2, 3, 5), List.copyOf(trends.moodDistribution().keySet()));

        assertEquals(2, trends.timeTrends().size());
        assertEquals(LocalDate.of(2024, 3, 1), trends.timeTrends().get(0).date());
        assertEquals(3.5, trends.timeTrends().get(0).moodScore(), 1e-9);

        assertEquals(1, trends.concerningCases().size());
        ConcerningCase concerning = trends.concerningCases().get(0);
        assertEquals(2L, concerning.studentId());
        assertEquals(Sentiment.NEGATIVE, concerning.sentiment());
        assertTrue(concerning.stressIndicators().containsAll(List.of("stressed", "overwhelmed")));
        assertTrue(trends.commonStressIndicators().contains("stressed"));
    }

    @Test
    void mentalHealthTrendsWithoutBehaviorIsEmpty() {
        assertTrue(analyticsService.mentalHealthTrends("History").isEmpty());
    }

    @Test
    void studentTrendsSummarizeSubjectsAndMood() {
        source.saveAcademicRecord(new AcademicRecord(3, "Chemistry", 55, 70, 60, DAY_2));

        StudentPerformanceTrends trends = analyticsService.studentPerformanceTrends(3).orElseThrow();

        assertEquals(2, trends.subjects().size());
        assertEquals(1, trends.mentalTrends().size());
        assertEquals(Sentiment.NEUTRAL, trends.mentalTrends().get(0).sentiment());
        StudentSummary summary = trends.summary();
        assertEquals(60.0, summary.avgMarks(), 1e-9);
        assertEquals(75.0, summary.avgAttendance(), 1e-9);
        assertEquals("Physics", summary.highestSubject());
        assertEquals("Chemistry", summary.lowestSubject());
        assertEquals(3.0, summary.avgMood(), 1e-9);
        assertEquals(7.0, summary.avgSleepHours(), 1e-9);
    }

    @Test
    void studentTrendsForUnknownStudentIsEmpty() {
        assertTrue(analyticsService.studentPerformanceTrends(4).isEmpty());
    }

    @Test
    void departmentAndSubjectSummaries() {
        List<DepartmentSummary> departments = analyticsService.departmentSummary();
        assertEquals(List.of("CS", "Math"), departments.stream().map(DepartmentSummary::department).toList());
        assertEquals(3, departments.get(0).studentCount());
        assertEquals(1L, departments.get(0).highRiskCount());
        assertEquals(30.0, departments.get(1).avgMarks(), 1e-9);

        List<SubjectSummary> subjects = analyticsService.subjectSummary();
        assertEquals(List.of("Algebra", "Physics"), subjects.stream().map(SubjectSummary::subject).toList());
        assertEquals(3L, subjects.get(0).recordCount());
        assertEquals(155.0 / 3, subjects.get(0).avgMarks(), 1e-9);
    }
}
