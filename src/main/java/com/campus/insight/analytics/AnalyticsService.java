package com.campus.insight.analytics;

import com.campus.insight.analytics.AnalyticsModels.*;
import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.domain.StudentRecords.Role;
import com.campus.insight.domain.StudentRecords.Student;
import com.campus.insight.features.FeatureAggregator;
import com.campus.insight.features.FeatureModels;
import com.campus.insight.features.FeatureModels.FeatureVector;
import com.campus.insight.features.FeatureModels.StudentFeatures;
import com.campus.insight.features.RiskLevel;
import com.campus.insight.repository.StudentRecordSource;
import com.campus.insight.sentiment.SentimentAnalyzer;
import com.campus.insight.sentiment.SentimentModels.BatchSentimentSummary;
import com.campus.insight.sentiment.SentimentModels.SentimentResult;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.*;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

@Service
public class AnalyticsService {
    static final int MAX_DATA_POINTS = 100;
    static final String UNKNOWN_DEPARTMENT = "Unassigned";

    private final StudentRecordSource records;
    private final FeatureAggregator aggregator;
    private final SentimentAnalyzer sentimentAnalyzer;

    public AnalyticsService(StudentRecordSource records, FeatureAggregator aggregator, SentimentAnalyzer sentimentAnalyzer) {
        this.records = records;
        this.aggregator = aggregator;
        this.sentimentAnalyzer = sentimentAnalyzer;
    }

    public Optional<ClassAnalytics> classAnalytics(String department) {
        List<StudentFeatures> data = aggregator.aggregateStudents(blankToNull(department));
        if (data.isEmpty()) return Optional.empty();

        Map<PerformanceCategory, Long> performance = new EnumMap<>(PerformanceCategory.class);
        Map<RiskLevel, Long> risk = new EnumMap<>(RiskLevel.class);
        List<AtRiskStudent> atRisk = new ArrayList<>();
        for (StudentFeatures row : data) {
            FeatureVector fv = row.features();
            performance.merge(PerformanceCategory.of(fv.avgMarks()), 1L, Long::sum);
            RiskLevel level = fv.riskLevel();
            risk.merge(level, 1L, Long::sum);
            if (level == RiskLevel.HIGH) {
                Student s = row.student();
                atRisk.add(new AtRiskStudent(s.id(), s.name(), s.department(), fv.avgMarks(), fv.avgMood()));
            }
        }

        double[] marks = column(data, FeatureVector::avgMarks);
        ClassStatistics stats = new ClassStatistics(
                data.size(),
                mean(marks),
                mean(column(data, FeatureVector::avgAttendance)),
                mean(column(data, FeatureVector::avgMood)),
                new StandardDeviation().evaluate(marks));

        return Optional.of(new ClassAnalytics(performance, risk, atRisk, stats));
    }

    public AttendanceMarksCorrelation attendanceMarksCorrelation() {
        List<AcademicRecord> academics = records.allAcademicRecords();
        double[] attendance = academics.stream().mapToDouble(AcademicRecord::attendance).toArray();
        double[] marks = academics.stream().mapToDouble(AcademicRecord::marks).toArray();
        double r = Correlations.pearson(attendance, marks);

        Map<String, List<Double>> byRange = new LinkedHashMap<>();
        List.of("90-100%", "75-89%", "60-74%", "<60%").forEach(k -> byRange.put(k, new ArrayList<>()));
        academics.forEach(a -> byRange.get(attendanceRange(a.attendance())).add(a.marks()));

        Map<String, Double> rangeAverages = new LinkedHashMap<>();
        byRange.forEach((range, values) -> {
            if (!values.isEmpty()) {
                rangeAverages.put(range, values.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
            }
        });

        List<DataPoint> points = academics.stream()
                .limit(MAX_DATA_POINTS)
                .map(a -> new DataPoint(a.attendance(), a.marks()))
                .toList();

        return new AttendanceMarksCorrelation(Correlations.round3(r), Correlations.describe(r), rangeAverages, points);
    }

    public WellbeingCorrelation stressMarksCorrelation() {
        List<StudentFeatures> data = aggregator.aggregateStudents(null);
        double[] marks = column(data, FeatureVector::avgMarks);
        double[] mood = column(data, FeatureVector::avgMood);

        Map<String, Double> correlations = new LinkedHashMap<>();
        correlations.put("mood_vs_marks", Correlations.round3(Correlations.pearson(mood, marks)));
        correlations.put("sleep_vs_marks", Correlations.round3(Correlations.pearson(column(data, FeatureVector::avgSleepHours), marks)));
        correlations.put("study_vs_marks", Correlations.round3(Correlations.pearson(column(data, FeatureVector::avgStudyHours), marks)));
        correlations.put("mood_vs_attendance", Correlations.round3(Correlations.pearson(mood, column(data, FeatureVector::avgAttendance))));

        Map<String, String> interpretations = new LinkedHashMap<>();
        correlations.forEach((k, v) -> interpretations.put(k, Correlations.describe(v)));

        return new WellbeingCorrelation(correlations, interpretations, insights(correlations));
    }

    public Optional<MentalHealthTrends> mentalHealthTrends(String department) {
        Set<Long> studentIds = records.students(Role.STUDENT, blankToNull(department)).stream()
                .map(Student::id)
                .collect(Collectors.toSet());
        List<BehaviorRecord> data = records.allBehaviorRecords().stream()
                .filter(b -> studentIds.contains(b.studentId()))
                .toList();
        if (data.isEmpty()) return Optional.empty();

        BatchSentimentSummary batch = sentimentAnalyzer.analyzeBatch(data.stream().map(BehaviorRecord::textFeedback).toList());

        Map<Integer, Long> moodDistribution = data.stream()
                .collect(Collectors.groupingBy(BehaviorRecord::moodScore, TreeMap::new, Collectors.counting()));

        Map<LocalDate, List<BehaviorRecord>> byDate = data.stream()
                .collect(Collectors.groupingBy(b -> dateOf(b.recordedAt()), TreeMap::new, Collectors.toList()));
        List<DailyTrend> trends = byDate.entrySet().stream()
                .map(e -> new DailyTrend(e.getKey(),
                        e.getValue().stream().mapToDouble(BehaviorRecord::moodScore).average().orElse(0.0),
                        e.getValue().stream().mapToDouble(BehaviorRecord::studyHours).average().orElse(0.0),
                        e.getValue().stream().mapToDouble(BehaviorRecord::sleepHours).average().orElse(0.0)))
                .toList();

        List<ConcerningCase> concerning = data.stream()
                .filter(b -> b.moodScore() <= 2)
                .map(b -> {
                    SentimentResult sentiment = sentimentAnalyzer.analyze(b.textFeedback());
                    return new ConcerningCase(b.studentId(), b.moodScore(), dateOf(b.recordedAt()), b.textFeedback(),
                            sentiment.sentiment(), sentiment.stressIndicators());
                })
                .toList();

        return Optional.of(new MentalHealthTrends(batch.sentimentDistribution(), moodDistribution, trends, concerning,
                batch.commonStressIndicators(), batch.averagePolarity()));
    }

    public Optional<StudentPerformanceTrends> studentPerformanceTrends(long studentId) {
        List<AcademicRecord> academics = records.academicRecords(studentId);
        List<BehaviorRecord> behavior = records.behaviorRecords(studentId);
        if (academics.isEmpty() && behavior.isEmpty()) return Optional.empty();

        List<SubjectScore> subjects = academics.stream()
                .map(a -> new SubjectScore(a.subject(), a.marks(), a.attendance()))
                .toList();

        List<MoodEntry> moods = behavior.stream()
                .map(b -> {
                    SentimentResult sentiment = sentimentAnalyzer.analyze(b.textFeedback());
                    return new MoodEntry(dateOf(b.recordedAt()), b.moodScore(), b.studyHours(), b.sleepHours(),
                            sentiment.sentiment(), sentiment.polarity());
                })
                .toList();

        String highest = academics.stream().max(Comparator.comparingDouble(AcademicRecord::marks)).map(AcademicRecord::subject).orElse("N/A");
        String lowest = academics.stream().min(Comparator.comparingDouble(AcademicRecord::marks)).map(AcademicRecord::subject).orElse("N/A");

        StudentSummary summary = new StudentSummary(
                avg(academics, AcademicRecord::marks, 0.0),
                avg(academics, AcademicRecord::attendance, 0.0),
                highest,
                lowest,
                avg(behavior, BehaviorRecord::moodScore, FeatureModels.DEFAULT_MOOD),
                avg(behavior, BehaviorRecord::studyHours, FeatureModels.DEFAULT_STUDY_HOURS),
                avg(behavior, BehaviorRecord::sleepHours, FeatureModels.DEFAULT_SLEEP_HOURS));

        return Optional.of(new StudentPerformanceTrends(subjects, moods, summary));
    }

    public List<DepartmentSummary> departmentSummary() {
        Map<String, List<StudentFeatures>> byDepartment = aggregator.aggregateStudents(null).stream()
                .collect(Collectors.groupingBy(
                        sf -> Optional.ofNullable(blankToNull(sf.student().department())).orElse(UNKNOWN_DEPARTMENT),
                        TreeMap::new, Collectors.toList()));

        return byDepartment.entrySet().stream()
                .map(e -> {
                    List<StudentFeatures> rows = e.getValue();
                    long highRisk = rows.stream().filter(r -> r.features().riskLevel() == RiskLevel.HIGH).count();
                    return new DepartmentSummary(e.getKey(), rows.size(),
                            mean(column(rows, FeatureVector::avgMarks)),
                            mean(column(rows, FeatureVector::avgAttendance)),
                            mean(column(rows, FeatureVector::avgMood)),
                            highRisk);
                })
                .toList();
    }

    public List<SubjectSummary> subjectSummary() {
        Map<String, List<AcademicRecord>> bySubject = records.allAcademicRecords().stream()
                .collect(Collectors.groupingBy(AcademicRecord::subject, TreeMap::new, Collectors.toList()));

        return bySubject.entrySet().stream()
                .map(e -> new SubjectSummary(e.getKey(), e.getValue().size(),
                        avg(e.getValue(), AcademicRecord::marks, 0.0),
                        avg(e.getValue(), AcademicRecord::attendance, 0.0),
                        avg(e.getValue(), AcademicRecord::assignmentScore, 0.0)))
                .toList();
    }

    static String attendanceRange(double attendance) {
        if (attendance >= 90) return "90-100%";
        if (attendance >= 75) return "75-89%";
        if (attendance >= 60) return "60-74%";
        return "<60%";
    }

    static List<String> insights(Map<String, Double> correlations) {
        List<String> insights = new ArrayList<>();
        if (correlations.getOrDefault("mood_vs_marks", 0.0) > 0.3) {
            insights.add("Students with higher mood scores tend to perform better academically. Mental health support could improve academic outcomes.");
        }
        if (correlations.getOrDefault("sleep_vs_marks", 0.0) > 0.3) {
            insights.add("Better sleep habits are associated with higher academic performance. Sleep hygiene should be promoted.");
        }
        if (correlations.getOrDefault("study_vs_marks", 0.0) > 0.5) {
            insights.add("Study hours show strong correlation with marks. Encouraging productive study habits is beneficial.");
        }
        if (correlations.getOrDefault("mood_vs_attendance", 0.0) > 0.4) {
            insights.add("Students with better mental health show higher attendance. Early mental health intervention could reduce absenteeism.");
        }
        if (insights.isEmpty()) {
            insights.add("Continue monitoring patterns as more data becomes available for deeper insights.");
        }
        return insights;
    }

    private static LocalDate dateOf(Instant instant) {
        return LocalDate.ofInstant(instant, ZoneOffset.UTC);
    }

    private static double[] column(List<StudentFeatures> rows, ToDoubleFunction<FeatureVector> fn) {
        return rows.stream().map(StudentFeatures::features).mapToDouble(fn).toArray();
    }

    private static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(0.0);
    }

    private static <T> double avg(List<T> rows, ToDoubleFunction<T> fn, double fallback) {
        return rows.stream().mapToDouble(fn).average().orElse(fallback);
    }

    private static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }
}
