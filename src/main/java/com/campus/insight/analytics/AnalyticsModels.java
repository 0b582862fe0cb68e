package com.campus.insight.analytics;

import com.campus.insight.features.RiskLevel;
import com.campus.insight.sentiment.SentimentModels.Sentiment;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class AnalyticsModels {
    public record ClassAnalytics(Map<PerformanceCategory, Long> performanceDistribution,
                                 Map<RiskLevel, Long> riskDistribution,
                                 List<AtRiskStudent> atRiskStudents,
                                 ClassStatistics statistics) {}

    public record AtRiskStudent(long studentId, String name, String department, double avgMarks, double avgMood) {}

    public record ClassStatistics(int totalStudents,
                                  double avgMarks,
                                  double avgAttendance,
                                  double avgMood,
                                  double marksStd) {}

    public record DataPoint(double attendance, double marks) {}

    public record AttendanceMarksCorrelation(double correlationCoefficient,
                                             String interpretation,
                                             Map<String, Double> rangeWiseAverage,
                                             List<DataPoint> dataPoints) {}

    public record WellbeingCorrelation(Map<String, Double> correlations,
                                       Map<String, String> interpretations,
                                       List<String> insights) {}

    public record DailyTrend(LocalDate date, double moodScore, double studyHours, double sleepHours) {}

    public record ConcerningCase(long studentId,
                                 int moodScore,
                                 LocalDate recordedDate,
                                 String textFeedback,
                                 Sentiment sentiment,
                                 Set<String> stressIndicators) {}

    public record MentalHealthTrends(Map<Sentiment, Long> sentimentDistribution,
                                     Map<Integer, Long> moodDistribution,
                                     List<DailyTrend> timeTrends,
                                     List<ConcerningCase> concerningCases,
                                     Set<String> commonStressIndicators,
                                     double averagePolarity) {}

    public record SubjectScore(String subject, double marks, double attendance) {}

    public record MoodEntry(LocalDate date,
                            int moodScore,
                            double studyHours,
                            double sleepHours,
                            Sentiment sentiment,
                            double polarity) {}

    public record StudentSummary(double avgMarks,
                                 double avgAttendance,
                                 String highestSubject,
                                 String lowestSubject,
                                 double avgMood,
                                 double avgStudyHours,
                                 double avgSleepHours) {}

    public record StudentPerformanceTrends(List<SubjectScore> subjects,
                                           List<MoodEntry> mentalTrends,
                                           StudentSummary summary) {}

    public record DepartmentSummary(String department,
                                    int studentCount,
                                    double avgMarks,
                                    double avgAttendance,
                                    double avgMood,
                                    long highRiskCount) {}

    public record SubjectSummary(String subject,
                                 long recordCount,
                                 double avgMarks,
                                 double avgAttendance,
                                 double avgAssignment) {}
}
