package com.campus.insight.recommendation;

import com.campus.insight.analytics.AnalyticsModels.StudentPerformanceTrends;
import com.campus.insight.analytics.AnalyticsModels.StudentSummary;
import com.campus.insight.analytics.AnalyticsService;
import com.campus.insight.recommendation.RecommendationModels.Priority;
import com.campus.insight.recommendation.RecommendationModels.Recommendation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Ordered, non-exclusive rules over a student's aggregated summary. Output order follows rule order.
 */
@Service
public class RecommendationService {
    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    private final AnalyticsService analyticsService;

    public RecommendationService(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    public List<Recommendation> generateRecommendations(long studentId) {
        List<Recommendation> recommendations = analyticsService.studentPerformanceTrends(studentId)
                .map(StudentPerformanceTrends::summary)
                .map(RecommendationService::fromSummary)
                .orElse(List.of());
        log.debug("Generated {} recommendations for student {}", recommendations.size(), studentId);
        return recommendations;
    }

    public static List<Recommendation> fromSummary(StudentSummary summary) {
        List<Recommendation> out = new ArrayList<>();

        if (summary.avgMarks() < 60) {
            out.add(new Recommendation(RecommendationTypes.ACADEMIC, Priority.HIGH,
                    "Improve Academic Performance",
                    "Your average marks (" + oneDecimal(summary.avgMarks()) + "%) need improvement. "
                            + "Consider forming study groups and utilizing tutoring services.",
                    List.of("Schedule regular tutoring sessions",
                            "Join or form a study group",
                            "Create a structured study schedule",
                            "Seek help from professors during office hours")));
        }

        if (summary.avgAttendance() < 75) {
            out.add(new Recommendation(RecommendationTypes.ATTENDANCE, Priority.HIGH,
                    "Improve Attendance",
                    "Your attendance (" + oneDecimal(summary.avgAttendance()) + "%) is below the recommended threshold. "
                            + "Regular attendance is correlated with better academic performance.",
                    List.of("Set multiple alarms for morning classes",
                            "Partner with a classmate for accountability",
                            "Address any underlying issues affecting attendance")));
        }

        if (summary.avgMood() <= 2) {
            out.add(new Recommendation(RecommendationTypes.MENTAL_HEALTH, Priority.URGENT,
                    "Seek Mental Health Support",
                    "Your recent mood indicators suggest you may be experiencing significant stress. "
                            + "Please consider reaching out to campus counseling services.",
                    List.of("Schedule an appointment with a campus counselor",
                            "Talk to a trusted friend, family member, or mentor",
                            "Practice stress-reduction techniques like meditation",
                            "Helpline: Campus Wellness Center")));
        } else if (summary.avgMood() <= 3) {
            out.add(new Recommendation(RecommendationTypes.WELLNESS, Priority.MEDIUM,
                    "Focus on Well-being",
                    "Consider incorporating wellness activities into your routine to maintain a healthy balance.",
                    List.of("Take regular breaks during study sessions",
                            "Engage in physical activity",
                            "Maintain social connections")));
        }

        if (summary.avgSleepHours() < 6) {
            out.add(new Recommendation(RecommendationTypes.HEALTH, Priority.MEDIUM,
                    "Improve Sleep Habits",
                    "You're averaging " + oneDecimal(summary.avgSleepHours()) + " hours of sleep. "
                            + "Adults need 7-9 hours for optimal cognitive function.",
                    List.of("Set a consistent bedtime",
                            "Limit screen time before bed",
                            "Create a relaxing pre-sleep routine",
                            "Avoid caffeine in the evening")));
        }

        if (summary.avgStudyHours() < 4) {
            out.add(new Recommendation(RecommendationTypes.STUDY_HABITS, Priority.MEDIUM,
                    "Increase Study Time",
                    "Consider increasing your study hours from " + oneDecimal(summary.avgStudyHours())
                            + " hours to at least 4-6 hours daily.",
                    List.of("Use the Pomodoro technique for focused study",
                            "Identify and minimize distractions",
                            "Create a dedicated study space")));
        }

        if (summary.avgMarks() >= 80 && summary.avgMood() >= 4) {
            out.add(new Recommendation(RecommendationTypes.POSITIVE, Priority.LOW,
                    "Keep Up the Great Work!",
                    "Your academic performance and well-being indicators are excellent. "
                            + "Continue maintaining your healthy habits.",
                    List.of("Consider mentoring other students",
                            "Explore advanced opportunities like research",
                            "Maintain your work-life balance")));
        }

        return List.copyOf(out);
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.US, "%.1f", value);
    }
}
