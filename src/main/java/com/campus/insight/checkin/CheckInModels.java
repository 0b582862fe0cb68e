package com.campus.insight.checkin;

import com.campus.insight.exception.InvalidInputException;
import com.campus.insight.ml.MlModels.PerformancePrediction;
import com.campus.insight.ml.MlModels.RiskPrediction;
import com.campus.insight.sentiment.SentimentModels.SentimentAnalysis;

import java.util.Optional;

public class CheckInModels {
    /**
     * Self-reported questionnaire. Concentration, confidence and mental fatigue are 1..5 answers;
     * fatigue counts against mood.
     */
    public record CheckInRequest(int concentration,
                                 int confidence,
                                 int mentalFatigue,
                                 double sleepHours,
                                 double studyHours,
                                 double marks,
                                 double attendance,
                                 double assignmentScore,
                                 String feedback) {
        public CheckInRequest {
            InvalidInputException.requireRange("concentration", concentration, 1, 5);
            InvalidInputException.requireRange("confidence", confidence, 1, 5);
            InvalidInputException.requireRange("mental_fatigue", mentalFatigue, 1, 5);
            InvalidInputException.requireNonNegative("sleep_hours", sleepHours);
            InvalidInputException.requireNonNegative("study_hours", studyHours);
            InvalidInputException.requireRange("marks", marks, 0, 100);
            InvalidInputException.requireRange("attendance", attendance, 0, 100);
            InvalidInputException.requireRange("assignment_score", assignmentScore, 0, 100);
        }

        public int moodScore() {
            return (int) Math.round((concentration + confidence + (6 - mentalFatigue)) / 3.0);
        }

        public Optional<String> feedbackText() {
            return Optional.ofNullable(feedback).filter(f -> !f.isBlank());
        }
    }

    public record CheckInResult(long studentId,
                                int moodScore,
                                SentimentAnalysis sentiment,
                                Optional<PerformancePrediction> prediction,
                                Optional<RiskPrediction> risk) {}
}
