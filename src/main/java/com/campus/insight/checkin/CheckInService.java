package com.campus.insight.checkin;

import com.campus.insight.checkin.CheckInModels.CheckInRequest;
import com.campus.insight.checkin.CheckInModels.CheckInResult;
import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.ml.MlService;
import com.campus.insight.repository.StudentRecordSource;
import com.campus.insight.sentiment.SentimentModels.SentimentAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
public class CheckInService {
    private static final Logger log = LoggerFactory.getLogger(CheckInService.class);

    private final StudentRecordSource records;
    private final MlService mlService;

    public CheckInService(StudentRecordSource records, MlService mlService) {
        this.records = records;
        this.mlService = mlService;
    }

    /**
     * Stores one behavior and one academic record for the questionnaire, then predicts from the
     * student's full history including the new records.
     */
    public CheckInResult submitCheckIn(long studentId, CheckInRequest request) {
        int mood = request.moodScore();
        String text = request.feedbackText().orElseGet(() -> String.format("Concentration: %d, Confidence: %d, Fatigue: %d",
                request.concentration(), request.confidence(), request.mentalFatigue()));
        SentimentAnalysis sentiment = mlService.analyzeSentiment(text);

        Instant now = Instant.now();
        records.saveBehaviorRecord(new BehaviorRecord(studentId, mood, request.sleepHours(), request.studyHours(),
                request.feedbackText().orElse(null), now), sentiment.result().sentiment().label());
        records.saveAcademicRecord(new AcademicRecord(studentId, request.marks(), request.attendance(),
                request.assignmentScore(), now));
        log.info("Stored check-in for student {} (mood {})", studentId, mood);

        return new CheckInResult(studentId, mood, sentiment,
                mlService.predictPerformance(studentId),
                mlService.classifyRisk(studentId));
    }
}
