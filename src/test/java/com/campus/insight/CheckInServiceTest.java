package com.campus.insight;

import com.campus.insight.checkin.CheckInModels.CheckInRequest;
import com.campus.insight.checkin.CheckInModels.CheckInResult;
import com.campus.insight.checkin.CheckInService;
import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.domain.StudentRecords.Role;
import com.campus.insight.exception.InvalidInputException;
import com.campus.insight.repository.StudentRecordJdbcRepository;
import com.campus.insight.sentiment.SentimentModels.Sentiment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class CheckInServiceTest {
    @Autowired
    private CheckInService checkInService;
    @Autowired
    private StudentRecordJdbcRepository repository;
    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void cleanDatabase() {
        jdbcTemplate.update("DELETE FROM behavior_records");
        jdbcTemplate.update("DELETE FROM academic_records");
        jdbcTemplate.update("DELETE FROM users");
    }

    private void seedClassmates() {
        Instant when = Instant.parse("2024-02-20T08:00:00Z");
        for (int i = 0; i < 5; i++) {
            long id = repository.saveStudent("Classmate " + i, "classmate" + i + "@campus.test", Role.STUDENT, "CS");
            repository.saveAcademicRecord(new AcademicRecord(id, 40 + i * 12, 60 + i * 8, 45 + i * 10, when));
            repository.saveBehaviorRecord(new BehaviorRecord(id, 1 + i, 5 + i * 0.5, 2 + i, null, when), null);
        }
    }

    @Test
    void storesRecordsAndPredictsFromQuestionnaire() {
        seedClassmates();
        long studentId = repository.saveStudent("Ada", "ada@campus.test", Role.STUDENT, "CS");

        CheckInResult result = checkInService.submitCheckIn(studentId,
                new CheckInRequest(4, 4, 2, 7.5, 5, 78, 92, 81, "Feeling great and motivated this week"));

        assertEquals(4, result.moodScore());
        assertEquals(Sentiment.POSITIVE, result.sentiment().result().sentiment());
        assertTrue(result.prediction().isPresent());
        assertTrue(result.risk().isPresent());

        List<BehaviorRecord> behavior = repository.behaviorRecords(studentId);
        assertEquals(1, behavior.size());
        assertEquals(4, behavior.get(0).moodScore());
        assertEquals("Feeling great and motivated this week", behavior.get(0).textFeedback());
        assertEquals("Positive", jdbcTemplate.queryForObject(
                "SELECT sentiment_result FROM behavior_records WHERE student_id = ?", String.class, studentId));
        assertEquals(78.0, repository.academicRecords(studentId).get(0).marks());
    }

    @Test
    void answersAloneAreScoredWhenNoFeedbackGiven() {
        seedClassmates();
        long studentId = repository.saveStudent("Ben", "ben@campus.test", Role.STUDENT, "Math");

        CheckInResult result = checkInService.submitCheckIn(studentId,
                new CheckInRequest(2, 2, 5, 6, 3, 55, 70, 60, null));

        assertEquals(2, result.moodScore());
        assertEquals(Sentiment.NEUTRAL, result.sentiment().result().sentiment());
        assertNull(repository.behaviorRecords(studentId).get(0).textFeedback());
    }

    @Test
    void rejectsOutOfRangeAnswers() {
        assertThrows(InvalidInputException.class, () -> new CheckInRequest(6, 3, 3, 7, 4, 70, 80, 75, null));
        assertThrows(InvalidInputException.class, () -> new CheckInRequest(3, 3, 3, -1, 4, 70, 80, 75, null));
        assertThrows(InvalidInputException.class, () -> new CheckInRequest(3, 3, 3, 7, 4, 101, 80, 75, null));
    }
}
