package com.campus.insight.domain;

import com.campus.insight.exception.InvalidInputException;

import java.time.Instant;

public class StudentRecords {
    public static final String DEFAULT_SUBJECT = "General";

    public record Student(long id, String name, String email, Role role, String department) {}

    public record AcademicRecord(long studentId,
                                 String subject,
                                 double marks,
                                 double attendance,
                                 double assignmentScore,
                                 Instant recordedAt) {
        public AcademicRecord {
            InvalidInputException.requireRange("marks", marks, 0, 100);
            InvalidInputException.requireRange("attendance", attendance, 0, 100);
            InvalidInputException.requireRange("assignment_score", assignmentScore, 0, 100);
            subject = (subject == null || subject.isBlank()) ? DEFAULT_SUBJECT : subject;
            recordedAt = recordedAt == null ? Instant.now() : recordedAt;
        }

        public AcademicRecord(long studentId, double marks, double attendance, double assignmentScore, Instant recordedAt) {
            this(studentId, DEFAULT_SUBJECT, marks, attendance, assignmentScore, recordedAt);
        }
    }

    public record BehaviorRecord(long studentId,
                                 int moodScore,
                                 double sleepHours,
                                 double studyHours,
                                 String textFeedback,
                                 Instant recordedAt) {
        public BehaviorRecord {
            InvalidInputException.requireRange("mood_score", moodScore, 1, 5);
            InvalidInputException.requireNonNegative("sleep_hours", sleepHours);
            InvalidInputException.requireNonNegative("study_hours", studyHours);
            recordedAt = recordedAt == null ? Instant.now() : recordedAt;
        }
    }

    public enum Role {
        STUDENT, TEACHER, COUNSELOR;

        public static Role fromCode(String code) {
            return code == null ? STUDENT : Role.valueOf(code.trim().toUpperCase());
        }

        public String code() {
            return name().toLowerCase();
        }
    }
}
