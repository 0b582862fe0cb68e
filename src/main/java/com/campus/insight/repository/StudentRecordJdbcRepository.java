package com.campus.insight.repository;

import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.domain.StudentRecords.Role;
import com.campus.insight.domain.StudentRecords.Student;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.List;
import java.util.Objects;

@Repository
public class StudentRecordJdbcRepository implements StudentRecordSource {
    private static final String ACADEMIC_COLUMNS = "student_id, subject, marks, attendance, assignment_score, recorded_at";
    private static final String BEHAVIOR_COLUMNS = "student_id, mood_score, sleep_hours, study_hours, text_feedback, recorded_at";

    private static final RowMapper<AcademicRecord> ACADEMIC_MAPPER = (rs, n) -> new AcademicRecord(
            rs.getLong(1), rs.getString(2), rs.getDouble(3), rs.getDouble(4), rs.getDouble(5),
            rs.getTimestamp(6).toInstant());

    private static final RowMapper<BehaviorRecord> BEHAVIOR_MAPPER = (rs, n) -> new BehaviorRecord(
            rs.getLong(1), rs.getInt(2), rs.getDouble(3), rs.getDouble(4), rs.getString(5),
            rs.getTimestamp(6).toInstant());

    private final JdbcTemplate jdbcTemplate;

    public StudentRecordJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<AcademicRecord> academicRecords(long studentId) {
        return jdbcTemplate.query(
                "SELECT " + ACADEMIC_COLUMNS + " FROM academic_records WHERE student_id = ? ORDER BY recorded_at, id",
                ACADEMIC_MAPPER, studentId);
    }

    @Override
    public List<BehaviorRecord> behaviorRecords(long studentId) {
        return jdbcTemplate.query(
                "SELECT " + BEHAVIOR_COLUMNS + " FROM behavior_records WHERE student_id = ? ORDER BY recorded_at, id",
                BEHAVIOR_MAPPER, studentId);
    }

    @Override
    public List<AcademicRecord> allAcademicRecords() {
        return jdbcTemplate.query(
                "SELECT " + ACADEMIC_COLUMNS + " FROM academic_records ORDER BY recorded_at, id",
                ACADEMIC_MAPPER);
    }

    @Override
    public List<BehaviorRecord> allBehaviorRecords() {
        return jdbcTemplate.query(
                "SELECT " + BEHAVIOR_COLUMNS + " FROM behavior_records ORDER BY recorded_at, id",
                BEHAVIOR_MAPPER);
    }

    @Override
    public List<Student> students(Role role, String department) {
        String roleCode = role == null ? null : role.code();
        return jdbcTemplate.query(
                "SELECT id, name, email, role, department FROM users " +
                        "WHERE (? IS NULL OR role = ?) AND (? IS NULL OR department = ?) ORDER BY id",
                (rs, n) -> new Student(rs.getLong(1), rs.getString(2), rs.getString(3),
                        Role.fromCode(rs.getString(4)), rs.getString(5)),
                roleCode, roleCode, department, department);
    }

    @Override
    public void saveAcademicRecord(AcademicRecord record) {
        jdbcTemplate.update(
                "INSERT INTO academic_records(" + ACADEMIC_COLUMNS + ") VALUES (?,?,?,?,?,?)",
                record.studentId(), record.subject(), record.marks(), record.attendance(),
                record.assignmentScore(), Timestamp.from(record.recordedAt()));
    }

    @Override
    public void saveBehaviorRecord(BehaviorRecord record, String sentimentLabel) {
        jdbcTemplate.update(
                "INSERT INTO behavior_records(" + BEHAVIOR_COLUMNS + ", sentiment_result) VALUES (?,?,?,?,?,?,?)",
                record.studentId(), record.moodScore(), record.sleepHours(), record.studyHours(),
                record.textFeedback(), Timestamp.from(record.recordedAt()), sentimentLabel);
    }

    public long saveStudent(String name, String email, Role role, String department) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO users(name, email, role, department) VALUES (?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, name);
            ps.setString(2, email);
            ps.setString(3, role.code());
            ps.setString(4, department);
            return ps;
        }, keys);
        return Objects.requireNonNull(keys.getKey(), "generated user id").longValue();
    }
}
