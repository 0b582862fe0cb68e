package com.campus.insight.repository;

import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.domain.StudentRecords.Role;
import com.campus.insight.domain.StudentRecords.Student;

import java.util.List;

/**
 * Record queries the insight engine consumes from the persistence layer.
 * Lists are returned in {@code recordedAt} order; {@code department == null} means no filter.
 */
public interface StudentRecordSource {
    List<AcademicRecord> academicRecords(long studentId);

    List<BehaviorRecord> behaviorRecords(long studentId);

    List<AcademicRecord> allAcademicRecords();

    List<BehaviorRecord> allBehaviorRecords();

    List<Student> students(Role role, String department);

    void saveAcademicRecord(AcademicRecord record);

    void saveBehaviorRecord(BehaviorRecord record, String sentimentLabel);
}
