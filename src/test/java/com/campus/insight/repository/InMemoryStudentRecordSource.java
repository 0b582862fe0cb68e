package com.campus.insight.repository;

import com.campus.insight.domain.StudentRecords.AcademicRecord;
import com.campus.insight.domain.StudentRecords.BehaviorRecord;
import com.campus.insight.domain.StudentRecords.Role;
import com.campus.insight.domain.StudentRecords.Student;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public class InMemoryStudentRecordSource implements StudentRecordSource {
    private final List<Student> students = new ArrayList<>();
    private final List<AcademicRecord> academics = new ArrayList<>();
    private final List<BehaviorRecord> behavior = new ArrayList<>();

    public Student addStudent(long id, String department) {
        Student student = new Student(id, "Student " + id, "student" + id + "@campus.test", Role.STUDENT, department);
        students.add(student);
        return student;
    }

    @Override
    public List<AcademicRecord> academicRecords(long studentId) {
        return academics.stream().filter(a -> a.studentId() == studentId).toList();
    }

    @Override
    public List<BehaviorRecord> behaviorRecords(long studentId) {
        return behavior.stream().filter(b -> b.studentId() == studentId).toList();
    }

    @Override
    public List<AcademicRecord> allAcademicRecords() {
        return List.copyOf(academics);
    }

    @Override
    public List<BehaviorRecord> allBehaviorRecords() {
        return List.copyOf(behavior);
    }

    @Override
    public List<Student> students(Role role, String department) {
        return students.stream()
                .filter(s -> role == null || s.role() == role)
                .filter(s -> department == null || Objects.equals(department, s.department()))
                .toList();
    }

    @Override
    public void saveAcademicRecord(AcademicRecord record) {
        academics.add(record);
    }

    @Override
    public void saveBehaviorRecord(BehaviorRecord record, String sentimentLabel) {
        behavior.add(record);
    }
}
