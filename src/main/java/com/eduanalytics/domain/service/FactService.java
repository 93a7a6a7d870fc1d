package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.persistence.entity.*;
import com.eduanalytics.infrastructure.persistence.repository.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Appends fact rows. Each call runs in its own transaction and fails with
 * {@link ResourceNotFoundException} before writing if any dimension reference is unknown.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactService {

    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final InstructorRepository instructorRepository;
    private final PerformanceFactRepository performanceFactRepository;
    private final EnrollmentFactRepository enrollmentFactRepository;
    private final AttendanceFactRepository attendanceFactRepository;
    private final TimeDimensionService timeDimensionService;

    /**
     * Stores a graded outcome. Final score, pass flag and (when absent) letter grade are derived
     * here; the student's cached GPA and credits are refreshed in the same transaction.
     */
    @Transactional
    public PerformanceFactResponse recordPerformance(PerformanceFactRequest request) {
        StudentEntity student = student(request.getStudentId());
        CourseEntity course = course(request.getCourseId());
        InstructorEntity instructor = instructorRepository.findById(request.getInstructorId())
                .orElseThrow(() -> ResourceNotFoundException.of("Instructor", request.getInstructorId()));

        double finalScore = PerformanceScoring.requireFinalScore(
                request.getAssignmentScore(), request.getExamScore(), request.getFinalScore());
        TimeDimensionEntity time = timeDimensionService.resolve(request.getDate());

        PerformanceFactEntity fact = PerformanceFactEntity.builder()
                .student(student)
                .course(course)
                .instructor(instructor)
                .timeDimension(time)
                .gradePoints(request.getGradePoints())
                .letterGrade(PerformanceScoring.letterGrade(request.getLetterGrade(), request.getGradePoints()))
                .creditsEarned(request.getCreditsEarned())
                .attendancePercentage(request.getAttendancePercentage())
                .assignmentScore(request.getAssignmentScore())
                .examScore(request.getExamScore())
                .finalScore(finalScore)
                .passed(PerformanceScoring.isPass(finalScore))
                .build();

        fact = performanceFactRepository.save(fact);
        refreshStudentAggregates(student);

        log.debug("Recorded performance fact {} for student {} course {}",
                fact.getFactId(), student.getStudentId(), course.getCourseId());
        return PerformanceFactResponse.from(fact);
    }

    @Transactional
    public EnrollmentFactResponse recordEnrollment(EnrollmentFactRequest request) {
        StudentEntity student = student(request.getStudentId());
        CourseEntity course = course(request.getCourseId());
        TimeDimensionEntity time = timeDimensionService.resolve(request.getEnrollmentDate());

        EnrollmentFactEntity fact = EnrollmentFactEntity.builder()
                .student(student)
                .course(course)
                .timeDimension(time)
                .enrollmentDate(request.getEnrollmentDate())
                .dropDate(request.getDropDate())
                .dropped(Boolean.TRUE.equals(request.getIsDropped()) || request.getDropDate() != null)
                .completed(Boolean.TRUE.equals(request.getIsCompleted()))
                .waitlistPosition(request.getWaitlistPosition())
                .build();

        return EnrollmentFactResponse.from(enrollmentFactRepository.save(fact));
    }

    @Transactional
    public AttendanceFactResponse recordAttendance(AttendanceFactRequest request) {
        StudentEntity student = student(request.getStudentId());
        CourseEntity course = course(request.getCourseId());
        TimeDimensionEntity time = timeDimensionService.resolve(request.getClassDate());

        boolean late = Boolean.TRUE.equals(request.getIsLate());
        AttendanceFactEntity fact = AttendanceFactEntity.builder()
                .student(student)
                .course(course)
                .timeDimension(time)
                .classDate(request.getClassDate())
                .present(Boolean.TRUE.equals(request.getIsPresent()))
                .late(late)
                .minutesLate(late && request.getMinutesLate() != null ? request.getMinutesLate() : 0)
                .build();

        return AttendanceFactResponse.from(attendanceFactRepository.save(fact));
    }

    private void refreshStudentAggregates(StudentEntity student) {
        Double gpa = performanceFactRepository.averageGradePoints(student.getStudentId());
        Long credits = performanceFactRepository.sumCreditsEarned(student.getStudentId());
        student.setGpa(gpa != null ? Math.round(gpa * 100.0) / 100.0 : null);
        student.setCreditsCompleted(credits != null ? credits.intValue() : 0);
        studentRepository.save(student);
    }

    private StudentEntity student(Long studentId) {
        return studentRepository.findById(studentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Student", studentId));
    }

    private CourseEntity course(Long courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> ResourceNotFoundException.of("Course", courseId));
    }
}
