package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.LetterGrade;
import com.eduanalytics.domain.model.PerformanceFactRequest;
import com.eduanalytics.domain.service.FactService;
import com.eduanalytics.infrastructure.persistence.repository.CourseRepository;
import com.eduanalytics.infrastructure.persistence.repository.InstructorRepository;
import com.eduanalytics.infrastructure.persistence.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Graded outcome rows. Each dimension is referenced by surrogate id or by business key.
 */
@Component
@RequiredArgsConstructor
public class PerformanceRecordLoader implements RecordLoader {

    private final FactService factService;
    private final StudentRepository studentRepository;
    private final CourseRepository courseRepository;
    private final InstructorRepository instructorRepository;

    @Override
    public EtlJobType jobType() {
        return EtlJobType.PERFORMANCE_DATA;
    }

    @Override
    public void load(RecordFields fields) {
        Integer credits = fields.requireInteger("credits_earned");
        if (credits < 0) {
            throw new ValidationException("credits_earned must not be negative: " + credits);
        }

        PerformanceFactRequest request = PerformanceFactRequest.builder()
                .studentId(studentId(fields))
                .courseId(courseId(fields))
                .instructorId(instructorId(fields))
                .date(fields.requireDate("date"))
                .gradePoints(fields.requireDecimal("grade_points", 0.0, 4.0))
                .creditsEarned(credits)
                .letterGrade(LetterGrade.fromSymbol(fields.text("letter_grade")))
                .attendancePercentage(fields.decimal("attendance_percentage", 0.0, 100.0))
                .assignmentScore(fields.decimal("assignment_score", 0.0, 100.0))
                .examScore(fields.decimal("exam_score", 0.0, 100.0))
                .finalScore(fields.decimal("final_score", 0.0, 100.0))
                .build();

        factService.recordPerformance(request);
    }

    private Long studentId(RecordFields fields) {
        if (fields.has("student_id")) {
            return fields.id("student_id");
        }
        String number = requireKey(fields, "student_id", "student_number");
        return studentRepository.findByStudentNumber(number)
                .orElseThrow(() -> ResourceNotFoundException.of("Student", number))
                .getStudentId();
    }

    private Long courseId(RecordFields fields) {
        if (fields.has("course_id")) {
            return fields.id("course_id");
        }
        String code = requireKey(fields, "course_id", "course_code");
        return courseRepository.findByCourseCode(code)
                .orElseThrow(() -> ResourceNotFoundException.of("Course", code))
                .getCourseId();
    }

    private Long instructorId(RecordFields fields) {
        if (fields.has("instructor_id")) {
            return fields.id("instructor_id");
        }
        String number = requireKey(fields, "instructor_id", "instructor_number");
        return instructorRepository.findByInstructorNumber(number)
                .orElseThrow(() -> ResourceNotFoundException.of("Instructor", number))
                .getInstructorId();
    }

    private static String requireKey(RecordFields fields, String idColumn, String keyColumn) {
        if (!fields.has(keyColumn)) {
            throw new ValidationException("Missing required field: " + idColumn + " or " + keyColumn);
        }
        return fields.text(keyColumn);
    }

    @Override
    public Map<String, String> constraints() {
        Map<String, String> constraints = new LinkedHashMap<>();
        constraints.put("student_id | student_number", "one is required");
        constraints.put("course_id | course_code", "one is required");
        constraints.put("instructor_id | instructor_number", "one is required");
        constraints.put("grade_points", "0.0 - 4.0");
        constraints.put("credits_earned", "integer >= 0");
        constraints.put("attendance_percentage", "0 - 100");
        constraints.put("assignment_score", "0 - 100");
        constraints.put("exam_score", "0 - 100");
        constraints.put("final_score", "0 - 100, or derived as 0.4 * assignment_score + 0.6 * exam_score");
        constraints.put("letter_grade", "A+ | A | A- | B+ | B | B- | C+ | C | C- | D+ | D | F");
        return constraints;
    }
}
