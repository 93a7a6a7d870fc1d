package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;
import java.util.Locale;

/**
 * Kinds of ETL job. Each kind is bound to exactly one {@link RecordLoader}.
 *
 * Alternative key columns (student_id / student_number and so on) are not listed as
 * required; the loader checks that one of them is present.
 */
public enum EtlJobType {
    STUDENT_DATA(
            List.of("student_number", "first_name", "last_name", "email",
                    "date_of_birth", "gender", "enrollment_date"),
            List.of("status", "major", "minor", "ethnicity", "graduation_date")),
    COURSE_DATA(
            List.of("course_code", "course_name", "credits", "level"),
            List.of("department_id", "department_code", "course_description",
                    "prerequisites", "is_active")),
    PERFORMANCE_DATA(
            List.of("date", "grade_points", "credits_earned"),
            List.of("student_id", "student_number", "course_id", "course_code",
                    "instructor_id", "instructor_number", "letter_grade",
                    "attendance_percentage", "assignment_score", "exam_score", "final_score"));

    private final List<String> requiredColumns;
    private final List<String> optionalColumns;

    EtlJobType(List<String> requiredColumns, List<String> optionalColumns) {
        this.requiredColumns = requiredColumns;
        this.optionalColumns = optionalColumns;
    }

    public List<String> requiredColumns() {
        return requiredColumns;
    }

    public List<String> optionalColumns() {
        return optionalColumns;
    }

    @JsonValue
    public String token() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static EtlJobType fromToken(String token) {
        if (token == null || token.isBlank()) {
            throw new ValidationException("Job type is required");
        }
        for (EtlJobType type : values()) {
            if (type.token().equalsIgnoreCase(token.trim())) {
                return type;
            }
        }
        throw new ValidationException("Unknown job type: " + token);
    }
}
