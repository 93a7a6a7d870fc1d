package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.model.Gender;
import com.eduanalytics.domain.model.StudentCreateRequest;
import com.eduanalytics.domain.model.StudentStatus;
import com.eduanalytics.domain.service.StudentService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Student rows: existing student numbers are updated in place, new ones created.
 */
@Component
@RequiredArgsConstructor
public class StudentRecordLoader implements RecordLoader {

    private final StudentService studentService;

    @Override
    public EtlJobType jobType() {
        return EtlJobType.STUDENT_DATA;
    }

    @Override
    public void load(RecordFields fields) {
        StudentCreateRequest request = StudentCreateRequest.builder()
                .studentNumber(fields.requireText("student_number"))
                .firstName(fields.requireText("first_name"))
                .lastName(fields.requireText("last_name"))
                .email(fields.requireText("email"))
                .dateOfBirth(fields.requireDate("date_of_birth"))
                .gender(Gender.fromToken(fields.requireText("gender")))
                .enrollmentDate(fields.requireDate("enrollment_date"))
                .ethnicity(fields.text("ethnicity"))
                .major(fields.text("major"))
                .minor(fields.text("minor"))
                .status(StudentStatus.fromToken(fields.text("status")))
                .build();

        studentService.upsert(request, fields.date("graduation_date"));
    }

    @Override
    public Map<String, String> constraints() {
        Map<String, String> constraints = new LinkedHashMap<>();
        constraints.put("student_number", "unique, at most 20 characters");
        constraints.put("email", "unique");
        constraints.put("gender", "male | female | other");
        constraints.put("status", "active | graduated | dropped | suspended");
        constraints.put("date_of_birth", "ISO date (yyyy-MM-dd)");
        constraints.put("enrollment_date", "ISO date (yyyy-MM-dd)");
        return constraints;
    }
}
