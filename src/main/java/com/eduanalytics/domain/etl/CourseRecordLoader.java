package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.CourseCreateRequest;
import com.eduanalytics.domain.model.CourseLevel;
import com.eduanalytics.domain.service.CourseService;
import com.eduanalytics.infrastructure.persistence.repository.DepartmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Course rows: existing course codes are updated in place. The department is referenced by
 * department_id or department_code.
 */
@Component
@RequiredArgsConstructor
public class CourseRecordLoader implements RecordLoader {

    private final CourseService courseService;
    private final DepartmentRepository departmentRepository;

    @Override
    public EtlJobType jobType() {
        return EtlJobType.COURSE_DATA;
    }

    @Override
    public void load(RecordFields fields) {
        Integer credits = fields.requireInteger("credits");
        if (credits < 0) {
            throw new ValidationException("credits must not be negative: " + credits);
        }

        CourseCreateRequest request = CourseCreateRequest.builder()
                .courseCode(fields.requireText("course_code"))
                .courseName(fields.requireText("course_name"))
                .credits(credits)
                .level(CourseLevel.fromToken(fields.requireText("level")))
                .departmentId(departmentId(fields))
                .courseDescription(fields.text("course_description"))
                .prerequisites(fields.text("prerequisites"))
                .build();

        courseService.upsert(request, fields.bool("is_active"));
    }

    private Long departmentId(RecordFields fields) {
        if (fields.has("department_id")) {
            return fields.id("department_id");
        }
        if (fields.has("department_code")) {
            String code = fields.text("department_code");
            return departmentRepository.findByDepartmentCode(code)
                    .orElseThrow(() -> ResourceNotFoundException.of("Department", code))
                    .getDepartmentId();
        }
        throw new ValidationException("Missing required field: department_id or department_code");
    }

    @Override
    public Map<String, String> constraints() {
        Map<String, String> constraints = new LinkedHashMap<>();
        constraints.put("course_code", "unique, at most 20 characters");
        constraints.put("credits", "integer >= 0");
        constraints.put("level", "undergraduate | graduate | doctorate");
        constraints.put("department_id | department_code", "one is required");
        constraints.put("prerequisites", "comma separated course codes");
        constraints.put("is_active", "true | false");
        return constraints;
    }
}
