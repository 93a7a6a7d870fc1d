package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ConflictException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.persistence.entity.CourseEntity;
import com.eduanalytics.infrastructure.persistence.entity.DepartmentEntity;
import com.eduanalytics.infrastructure.persistence.repository.CourseRepository;
import com.eduanalytics.infrastructure.persistence.repository.DepartmentRepository;
import com.eduanalytics.infrastructure.persistence.repository.EnrollmentFactRepository;
import com.eduanalytics.infrastructure.persistence.repository.PerformanceFactRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Course dimension management. Courses are never removed; delete clears the active flag.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CourseService {

    private final CourseRepository courseRepository;
    private final DepartmentRepository departmentRepository;
    private final PerformanceFactRepository performanceFactRepository;
    private final EnrollmentFactRepository enrollmentFactRepository;
    private final MetricsAggregator metricsAggregator;

    @Transactional(readOnly = true)
    public PageResponse<CourseResponse> list(int page, int size, String search, CourseLevel level,
                                             Long departmentId, Boolean active) {
        return PageResponse.of(
                courseRepository.search(StudentService.likePattern(search), level, departmentId, active,
                        PageRequest.of(page - 1, size, Sort.by("courseId"))),
                CourseResponse::from);
    }

    @Transactional(readOnly = true)
    public CourseResponse get(Long courseId) {
        return CourseResponse.from(find(courseId));
    }

    @Transactional
    public CourseResponse create(CourseCreateRequest request) {
        if (courseRepository.existsByCourseCode(request.getCourseCode())) {
            throw new ConflictException("Course code already exists: " + request.getCourseCode());
        }
        DepartmentEntity department = department(request.getDepartmentId());

        CourseEntity course = CourseEntity.builder()
                .courseCode(request.getCourseCode())
                .courseName(request.getCourseName())
                .courseDescription(request.getCourseDescription())
                .credits(request.getCredits())
                .level(request.getLevel())
                .department(department)
                .prerequisites(request.getPrerequisites())
                .build();

        course = courseRepository.save(course);
        log.info("Created course {} ({})", course.getCourseId(), course.getCourseCode());
        return CourseResponse.from(course);
    }

    @Transactional
    public CourseResponse update(Long courseId, CourseUpdateRequest request) {
        CourseEntity course = find(courseId);

        if (request.getCourseName() != null) course.setCourseName(request.getCourseName());
        if (request.getCourseDescription() != null) course.setCourseDescription(request.getCourseDescription());
        if (request.getCredits() != null) course.setCredits(request.getCredits());
        if (request.getPrerequisites() != null) course.setPrerequisites(request.getPrerequisites());
        if (request.getIsActive() != null) course.setActive(request.getIsActive());

        return CourseResponse.from(courseRepository.save(course));
    }

    @Transactional
    public void delete(Long courseId) {
        CourseEntity course = find(courseId);
        course.setActive(false);
        courseRepository.save(course);
        log.info("Course {} deactivated", courseId);
    }

    /**
     * Insert-or-update keyed by course code, used by bulk loads.
     *
     * @return true when a new course was created
     */
    @Transactional
    public boolean upsert(CourseCreateRequest request, Boolean active) {
        DepartmentEntity department = department(request.getDepartmentId());
        CourseEntity course = courseRepository.findByCourseCode(request.getCourseCode()).orElse(null);
        boolean created = course == null;
        if (created) {
            course = CourseEntity.builder().courseCode(request.getCourseCode()).build();
        }

        course.setCourseName(request.getCourseName());
        course.setCourseDescription(request.getCourseDescription());
        course.setCredits(request.getCredits());
        course.setLevel(request.getLevel());
        course.setDepartment(department);
        course.setPrerequisites(request.getPrerequisites());
        if (active != null) {
            course.setActive(active);
        }

        courseRepository.save(course);
        return created;
    }

    @Transactional(readOnly = true)
    public List<EnrollmentFactResponse> enrollments(Long courseId) {
        find(courseId);
        return enrollmentFactRepository.findByCourseCourseIdOrderByEnrollmentDateDesc(courseId).stream()
                .map(EnrollmentFactResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<PerformanceFactResponse> performance(Long courseId) {
        find(courseId);
        return performanceFactRepository.findByCourseCourseIdOrderByFactIdAsc(courseId).stream()
                .map(PerformanceFactResponse::from)
                .toList();
    }

    /**
     * Courses named in the free-text prerequisite list, in list order. Codes that match no
     * course are skipped.
     */
    @Transactional(readOnly = true)
    public List<CourseResponse> prerequisites(Long courseId) {
        List<String> codes = prerequisiteCodes(find(courseId).getPrerequisites());
        if (codes.isEmpty()) {
            return List.of();
        }

        Map<String, CourseEntity> byCode = courseRepository.findByCourseCodeIn(codes).stream()
                .collect(Collectors.toMap(CourseEntity::getCourseCode, Function.identity()));
        return codes.stream()
                .map(byCode::get)
                .filter(Objects::nonNull)
                .map(CourseResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public CourseStatistics statistics(Long courseId) {
        find(courseId);
        return metricsAggregator.courseStatistics(
                courseId,
                performanceFactRepository.aggregateByCourse(null, courseId, null, null, null, null).stream()
                        .findFirst().orElse(null),
                enrollmentFactRepository.aggregateByCourse(null, courseId, null, null, null, null).stream()
                        .findFirst().orElse(null));
    }

    static List<String> prerequisiteCodes(String prerequisites) {
        if (prerequisites == null || prerequisites.isBlank()) {
            return List.of();
        }
        return Arrays.stream(prerequisites.split(","))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .distinct()
                .toList();
    }

    private CourseEntity find(Long courseId) {
        return courseRepository.findById(courseId)
                .orElseThrow(() -> ResourceNotFoundException.of("Course", courseId));
    }

    private DepartmentEntity department(Long departmentId) {
        return departmentRepository.findById(departmentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Department", departmentId));
    }
}
