package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ConflictException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.persistence.entity.StudentEntity;
import com.eduanalytics.infrastructure.persistence.repository.EnrollmentFactRepository;
import com.eduanalytics.infrastructure.persistence.repository.PerformanceFactRepository;
import com.eduanalytics.infrastructure.persistence.repository.StudentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Student dimension management. Students are never removed; delete moves them to DROPPED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StudentService {

    private final StudentRepository studentRepository;
    private final PerformanceFactRepository performanceFactRepository;
    private final EnrollmentFactRepository enrollmentFactRepository;
    private final MetricsAggregator metricsAggregator;

    @Transactional(readOnly = true)
    public PageResponse<StudentResponse> list(int page, int size, String search, StudentStatus status, String major) {
        return PageResponse.of(
                studentRepository.search(likePattern(search), status, blankToNull(major),
                        PageRequest.of(page - 1, size, Sort.by("studentId"))),
                StudentResponse::from);
    }

    @Transactional(readOnly = true)
    public StudentResponse get(Long studentId) {
        return StudentResponse.from(find(studentId));
    }

    @Transactional
    public StudentResponse create(StudentCreateRequest request) {
        if (studentRepository.existsByStudentNumber(request.getStudentNumber())) {
            throw new ConflictException("Student number already registered: " + request.getStudentNumber());
        }
        if (studentRepository.existsByEmail(request.getEmail())) {
            throw new ConflictException("Email already registered: " + request.getEmail());
        }

        StudentEntity student = StudentEntity.builder()
                .studentNumber(request.getStudentNumber())
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(request.getEmail())
                .dateOfBirth(request.getDateOfBirth())
                .gender(request.getGender())
                .ethnicity(request.getEthnicity())
                .major(request.getMajor())
                .minor(request.getMinor())
                .enrollmentDate(request.getEnrollmentDate())
                .status(request.getStatus() != null ? request.getStatus() : StudentStatus.ACTIVE)
                .build();

        student = studentRepository.save(student);
        log.info("Created student {} ({})", student.getStudentId(), student.getStudentNumber());
        return StudentResponse.from(student);
    }

    /**
     * Applies only the non-null fields of the request.
     */
    @Transactional
    public StudentResponse update(Long studentId, StudentUpdateRequest request) {
        StudentEntity student = find(studentId);

        if (request.getEmail() != null && !request.getEmail().equals(student.getEmail())
                && studentRepository.existsByEmailAndStudentIdNot(request.getEmail(), studentId)) {
            throw new ConflictException("Email already registered: " + request.getEmail());
        }

        if (request.getFirstName() != null) student.setFirstName(request.getFirstName());
        if (request.getLastName() != null) student.setLastName(request.getLastName());
        if (request.getEmail() != null) student.setEmail(request.getEmail());
        if (request.getMajor() != null) student.setMajor(request.getMajor());
        if (request.getMinor() != null) student.setMinor(request.getMinor());
        if (request.getStatus() != null) student.setStatus(request.getStatus());
        if (request.getGraduationDate() != null) student.setGraduationDate(request.getGraduationDate());

        return StudentResponse.from(studentRepository.save(student));
    }

    @Transactional
    public void delete(Long studentId) {
        StudentEntity student = find(studentId);
        student.setStatus(StudentStatus.DROPPED);
        studentRepository.save(student);
        log.info("Student {} marked as dropped", studentId);
    }

    /**
     * Insert-or-update keyed by student number, used by bulk loads.
     *
     * @return true when a new student was created
     */
    @Transactional
    public boolean upsert(StudentCreateRequest request, LocalDate graduationDate) {
        StudentEntity student = studentRepository.findByStudentNumber(request.getStudentNumber()).orElse(null);
        boolean created = student == null;

        if (created) {
            if (studentRepository.existsByEmail(request.getEmail())) {
                throw new ConflictException("Email already registered: " + request.getEmail());
            }
            student = StudentEntity.builder().studentNumber(request.getStudentNumber()).build();
        } else if (!request.getEmail().equals(student.getEmail())
                && studentRepository.existsByEmailAndStudentIdNot(request.getEmail(), student.getStudentId())) {
            throw new ConflictException("Email already registered: " + request.getEmail());
        }

        student.setFirstName(request.getFirstName());
        student.setLastName(request.getLastName());
        student.setEmail(request.getEmail());
        student.setDateOfBirth(request.getDateOfBirth());
        student.setGender(request.getGender());
        student.setEthnicity(request.getEthnicity());
        student.setMajor(request.getMajor());
        student.setMinor(request.getMinor());
        student.setEnrollmentDate(request.getEnrollmentDate());
        if (request.getStatus() != null) {
            student.setStatus(request.getStatus());
        }
        if (graduationDate != null) {
            student.setGraduationDate(graduationDate);
        }

        studentRepository.save(student);
        return created;
    }

    @Transactional(readOnly = true)
    public List<PerformanceFactResponse> performance(Long studentId) {
        find(studentId);
        return performanceFactRepository.findByStudentStudentIdOrderByFactIdAsc(studentId).stream()
                .map(PerformanceFactResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<EnrollmentFactResponse> enrollments(Long studentId) {
        find(studentId);
        return enrollmentFactRepository.findByStudentStudentIdOrderByEnrollmentDateDesc(studentId).stream()
                .map(EnrollmentFactResponse::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public StudentStatistics statistics(Long studentId) {
        find(studentId);
        return metricsAggregator.studentStatistics(
                studentId,
                performanceFactRepository.aggregateByStudent(studentId, null, null, null).stream()
                        .findFirst().orElse(null),
                enrollmentFactRepository.aggregateByStudent(studentId, null, null, null).stream()
                        .findFirst().orElse(null));
    }

    private StudentEntity find(Long studentId) {
        return studentRepository.findById(studentId)
                .orElseThrow(() -> ResourceNotFoundException.of("Student", studentId));
    }

    static String likePattern(String search) {
        if (search == null || search.isBlank()) {
            return null;
        }
        return "%" + search.trim().toLowerCase(Locale.ROOT) + "%";
    }

    static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
