package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ConflictException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.persistence.entity.DepartmentEntity;
import com.eduanalytics.infrastructure.persistence.entity.InstructorEntity;
import com.eduanalytics.infrastructure.persistence.entity.SchoolEntity;
import com.eduanalytics.infrastructure.persistence.repository.DepartmentRepository;
import com.eduanalytics.infrastructure.persistence.repository.InstructorRepository;
import com.eduanalytics.infrastructure.persistence.repository.SchoolRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Schools, departments and instructors: the dimensions courses and facts hang off.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DimensionService {

    private final SchoolRepository schoolRepository;
    private final DepartmentRepository departmentRepository;
    private final InstructorRepository instructorRepository;

    @Transactional
    public SchoolResponse createSchool(SchoolRequest request) {
        if (schoolRepository.existsBySchoolCode(request.getSchoolCode())) {
            throw new ConflictException("School code already exists: " + request.getSchoolCode());
        }
        SchoolEntity school = schoolRepository.save(SchoolEntity.builder()
                .schoolCode(request.getSchoolCode())
                .schoolName(request.getSchoolName())
                .deanName(request.getDeanName())
                .build());
        log.info("Created school {} ({})", school.getSchoolId(), school.getSchoolCode());
        return SchoolResponse.from(school);
    }

    @Transactional(readOnly = true)
    public List<SchoolResponse> listSchools() {
        return schoolRepository.findAll(Sort.by("schoolId")).stream()
                .map(SchoolResponse::from)
                .toList();
    }

    @Transactional
    public DepartmentResponse createDepartment(DepartmentRequest request) {
        if (departmentRepository.existsByDepartmentCode(request.getDepartmentCode())) {
            throw new ConflictException("Department code already exists: " + request.getDepartmentCode());
        }
        SchoolEntity school = null;
        if (request.getSchoolId() != null) {
            school = schoolRepository.findById(request.getSchoolId())
                    .orElseThrow(() -> ResourceNotFoundException.of("School", request.getSchoolId()));
        }

        DepartmentEntity department = departmentRepository.save(DepartmentEntity.builder()
                .departmentCode(request.getDepartmentCode())
                .departmentName(request.getDepartmentName())
                .school(school)
                .budget(request.getBudget())
                .build());
        log.info("Created department {} ({})", department.getDepartmentId(), department.getDepartmentCode());
        return DepartmentResponse.from(department);
    }

    @Transactional(readOnly = true)
    public List<DepartmentResponse> listDepartments() {
        return departmentRepository.findAll(Sort.by("departmentId")).stream()
                .map(DepartmentResponse::from)
                .toList();
    }

    @Transactional
    public InstructorResponse createInstructor(InstructorRequest request) {
        if (instructorRepository.existsByInstructorNumber(request.getInstructorNumber())) {
            throw new ConflictException("Instructor number already exists: " + request.getInstructorNumber());
        }
        if (instructorRepository.existsByEmail(request.getEmail())) {
            throw new ConflictException("Email already registered: " + request.getEmail());
        }
        DepartmentEntity department = null;
        if (request.getDepartmentId() != null) {
            department = departmentRepository.findById(request.getDepartmentId())
                    .orElseThrow(() -> ResourceNotFoundException.of("Department", request.getDepartmentId()));
        }

        InstructorEntity instructor = instructorRepository.save(InstructorEntity.builder()
                .instructorNumber(request.getInstructorNumber())
                .firstName(request.getFirstName())
                .lastName(request.getLastName())
                .email(request.getEmail())
                .title(request.getTitle())
                .department(department)
                .hireDate(request.getHireDate())
                .build());
        log.info("Created instructor {} ({})", instructor.getInstructorId(), instructor.getInstructorNumber());
        return InstructorResponse.from(instructor);
    }

    @Transactional(readOnly = true)
    public List<InstructorResponse> listInstructors() {
        return instructorRepository.findAll(Sort.by("instructorId")).stream()
                .map(InstructorResponse::from)
                .toList();
    }
}
