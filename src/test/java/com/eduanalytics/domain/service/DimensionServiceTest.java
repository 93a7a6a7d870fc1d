package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ConflictException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.DepartmentRequest;
import com.eduanalytics.domain.model.DepartmentResponse;
import com.eduanalytics.infrastructure.persistence.entity.DepartmentEntity;
import com.eduanalytics.infrastructure.persistence.entity.SchoolEntity;
import com.eduanalytics.infrastructure.persistence.repository.DepartmentRepository;
import com.eduanalytics.infrastructure.persistence.repository.InstructorRepository;
import com.eduanalytics.infrastructure.persistence.repository.SchoolRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DimensionServiceTest {

    @Mock
    private SchoolRepository schoolRepository;

    @Mock
    private DepartmentRepository departmentRepository;

    @Mock
    private InstructorRepository instructorRepository;

    private DimensionService dimensionService;

    @BeforeEach
    void setUp() {
        dimensionService = new DimensionService(schoolRepository, departmentRepository, instructorRepository);
    }

    @Test
    void testCreateDepartment_LinkedToSchool() {
        // Given
        SchoolEntity school = SchoolEntity.builder().schoolId(2L).schoolCode("SCI").build();
        when(departmentRepository.existsByDepartmentCode("PHY")).thenReturn(false);
        when(schoolRepository.findById(2L)).thenReturn(Optional.of(school));
        when(departmentRepository.save(any(DepartmentEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        DepartmentResponse response = dimensionService.createDepartment(request(2L));

        // Then
        assertEquals(2L, response.getSchoolId());
        assertTrue(response.getIsActive());
    }

    @Test
    void testCreateDepartment_UnknownSchool() {
        when(departmentRepository.existsByDepartmentCode("PHY")).thenReturn(false);
        when(schoolRepository.findById(2L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> dimensionService.createDepartment(request(2L)));
        verify(departmentRepository, never()).save(any());
    }

    @Test
    void testCreateDepartment_DuplicateCode() {
        when(departmentRepository.existsByDepartmentCode("PHY")).thenReturn(true);

        assertThrows(ConflictException.class, () -> dimensionService.createDepartment(request(null)));
        verifyNoInteractions(schoolRepository);
    }

    private static DepartmentRequest request(Long schoolId) {
        return DepartmentRequest.builder()
                .departmentCode("PHY")
                .departmentName("Physics")
                .schoolId(schoolId)
                .build();
    }
}
