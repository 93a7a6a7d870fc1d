package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ConflictException;
import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.CourseCreateRequest;
import com.eduanalytics.domain.model.CourseLevel;
import com.eduanalytics.domain.model.CourseResponse;
import com.eduanalytics.domain.model.CourseUpdateRequest;
import com.eduanalytics.infrastructure.persistence.entity.CourseEntity;
import com.eduanalytics.infrastructure.persistence.entity.DepartmentEntity;
import com.eduanalytics.infrastructure.persistence.repository.CourseRepository;
import com.eduanalytics.infrastructure.persistence.repository.DepartmentRepository;
import com.eduanalytics.infrastructure.persistence.repository.EnrollmentFactRepository;
import com.eduanalytics.infrastructure.persistence.repository.PerformanceFactRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CourseServiceTest {

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private DepartmentRepository departmentRepository;

    @Mock
    private PerformanceFactRepository performanceFactRepository;

    @Mock
    private EnrollmentFactRepository enrollmentFactRepository;

    @Mock
    private MetricsAggregator metricsAggregator;

    private CourseService courseService;

    private DepartmentEntity physics;

    @BeforeEach
    void setUp() {
        courseService = new CourseService(courseRepository, departmentRepository,
                performanceFactRepository, enrollmentFactRepository, metricsAggregator);
        physics = DepartmentEntity.builder().departmentId(3L).departmentCode("PHY").build();
    }

    @Test
    void testCreate_ActiveByDefault() {
        // Given
        when(courseRepository.existsByCourseCode("PHY101")).thenReturn(false);
        when(departmentRepository.findById(3L)).thenReturn(Optional.of(physics));
        when(courseRepository.save(any(CourseEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        CourseResponse response = courseService.create(createRequest("PHY101"));

        // Then
        assertTrue(response.getIsActive());
        assertEquals(3L, response.getDepartmentId());
        assertEquals(CourseLevel.UNDERGRADUATE, response.getLevel());
    }

    @Test
    void testCreate_DuplicateCode() {
        when(courseRepository.existsByCourseCode("PHY101")).thenReturn(true);

        assertThrows(ConflictException.class, () -> courseService.create(createRequest("PHY101")));
        verify(courseRepository, never()).save(any());
    }

    @Test
    void testCreate_UnknownDepartment() {
        when(courseRepository.existsByCourseCode("PHY101")).thenReturn(false);
        when(departmentRepository.findById(3L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> courseService.create(createRequest("PHY101")));
        verify(courseRepository, never()).save(any());
    }

    @Test
    void testUpdate_CanReactivate() {
        // Given
        CourseEntity course = course("PHY101", null);
        course.setActive(false);
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(courseRepository.save(course)).thenReturn(course);

        // When
        CourseResponse response = courseService.update(10L, CourseUpdateRequest.builder().isActive(true).build());

        // Then
        assertTrue(response.getIsActive());
        assertEquals("Physics I", response.getCourseName());
    }

    @Test
    void testDelete_Deactivates() {
        // Given
        CourseEntity course = course("PHY101", null);
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));

        // When
        courseService.delete(10L);

        // Then
        assertFalse(course.isActive());
        verify(courseRepository).save(course);
        verify(courseRepository, never()).delete(any());
    }

    @Test
    void testPrerequisites_ListOrderAndUnknownCodesSkipped() {
        // Given
        CourseEntity advanced = course("PHY301", "PHY201, MTH101 ,,PHY999");
        when(courseRepository.findById(10L)).thenReturn(Optional.of(advanced));
        when(courseRepository.findByCourseCodeIn(List.of("PHY201", "MTH101", "PHY999")))
                .thenReturn(List.of(course("MTH101", null), course("PHY201", null)));

        // When
        List<CourseResponse> prerequisites = courseService.prerequisites(10L);

        // Then
        assertEquals(List.of("PHY201", "MTH101"),
                prerequisites.stream().map(CourseResponse::getCourseCode).toList());
    }

    @Test
    void testPrerequisites_NoneDeclared() {
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course("PHY101", "  ")));

        assertTrue(courseService.prerequisites(10L).isEmpty());
        verify(courseRepository, never()).findByCourseCodeIn(any());
    }

    @Test
    void testUpsert_KeepsActiveFlagWhenNotSupplied() {
        // Given
        CourseEntity existing = course("PHY101", null);
        existing.setActive(false);
        when(departmentRepository.findById(3L)).thenReturn(Optional.of(physics));
        when(courseRepository.findByCourseCode("PHY101")).thenReturn(Optional.of(existing));

        // When
        boolean created = courseService.upsert(createRequest("PHY101"), null);

        // Then
        assertFalse(created);
        assertFalse(existing.isActive());
        assertEquals("Physics I", existing.getCourseName());
        verify(courseRepository).save(existing);
    }

    private CourseCreateRequest createRequest(String code) {
        return CourseCreateRequest.builder()
                .courseCode(code)
                .courseName("Physics I")
                .credits(4)
                .level(CourseLevel.UNDERGRADUATE)
                .departmentId(3L)
                .build();
    }

    private CourseEntity course(String code, String prerequisites) {
        return CourseEntity.builder()
                .courseId(10L)
                .courseCode(code)
                .courseName("Physics I")
                .credits(4)
                .level(CourseLevel.UNDERGRADUATE)
                .department(physics)
                .prerequisites(prerequisites)
                .build();
    }
}
