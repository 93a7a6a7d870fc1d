package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.persistence.entity.*;
import com.eduanalytics.infrastructure.persistence.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FactService.
 *
 * Pass flags must come from the final score, never from the request.
 */
@ExtendWith(MockitoExtension.class)
class FactServiceTest {

    private static final LocalDate CLASS_DATE = LocalDate.of(2024, 3, 4);

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private InstructorRepository instructorRepository;

    @Mock
    private PerformanceFactRepository performanceFactRepository;

    @Mock
    private EnrollmentFactRepository enrollmentFactRepository;

    @Mock
    private AttendanceFactRepository attendanceFactRepository;

    @Mock
    private TimeDimensionService timeDimensionService;

    private FactService factService;

    private StudentEntity student;
    private CourseEntity course;

    @BeforeEach
    void setUp() {
        factService = new FactService(studentRepository, courseRepository, instructorRepository,
                performanceFactRepository, enrollmentFactRepository, attendanceFactRepository, timeDimensionService);
        student = StudentEntity.builder().studentId(1L).studentNumber("S001").build();
        course = CourseEntity.builder().courseId(10L).courseCode("PHY101").courseName("Physics").build();
    }

    @Test
    void testRecordPerformance_FailingScoreIgnoresSuppliedPassFlag() {
        // Given
        stubPerformanceDependencies();
        when(performanceFactRepository.averageGradePoints(1L)).thenReturn(1.0);
        when(performanceFactRepository.sumCreditsEarned(1L)).thenReturn(0L);

        PerformanceFactRequest request = performanceRequest(59.0);
        request.setIsPass(true);

        // When
        PerformanceFactResponse response = factService.recordPerformance(request);

        // Then
        assertFalse(response.getIsPass());
        assertEquals(59.0, response.getFinalScore());
    }

    @Test
    void testRecordPerformance_PassingScore() {
        // Given
        stubPerformanceDependencies();
        when(performanceFactRepository.averageGradePoints(1L)).thenReturn(3.456);
        when(performanceFactRepository.sumCreditsEarned(1L)).thenReturn(7L);

        PerformanceFactRequest request = performanceRequest(85.0);
        request.setIsPass(false);

        // When
        PerformanceFactResponse response = factService.recordPerformance(request);

        // Then
        assertTrue(response.getIsPass());
        assertEquals(LetterGrade.A_MINUS, response.getLetterGrade());
        assertEquals(3.46, student.getGpa());
        assertEquals(7, student.getCreditsCompleted());
        verify(studentRepository).save(student);
    }

    @Test
    void testRecordPerformance_FinalScoreDerivedFromComponents() {
        // Given
        stubPerformanceDependencies();
        when(performanceFactRepository.averageGradePoints(1L)).thenReturn(3.5);
        when(performanceFactRepository.sumCreditsEarned(1L)).thenReturn(3L);

        PerformanceFactRequest request = performanceRequest(null);
        request.setAssignmentScore(50.0);
        request.setExamScore(65.0);

        // When
        PerformanceFactResponse response = factService.recordPerformance(request);

        // Then - 0.4 * 50 + 0.6 * 65 = 59.0
        assertEquals(59.0, response.getFinalScore());
        assertFalse(response.getIsPass());
    }

    @Test
    void testRecordPerformance_NoScoreRejectedBeforeSave() {
        // Given
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(instructorRepository.findById(5L)).thenReturn(Optional.of(InstructorEntity.builder().instructorId(5L).build()));

        // When / Then
        assertThrows(ValidationException.class, () -> factService.recordPerformance(performanceRequest(null)));
        verify(performanceFactRepository, never()).save(any());
    }

    @Test
    void testRecordPerformance_UnknownStudentIsNotFound() {
        when(studentRepository.findById(1L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> factService.recordPerformance(performanceRequest(70.0)));
        verify(performanceFactRepository, never()).save(any());
    }

    @Test
    void testRecordEnrollment_DropDateImpliesDropped() {
        // Given
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(timeDimensionService.resolve(CLASS_DATE)).thenReturn(TimeDimensionEntity.forDate(CLASS_DATE));
        when(enrollmentFactRepository.save(any(EnrollmentFactEntity.class))).thenAnswer(inv -> inv.getArgument(0));

        EnrollmentFactRequest request = EnrollmentFactRequest.builder()
                .studentId(1L)
                .courseId(10L)
                .enrollmentDate(CLASS_DATE)
                .dropDate(CLASS_DATE.plusDays(14))
                .build();

        // When
        EnrollmentFactResponse response = factService.recordEnrollment(request);

        // Then
        assertTrue(response.getIsDropped());
        assertFalse(response.getIsCompleted());
    }

    private void stubPerformanceDependencies() {
        when(studentRepository.findById(1L)).thenReturn(Optional.of(student));
        when(courseRepository.findById(10L)).thenReturn(Optional.of(course));
        when(instructorRepository.findById(5L)).thenReturn(Optional.of(InstructorEntity.builder().instructorId(5L).build()));
        when(timeDimensionService.resolve(CLASS_DATE)).thenReturn(TimeDimensionEntity.forDate(CLASS_DATE));
        when(performanceFactRepository.save(any(PerformanceFactEntity.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private static PerformanceFactRequest performanceRequest(Double finalScore) {
        return PerformanceFactRequest.builder()
                .studentId(1L)
                .courseId(10L)
                .instructorId(5L)
                .date(CLASS_DATE)
                .gradePoints(3.5)
                .creditsEarned(3)
                .finalScore(finalScore)
                .build();
    }
}
