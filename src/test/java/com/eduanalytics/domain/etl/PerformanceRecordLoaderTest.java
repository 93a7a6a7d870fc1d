package com.eduanalytics.domain.etl;

import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.LetterGrade;
import com.eduanalytics.domain.model.PerformanceFactRequest;
import com.eduanalytics.domain.service.FactService;
import com.eduanalytics.infrastructure.persistence.entity.CourseEntity;
import com.eduanalytics.infrastructure.persistence.entity.StudentEntity;
import com.eduanalytics.infrastructure.persistence.repository.CourseRepository;
import com.eduanalytics.infrastructure.persistence.repository.InstructorRepository;
import com.eduanalytics.infrastructure.persistence.repository.StudentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PerformanceRecordLoaderTest {

    @Mock
    private FactService factService;

    @Mock
    private StudentRepository studentRepository;

    @Mock
    private CourseRepository courseRepository;

    @Mock
    private InstructorRepository instructorRepository;

    private PerformanceRecordLoader loader;

    @BeforeEach
    void setUp() {
        loader = new PerformanceRecordLoader(factService, studentRepository, courseRepository, instructorRepository);
    }

    @Test
    void testLoad_BusinessKeysResolved() {
        // Given
        when(studentRepository.findByStudentNumber("S001"))
                .thenReturn(Optional.of(StudentEntity.builder().studentId(1L).build()));
        when(courseRepository.findByCourseCode("PHY101"))
                .thenReturn(Optional.of(CourseEntity.builder().courseId(10L).build()));

        Map<String, String> row = baseRow();
        row.put("student_number", "S001");
        row.put("course_code", "PHY101");
        row.put("instructor_id", "5");
        row.put("letter_grade", "b+");
        row.put("assignment_score", "80");
        row.put("exam_score", "90");

        // When
        loader.load(new RecordFields(row));

        // Then
        ArgumentCaptor<PerformanceFactRequest> captor = ArgumentCaptor.forClass(PerformanceFactRequest.class);
        verify(factService).recordPerformance(captor.capture());
        PerformanceFactRequest request = captor.getValue();
        assertEquals(1L, request.getStudentId());
        assertEquals(10L, request.getCourseId());
        assertEquals(5L, request.getInstructorId());
        assertEquals(LocalDate.of(2024, 5, 20), request.getDate());
        assertEquals(LetterGrade.B_PLUS, request.getLetterGrade());
        assertNull(request.getFinalScore());
        verifyNoInteractions(instructorRepository);
    }

    @Test
    void testLoad_UnknownStudentNumber() {
        when(studentRepository.findByStudentNumber("S404")).thenReturn(Optional.empty());

        Map<String, String> row = baseRow();
        row.put("student_number", "S404");

        assertThrows(ResourceNotFoundException.class, () -> loader.load(new RecordFields(row)));
        verify(factService, never()).recordPerformance(any());
    }

    @Test
    void testLoad_GradePointsOutOfRange() {
        Map<String, String> row = baseRow();
        row.put("student_id", "1");
        row.put("course_id", "10");
        row.put("instructor_id", "5");
        row.put("grade_points", "4.5");

        assertThrows(ValidationException.class, () -> loader.load(new RecordFields(row)));
        verifyNoInteractions(factService);
    }

    @Test
    void testLoad_MissingCourseReference() {
        Map<String, String> row = baseRow();
        row.put("student_id", "1");

        ValidationException ex = assertThrows(ValidationException.class, () -> loader.load(new RecordFields(row)));
        assertEquals("Missing required field: course_id or course_code", ex.getMessage());
    }

    private static Map<String, String> baseRow() {
        Map<String, String> row = new HashMap<>();
        row.put("date", "2024-05-20");
        row.put("grade_points", "3.3");
        row.put("credits_earned", "3");
        return row;
    }
}
