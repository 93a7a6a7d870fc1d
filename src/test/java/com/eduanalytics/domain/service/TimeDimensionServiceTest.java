package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.TimeRangeResult;
import com.eduanalytics.infrastructure.persistence.entity.TimeDimensionEntity;
import com.eduanalytics.infrastructure.persistence.repository.TimeDimensionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TimeDimensionServiceTest {

    @Mock
    private TimeDimensionRepository timeDimensionRepository;

    @Captor
    private ArgumentCaptor<TimeDimensionEntity> rowCaptor;

    private TimeDimensionService timeDimensionService;

    @BeforeEach
    void setUp() {
        timeDimensionService = new TimeDimensionService(timeDimensionRepository);
    }

    @Test
    void testGenerateRange_OnlyMissingDatesCreated() {
        // Given
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 5);
        when(timeDimensionRepository.findMinDate()).thenReturn(Optional.of(LocalDate.of(2024, 1, 2)));
        when(timeDimensionRepository.findMaxDate()).thenReturn(Optional.of(LocalDate.of(2024, 1, 3)));
        when(timeDimensionRepository.findDatesBetween(start, end))
                .thenReturn(List.of(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3)));
        when(timeDimensionRepository.insertIfAbsent(any(TimeDimensionEntity.class))).thenReturn(1);

        // When
        TimeRangeResult result = timeDimensionService.generateRange(start, end);

        // Then
        assertEquals(3, result.getRowsCreated());
        verify(timeDimensionRepository, times(3)).insertIfAbsent(rowCaptor.capture());
        assertEquals(List.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 5)),
                rowCaptor.getAllValues().stream().map(TimeDimensionEntity::getCalendarDate).toList());
    }

    @Test
    void testGenerateRange_WidenedToKeepRangeContiguous() {
        // Given - stored range ends 2024-01-10, request starts five days later
        LocalDate start = LocalDate.of(2024, 1, 15);
        LocalDate end = LocalDate.of(2024, 1, 16);
        when(timeDimensionRepository.findMinDate()).thenReturn(Optional.of(LocalDate.of(2024, 1, 1)));
        when(timeDimensionRepository.findMaxDate()).thenReturn(Optional.of(LocalDate.of(2024, 1, 10)));
        when(timeDimensionRepository.findDatesBetween(LocalDate.of(2024, 1, 11), end)).thenReturn(List.of());
        when(timeDimensionRepository.insertIfAbsent(any(TimeDimensionEntity.class))).thenReturn(1);

        // When
        TimeRangeResult result = timeDimensionService.generateRange(start, end);

        // Then
        assertEquals(LocalDate.of(2024, 1, 11), result.getStartDate());
        assertEquals(6, result.getRowsCreated());
    }

    @Test
    void testGenerateRange_NothingMissingSavesNothing() {
        LocalDate day = LocalDate.of(2024, 1, 1);
        when(timeDimensionRepository.findMinDate()).thenReturn(Optional.of(day));
        when(timeDimensionRepository.findMaxDate()).thenReturn(Optional.of(day));
        when(timeDimensionRepository.findDatesBetween(day, day)).thenReturn(List.of(day));

        TimeRangeResult result = timeDimensionService.generateRange(day, day);

        assertEquals(0, result.getRowsCreated());
        verify(timeDimensionRepository, never()).insertIfAbsent(any());
    }

    @Test
    void testGenerateRange_EndBeforeStartRejected() {
        assertThrows(ValidationException.class, () -> timeDimensionService.generateRange(
                LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)));
        verifyNoInteractions(timeDimensionRepository);
    }

    @Test
    void testGenerateRangeOrDefault_MissingBoundsUseDefaults() {
        when(timeDimensionRepository.findMinDate()).thenReturn(Optional.empty());
        when(timeDimensionRepository.findMaxDate()).thenReturn(Optional.empty());
        when(timeDimensionRepository.findDatesBetween(LocalDate.of(2018, 1, 1), LocalDate.of(2018, 1, 3)))
                .thenReturn(List.of());
        when(timeDimensionRepository.insertIfAbsent(any(TimeDimensionEntity.class))).thenReturn(1);

        TimeRangeResult result = timeDimensionService.generateRangeOrDefault(null, LocalDate.of(2018, 1, 3));

        assertEquals(LocalDate.of(2018, 1, 1), result.getStartDate());
        assertEquals(3, result.getRowsCreated());
    }

    @Test
    void testResolve_ExistingRowReturned() {
        LocalDate day = LocalDate.of(2024, 1, 1);
        TimeDimensionEntity row = TimeDimensionEntity.forDate(day);
        when(timeDimensionRepository.findByCalendarDate(day)).thenReturn(Optional.of(row));

        assertSame(row, timeDimensionService.resolve(day));
        verify(timeDimensionRepository, never()).insertIfAbsent(any());
    }

    @Test
    void testGenerateRange_DatesWrittenConcurrentlyNotCounted() {
        // Given - another job inserted 2024-01-02 after the existing dates were read
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 1, 3);
        when(timeDimensionRepository.findMinDate()).thenReturn(Optional.empty());
        when(timeDimensionRepository.findMaxDate()).thenReturn(Optional.empty());
        when(timeDimensionRepository.findDatesBetween(start, end)).thenReturn(List.of());
        when(timeDimensionRepository.insertIfAbsent(any(TimeDimensionEntity.class)))
                .thenReturn(1, 0, 1);

        // When
        TimeRangeResult result = timeDimensionService.generateRange(start, end);

        // Then
        assertEquals(2, result.getRowsCreated());
        verify(timeDimensionRepository, times(3)).insertIfAbsent(any(TimeDimensionEntity.class));
    }

    @Test
    void testResolve_RowInsertedByConcurrentJobIsReRead() {
        // Given - the date is missing on the first read and written by someone else meanwhile
        LocalDate day = LocalDate.of(2024, 1, 1);
        TimeDimensionEntity row = TimeDimensionEntity.forDate(day);
        when(timeDimensionRepository.findByCalendarDate(day))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(row));
        when(timeDimensionRepository.findMinDate()).thenReturn(Optional.empty());
        when(timeDimensionRepository.findMaxDate()).thenReturn(Optional.empty());
        when(timeDimensionRepository.findDatesBetween(day, day)).thenReturn(List.of());
        when(timeDimensionRepository.insertIfAbsent(any(TimeDimensionEntity.class))).thenReturn(0);

        // When
        TimeDimensionEntity resolved = timeDimensionService.resolve(day);

        // Then
        assertSame(row, resolved);
    }
}
