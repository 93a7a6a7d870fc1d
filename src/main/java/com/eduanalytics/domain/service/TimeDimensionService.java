package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ValidationException;
import com.eduanalytics.domain.model.TimeRangeResult;
import com.eduanalytics.infrastructure.persistence.entity.TimeDimensionEntity;
import com.eduanalytics.infrastructure.persistence.repository.TimeDimensionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Maintains the time dimension as one contiguous run of dates.
 *
 * Any request that would leave a hole between the stored range and the requested dates is
 * widened to fill the hole. Rows are inserted with ON CONFLICT DO NOTHING, so two jobs
 * widening the range at the same time do not fail on the unique date index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TimeDimensionService {

    private final TimeDimensionRepository timeDimensionRepository;

    @Value("${app.time-dimension.default-start:2018-01-01}")
    private String defaultStart = "2018-01-01";

    @Value("${app.time-dimension.default-end:2030-12-31}")
    private String defaultEnd = "2030-12-31";

    /**
     * Time row for a date, generating it (and any dates between it and the stored range) when missing.
     */
    @Transactional
    public TimeDimensionEntity resolve(LocalDate date) {
        Optional<TimeDimensionEntity> existing = timeDimensionRepository.findByCalendarDate(date);
        if (existing.isPresent()) {
            return existing.get();
        }
        generateRange(date, date);
        return timeDimensionRepository.findByCalendarDate(date)
                .orElseThrow(() -> new IllegalStateException("Time row for " + date + " was not generated"));
    }

    /**
     * Range generation with the configured default bounds standing in for missing ones.
     */
    @Transactional
    public TimeRangeResult generateRangeOrDefault(LocalDate startDate, LocalDate endDate) {
        return generateRange(
                startDate != null ? startDate : LocalDate.parse(defaultStart),
                endDate != null ? endDate : LocalDate.parse(defaultEnd));
    }

    /**
     * Creates the rows of [startDate, endDate] that do not exist yet.
     */
    @Transactional
    public TimeRangeResult generateRange(LocalDate startDate, LocalDate endDate) {
        if (startDate == null || endDate == null) {
            throw new ValidationException("Both start and end date are required");
        }
        if (endDate.isBefore(startDate)) {
            throw new ValidationException("End date " + endDate + " is before start date " + startDate);
        }

        LocalDate from = startDate;
        LocalDate to = endDate;
        Optional<LocalDate> min = timeDimensionRepository.findMinDate();
        Optional<LocalDate> max = timeDimensionRepository.findMaxDate();
        if (max.isPresent() && from.isAfter(max.get().plusDays(1))) {
            from = max.get().plusDays(1);
        }
        if (min.isPresent() && to.isBefore(min.get().minusDays(1))) {
            to = min.get().minusDays(1);
        }

        Set<LocalDate> present = new HashSet<>(timeDimensionRepository.findDatesBetween(from, to));
        int created = 0;
        for (LocalDate date = from; !date.isAfter(to); date = date.plusDays(1)) {
            if (!present.contains(date)) {
                created += timeDimensionRepository.insertIfAbsent(TimeDimensionEntity.forDate(date));
            }
        }

        if (created > 0) {
            log.info("Generated {} time dimension rows between {} and {}", created, from, to);
        }

        return TimeRangeResult.builder()
                .startDate(from)
                .endDate(to)
                .rowsCreated(created)
                .build();
    }
}
