package com.eduanalytics.domain.service;

import com.eduanalytics.domain.exception.ResourceNotFoundException;
import com.eduanalytics.domain.model.*;
import com.eduanalytics.infrastructure.document.model.FeedbackDocument;
import com.eduanalytics.infrastructure.document.repository.FeedbackRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class FeedbackService {

    public static final int DEFAULT_TAG_LIMIT = 20;
    public static final int MAX_TAG_LIMIT = 100;

    private final FeedbackRepository feedbackRepository;

    public PageResponse<FeedbackDocument> list(int page, int size, FeedbackFilter filter) {
        return PageResponse.of(
                feedbackRepository.findPage(filter, PageRequest.of(page - 1, size)),
                document -> document);
    }

    public FeedbackDocument get(String id) {
        return feedbackRepository.findById(id)
                .orElseThrow(() -> ResourceNotFoundException.of("Feedback", id));
    }

    public FeedbackDocument create(FeedbackRequest request) {
        FeedbackDocument saved = feedbackRepository.save(toDocument(request, Instant.now()));
        log.debug("Stored feedback {} for student {} course {}", saved.getId(), saved.getStudentId(), saved.getCourseId());
        return saved;
    }

    /**
     * @return number of documents inserted
     */
    public int bulkImport(List<FeedbackRequest> requests) {
        if (requests.isEmpty()) {
            return 0;
        }
        Instant now = Instant.now();
        List<FeedbackDocument> documents = requests.stream()
                .map(r -> toDocument(r, now))
                .toList();
        int inserted = feedbackRepository.insert(documents).size();
        log.info("Bulk imported {} feedback documents", inserted);
        return inserted;
    }

    public List<SentimentBucket> sentiment(FeedbackFilter filter) {
        return feedbackRepository.sentimentDistribution(filter);
    }

    public TrendSeries trends(FeedbackFilter filter, TrendPeriod period) {
        return TrendSeries.builder()
                .metric("feedback")
                .period(period)
                .trends(feedbackRepository.trend(filter, period))
                .build();
    }

    public RatingDistribution ratings(FeedbackFilter filter) {
        Map<String, Long> ratings = new LinkedHashMap<>();
        feedbackRepository.ratingCounts(filter).forEach((rating, count) -> ratings.put(String.valueOf(rating), count));
        return RatingDistribution.builder()
                .ratings(ratings)
                .total(ratings.values().stream().mapToLong(Long::longValue).sum())
                .build();
    }

    public List<TagCount> popularTags(FeedbackFilter filter, Integer limit) {
        return feedbackRepository.popularTags(filter, clampTagLimit(limit));
    }

    public static int clampTagLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_TAG_LIMIT;
        }
        return Math.max(1, Math.min(MAX_TAG_LIMIT, limit));
    }

    private FeedbackDocument toDocument(FeedbackRequest request, Instant now) {
        return FeedbackDocument.builder()
                .studentId(request.getStudentId())
                .courseId(request.getCourseId())
                .feedbackType(request.getFeedbackType())
                .rating(request.getRating())
                .comment(request.getComment())
                .sentiment(request.getSentiment() == null || request.getSentiment().isBlank()
                        ? null : request.getSentiment())
                .tags(request.getTags() != null ? new ArrayList<>(request.getTags()) : new ArrayList<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
