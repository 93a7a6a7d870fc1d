package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.domain.model.FeedbackFilter;
import com.eduanalytics.domain.model.SentimentBucket;
import com.eduanalytics.domain.model.TagCount;
import com.eduanalytics.domain.model.TrendPeriod;
import com.eduanalytics.domain.model.TrendPoint;
import com.eduanalytics.infrastructure.document.model.FeedbackDocument;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Map;

/**
 * Filtered reads and aggregation pipelines over feedback.
 */
public interface FeedbackRepositoryCustom {

    String UNKNOWN_SENTIMENT = "unknown";

    Page<FeedbackDocument> findPage(FeedbackFilter filter, Pageable pageable);

    /**
     * Count and mean rating per sentiment label, largest group first, ties by label.
     * Documents without a label are grouped under {@value #UNKNOWN_SENTIMENT}.
     */
    List<SentimentBucket> sentimentDistribution(FeedbackFilter filter);

    /**
     * Count per rating value, ascending; ratings that never occur are absent.
     */
    Map<Integer, Long> ratingCounts(FeedbackFilter filter);

    /**
     * Calendar buckets of the creation date (UTC) with count and mean rating, oldest first.
     */
    List<TrendPoint> trend(FeedbackFilter filter, TrendPeriod period);

    /**
     * Most used tags, count descending, ties by tag name.
     */
    List<TagCount> popularTags(FeedbackFilter filter, int limit);

    /**
     * Mean rating of the matching feedback, 0 when none is rated.
     */
    double averageRating(FeedbackFilter filter);
}
