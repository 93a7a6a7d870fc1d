package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.domain.model.FeedbackFilter;
import com.eduanalytics.domain.model.SentimentBucket;
import com.eduanalytics.domain.model.TagCount;
import com.eduanalytics.domain.model.TrendPeriod;
import com.eduanalytics.domain.model.TrendPoint;
import com.eduanalytics.infrastructure.document.model.FeedbackDocument;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.query.Query;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the feedback aggregation pipelines.
 *
 * MongoTemplate is mocked; the tests check the stages sent to the server and the mapping of
 * the grouped results.
 */
@ExtendWith(MockitoExtension.class)
class FeedbackRepositoryCustomImplTest {

    @Mock
    private MongoTemplate mongoTemplate;

    private FeedbackRepositoryCustomImpl repository;

    @BeforeEach
    void setUp() {
        repository = new FeedbackRepositoryCustomImpl(mongoTemplate);
    }

    @Test
    void testPopularTags_GroupedAndLimitedInPipeline() {
        // Given
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(FeedbackDocument.class), eq(TagCount.class)))
                .thenReturn(new AggregationResults<>(List.of(new TagCount("labs", 10000)), new Document()));

        // When
        List<TagCount> tags = repository.popularTags(FeedbackFilter.builder().build(), 1);

        // Then - only the grouped result is returned, no documents are listed
        assertEquals(List.of(new TagCount("labs", 10000)), tags);
        verify(mongoTemplate, never()).find(any(Query.class), eq(FeedbackDocument.class));

        List<Document> stages = pipeline(TagCount.class);
        assertTrue(stages.get(0).containsKey("$match"));
        assertEquals("$tags", stages.get(1).get("$unwind"));
        assertEquals("$tags", ((Document) stages.get(3).get("$group")).get("_id"));
        assertEquals(1L, ((Number) stages.get(stages.size() - 1).get("$limit")).longValue());
    }

    @Test
    void testSentimentDistribution_MissingLabelBecomesUnknownInStore() {
        // Given
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(FeedbackDocument.class), eq(SentimentBucket.class)))
                .thenReturn(new AggregationResults<>(List.of(
                        new SentimentBucket("positive", 3, 4.5),
                        new SentimentBucket(FeedbackRepositoryCustom.UNKNOWN_SENTIMENT, 1, 2.0)), new Document()));

        // When
        List<SentimentBucket> buckets = repository.sentimentDistribution(FeedbackFilter.builder().courseId(10L).build());

        // Then
        assertEquals(2, buckets.size());
        List<Document> stages = pipeline(SentimentBucket.class);
        Document match = (Document) stages.get(0).get("$match");
        assertEquals(List.of(new Document("courseId", 10L)), match.get("$and"));
        Document sentiment = (Document) ((Document) stages.get(1).get("$project")).get("sentiment");
        assertEquals(List.of("$sentiment", "unknown"), sentiment.get("$ifNull"));
        assertTrue(stages.get(2).containsKey("$group"));
    }

    @Test
    void testTrend_BucketLabelledByDateToString() {
        // Given
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(FeedbackDocument.class), eq(TrendPoint.class)))
                .thenReturn(new AggregationResults<>(List.of(
                        TrendPoint.builder().period("2024-W10").count(2).average(4.0).build()), new Document()));

        // When
        List<TrendPoint> points = repository.trend(FeedbackFilter.builder().build(), TrendPeriod.WEEKLY);

        // Then
        assertEquals("2024-W10", points.get(0).getPeriod());
        Document period = (Document) ((Document) pipeline(TrendPoint.class).get(1).get("$project")).get("period");
        Document dateToString = (Document) period.get("$dateToString");
        assertEquals("%G-W%V", dateToString.get("format"));
    }

    @Test
    void testRatingCounts_UnratedExcludedAndMapped() {
        // Given
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(FeedbackDocument.class), eq(Document.class)))
                .thenReturn(new AggregationResults<>(List.of(
                        new Document("_id", 2).append("count", 1),
                        new Document("_id", 5).append("count", 3)), new Document()));

        // When
        Map<Integer, Long> counts = repository.ratingCounts(FeedbackFilter.builder().build());

        // Then
        assertEquals(List.of(2, 5), List.copyOf(counts.keySet()));
        assertEquals(3L, counts.get(5));
        Document match = (Document) pipeline(Document.class).get(0).get("$match");
        assertTrue(((Document) match.get("rating")).containsKey("$ne"));
    }

    @Test
    void testAverageRating_SingleGroupOrZero() {
        when(mongoTemplate.aggregate(any(Aggregation.class), eq(FeedbackDocument.class), eq(Document.class)))
                .thenReturn(new AggregationResults<>(List.of(new Document("average", 4.25)), new Document()))
                .thenReturn(new AggregationResults<>(List.of(), new Document()));

        FeedbackFilter filter = FeedbackFilter.builder()
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 12, 31))
                .build();

        assertEquals(4.25, repository.averageRating(filter));
        assertEquals(0.0, repository.averageRating(filter));
    }

    private <T> List<Document> pipeline(Class<T> outputType) {
        ArgumentCaptor<Aggregation> captor = ArgumentCaptor.forClass(Aggregation.class);
        verify(mongoTemplate, atLeastOnce()).aggregate(captor.capture(), eq(FeedbackDocument.class), eq(outputType));
        return captor.getValue().toPipeline(Aggregation.DEFAULT_CONTEXT);
    }
}
