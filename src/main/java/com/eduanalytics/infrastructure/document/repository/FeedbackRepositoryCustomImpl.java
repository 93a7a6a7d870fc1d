package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.domain.model.FeedbackFilter;
import com.eduanalytics.domain.model.SentimentBucket;
import com.eduanalytics.domain.model.TagCount;
import com.eduanalytics.domain.model.TrendPeriod;
import com.eduanalytics.domain.model.TrendPoint;
import com.eduanalytics.infrastructure.document.model.FeedbackDocument;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.aggregation.DateOperators;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.support.PageableExecutionUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.springframework.data.mongodb.core.aggregation.Aggregation.*;

/**
 * Grouping runs inside MongoDB; only the grouped results cross the wire.
 */
@RequiredArgsConstructor
public class FeedbackRepositoryCustomImpl implements FeedbackRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Page<FeedbackDocument> findPage(FeedbackFilter filter, Pageable pageable) {
        Query query = toQuery(filter).with(pageable);
        if (pageable.getSort().isUnsorted()) {
            query.with(Sort.by(Sort.Direction.DESC, "createdAt"));
        }
        List<FeedbackDocument> content = mongoTemplate.find(query, FeedbackDocument.class);
        return PageableExecutionUtils.getPage(content, pageable,
                () -> mongoTemplate.count(toQuery(filter), FeedbackDocument.class));
    }

    @Override
    public List<SentimentBucket> sentimentDistribution(FeedbackFilter filter) {
        Aggregation aggregation = newAggregation(
                match(toCriteria(filter)),
                project("rating")
                        .and(ConditionalOperators.ifNull("sentiment").then(UNKNOWN_SENTIMENT)).as("sentiment"),
                group("sentiment").count().as("count").avg("rating").as("averageRating"),
                project("count", "averageRating").and("sentiment").previousOperation(),
                sort(Sort.by(Sort.Order.desc("count"), Sort.Order.asc("sentiment"))));

        return mongoTemplate.aggregate(aggregation, FeedbackDocument.class, SentimentBucket.class)
                .getMappedResults();
    }

    @Override
    public Map<Integer, Long> ratingCounts(FeedbackFilter filter) {
        Aggregation aggregation = newAggregation(
                match(toCriteria(filter).and("rating").ne(null)),
                group("rating").count().as("count"),
                sort(Sort.Direction.ASC, "_id"));

        Map<Integer, Long> counts = new LinkedHashMap<>();
        for (Document row : mongoTemplate.aggregate(aggregation, FeedbackDocument.class, Document.class)) {
            counts.put(((Number) row.get("_id")).intValue(), ((Number) row.get("count")).longValue());
        }
        return counts;
    }

    @Override
    public List<TrendPoint> trend(FeedbackFilter filter, TrendPeriod period) {
        Aggregation aggregation = newAggregation(
                match(toCriteria(filter).and("createdAt").ne(null)),
                project("rating")
                        .and(DateOperators.dateOf("createdAt").toString(period.mongoFormat())).as("period"),
                group("period").count().as("count").avg("rating").as("average"),
                project("count", "average").and("period").previousOperation(),
                sort(Sort.Direction.ASC, "period"));

        return mongoTemplate.aggregate(aggregation, FeedbackDocument.class, TrendPoint.class)
                .getMappedResults();
    }

    @Override
    public List<TagCount> popularTags(FeedbackFilter filter, int limit) {
        Aggregation aggregation = newAggregation(
                match(toCriteria(filter)),
                unwind("tags"),
                match(Criteria.where("tags").ne(null)),
                group("tags").count().as("count"),
                project("count").and("tag").previousOperation(),
                sort(Sort.by(Sort.Order.desc("count"), Sort.Order.asc("tag"))),
                limit(limit));

        return mongoTemplate.aggregate(aggregation, FeedbackDocument.class, TagCount.class)
                .getMappedResults();
    }

    @Override
    public double averageRating(FeedbackFilter filter) {
        Aggregation aggregation = newAggregation(
                match(toCriteria(filter).and("rating").ne(null)),
                group().avg("rating").as("average"));

        Document result = mongoTemplate.aggregate(aggregation, FeedbackDocument.class, Document.class)
                .getUniqueMappedResult();
        if (result == null || result.get("average") == null) {
            return 0.0;
        }
        return ((Number) result.get("average")).doubleValue();
    }

    private Query toQuery(FeedbackFilter filter) {
        return new Query(toCriteria(filter));
    }

    // Conjunction of the filter's bounds; an empty filter matches everything
    private Criteria toCriteria(FeedbackFilter filter) {
        List<Criteria> parts = new ArrayList<>();
        if (filter.getStudentId() != null) {
            parts.add(Criteria.where("studentId").is(filter.getStudentId()));
        }
        if (filter.getCourseId() != null) {
            parts.add(Criteria.where("courseId").is(filter.getCourseId()));
        }
        if (filter.getFeedbackType() != null) {
            parts.add(Criteria.where("feedbackType").is(filter.getFeedbackType()));
        }
        if (filter.getMinRating() != null || filter.getMaxRating() != null) {
            Criteria rating = Criteria.where("rating");
            if (filter.getMinRating() != null) {
                rating.gte(filter.getMinRating());
            }
            if (filter.getMaxRating() != null) {
                rating.lte(filter.getMaxRating());
            }
            parts.add(rating);
        }
        if (filter.getStartDate() != null || filter.getEndDate() != null) {
            Criteria created = Criteria.where("createdAt");
            if (filter.getStartDate() != null) {
                created.gte(filter.startInstant());
            }
            if (filter.getEndDate() != null) {
                created.lt(filter.endInstantExclusive());
            }
            parts.add(created);
        }
        return parts.isEmpty() ? new Criteria() : new Criteria().andOperator(parts);
    }
}
