package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.domain.etl.EtlJobState;
import com.eduanalytics.domain.etl.EtlJobType;
import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;
import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class EtlJobLogRepositoryCustomImpl implements EtlJobLogRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public void updateTotalRecords(String jobId, long totalRecords) {
        mongoTemplate.updateFirst(
                Query.query(Criteria.where("jobId").is(jobId)),
                new Update().set("totalRecords", totalRecords),
                EtlJobLogDocument.class);
    }

    @Override
    public void updateProgress(String jobId, long processed, long successful, long failed) {
        mongoTemplate.updateFirst(
                Query.query(Criteria.where("jobId").is(jobId)),
                new Update()
                        .set("recordsProcessed", processed)
                        .set("recordsSuccessful", successful)
                        .set("recordsFailed", failed),
                EtlJobLogDocument.class);
    }

    @Override
    public boolean finishIfRunning(String jobId, EtlJobState state, String errorMessage, Instant endTime) {
        Query query = Query.query(Criteria.where("jobId").is(jobId)
                .and("status").is(EtlJobState.RUNNING));

        Update update = new Update()
                .set("status", state)
                .set("endTime", endTime);
        if (errorMessage != null) {
            update.set("errorMessage", errorMessage);
        }

        UpdateResult result = mongoTemplate.updateFirst(query, update, EtlJobLogDocument.class);
        boolean applied = result.getModifiedCount() > 0;
        if (!applied) {
            log.debug("Job {} no longer running, {} not applied", jobId, state);
        }
        return applied;
    }

    @Override
    public List<EtlJobLogDocument> findJobs(EtlJobState status, EtlJobType jobType, int limit) {
        Query query = new Query();
        if (status != null) {
            query.addCriteria(Criteria.where("status").is(status));
        }
        if (jobType != null) {
            query.addCriteria(Criteria.where("jobType").is(jobType));
        }
        query.with(Sort.by(Sort.Direction.DESC, "createdAt")).limit(limit);
        return mongoTemplate.find(query, EtlJobLogDocument.class);
    }
}
