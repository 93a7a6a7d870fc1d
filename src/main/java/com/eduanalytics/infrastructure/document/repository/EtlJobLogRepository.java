package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.infrastructure.document.model.EtlJobLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface EtlJobLogRepository extends MongoRepository<EtlJobLogDocument, String>, EtlJobLogRepositoryCustom {

    Optional<EtlJobLogDocument> findByJobId(String jobId);
}
