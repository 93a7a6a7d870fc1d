package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.infrastructure.document.model.SystemLogDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SystemLogRepository extends MongoRepository<SystemLogDocument, String> {
}
