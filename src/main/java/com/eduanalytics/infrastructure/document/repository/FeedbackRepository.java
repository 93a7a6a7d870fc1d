package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.infrastructure.document.model.FeedbackDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FeedbackRepository extends MongoRepository<FeedbackDocument, String>, FeedbackRepositoryCustom {
}
