package com.eduanalytics.infrastructure.document.repository;

import com.eduanalytics.infrastructure.document.model.SurveyResponseDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SurveyResponseRepository extends MongoRepository<SurveyResponseDocument, String> {

    List<SurveyResponseDocument> findBySurveyIdOrderByCreatedAtDesc(String surveyId);
}
