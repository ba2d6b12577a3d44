package com.kotsin.insights.store.repository;

import com.kotsin.insights.store.model.InsightsReportDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for InsightsReportDocument MongoDB documents
 */
@Repository
public interface InsightsReportRepository extends MongoRepository<InsightsReportDocument, String> {
}
