package com.kotsin.insights.data.repository;

import com.kotsin.insights.data.model.PipelineKpi;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

/**
 * Repository for PipelineKpi MongoDB documents
 *
 * Callers pass a Pageable carrying the row limit and date ordering.
 */
@Repository
public interface PipelineKpiRepository extends MongoRepository<PipelineKpi, String> {

    /**
     * KPIs with start &lt;= date &lt;= end, all facilities
     */
    @Query("{ 'date': { $gte: ?0, $lte: ?1 } }")
    List<PipelineKpi> findInWindow(LocalDate start, LocalDate end, Pageable pageable);

    /**
     * KPIs with start &lt;= date &lt;= end for one facility
     */
    @Query("{ 'facilityId': ?0, 'date': { $gte: ?1, $lte: ?2 } }")
    List<PipelineKpi> findInWindowForFacility(String facilityId, LocalDate start, LocalDate end, Pageable pageable);

    /**
     * All KPIs for one facility
     */
    List<PipelineKpi> findByFacilityId(String facilityId, Pageable pageable);
}
