package com.kotsin.insights.data;

import com.kotsin.insights.anomaly.model.TimeSeriesPoint;
import com.kotsin.insights.config.InsightsConfig;
import com.kotsin.insights.data.model.PipelineKpi;
import com.kotsin.insights.data.repository.PipelineKpiRepository;
import com.kotsin.insights.driver.model.FeatureTable;
import com.kotsin.insights.orchestrator.model.InsightsQuery;
import com.kotsin.insights.util.MathUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * MongoInsightsDataProvider - Reads daily pipeline KPIs for insights analysis
 *
 * Primary metric and target: total_applications.
 * Features: active_applications, avg_time_to_fill, placement_rate, response_rate.
 *
 * Rows are ordered by date ascending and capped at {@code insights.data.max-points}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MongoInsightsDataProvider implements InsightsDataProvider {

    public static final String TARGET_METRIC = "total_applications";
    public static final String ACTIVE_APPLICATIONS = "active_applications";
    public static final String AVG_TIME_TO_FILL = "avg_time_to_fill";
    public static final String PLACEMENT_RATE = "placement_rate";
    public static final String RESPONSE_RATE = "response_rate";

    private final PipelineKpiRepository kpiRepository;
    private final InsightsConfig config;

    @Override
    public InsightsDataset fetch(InsightsQuery query, String facilityId) {
        List<PipelineKpi> rows = loadRows(query != null ? query : InsightsQuery.all(), facilityId);
        if (rows.isEmpty()) {
            log.info("[INSIGHTS-DATA] No KPI rows for facility={} window={}..{}",
                    facilityId, query != null ? query.getStartDate() : null, query != null ? query.getEndDate() : null);
            return InsightsDataset.empty();
        }

        List<TimeSeriesPoint> timeSeries = new ArrayList<>(rows.size());
        for (PipelineKpi row : rows) {
            timeSeries.add(TimeSeriesPoint.of(
                    row.getDate() != null ? row.getDate().toString() : null,
                    MathUtils.valueOrDefault(row.getTotalApplications(), 0.0)));
        }

        FeatureTable features = FeatureTable.builder()
                .feature(ACTIVE_APPLICATIONS, column(rows, PipelineKpi::getActiveApplications))
                .feature(AVG_TIME_TO_FILL, column(rows, PipelineKpi::getAvgTimeToFill))
                .feature(PLACEMENT_RATE, column(rows, PipelineKpi::getPlacementRate))
                .feature(RESPONSE_RATE, column(rows, PipelineKpi::getResponseRate))
                .build();

        log.debug("[INSIGHTS-DATA] Loaded {} KPI rows for facility={}", rows.size(), facilityId);

        return InsightsDataset.builder()
                .timeSeries(timeSeries)
                .features(features)
                .target(column(rows, PipelineKpi::getTotalApplications))
                .build();
    }

    private List<PipelineKpi> loadRows(InsightsQuery query, String facilityId) {
        Pageable page = PageRequest.of(0, Math.max(1, config.getData().getMaxPoints()),
                Sort.by(Sort.Direction.ASC, "date"));

        if (query.hasWindow()) {
            return facilityId != null
                    ? kpiRepository.findInWindowForFacility(facilityId, query.getStartDate(), query.getEndDate(), page)
                    : kpiRepository.findInWindow(query.getStartDate(), query.getEndDate(), page);
        }
        return facilityId != null
                ? kpiRepository.findByFacilityId(facilityId, page)
                : kpiRepository.findAll(page).getContent();
    }

    private static double[] column(List<PipelineKpi> rows, Function<PipelineKpi, Double> metric) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = MathUtils.valueOrDefault(metric.apply(rows.get(i)), 0.0);
        }
        return values;
    }
}
