package com.kotsin.insights.orchestrator;

import com.kotsin.insights.anomaly.AnomalyDetector;
import com.kotsin.insights.anomaly.SeasonalAdjuster;
import com.kotsin.insights.anomaly.model.TimeSeriesPoint;
import com.kotsin.insights.calculator.StatisticsCalculator;
import com.kotsin.insights.config.InsightsConfig;
import com.kotsin.insights.data.InsightsDataProvider;
import com.kotsin.insights.data.InsightsDataset;
import com.kotsin.insights.driver.DriverAnalyzer;
import com.kotsin.insights.driver.model.FeatureTable;
import com.kotsin.insights.narrative.NarrativeGenerator;
import com.kotsin.insights.narrative.NarrativeVocabulary;
import com.kotsin.insights.orchestrator.model.InsightsQuery;
import com.kotsin.insights.orchestrator.model.InsightsReport;
import com.kotsin.insights.orchestrator.model.InsightsUser;
import com.kotsin.insights.store.InsightsJsonCodec;
import com.kotsin.insights.store.InsightsReportStore;
import com.kotsin.insights.store.MongoInsightsReportStore;
import com.kotsin.insights.store.ReportStoreException;
import com.kotsin.insights.store.model.InsightsReportDocument;
import com.kotsin.insights.store.repository.InsightsReportRepository;
import com.kotsin.insights.trend.TrendAnalyzer;
import com.kotsin.insights.trend.model.TrendDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for InsightsOrchestrator
 *
 * Analyzers are real; the data provider and report store are mocked.
 */
@ExtendWith(MockitoExtension.class)
class InsightsOrchestratorTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00.123456Z");

    @Mock
    private InsightsDataProvider dataProvider;

    @Mock
    private InsightsReportStore reportStore;

    @Mock
    private InsightsReportRepository reportRepository;

    private InsightsOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        orchestrator = orchestratorWith(reportStore);
    }

    private InsightsOrchestrator orchestratorWith(InsightsReportStore store) {
        StatisticsCalculator statistics = new StatisticsCalculator();
        return new InsightsOrchestrator(
                new AnomalyDetector(statistics, new SeasonalAdjuster(statistics)),
                new DriverAnalyzer(statistics),
                new TrendAnalyzer(statistics),
                new NarrativeGenerator(),
                dataProvider,
                store,
                new InsightsConfig(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    // ========== generateInsights ==========

    @Test
    @DisplayName("Generated report carries every analysis and is persisted")
    void testGenerateInsights_FullReport() {
        // Given
        InsightsQuery query = InsightsQuery.builder()
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 30))
                .build();
        when(dataProvider.fetch(query, null)).thenReturn(growingDataset());

        // When
        InsightsReport report = orchestrator.generateInsights(query, InsightsUser.builder().id("u1").build());

        // Then
        assertTrue(report.getId().startsWith("insight_" + NOW.toEpochMilli() + "_"));
        assertEquals(NOW.truncatedTo(ChronoUnit.MILLIS), report.getTimestamp());
        assertEquals("2024-01-01", report.getQueryParams().get("startDate"));
        assertEquals("2024-01-30", report.getQueryParams().get("endDate"));
        assertEquals(false, report.getQueryParams().get("includePII"));

        assertEquals(30, report.getAnomalies().getTotalPoints());
        assertEquals(TrendDirection.INCREASING, report.getTrends().getDirection());
        assertEquals(2, report.getDrivers().getMetadata().getTotalFeatures());
        assertEquals("active_applications", report.getDrivers().getDrivers().get(0).getFeature());
        assertTrue(report.getNarrative().contains("upward trend"));

        verify(reportStore).save(report);
    }

    @Test
    @DisplayName("Generated report survives the JSON round trip through the Mongo store")
    void testGenerateInsights_RoundTripThroughStore() {
        // Given: real store and codec over a mocked repository
        InsightsOrchestrator persisting = orchestratorWith(new MongoInsightsReportStore(
                reportRepository, new InsightsJsonCodec(), Clock.fixed(NOW, ZoneOffset.UTC)));
        when(dataProvider.fetch(any(), any())).thenReturn(spikyDataset());
        when(reportRepository.findById(anyString())).thenReturn(Optional.empty());
        InsightsQuery query = InsightsQuery.builder()
                .startDate(LocalDate.of(2024, 1, 1))
                .endDate(LocalDate.of(2024, 1, 30))
                .facilityId("facility-A")
                .build();

        // When
        InsightsReport report = persisting.generateInsights(query, null);

        ArgumentCaptor<InsightsReportDocument> saved = ArgumentCaptor.forClass(InsightsReportDocument.class);
        verify(reportRepository).save(saved.capture());
        when(reportRepository.findById(report.getId())).thenReturn(Optional.of(saved.getValue()));
        Optional<InsightsReport> loaded = persisting.getReport(report.getId());

        // Then
        assertTrue(report.getAnomalies().hasAnomalies());
        assertTrue(loaded.isPresent());
        assertNotSame(report, loaded.get());
        assertEquals(report, loaded.get());
        assertEquals(List.copyOf(report.getQueryParams().keySet()), List.copyOf(loaded.get().getQueryParams().keySet()));
    }

    @Test
    @DisplayName("Report collections cannot be modified by callers")
    void testGenerateInsights_ReportIsReadOnly() {
        when(dataProvider.fetch(any(), any())).thenReturn(spikyDataset());

        InsightsReport report = orchestrator.generateInsights(InsightsQuery.all(), null);

        assertThrows(UnsupportedOperationException.class,
                () -> report.getQueryParams().put("facilityId", "other"));
        assertThrows(UnsupportedOperationException.class,
                () -> report.getAnomalies().getAnomalies().clear());
        assertThrows(UnsupportedOperationException.class,
                () -> report.getDrivers().getDrivers().clear());
    }

    @Test
    void testDataset_TargetIsCopied() {
        double[] target = {1, 2, 3};
        InsightsDataset dataset = InsightsDataset.builder().target(target).build();

        target[0] = 99;
        dataset.getTarget()[1] = 99;

        assertArrayEquals(new double[]{1, 2, 3}, dataset.getTarget());
    }

    @Test
    void testGenerateInsights_UniqueIds() {
        when(dataProvider.fetch(any(), any())).thenReturn(InsightsDataset.empty());

        InsightsReport first = orchestrator.generateInsights(InsightsQuery.all(), null);
        InsightsReport second = orchestrator.generateInsights(InsightsQuery.all(), null);

        assertNotEquals(first.getId(), second.getId());
    }

    @Test
    @DisplayName("A facility bound to the user overrides the query's facility")
    void testGenerateInsights_UserFacilityWins() {
        when(dataProvider.fetch(any(), eq("facility-A"))).thenReturn(InsightsDataset.empty());
        InsightsQuery query = InsightsQuery.builder().facilityId("facility-B").build();

        orchestrator.generateInsights(query, InsightsUser.builder().id("u1").facilityId("facility-A").build());

        verify(dataProvider).fetch(query, "facility-A");
        verify(dataProvider, never()).fetch(any(), eq("facility-B"));
    }

    @Test
    void testResolveFacility() {
        InsightsQuery query = InsightsQuery.builder().facilityId("facility-B").build();

        assertEquals("facility-B", orchestrator.resolveFacility(query, null));
        assertEquals("facility-B", orchestrator.resolveFacility(query, InsightsUser.builder().id("admin").build()));
        assertEquals("facility-A", orchestrator.resolveFacility(query,
                InsightsUser.builder().id("u1").facilityId("facility-A").build()));
    }

    @Test
    @DisplayName("Empty window still yields a complete report")
    void testGenerateInsights_NoData() {
        when(dataProvider.fetch(any(), any())).thenReturn(InsightsDataset.empty());

        InsightsReport report = orchestrator.generateInsights(null, null);

        assertNotNull(report.getAnomalies().getStatistics());
        assertEquals(0, report.getAnomalies().getTotalPoints());
        assertFalse(report.getDrivers().hasDrivers());
        assertEquals(TrendDirection.STABLE, report.getTrends().getDirection());
        assertTrue(report.getNarrative().contains(NarrativeVocabulary.NO_ANOMALIES));
        assertTrue(report.getNarrative().contains(NarrativeVocabulary.NO_DRIVERS));
        assertEquals(Map.of("includePII", false), report.getQueryParams());
    }

    @Test
    @DisplayName("Provider failure degrades to an empty analysis")
    void testGenerateInsights_ProviderFailure() {
        when(dataProvider.fetch(any(), any())).thenThrow(new IllegalStateException("connection refused"));

        InsightsReport report = orchestrator.generateInsights(InsightsQuery.all(), null);

        assertEquals(0, report.getAnomalies().getTotalPoints());
        verify(reportStore).save(report);
    }

    @Test
    @DisplayName("Store failure is logged and the report still returned")
    void testGenerateInsights_SaveFailure() {
        when(dataProvider.fetch(any(), any())).thenReturn(growingDataset());
        doThrow(new ReportStoreException("write failed", new RuntimeException()))
                .when(reportStore).save(any());

        InsightsReport report = assertDoesNotThrow(() -> orchestrator.generateInsights(InsightsQuery.all(), null));

        assertNotNull(report.getId());
        assertNotNull(report.getNarrative());
    }

    // ========== getReport ==========

    @Test
    void testGetReport_Unknown() {
        when(reportStore.findById("insight_missing")).thenReturn(Optional.empty());

        assertTrue(orchestrator.getReport("insight_missing").isEmpty());
    }

    @Test
    void testGetReport_BlankIdSkipsStore() {
        assertTrue(orchestrator.getReport(" ").isEmpty());
        assertTrue(orchestrator.getReport(null).isEmpty());

        verifyNoInteractions(reportStore);
    }

    @Test
    @DisplayName("Unreadable stored record reads as not found")
    void testGetReport_StoreFailure() {
        when(reportStore.findById(anyString()))
                .thenThrow(new ReportStoreException("corrupt", new RuntimeException()));

        assertEquals(Optional.empty(), orchestrator.getReport("insight_1"));
    }

    // ========== Fixtures ==========

    // growing series with one spike on day 12
    private static InsightsDataset spikyDataset() {
        InsightsDataset base = growingDataset();
        List<TimeSeriesPoint> series = new ArrayList<>(base.getTimeSeries());
        series.set(12, TimeSeriesPoint.of(series.get(12).getTimestamp(), 900.0));
        double[] target = base.getTarget();
        target[12] = 900.0;
        return InsightsDataset.builder()
                .timeSeries(series)
                .features(base.getFeatures())
                .target(target)
                .build();
    }

    private static InsightsDataset growingDataset() {
        List<TimeSeriesPoint> series = new ArrayList<>();
        double[] target = new double[30];
        double[] active = new double[30];
        double[] responseRate = new double[30];
        for (int i = 0; i < 30; i++) {
            target[i] = 100 + i * 5 + (i % 2);
            active[i] = 2 * target[i];
            responseRate[i] = 0.5 + (i % 3) * 0.01;
            series.add(TimeSeriesPoint.of(LocalDate.of(2024, 1, 1).plusDays(i).toString(), target[i]));
        }
        return InsightsDataset.builder()
                .timeSeries(series)
                .features(FeatureTable.builder()
                        .feature("active_applications", active)
                        .feature("response_rate", responseRate)
                        .build())
                .target(target)
                .build();
    }
}
