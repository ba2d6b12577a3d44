package com.kotsin.insights.config;

import com.kotsin.insights.anomaly.model.AnomalyConfig;
import com.kotsin.insights.anomaly.model.DetectionMethod;
import com.kotsin.insights.driver.model.DriverConfig;
import com.kotsin.insights.driver.model.DriverMethod;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InsightsConfigTest {

    @Test
    void testDefaultsMatchAnalyzerDefaults() {
        InsightsConfig config = new InsightsConfig();

        assertEquals(AnomalyConfig.defaults(), config.getAnomaly().toAnomalyConfig());
        assertEquals(DriverConfig.defaults(), config.getDrivers().toDriverConfig());
        assertEquals(1000, config.getData().getMaxPoints());
    }

    @Test
    void testOverridesFlowIntoRunConfig() {
        InsightsConfig config = new InsightsConfig();
        config.getAnomaly().setMethod(DetectionMethod.ZSCORE);
        config.getAnomaly().setThreshold(2.5);
        config.getAnomaly().setSeasonalPeriod(0);
        config.getDrivers().setMethod(DriverMethod.CORRELATION);
        config.getDrivers().setTopN(3);

        AnomalyConfig anomaly = config.getAnomaly().toAnomalyConfig();
        DriverConfig drivers = config.getDrivers().toDriverConfig();

        assertEquals(DetectionMethod.ZSCORE, anomaly.getMethod());
        assertEquals(2.5, anomaly.getThreshold());
        assertEquals(0, anomaly.getSeasonalPeriod());
        assertEquals(DriverMethod.CORRELATION, drivers.getMethod());
        assertEquals(3, drivers.getTopN());
    }

    @Test
    void testMethodNamesParseLeniently() {
        assertEquals(DetectionMethod.ZSCORE, DetectionMethod.fromValue(" ZScore "));
        assertEquals(DetectionMethod.ESD, DetectionMethod.fromValue("iqr"));
        assertEquals(DriverMethod.IMPORTANCE, DriverMethod.fromValue(null));
    }
}
