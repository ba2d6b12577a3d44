package com.kotsin.insights.config;

import com.kotsin.insights.anomaly.model.AnomalyConfig;
import com.kotsin.insights.anomaly.model.DetectionMethod;
import com.kotsin.insights.driver.model.DriverConfig;
import com.kotsin.insights.driver.model.DriverMethod;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized configuration for the insights engine.
 * Analyzer defaults used by report generation and data-access limits.
 */
@Configuration
@ConfigurationProperties(prefix = "insights")
@Data
public class InsightsConfig {

    /**
     * Anomaly detection defaults
     */
    private AnomalyDefaults anomaly = new AnomalyDefaults();

    /**
     * Driver analysis defaults
     */
    private DriverDefaults drivers = new DriverDefaults();

    /**
     * Data-access limits
     */
    private DataConfig data = new DataConfig();

    @Data
    public static class AnomalyDefaults {
        /**
         * esd or zscore
         */
        private DetectionMethod method = DetectionMethod.ESD;

        /**
         * Z-score cutoff and severity unit
         */
        private double threshold = AnomalyConfig.DEFAULT_THRESHOLD;

        /**
         * Points per seasonal cycle (7 = weekly pattern on daily data), 0 disables
         */
        private int seasonalPeriod = AnomalyConfig.DEFAULT_SEASONAL_PERIOD;

        /**
         * ESD significance level
         */
        private double alpha = AnomalyConfig.DEFAULT_ALPHA;

        /**
         * Cap on ESD removals, 0 = half the series
         */
        private int maxAnomalies = 0;

        public AnomalyConfig toAnomalyConfig() {
            return AnomalyConfig.builder()
                    .method(method)
                    .threshold(threshold)
                    .seasonalPeriod(seasonalPeriod)
                    .alpha(alpha)
                    .maxAnomalies(maxAnomalies)
                    .build();
        }
    }

    @Data
    public static class DriverDefaults {
        /**
         * importance or correlation
         */
        private DriverMethod method = DriverMethod.IMPORTANCE;

        /**
         * Drivers kept per report
         */
        private int topN = DriverConfig.DEFAULT_TOP_N;

        public DriverConfig toDriverConfig() {
            return DriverConfig.builder()
                    .method(method)
                    .topN(topN)
                    .build();
        }
    }

    @Data
    public static class DataConfig {
        /**
         * Maximum rows fetched per analysis window
         */
        private int maxPoints = 1000;
    }
}
