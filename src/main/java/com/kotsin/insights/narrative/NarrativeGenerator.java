package com.kotsin.insights.narrative;

import com.kotsin.insights.anomaly.model.AnomalyResult;
import com.kotsin.insights.anomaly.model.Severity;
import com.kotsin.insights.driver.model.Driver;
import com.kotsin.insights.driver.model.DriverAnalysisResult;
import com.kotsin.insights.trend.model.TrendDirection;
import com.kotsin.insights.trend.model.TrendResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

import static com.kotsin.insights.narrative.NarrativeVocabulary.*;

/**
 * NarrativeGenerator - Turns analyzer output into a short, human-readable summary
 *
 * Three sections, always in this order:
 * 1. Trend - direction, qualitative magnitude, variance
 * 2. Anomalies - count, rate, high/medium severity call-outs (or "none")
 * 3. Drivers - top driver with importance and direction, up to two runners-up
 *
 * Pure templating: identical inputs always produce identical text.
 */
@Slf4j
@Component
public class NarrativeGenerator {

    private static final int OTHER_DRIVERS_SHOWN = 2;

    // ======================== MAIN GENERATION ========================

    public String generate(TrendResult trend, AnomalyResult anomalies, DriverAnalysisResult drivers) {
        String narrative = String.join(" ",
                buildTrendSection(trend != null ? trend : TrendResult.flat()),
                buildAnomalySection(anomalies),
                buildDriversSection(drivers)).trim();

        log.debug("[NARRATIVE] Generated {} chars", narrative.length());
        return narrative;
    }

    // ======================== SECTION BUILDERS ========================

    String buildTrendSection(TrendResult trend) {
        StringBuilder section = new StringBuilder();

        if (trend.getDirection() == null || trend.getDirection() == TrendDirection.STABLE) {
            section.append(STABLE_TREND);
        } else {
            section.append(format(TREND_TEMPLATE,
                    magnitudeAdjective(trend.getChangeRate()),
                    directionWord(trend.getDirection()),
                    Math.abs(trend.getChangeRate()) * 100,
                    changeNoun(trend.getDirection())));
        }

        section.append(' ').append(variancePhrase(trend.getVariance()));
        return section.toString();
    }

    String buildAnomalySection(AnomalyResult anomalies) {
        if (anomalies == null || !anomalies.hasAnomalies()) {
            return NO_ANOMALIES;
        }

        int detected = anomalies.getAnomalies().size();
        int totalPoints = Math.max(anomalies.getTotalPoints(), detected);

        StringBuilder section = new StringBuilder(format(ANOMALY_TEMPLATE,
                detected, anomalyNoun(detected), totalPoints, anomalies.getAnomalyRate() * 100));

        long high = anomalies.countBySeverity(Severity.HIGH);
        long medium = anomalies.countBySeverity(Severity.MEDIUM);
        if (high > 0) {
            section.append(' ').append(format(HIGH_SEVERITY_TEMPLATE, high, anomalyNounWithVerb(high)));
        } else if (medium > 0) {
            section.append(' ').append(format(MEDIUM_SEVERITY_TEMPLATE, medium, anomalyNoun(medium)));
        }

        return section.toString();
    }

    String buildDriversSection(DriverAnalysisResult drivers) {
        if (drivers == null || !drivers.hasDrivers()) {
            return NO_DRIVERS;
        }

        List<Driver> ranked = drivers.getDrivers();
        Driver top = ranked.get(0);

        StringBuilder section = new StringBuilder(format(TOP_DRIVER_TEMPLATE,
                top.getFeature(), top.getImportance() * 100, top.getDirection().getValue()));

        if (ranked.size() > 1) {
            String others = ranked.stream()
                    .skip(1)
                    .limit(OTHER_DRIVERS_SHOWN)
                    .map(Driver::getFeature)
                    .collect(Collectors.joining(", "));
            section.append(' ').append(format(OTHER_DRIVERS_TEMPLATE, others));
        }

        return section.toString();
    }
}
