package com.kotsin.insights.data;

import com.kotsin.insights.anomaly.model.TimeSeriesPoint;
import com.kotsin.insights.driver.model.FeatureTable;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.Value;

import java.util.List;

/**
 * InsightsDataset - Raw numeric input of one analysis
 *
 * timeSeries: primary metric, one point per period
 * features:   secondary metrics aligned by the same index
 * target:     series the features are ranked against (usually the primary metric's values)
 */
@Value
public class InsightsDataset {

    List<TimeSeriesPoint> timeSeries;

    FeatureTable features;

    @Getter(AccessLevel.NONE)
    double[] target;

    @Builder
    private InsightsDataset(List<TimeSeriesPoint> timeSeries, FeatureTable features, double[] target) {
        this.timeSeries = timeSeries == null ? List.of() : List.copyOf(timeSeries);
        this.features = features == null ? FeatureTable.empty() : features;
        this.target = target == null ? new double[0] : target.clone();
    }

    /**
     * Copy of the target values
     */
    public double[] getTarget() {
        return target.clone();
    }

    public static InsightsDataset empty() {
        return InsightsDataset.builder().build();
    }
}
