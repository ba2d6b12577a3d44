package com.kotsin.insights.driver.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * FeatureTable - Named numeric columns, aligned by index with a target series
 *
 * Column order is insertion order and drives tie-breaking when drivers score equally.
 * Names are unique. Columns are copied on the way in and out, so a table is immutable.
 */
public final class FeatureTable {

    private static final FeatureTable EMPTY = new FeatureTable(new LinkedHashMap<>());

    private final Map<String, double[]> columns;

    private FeatureTable(LinkedHashMap<String, double[]> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static FeatureTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Feature names in insertion order
     */
    public Set<String> featureNames() {
        return columns.keySet();
    }

    /**
     * Copy of one column, or null when the feature is unknown
     */
    public double[] column(String feature) {
        double[] values = columns.get(feature);
        return values == null ? null : values.clone();
    }

    /**
     * Length of one column, -1 when the feature is unknown
     */
    public int length(String feature) {
        double[] values = columns.get(feature);
        return values == null ? -1 : values.length;
    }

    public int size() {
        return columns.size();
    }

    public boolean isEmpty() {
        return columns.isEmpty();
    }

    @Override
    public String toString() {
        return "FeatureTable" + columns.keySet();
    }

    public static final class Builder {

        private final LinkedHashMap<String, double[]> columns = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Append a column.
         *
         * @throws IllegalArgumentException on a null/blank or duplicate name
         */
        public Builder feature(String name, double... values) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Feature name must not be blank");
            }
            if (columns.containsKey(name)) {
                throw new IllegalArgumentException("Duplicate feature: " + name);
            }
            columns.put(name, values == null ? new double[0] : values.clone());
            return this;
        }

        public FeatureTable build() {
            return new FeatureTable(new LinkedHashMap<>(columns));
        }
    }
}
