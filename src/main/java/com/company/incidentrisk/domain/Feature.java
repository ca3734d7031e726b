package com.company.incidentrisk.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * The fixed feature schema, in the order the model's weight vector uses.
 */
public enum Feature {
    ERROR_RATE("errorRate", FeatureRow::getErrorRate),
    P95_LATENCY_MS("p95LatencyMs", FeatureRow::getP95LatencyMs),
    P99_LATENCY_MS("p99LatencyMs", FeatureRow::getP99LatencyMs),
    AVG_MEMORY_MB("avgMemoryMb", FeatureRow::getAvgMemoryMb),
    AVG_CPU_PCT("avgCpuPct", FeatureRow::getAvgCpuPct),
    RETRIES_RATE("retriesRate", FeatureRow::getRetriesRate),
    TIMEOUT_RATE("timeoutRate", FeatureRow::getTimeoutRate),
    // Volume signal, leakage-prone; only used when explicitly configured in
    TOTAL_REQUESTS("totalRequests", row -> (double) row.getTotalRequests());

    private final String fieldName;
    private final ToDoubleFunction<FeatureRow> extractor;

    Feature(String fieldName, ToDoubleFunction<FeatureRow> extractor) {
        this.fieldName = fieldName;
        this.extractor = extractor;
    }

    public String getFieldName() {
        return fieldName;
    }

    public double valueOf(FeatureRow row) {
        return extractor.applyAsDouble(row);
    }

    public static List<Feature> schema(boolean includeTotalRequests) {
        List<Feature> features = new ArrayList<>(Arrays.asList(values()));
        if (!includeTotalRequests) {
            features.remove(TOTAL_REQUESTS);
        }
        return List.copyOf(features);
    }

    public static Feature fromFieldName(String fieldName) {
        for (Feature feature : values()) {
            if (feature.fieldName.equals(fieldName)) {
                return feature;
            }
        }
        throw new IllegalArgumentException("Unknown feature: " + fieldName);
    }
}
