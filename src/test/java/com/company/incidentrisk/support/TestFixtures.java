package com.company.incidentrisk.support;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.ModelArtifact;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.domain.TrainingHyperparameters;
import com.company.incidentrisk.util.BucketWindows;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public final class TestFixtures {

    public static final Instant T0 = Instant.parse("2026-01-05T00:00:00Z");
    public static final Duration BUCKET = Duration.ofMinutes(5);

    private TestFixtures() {
    }

    public static IncidentRiskProperties properties() {
        IncidentRiskProperties properties = new IncidentRiskProperties();
        properties.getEtl().setRetryBackoff(Duration.ofMillis(1));
        return properties;
    }

    public static BucketWindows windows(IncidentRiskProperties properties) {
        IncidentRiskProperties.Etl etl = properties.getEtl();
        return new BucketWindows(etl.getBucketWidth(), etl.getWatermarkDelay(), etl.getAllowedLateness());
    }

    public static TelemetryEvent event(String service, String route, Instant timestamp, double latencyMs) {
        return TelemetryEvent.builder()
                .timestamp(timestamp)
                .service(service)
                .route(route)
                .statusCode(200)
                .latencyMs(latencyMs)
                .memoryMb(256)
                .cpuPct(40)
                .retries(0)
                .timeout(false)
                .build();
    }

    public static FeatureRow row(String service, String route, Instant bucketStart, double errorRate) {
        return FeatureRow.builder()
                .service(service)
                .route(route)
                .bucketStart(bucketStart)
                .bucketEnd(bucketStart.plus(BUCKET))
                .errorRate(errorRate)
                .p95LatencyMs(100 + 900 * errorRate)
                .p99LatencyMs(150 + 1200 * errorRate)
                .avgMemoryMb(256)
                .avgCpuPct(30 + 50 * errorRate)
                .retriesRate(errorRate / 2)
                .timeoutRate(errorRate / 4)
                .totalRequests(100)
                .build();
    }

    public static TrainingHyperparameters hyperparameters() {
        return TrainingHyperparameters.builder()
                .learningRate(0.5)
                .maxIterations(300)
                .tolerance(1e-9)
                .l2(0.001)
                .validationFraction(0.2)
                .minRows(10)
                .includeTotalRequests(false)
                .lookaheadBuckets(3)
                .incidentThreshold(0.2)
                .timeBudget(null)
                .build();
    }

    /**
     * Model whose only non-zero weight is on errorRate; all features are left unscaled.
     */
    public static ModelArtifact errorRateModel(long version, double errorWeight, double bias) {
        return ModelArtifact.builder()
                .version(version)
                .modelFamily("incident-risk-logistic")
                .featureNames(List.of("errorRate", "p95LatencyMs", "p99LatencyMs", "avgMemoryMb",
                        "avgCpuPct", "retriesRate", "timeoutRate"))
                .weights(List.of(errorWeight, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0))
                .bias(bias)
                .means(List.of(0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0))
                .stdDevs(List.of(1.0, 1.0, 1.0, 1.0, 1.0, 1.0, 1.0))
                .createdAt(T0)
                .build();
    }
}
