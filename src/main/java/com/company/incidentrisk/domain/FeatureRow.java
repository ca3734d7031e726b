package com.company.incidentrisk.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;

/**
 * Aggregated statistics for one (service, route, bucket).
 * Unique per (service, route, bucketStart); a recompute replaces the stored row.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FeatureRow implements Serializable {
    private static final long serialVersionUID = 1L;

    String service;
    String route;
    Instant bucketStart;
    Instant bucketEnd;

    double errorRate;
    double p95LatencyMs;
    double p99LatencyMs;
    double avgMemoryMb;
    double avgCpuPct;
    double retriesRate;
    double timeoutRate;
    long totalRequests;

    @JsonIgnore
    public SeriesKey seriesKey() {
        return SeriesKey.of(service, route);
    }
}
