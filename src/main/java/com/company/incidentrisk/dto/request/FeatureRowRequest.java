package com.company.incidentrisk.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Feature values to score. Missing values are scored as 0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeatureRowRequest {
    @NotBlank(message = "Service is required")
    private String service;

    @NotBlank(message = "Route is required")
    private String route;

    @NotNull(message = "Bucket start is required")
    private Instant bucketStart;

    private Double errorRate;
    private Double p95LatencyMs;
    private Double p99LatencyMs;
    private Double avgMemoryMb;
    private Double avgCpuPct;
    private Double retriesRate;
    private Double timeoutRate;
    private Long totalRequests;
}
