package com.company.incidentrisk.dto.request;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One telemetry sample. Field rules are checked by the ingestor so that a batch
 * can report each invalid event instead of failing as a whole.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryEventRequest {
    private Instant timestamp;
    private String service;
    private String route;
    private int statusCode;
    private double latencyMs;
    private double memoryMb;
    private double cpuPct;
    private int retries;
    private boolean timeout;
}
