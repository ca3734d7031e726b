package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;

import java.io.Serializable;
import java.time.Instant;

/**
 * One observed request/operation. Immutable once accepted by the ingestor.
 */
@Value
@Builder(toBuilder = true)
public class TelemetryEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    // Event time, drives bucket assignment
    Instant timestamp;
    String service;
    String route;

    int statusCode;
    double latencyMs;
    double memoryMb;
    double cpuPct;
    int retries;
    boolean timeout;

    // Receipt time, stamped by the ingestor; decides late-drop
    Instant receivedAt;

    public boolean isServerError() {
        return statusCode >= 500;
    }

    public SeriesKey seriesKey() {
        return SeriesKey.of(service, route);
    }
}
