package com.company.incidentrisk.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskSummaryResponse {
    private String modelFamily;
    // null until a model has been activated
    private Long activeModelVersion;
    private boolean trainingInProgress;

    private long openAlerts;
    private Map<String, Long> alertsLast24h;

    private Instant lastEtlRunAt;
    private Integer lastEtlRowsUpserted;

    // Telemetry
    private long totalEvents;
    private double errorRate;
    private double timeoutRate;
    private long lateDroppedEvents;
    private long featureRows;

    private Instant generatedAt;
}
