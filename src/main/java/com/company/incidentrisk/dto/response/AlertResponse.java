package com.company.incidentrisk.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {
    private Long alertId;
    private String service;
    private String route;
    private Instant bucketStart;
    private String severity;
    private double riskScore;
    private Long modelVersion;
    private String topFactors;
    private String status;
    private Instant createdAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;
    private String deliveryStatus;
}
