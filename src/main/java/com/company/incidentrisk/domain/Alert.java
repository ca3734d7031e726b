package com.company.incidentrisk.domain;

import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Preventive alert raised from a high-risk prediction.
 * Status changes only through the evaluator's transition rules.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    private Long alertId;

    private String service;
    private String route;
    // Bucket of the prediction that raised the alert
    private Instant bucketStart;

    private Severity severity;
    private double riskScore;
    private Long modelVersion;
    private String topFactors;

    private AlertStatus status;
    private Instant createdAt;
    private Instant acknowledgedAt;
    private Instant resolvedAt;

    // Delivery tracking
    private DeliveryStatus deliveryStatus;
    private Integer deliveryAttempts;
    private String lastError;
    private Instant deliveredAt;

    public SeriesKey seriesKey() {
        return SeriesKey.of(service, route);
    }

    public boolean isOpen() {
        return status == AlertStatus.OPEN;
    }
}
