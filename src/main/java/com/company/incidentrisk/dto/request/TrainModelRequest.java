package com.company.incidentrisk.dto.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Optional overrides; null fields keep the configured defaults.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrainModelRequest {
    @Positive
    private Double learningRate;

    @Min(1)
    private Integer maxIterations;

    @Positive
    private Double tolerance;

    @DecimalMin("0.0")
    private Double l2;

    @DecimalMin("0.0")
    @DecimalMax("0.9")
    private Double validationFraction;

    @Min(2)
    private Integer minRows;

    private Boolean includeTotalRequests;

    @Min(1)
    private Integer lookaheadBuckets;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double incidentThreshold;

    @Min(1)
    private Long timeBudgetSeconds;
}
