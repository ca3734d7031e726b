package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BacktestMetrics {
    // null when every evaluated row is positive, AUC needs both classes
    Double auc;
    double precisionAtK;
    double recallIncidents;
    // Number of positive rows evaluated
    int support;

    int k;
    int evaluatedRows;
    long modelVersion;
    Instant from;
    Instant to;
}
