package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingHyperparameters {
    double learningRate;
    int maxIterations;
    double tolerance;
    double l2;
    double validationFraction;
    int minRows;
    boolean includeTotalRequests;
    int lookaheadBuckets;
    double incidentThreshold;
    Duration timeBudget;
}
