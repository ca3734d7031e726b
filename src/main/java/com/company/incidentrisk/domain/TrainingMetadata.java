package com.company.incidentrisk.domain;

import com.company.incidentrisk.domain.enums.StopReason;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class TrainingMetadata {
    Instant trainedAt;
    Instant windowStart;
    Instant windowEnd;

    int totalRows;
    int fitRows;
    int validationRows;
    int positiveRows;

    int iterations;
    double fitLoss;
    // null when the validation split is empty or single-class
    Double validationLoss;
    Double validationAuc;
    StopReason stopReason;

    TrainingHyperparameters hyperparameters;
}
