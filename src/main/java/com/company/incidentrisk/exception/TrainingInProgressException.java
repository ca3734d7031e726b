package com.company.incidentrisk.exception;

public class TrainingInProgressException extends RuntimeException {
    public TrainingInProgressException(String modelFamily) {
        super("A training run is already in progress for model family " + modelFamily);
    }
}
