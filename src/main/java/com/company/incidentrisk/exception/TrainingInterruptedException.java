package com.company.incidentrisk.exception;

import com.company.incidentrisk.domain.FittedModel;

public class TrainingInterruptedException extends OperationInterruptedException {

    private final FittedModel partialResult;

    public TrainingInterruptedException(String reason, FittedModel partialResult) {
        super("Training stopped after " + partialResult.getMetadata().getIterations() + " iterations: " + reason);
        this.partialResult = partialResult;
    }

    /**
     * Weights and normalization reached before the stop. Never published.
     */
    @Override
    public FittedModel getPartialResult() {
        return partialResult;
    }
}
