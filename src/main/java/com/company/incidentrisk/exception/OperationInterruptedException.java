package com.company.incidentrisk.exception;

/**
 * A long-running job stopped on its cancellation/time-budget signal.
 * Carries the best result reached before stopping.
 */
public abstract class OperationInterruptedException extends RuntimeException {

    protected OperationInterruptedException(String message) {
        super(message);
    }

    public abstract Object getPartialResult();
}
