package com.company.incidentrisk.exception;

public class AlertDispatchException extends RuntimeException {
    public AlertDispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
