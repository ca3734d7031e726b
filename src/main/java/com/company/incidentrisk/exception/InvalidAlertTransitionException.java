package com.company.incidentrisk.exception;

import com.company.incidentrisk.domain.enums.AlertStatus;

public class InvalidAlertTransitionException extends RuntimeException {
    public InvalidAlertTransitionException(long alertId, AlertStatus from, AlertStatus to) {
        super("Alert " + alertId + " cannot move from " + from + " to " + to);
    }
}
