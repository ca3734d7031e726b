package com.company.incidentrisk.exception;

import java.util.List;

public class TelemetryValidationException extends RuntimeException {

    private final List<String> violations;

    public TelemetryValidationException(List<String> violations) {
        super("Invalid telemetry event: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
