package com.company.incidentrisk.domain.enums;

public enum StopReason {
    CONVERGED,
    MAX_ITERATIONS,
    CANCELLED
}
