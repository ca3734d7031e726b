package com.company.incidentrisk.domain.enums;

public enum IngestionOutcome {
    ACCEPTED,
    // Valid, but its bucket was already frozen when it arrived
    DROPPED_LATE
}
