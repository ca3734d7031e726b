package com.company.incidentrisk.domain;

import lombok.Value;

@Value
public class TelemetryTotals {
    long totalEvents;
    long serverErrors;
    long timeouts;

    public static TelemetryTotals empty() {
        return new TelemetryTotals(0, 0, 0);
    }
}
