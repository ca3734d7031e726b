package com.company.incidentrisk.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * One scoring outcome. topFactors is sorted by absolute contribution, largest first.
 */
@Value
@Builder
@Jacksonized
public class PredictionResult {
    String service;
    String route;
    Instant bucketStart;
    double riskScore;
    Long modelVersion;
    List<FactorContribution> topFactors;

    @JsonIgnore
    public SeriesKey seriesKey() {
        return SeriesKey.of(service, route);
    }
}
