package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FactorContribution {
    String feature;
    // Signed weight x normalized value
    double contribution;
}
