package com.company.incidentrisk.domain;

import lombok.Value;

import java.time.Instant;

/**
 * A labeled row reduced to what ranking metrics need.
 */
@Value
public class ScoredExample {
    Instant bucketStart;
    double score;
    int label;

    public boolean isPositive() {
        return label == 1;
    }
}
