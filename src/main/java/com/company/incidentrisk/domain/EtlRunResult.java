package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EtlRunResult {
    Instant windowStart;
    Instant windowEnd;

    int bucketsEvaluated;
    // Rows written or replaced by this run
    int rowsUpserted;
    int rowsUnchanged;
    int bucketsFrozen;
    int bucketsSkippedFrozen;
    int bucketsPending;
    int bucketsFailed;

    Instant startedAt;
    Instant completedAt;
}
