package com.company.incidentrisk.domain;

import com.company.incidentrisk.domain.enums.BucketState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class BucketStatus {
    String service;
    String route;
    Instant bucketStart;
    BucketState state;
    int attempts;
    String reason;
    Instant updatedAt;
}
