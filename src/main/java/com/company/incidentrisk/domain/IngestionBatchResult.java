package com.company.incidentrisk.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class IngestionBatchResult {
    int received;
    int accepted;
    int rejected;
    int droppedLate;
    // One entry per rejected event, prefixed with its position in the batch
    List<String> errors;
}
