package com.company.incidentrisk.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetryBatchRequest {
    @NotEmpty(message = "At least one event is required")
    @Size(max = 5000, message = "At most 5000 events per batch")
    private List<TelemetryEventRequest> events;
}
