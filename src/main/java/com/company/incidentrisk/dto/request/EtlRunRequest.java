package com.company.incidentrisk.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EtlRunRequest {
    @NotNull(message = "Window start is required")
    private Instant windowStart;

    @NotNull(message = "Window end is required")
    private Instant windowEnd;
}
