package com.company.incidentrisk.dto.request;

import jakarta.validation.constraints.Min;
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
public class BacktestRequest {
    @NotNull(message = "Range start is required")
    private Instant from;

    @NotNull(message = "Range end is required")
    private Instant to;

    @NotNull(message = "Model version is required")
    private Long modelVersion;

    @Min(1)
    private Integer k;
}
