package com.company.incidentrisk.dto.request;

import jakarta.validation.constraints.NotBlank;
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
public class IncidentRequest {
    @NotBlank(message = "Service is required")
    private String service;

    @NotBlank(message = "Route is required")
    private String route;

    @NotNull(message = "Incident start time is required")
    private Instant startedAt;

    // Optional fields
    private String severity;
    private String description;
}
