package com.company.incidentrisk.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An externally recorded incident, used only for offline labeling.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncidentRecord {
    private Long incidentId;
    private String service;
    private String route;
    private Instant startedAt;
    private String severity;
    private String description;
    private Instant recordedAt;
}
