package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.IncidentRecord;

import java.time.Instant;
import java.util.List;

/**
 * Externally recorded incidents, read for offline labeling only.
 */
public interface IncidentOutcomeSource {

    /**
     * Incidents with from <= startedAt < to.
     */
    List<IncidentRecord> findIncidents(Instant from, Instant to);
}
