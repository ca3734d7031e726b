package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.IncidentRecord;
import com.company.incidentrisk.repository.IncidentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Records externally observed incidents, the outcome source for labeling.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentOutcomeService {

    private final IncidentRecordRepository incidentRepository;
    private final Clock clock;

    public IncidentRecord recordIncident(IncidentRecord incident) {
        if (incident.getRecordedAt() == null) {
            incident.setRecordedAt(clock.instant());
        }
        IncidentRecord saved = incidentRepository.save(incident);
        log.info("Recorded incident {} for {}|{} starting {}",
                saved.getIncidentId(), saved.getService(), saved.getRoute(), saved.getStartedAt());
        return saved;
    }

    public List<IncidentRecord> findIncidents(Instant from, Instant to) {
        return incidentRepository.findIncidents(from, to);
    }
}
