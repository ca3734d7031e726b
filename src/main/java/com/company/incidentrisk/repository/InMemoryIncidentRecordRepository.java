package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.IncidentRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Repository
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "memory")
public class InMemoryIncidentRecordRepository implements IncidentRecordRepository {

    private final AtomicLong idSequence = new AtomicLong();
    private final Queue<IncidentRecord> incidents = new ConcurrentLinkedQueue<>();

    @Override
    public IncidentRecord save(IncidentRecord incident) {
        incident.setIncidentId(idSequence.incrementAndGet());
        incidents.add(incident);
        return incident;
    }

    @Override
    public List<IncidentRecord> findIncidents(Instant from, Instant to) {
        return incidents.stream()
                .filter(incident -> !incident.getStartedAt().isBefore(from) && incident.getStartedAt().isBefore(to))
                .sorted(Comparator.comparing(IncidentRecord::getStartedAt))
                .collect(Collectors.toList());
    }
}
