package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.IngestionBatchResult;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.domain.enums.IngestionOutcome;
import com.company.incidentrisk.exception.TelemetryValidationException;
import com.company.incidentrisk.repository.TelemetryEventRepository;
import com.company.incidentrisk.util.BucketWindows;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
@RequiredArgsConstructor
public class TelemetryIngestionService {

    private final TelemetryEventRepository telemetryRepository;
    private final BucketWindows bucketWindows;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong lateDropped = new AtomicLong();

    /**
     * Validates and appends one event, stamping its receipt time.
     * Events whose bucket is already past its grace deadline are dropped, not stored.
     *
     * @throws TelemetryValidationException listing every violated rule
     */
    public IngestionOutcome ingest(TelemetryEvent event) {
        Instant now = clock.instant();

        List<String> violations = validate(event, now);
        if (!violations.isEmpty()) {
            meterRegistry.counter("incident.telemetry.rejected").increment();
            log.debug("Rejected telemetry event for {}|{}: {}",
                    event.getService(), event.getRoute(), violations);
            throw new TelemetryValidationException(violations);
        }

        Instant bucketStart = bucketWindows.bucketStart(event.getTimestamp());
        if (bucketWindows.isFrozen(bucketStart, now)) {
            lateDropped.incrementAndGet();
            meterRegistry.counter("incident.telemetry.late_dropped",
                    "service", event.getService()
            ).increment();
            log.debug("Dropped late event for {}|{} in bucket {} (grace deadline {})",
                    event.getService(), event.getRoute(), bucketStart, bucketWindows.graceDeadline(bucketStart));
            return IngestionOutcome.DROPPED_LATE;
        }

        telemetryRepository.append(event.toBuilder().receivedAt(now).build());

        meterRegistry.counter("incident.telemetry.accepted",
                "service", event.getService()
        ).increment();

        return IngestionOutcome.ACCEPTED;
    }

    /**
     * Ingests each event independently; one invalid event does not reject the rest.
     */
    public IngestionBatchResult ingestBatch(List<TelemetryEvent> events) {
        int accepted = 0;
        int droppedLate = 0;
        List<String> errors = new ArrayList<>();

        for (int i = 0; i < events.size(); i++) {
            try {
                IngestionOutcome outcome = ingest(events.get(i));
                if (outcome == IngestionOutcome.ACCEPTED) {
                    accepted++;
                } else {
                    droppedLate++;
                }
            } catch (TelemetryValidationException e) {
                errors.add("event[" + i + "]: " + String.join("; ", e.getViolations()));
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Telemetry batch of {} events: {} rejected", events.size(), errors.size());
        }

        return IngestionBatchResult.builder()
                .received(events.size())
                .accepted(accepted)
                .rejected(errors.size())
                .droppedLate(droppedLate)
                .errors(errors)
                .build();
    }

    /**
     * Removes raw events older than the retention horizon.
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(properties.getIngestion().getRetentionHorizon());
        int removed = telemetryRepository.purgeOlderThan(cutoff);
        log.info("Purged {} telemetry events older than {}", removed, cutoff);
        return removed;
    }

    public long getLateDroppedCount() {
        return lateDropped.get();
    }

    private List<String> validate(TelemetryEvent event, Instant now) {
        List<String> violations = new ArrayList<>();

        if (event.getService() == null || event.getService().isBlank()) {
            violations.add("service must not be empty");
        }
        if (event.getRoute() == null || event.getRoute().isBlank()) {
            violations.add("route must not be empty");
        }
        if (event.getStatusCode() < 0) {
            violations.add("statusCode must not be negative");
        }
        if (event.getLatencyMs() < 0 || Double.isNaN(event.getLatencyMs())) {
            violations.add("latencyMs must not be negative");
        }
        if (event.getMemoryMb() < 0 || Double.isNaN(event.getMemoryMb())) {
            violations.add("memoryMb must not be negative");
        }
        if (event.getCpuPct() < 0 || Double.isNaN(event.getCpuPct())) {
            violations.add("cpuPct must not be negative");
        }
        if (event.getRetries() < 0) {
            violations.add("retries must not be negative");
        }

        if (event.getTimestamp() == null) {
            violations.add("timestamp is required");
        } else {
            Instant latestAllowed = now.plus(properties.getIngestion().getClockSkewTolerance());
            Instant oldestAllowed = now.minus(properties.getIngestion().getRetentionHorizon());
            if (event.getTimestamp().isAfter(latestAllowed)) {
                violations.add("timestamp " + event.getTimestamp() + " is beyond the clock-skew tolerance");
            }
            if (event.getTimestamp().isBefore(oldestAllowed)) {
                violations.add("timestamp " + event.getTimestamp() + " is older than the retention horizon");
            }
        }

        return violations;
    }
}
