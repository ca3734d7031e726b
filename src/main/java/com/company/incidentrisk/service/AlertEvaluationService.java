package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.FactorContribution;
import com.company.incidentrisk.domain.PredictionResult;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;
import com.company.incidentrisk.event.AlertRaisedEvent;
import com.company.incidentrisk.exception.AlertNotFoundException;
import com.company.incidentrisk.exception.InvalidAlertTransitionException;
import com.company.incidentrisk.repository.AlertRepository;
import com.company.incidentrisk.util.KeyedLocks;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns high-risk predictions into alerts. The dedupe check and the insert for one series run
 * under that series' lock; series are independent of each other.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertEvaluationService {

    private final AlertRepository alertRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final KeyedLocks<SeriesKey> seriesLocks = new KeyedLocks<>();

    /**
     * @return alerts created by this call, in prediction order
     */
    public List<Alert> evaluate(List<PredictionResult> predictions) {
        List<Alert> created = new ArrayList<>();

        for (PredictionResult prediction : predictions) {
            try {
                seriesLocks.withLock(prediction.seriesKey(), () -> evaluateOne(prediction))
                        .ifPresent(created::add);
            } catch (RuntimeException e) {
                log.error("Alert evaluation failed for {} bucket {}",
                        prediction.seriesKey(), prediction.getBucketStart(), e);
                meterRegistry.counter("incident.alerts.failed").increment();
            }
        }

        if (!created.isEmpty()) {
            log.info("Alert evaluation over {} predictions created {} alerts", predictions.size(), created.size());
        }
        return created;
    }

    /**
     * Band lookup; empty below the alerting threshold or the lowest band.
     */
    public Optional<Severity> severityFor(double riskScore) {
        IncidentRiskProperties.Alerting alerting = properties.getAlerting();
        if (riskScore < alerting.getThreshold()) {
            return Optional.empty();
        }
        if (riskScore >= alerting.getCriticalBand()) {
            return Optional.of(Severity.CRITICAL);
        }
        if (riskScore >= alerting.getHighBand()) {
            return Optional.of(Severity.HIGH);
        }
        if (riskScore >= alerting.getMediumBand()) {
            return Optional.of(Severity.MEDIUM);
        }
        return Optional.empty();
    }

    public Alert acknowledge(long alertId) {
        return transition(alertId, AlertStatus.ACKNOWLEDGED);
    }

    public Alert resolve(long alertId) {
        return transition(alertId, AlertStatus.RESOLVED);
    }

    public Alert getAlert(long alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new AlertNotFoundException(alertId));
    }

    public List<Alert> listAlerts(AlertStatus status, int limit) {
        return alertRepository.findByStatus(status, limit);
    }

    private Optional<Alert> evaluateOne(PredictionResult prediction) {
        Optional<Severity> severity = severityFor(prediction.getRiskScore());
        if (severity.isEmpty()) {
            return Optional.empty();
        }

        SeriesKey key = prediction.seriesKey();
        Instant now = clock.instant();

        if (alertRepository.existsForBucket(key, prediction.getBucketStart())) {
            recordSuppressed("duplicate_bucket");
            log.debug("Alert for {} bucket {} already exists", key, prediction.getBucketStart());
            return Optional.empty();
        }

        Optional<Alert> recent = alertRepository.findLatestOpen(key, now.minus(properties.getAlerting().getCooldown()));
        if (recent.isPresent()) {
            recordSuppressed("cooldown");
            log.debug("Alert for {} suppressed by open alert {} created at {}",
                    key, recent.get().getAlertId(), recent.get().getCreatedAt());
            return Optional.empty();
        }

        Alert alert = Alert.builder()
                .service(prediction.getService())
                .route(prediction.getRoute())
                .bucketStart(prediction.getBucketStart())
                .severity(severity.get())
                .riskScore(prediction.getRiskScore())
                .modelVersion(prediction.getModelVersion())
                .topFactors(describeFactors(prediction.getTopFactors()))
                .status(AlertStatus.OPEN)
                .createdAt(now)
                .deliveryStatus(DeliveryStatus.PENDING)
                .deliveryAttempts(0)
                .build();

        Alert saved;
        try {
            saved = alertRepository.save(alert);
        } catch (DuplicateKeyException e) {
            // another instance raised it first
            recordSuppressed("duplicate_bucket");
            log.warn("Alert for {} bucket {} already recorded, skipping", key, prediction.getBucketStart());
            return Optional.empty();
        }

        meterRegistry.counter("incident.alerts.created",
                "severity", saved.getSeverity().name()
        ).increment();

        log.warn("Raised {} alert {} for {} (risk {}, bucket {})",
                saved.getSeverity(), saved.getAlertId(), key,
                String.format(Locale.ROOT, "%.3f", saved.getRiskScore()), saved.getBucketStart());

        eventPublisher.publishEvent(new AlertRaisedEvent(saved));
        return Optional.of(saved);
    }

    private Alert transition(long alertId, AlertStatus target) {
        Alert alert = getAlert(alertId);

        return seriesLocks.withLock(alert.seriesKey(), () -> {
            Alert current = getAlert(alertId);
            if (!current.getStatus().canTransitionTo(target)) {
                throw new InvalidAlertTransitionException(alertId, current.getStatus(), target);
            }

            Instant now = clock.instant();
            current.setStatus(target);
            if (target == AlertStatus.ACKNOWLEDGED) {
                current.setAcknowledgedAt(now);
            } else if (target == AlertStatus.RESOLVED) {
                current.setResolvedAt(now);
            }
            alertRepository.updateStatus(current);

            log.info("Alert {} moved to {}", alertId, target);
            return current;
        });
    }

    private void recordSuppressed(String reason) {
        meterRegistry.counter("incident.alerts.suppressed", "reason", reason).increment();
    }

    private static String describeFactors(List<FactorContribution> factors) {
        if (factors == null || factors.isEmpty()) {
            return "";
        }
        return factors.stream()
                .map(f -> String.format(Locale.ROOT, "%s=%+.4f", f.getFeature(), f.getContribution()))
                .collect(Collectors.joining(", "));
    }
}
