package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.event.AlertRaisedEvent;
import com.company.incidentrisk.repository.AlertRepository;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Hands newly raised alerts to the dispatcher and tracks delivery state on the alert.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AlertDeliveryService {

    private final AlertRepository alertRepository;
    private final AlertDispatcher alertDispatcher;
    private final IncidentRiskProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @EventListener
    @Async
    public void handleAlertRaised(AlertRaisedEvent event) {
        deliver(event.getAlert());
    }

    /**
     * Dispatches the alert and records the delivery outcome. Only delivery tracking is written
     * back, so a status change made while the alert was in flight is kept.
     *
     * @return true when the dispatcher accepted the alert
     */
    public boolean deliver(Alert alert) {
        int attempts = (alert.getDeliveryAttempts() != null ? alert.getDeliveryAttempts() : 0) + 1;
        alert.setDeliveryAttempts(attempts);

        try {
            alertDispatcher.dispatch(alert);

            recordDelivery(alert, DeliveryStatus.SENT, null, clock.instant());

            meterRegistry.counter("incident.alerts.delivered",
                    "severity", alert.getSeverity().name()
            ).increment();
            return true;

        } catch (CallNotPermittedException e) {
            log.error("Alert channel unavailable for alert {}, leaving it pending: {}",
                    alert.getAlertId(), e.getMessage());

            recordDelivery(alert, DeliveryStatus.PENDING, "Circuit open: " + e.getMessage(), null);

            meterRegistry.counter("incident.alerts.circuit_open").increment();
            return false;

        } catch (RuntimeException e) {
            log.error("Failed to deliver alert {}", alert.getAlertId(), e);

            recordDelivery(alert, DeliveryStatus.FAILED, e.getMessage(), null);

            meterRegistry.counter("incident.alerts.delivery_failed").increment();
            return false;
        }
    }

    private void recordDelivery(Alert alert, DeliveryStatus status, String lastError, Instant deliveredAt) {
        alert.setDeliveryStatus(status);
        alert.setLastError(lastError);
        alert.setDeliveredAt(deliveredAt);
        alertRepository.updateDelivery(alert.getAlertId(), status, alert.getDeliveryAttempts(),
                lastError, deliveredAt);
    }

    /**
     * Retries PENDING and FAILED deliveries that still have attempts left.
     *
     * @return number of alerts delivered
     */
    public int redeliverPending(int limit) {
        int maxAttempts = properties.getAlerting().getMaxDeliveryAttempts();

        List<Alert> undelivered = alertRepository.findUndelivered(limit).stream()
                .filter(alert -> alert.getDeliveryAttempts() == null || alert.getDeliveryAttempts() < maxAttempts)
                .toList();

        if (undelivered.isEmpty()) {
            log.debug("No undelivered alerts");
            return 0;
        }

        int delivered = 0;
        for (Alert alert : undelivered) {
            if (deliver(alert)) {
                delivered++;
            }
        }

        log.info("Alert redelivery completed: {} delivered, {} still pending",
                delivered, undelivered.size() - delivered);
        return delivered;
    }
}
