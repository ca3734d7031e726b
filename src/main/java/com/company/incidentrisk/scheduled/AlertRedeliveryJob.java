package com.company.incidentrisk.scheduled;

import com.company.incidentrisk.service.AlertDeliveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Retries alert deliveries left PENDING or FAILED by the event-driven path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "incident-risk.alerting.redelivery-enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class AlertRedeliveryJob {

    private static final int BATCH_SIZE = 100;

    private final AlertDeliveryService deliveryService;

    @Scheduled(fixedDelay = 300000, initialDelay = 60000)
    public void redeliverPendingAlerts() {
        log.debug("Checking for undelivered alerts");
        deliveryService.redeliverPending(BATCH_SIZE);
    }
}
