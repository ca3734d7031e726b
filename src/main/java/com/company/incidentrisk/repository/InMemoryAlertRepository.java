package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Stores copies so callers never mutate stored state without going through the update methods.
 */
@Repository
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "memory")
public class InMemoryAlertRepository implements AlertRepository {

    private final AtomicLong idSequence = new AtomicLong();
    private final Map<Long, Alert> store = new ConcurrentHashMap<>();

    @Override
    public Alert save(Alert alert) {
        alert.setAlertId(idSequence.incrementAndGet());
        store.put(alert.getAlertId(), copy(alert));
        return alert;
    }

    @Override
    public void updateStatus(Alert alert) {
        store.computeIfPresent(alert.getAlertId(), (id, stored) -> stored.toBuilder()
                .status(alert.getStatus())
                .acknowledgedAt(alert.getAcknowledgedAt())
                .resolvedAt(alert.getResolvedAt())
                .build());
    }

    @Override
    public void updateDelivery(long alertId, DeliveryStatus deliveryStatus, int deliveryAttempts,
                               String lastError, Instant deliveredAt) {
        store.computeIfPresent(alertId, (id, stored) -> stored.toBuilder()
                .deliveryStatus(deliveryStatus)
                .deliveryAttempts(deliveryAttempts)
                .lastError(lastError)
                .deliveredAt(deliveredAt)
                .build());
    }

    @Override
    public Optional<Alert> findById(long alertId) {
        return Optional.ofNullable(store.get(alertId)).map(InMemoryAlertRepository::copy);
    }

    @Override
    public Optional<Alert> findLatestOpen(SeriesKey key, Instant createdAfter) {
        return store.values().stream()
                .filter(alert -> alert.seriesKey().equals(key))
                .filter(Alert::isOpen)
                .filter(alert -> alert.getCreatedAt().isAfter(createdAfter))
                .max(Comparator.comparing(Alert::getCreatedAt))
                .map(InMemoryAlertRepository::copy);
    }

    @Override
    public boolean existsForBucket(SeriesKey key, Instant bucketStart) {
        return store.values().stream()
                .anyMatch(alert -> alert.seriesKey().equals(key) && alert.getBucketStart().equals(bucketStart));
    }

    @Override
    public List<Alert> findByStatus(AlertStatus status, int limit) {
        return store.values().stream()
                .filter(alert -> status == null || alert.getStatus() == status)
                .sorted(Comparator.comparing(Alert::getCreatedAt).reversed())
                .limit(limit)
                .map(InMemoryAlertRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public List<Alert> findUndelivered(int limit) {
        return store.values().stream()
                .filter(alert -> alert.getDeliveryStatus() != DeliveryStatus.SENT)
                .sorted(Comparator.comparing(Alert::getCreatedAt))
                .limit(limit)
                .map(InMemoryAlertRepository::copy)
                .collect(Collectors.toList());
    }

    @Override
    public Map<Severity, Long> countCreatedSince(Instant since) {
        Map<Severity, Long> counts = new EnumMap<>(Severity.class);
        store.values().stream()
                .filter(alert -> !alert.getCreatedAt().isBefore(since))
                .forEach(alert -> counts.merge(alert.getSeverity(), 1L, Long::sum));
        return counts;
    }

    @Override
    public long countOpen() {
        return store.values().stream().filter(Alert::isOpen).count();
    }

    private static Alert copy(Alert alert) {
        return alert.toBuilder().build();
    }
}
