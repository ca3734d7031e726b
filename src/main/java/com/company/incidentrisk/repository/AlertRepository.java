package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.Alert;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.AlertStatus;
import com.company.incidentrisk.domain.enums.DeliveryStatus;
import com.company.incidentrisk.domain.enums.Severity;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface AlertRepository {

    /**
     * Inserts a new alert and assigns its id.
     */
    Alert save(Alert alert);

    /**
     * Writes status and its timestamps only; delivery columns are left untouched.
     */
    void updateStatus(Alert alert);

    /**
     * Writes delivery tracking only; status columns are left untouched.
     */
    void updateDelivery(long alertId, DeliveryStatus deliveryStatus, int deliveryAttempts,
                        String lastError, Instant deliveredAt);

    Optional<Alert> findById(long alertId);

    /**
     * Most recent OPEN alert for the series created after the given instant.
     */
    Optional<Alert> findLatestOpen(SeriesKey key, Instant createdAfter);

    boolean existsForBucket(SeriesKey key, Instant bucketStart);

    /**
     * Newest first; a null status returns all alerts.
     */
    List<Alert> findByStatus(AlertStatus status, int limit);

    /**
     * Alerts whose delivery is PENDING or FAILED, oldest first.
     */
    List<Alert> findUndelivered(int limit);

    Map<Severity, Long> countCreatedSince(Instant since);

    long countOpen();
}
