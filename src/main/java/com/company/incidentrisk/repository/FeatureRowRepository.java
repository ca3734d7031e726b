package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.BucketStatus;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.BucketState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Feature rows keyed by (service, route, bucketStart), plus per-bucket lifecycle state.
 */
public interface FeatureRowRepository {

    Optional<FeatureRow> find(SeriesKey key, Instant bucketStart);

    /**
     * Inserts the row or replaces the one stored for the same key.
     */
    void upsert(FeatureRow row);

    /**
     * Rows with from <= bucketStart < to, ordered by bucketStart, service, route.
     */
    List<FeatureRow> findByRange(Instant from, Instant to);

    /**
     * Newest row per series whose bucketStart is not after the bound.
     */
    List<FeatureRow> findLatestPerSeries(Instant maxBucketStart);

    long count();

    Optional<BucketStatus> findStatus(SeriesKey key, Instant bucketStart);

    void saveStatus(BucketStatus status);

    List<BucketStatus> findStatuses(BucketState state, Instant from, Instant to);
}
