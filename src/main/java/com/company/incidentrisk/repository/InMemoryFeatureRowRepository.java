package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.BucketStatus;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.enums.BucketState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

@Repository
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "memory")
public class InMemoryFeatureRowRepository implements FeatureRowRepository {

    private static final Comparator<FeatureRow> ROW_ORDER = Comparator
            .comparing(FeatureRow::getBucketStart)
            .thenComparing(FeatureRow::getService)
            .thenComparing(FeatureRow::getRoute);

    private final Map<BucketKey, FeatureRow> rows = new ConcurrentHashMap<>();
    private final Map<BucketKey, BucketStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public Optional<FeatureRow> find(SeriesKey key, Instant bucketStart) {
        return Optional.ofNullable(rows.get(new BucketKey(key, bucketStart)));
    }

    @Override
    public void upsert(FeatureRow row) {
        rows.put(new BucketKey(row.seriesKey(), row.getBucketStart()), row);
    }

    @Override
    public List<FeatureRow> findByRange(Instant from, Instant to) {
        return rows.values().stream()
                .filter(row -> !row.getBucketStart().isBefore(from) && row.getBucketStart().isBefore(to))
                .sorted(ROW_ORDER)
                .collect(Collectors.toList());
    }

    @Override
    public List<FeatureRow> findLatestPerSeries(Instant maxBucketStart) {
        BinaryOperator<FeatureRow> newest = (a, b) -> a.getBucketStart().isAfter(b.getBucketStart()) ? a : b;
        return rows.values().stream()
                .filter(row -> !row.getBucketStart().isAfter(maxBucketStart))
                .collect(Collectors.toMap(FeatureRow::seriesKey, row -> row, newest))
                .values().stream()
                .sorted(Comparator.comparing(FeatureRow::seriesKey))
                .collect(Collectors.toList());
    }

    @Override
    public long count() {
        return rows.size();
    }

    @Override
    public Optional<BucketStatus> findStatus(SeriesKey key, Instant bucketStart) {
        return Optional.ofNullable(statuses.get(new BucketKey(key, bucketStart)));
    }

    @Override
    public void saveStatus(BucketStatus status) {
        statuses.put(new BucketKey(SeriesKey.of(status.getService(), status.getRoute()), status.getBucketStart()), status);
    }

    @Override
    public List<BucketStatus> findStatuses(BucketState state, Instant from, Instant to) {
        return statuses.values().stream()
                .filter(status -> status.getState() == state)
                .filter(status -> !status.getBucketStart().isBefore(from) && status.getBucketStart().isBefore(to))
                .sorted(Comparator.comparing(BucketStatus::getBucketStart))
                .collect(Collectors.toList());
    }

    private record BucketKey(SeriesKey series, Instant bucketStart) {
    }
}
