package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.BucketStatus;
import com.company.incidentrisk.domain.EtlRunResult;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.domain.enums.BucketState;
import com.company.incidentrisk.repository.FeatureRowRepository;
import com.company.incidentrisk.repository.TelemetryEventRepository;
import com.company.incidentrisk.util.BucketWindows;
import com.company.incidentrisk.util.KeyedLocks;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Closes buckets into feature rows. Work for one (service, route, bucket) is serialized by a
 * key-scoped lock; different keys are computed in parallel on the ETL executor.
 */
@Service
@Slf4j
public class FeatureAggregationService {

    private final TelemetryEventRepository telemetryRepository;
    private final FeatureRowRepository featureRowRepository;
    private final FeatureAggregator aggregator;
    private final BucketWindows bucketWindows;
    private final Retry etlBucketRetry;
    private final Executor etlExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final KeyedLocks<BucketKey> bucketLocks = new KeyedLocks<>();
    private final AtomicReference<EtlRunResult> lastRun = new AtomicReference<>();

    public FeatureAggregationService(TelemetryEventRepository telemetryRepository,
                                     FeatureRowRepository featureRowRepository,
                                     FeatureAggregator aggregator,
                                     BucketWindows bucketWindows,
                                     Retry etlBucketRetry,
                                     @Qualifier("etlExecutor") Executor etlExecutor,
                                     MeterRegistry meterRegistry,
                                     Clock clock) {
        this.telemetryRepository = telemetryRepository;
        this.featureRowRepository = featureRowRepository;
        this.aggregator = aggregator;
        this.bucketWindows = bucketWindows;
        this.etlBucketRetry = etlBucketRetry;
        this.etlExecutor = etlExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    private record BucketKey(SeriesKey series, Instant bucketStart) {
    }

    private enum Outcome {
        UPSERTED, UNCHANGED, SKIPPED_FROZEN, PENDING, EMPTY, FAILED
    }

    private record BucketResult(Outcome outcome, boolean frozenNow) {
    }

    /**
     * Computes every closed bucket intersecting [windowStart, windowEnd) for each series with events in it.
     */
    public EtlRunResult runEtl(Instant windowStart, Instant windowEnd) {
        if (!windowStart.isBefore(windowEnd)) {
            throw new IllegalArgumentException("windowStart must be before windowEnd");
        }

        Instant startedAt = clock.instant();
        Timer.Sample sample = Timer.start(meterRegistry);

        List<Instant> bucketStarts = bucketWindows.bucketStartsBetween(windowStart, windowEnd);
        Set<SeriesKey> seriesKeys = telemetryRepository.findSeriesKeys(
                bucketWindows.bucketStart(windowStart), windowEnd);

        log.info("ETL run over [{}, {}): {} series x {} buckets",
                windowStart, windowEnd, seriesKeys.size(), bucketStarts.size());

        List<CompletableFuture<BucketResult>> futures = new ArrayList<>();
        for (SeriesKey key : seriesKeys) {
            for (Instant bucketStart : bucketStarts) {
                futures.add(CompletableFuture.supplyAsync(
                        () -> processBucket(key, bucketStart, startedAt), etlExecutor));
            }
        }

        int upserted = 0;
        int unchanged = 0;
        int frozen = 0;
        int skippedFrozen = 0;
        int pending = 0;
        int failed = 0;

        for (CompletableFuture<BucketResult> future : futures) {
            BucketResult result = future.join();
            switch (result.outcome()) {
                case UPSERTED -> upserted++;
                case UNCHANGED -> unchanged++;
                case SKIPPED_FROZEN -> skippedFrozen++;
                case PENDING -> pending++;
                case FAILED -> failed++;
                case EMPTY -> { }
            }
            if (result.frozenNow()) {
                frozen++;
            }
        }

        EtlRunResult runResult = EtlRunResult.builder()
                .windowStart(windowStart)
                .windowEnd(windowEnd)
                .bucketsEvaluated(futures.size())
                .rowsUpserted(upserted)
                .rowsUnchanged(unchanged)
                .bucketsFrozen(frozen)
                .bucketsSkippedFrozen(skippedFrozen)
                .bucketsPending(pending)
                .bucketsFailed(failed)
                .startedAt(startedAt)
                .completedAt(clock.instant())
                .build();

        lastRun.set(runResult);

        sample.stop(meterRegistry.timer("incident.etl.duration"));
        meterRegistry.counter("incident.etl.rows.upserted").increment(upserted);
        meterRegistry.counter("incident.etl.buckets.frozen").increment(frozen);
        meterRegistry.counter("incident.etl.buckets.failed").increment(failed);

        log.info("ETL run completed: {} upserted, {} unchanged, {} frozen, {} skipped (frozen), {} pending, {} failed",
                upserted, unchanged, frozen, skippedFrozen, pending, failed);

        return runResult;
    }

    public Optional<EtlRunResult> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    private BucketResult processBucket(SeriesKey key, Instant bucketStart, Instant now) {
        if (!bucketWindows.isClosed(bucketStart, now)) {
            return new BucketResult(Outcome.PENDING, false);
        }

        return bucketLocks.withLock(new BucketKey(key, bucketStart), () -> {
            try {
                Optional<BucketStatus> status = featureRowRepository.findStatus(key, bucketStart);
                if (status.isPresent() && status.get().getState() == BucketState.FROZEN) {
                    return new BucketResult(Outcome.SKIPPED_FROZEN, false);
                }

                return Retry.decorateSupplier(etlBucketRetry,
                        () -> computeAndStore(key, bucketStart, now)).get();

            } catch (RuntimeException e) {
                log.error("Bucket {} {} failed after retries", key, bucketStart, e);
                markFailed(key, bucketStart, now, e);
                return new BucketResult(Outcome.FAILED, false);
            }
        });
    }

    private BucketResult computeAndStore(SeriesKey key, Instant bucketStart, Instant now) {
        Instant bucketEnd = bucketWindows.bucketEnd(bucketStart);
        Instant graceDeadline = bucketWindows.graceDeadline(bucketStart);

        List<TelemetryEvent> events = telemetryRepository.findBySeries(key, bucketStart, bucketEnd).stream()
                .filter(event -> event.getReceivedAt() == null || !event.getReceivedAt().isAfter(graceDeadline))
                .toList();

        Optional<FeatureRow> computed = aggregator.aggregate(key, bucketStart, bucketEnd, events);
        if (computed.isEmpty()) {
            return new BucketResult(Outcome.EMPTY, false);
        }

        FeatureRow row = computed.get();
        Optional<FeatureRow> existing = featureRowRepository.find(key, bucketStart);

        Outcome outcome;
        if (existing.isPresent() && existing.get().equals(row)) {
            outcome = Outcome.UNCHANGED;
        } else {
            featureRowRepository.upsert(row);
            outcome = Outcome.UPSERTED;
            if (existing.isPresent()) {
                log.info("Recomputed bucket {} {} with {} events", key, bucketStart, events.size());
            }
        }

        boolean frozenNow = bucketWindows.isFrozen(bucketStart, now);
        featureRowRepository.saveStatus(BucketStatus.builder()
                .service(key.getService())
                .route(key.getRoute())
                .bucketStart(bucketStart)
                .state(frozenNow ? BucketState.FROZEN : BucketState.COMPUTED)
                .attempts(0)
                .updatedAt(now)
                .build());

        return new BucketResult(outcome, frozenNow);
    }

    private void markFailed(SeriesKey key, Instant bucketStart, Instant now, RuntimeException cause) {
        try {
            featureRowRepository.saveStatus(BucketStatus.builder()
                    .service(key.getService())
                    .route(key.getRoute())
                    .bucketStart(bucketStart)
                    .state(BucketState.FAILED)
                    .attempts(etlBucketRetry.getRetryConfig().getMaxAttempts())
                    .reason(cause.getMessage())
                    .updatedAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Could not record failed state for bucket {} {}: {}", key, bucketStart, e.getMessage());
        }
    }
}
