package com.company.incidentrisk.service;

import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.util.StatsUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Turns the events of one (service, route, bucket) into a feature row.
 * Every aggregate is computed over sorted values, so the result does not depend on event order.
 */
@Component
public class FeatureAggregator {

    public Optional<FeatureRow> aggregate(SeriesKey key, Instant bucketStart, Instant bucketEnd,
                                          List<TelemetryEvent> events) {
        int n = events.size();
        if (n == 0) {
            return Optional.empty();
        }

        double[] latencies = new double[n];
        double[] memory = new double[n];
        double[] cpu = new double[n];
        double[] retries = new double[n];
        long serverErrors = 0;
        long timeouts = 0;

        for (int i = 0; i < n; i++) {
            TelemetryEvent event = events.get(i);
            latencies[i] = event.getLatencyMs();
            memory[i] = event.getMemoryMb();
            cpu[i] = event.getCpuPct();
            retries[i] = event.getRetries();
            if (event.isServerError()) {
                serverErrors++;
            }
            if (event.isTimeout()) {
                timeouts++;
            }
        }

        Arrays.sort(latencies);
        Arrays.sort(memory);
        Arrays.sort(cpu);
        Arrays.sort(retries);

        FeatureRow row = FeatureRow.builder()
                .service(key.getService())
                .route(key.getRoute())
                .bucketStart(bucketStart)
                .bucketEnd(bucketEnd)
                .errorRate(StatsUtils.ratio(serverErrors, n))
                .p95LatencyMs(StatsUtils.percentile(latencies, 0.95))
                .p99LatencyMs(StatsUtils.percentile(latencies, 0.99))
                .avgMemoryMb(StatsUtils.mean(memory))
                .avgCpuPct(StatsUtils.mean(cpu))
                // capped at 1 so every rate stays in [0, 1]
                .retriesRate(StatsUtils.clamp(StatsUtils.mean(retries), 0.0, 1.0))
                .timeoutRate(StatsUtils.ratio(timeouts, n))
                .totalRequests(n)
                .build();

        return Optional.of(row);
    }
}
