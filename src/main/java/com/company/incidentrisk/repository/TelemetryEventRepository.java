package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.domain.TelemetryTotals;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Append-only raw telemetry store, partitioned by (service, route).
 */
public interface TelemetryEventRepository {

    void append(TelemetryEvent event);

    /**
     * Events of one series with from <= timestamp < to, in no particular order.
     */
    List<TelemetryEvent> findBySeries(SeriesKey key, Instant from, Instant to);

    /**
     * Series that have at least one event with from <= timestamp < to.
     */
    Set<SeriesKey> findSeriesKeys(Instant from, Instant to);

    TelemetryTotals summarize();

    /**
     * Drops events with timestamp before the cutoff. Returns the number removed.
     */
    int purgeOlderThan(Instant cutoff);
}
