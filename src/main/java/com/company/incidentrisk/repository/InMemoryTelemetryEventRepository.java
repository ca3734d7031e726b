package com.company.incidentrisk.repository;

import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.TelemetryEvent;
import com.company.incidentrisk.domain.TelemetryTotals;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

/**
 * Lock-free append store: one concurrent queue per series.
 */
@Repository
@ConditionalOnProperty(value = "incident-risk.store.type", havingValue = "memory")
public class InMemoryTelemetryEventRepository implements TelemetryEventRepository {

    private final Map<SeriesKey, Queue<TelemetryEvent>> store = new ConcurrentHashMap<>();

    @Override
    public void append(TelemetryEvent event) {
        store.computeIfAbsent(event.seriesKey(), key -> new ConcurrentLinkedQueue<>()).add(event);
    }

    @Override
    public List<TelemetryEvent> findBySeries(SeriesKey key, Instant from, Instant to) {
        Queue<TelemetryEvent> events = store.get(key);
        if (events == null) {
            return List.of();
        }
        return events.stream()
                .filter(event -> inRange(event.getTimestamp(), from, to))
                .collect(Collectors.toList());
    }

    @Override
    public Set<SeriesKey> findSeriesKeys(Instant from, Instant to) {
        return store.entrySet().stream()
                .filter(entry -> entry.getValue().stream()
                        .anyMatch(event -> inRange(event.getTimestamp(), from, to)))
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    @Override
    public TelemetryTotals summarize() {
        long total = 0;
        long errors = 0;
        long timeouts = 0;
        for (Queue<TelemetryEvent> events : store.values()) {
            for (TelemetryEvent event : events) {
                total++;
                if (event.isServerError()) errors++;
                if (event.isTimeout()) timeouts++;
            }
        }
        return new TelemetryTotals(total, errors, timeouts);
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int removed = 0;
        for (Queue<TelemetryEvent> events : store.values()) {
            int before = events.size();
            events.removeIf(event -> event.getTimestamp().isBefore(cutoff));
            removed += before - events.size();
        }
        return removed;
    }

    private static boolean inRange(Instant timestamp, Instant from, Instant to) {
        return !timestamp.isBefore(from) && timestamp.isBefore(to);
    }
}
