package com.company.incidentrisk.service;

import com.company.incidentrisk.config.IncidentRiskProperties;
import com.company.incidentrisk.domain.FeatureRow;
import com.company.incidentrisk.domain.IncidentRecord;
import com.company.incidentrisk.domain.SeriesKey;
import com.company.incidentrisk.domain.TrainingRow;
import com.company.incidentrisk.repository.FeatureRowRepository;
import com.company.incidentrisk.repository.IncidentOutcomeSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds offline training rows. A row is positive when an incident for its series starts
 * inside the lookahead horizon [bucketEnd, bucketEnd + lookahead * width).
 * Only used for training and backtests, never on the live path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LabelGenerator {

    private final FeatureRowRepository featureRowRepository;
    private final IncidentOutcomeSource incidentOutcomeSource;
    private final IncidentRiskProperties properties;

    /**
     * Labels the stored rows with from <= bucketStart < to, observing outcomes up to {@code to}.
     */
    public List<TrainingRow> buildTrainingRows(Instant from, Instant to, int lookaheadBuckets,
                                               double incidentThreshold) {
        List<FeatureRow> rows = featureRowRepository.findByRange(from, to);
        List<IncidentRecord> incidents = incidentOutcomeSource.findIncidents(from, to);

        List<TrainingRow> labeled = label(rows, incidents, to, lookaheadBuckets, incidentThreshold);

        log.info("Labeled {} of {} feature rows in [{}, {}): {} positive",
                labeled.size(), rows.size(), from, to,
                labeled.stream().filter(TrainingRow::isPositive).count());

        return labeled;
    }

    /**
     * Rows whose horizon ends after {@code asOf} are dropped; their outcome is not yet known.
     */
    public List<TrainingRow> label(List<FeatureRow> rows, List<IncidentRecord> incidents, Instant asOf,
                                   int lookaheadBuckets, double incidentThreshold) {
        Duration horizon = properties.getEtl().getBucketWidth().multipliedBy(lookaheadBuckets);
        boolean deriveFromFeatures = properties.getLabels().isDeriveFromFeatures();

        Map<SeriesKey, NavigableSet<Instant>> incidentStarts = new HashMap<>();
        for (IncidentRecord incident : incidents) {
            incidentStarts.computeIfAbsent(SeriesKey.of(incident.getService(), incident.getRoute()),
                    k -> new TreeSet<>()).add(incident.getStartedAt());
        }

        Map<SeriesKey, NavigableMap<Instant, FeatureRow>> rowsBySeries = new HashMap<>();
        for (FeatureRow row : rows) {
            rowsBySeries.computeIfAbsent(row.seriesKey(), k -> new TreeMap<>()).put(row.getBucketStart(), row);
        }

        List<TrainingRow> labeled = new ArrayList<>();
        for (FeatureRow row : rows) {
            Instant horizonStart = row.getBucketEnd();
            Instant horizonEnd = horizonStart.plus(horizon);
            if (horizonEnd.isAfter(asOf)) {
                continue;
            }

            boolean incident = hasRecordedIncident(incidentStarts.get(row.seriesKey()), horizonStart, horizonEnd)
                    || (deriveFromFeatures && hasDegradedBucket(rowsBySeries.get(row.seriesKey()),
                    horizonStart, horizonEnd, incidentThreshold));

            labeled.add(new TrainingRow(row, incident ? 1 : 0));
        }
        return labeled;
    }

    private boolean hasRecordedIncident(NavigableSet<Instant> starts, Instant from, Instant to) {
        if (starts == null) {
            return false;
        }
        Instant first = starts.ceiling(from);
        return first != null && first.isBefore(to);
    }

    private boolean hasDegradedBucket(NavigableMap<Instant, FeatureRow> series, Instant from, Instant to,
                                      double threshold) {
        if (series == null) {
            return false;
        }
        return series.subMap(from, true, to, false).values().stream()
                .anyMatch(future -> future.getErrorRate() >= threshold || future.getTimeoutRate() >= threshold);
    }
}
