package com.company.incidentrisk.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-width bucket arithmetic plus the watermark/grace lifecycle of a bucket.
 * <p>
 * A bucket [s, s+W) is closed at s + W + watermarkDelay and frozen at
 * close + allowedLateness (its grace deadline).
 */
public class BucketWindows {

    private final Duration bucketWidth;
    private final Duration watermarkDelay;
    private final Duration allowedLateness;

    public BucketWindows(Duration bucketWidth, Duration watermarkDelay, Duration allowedLateness) {
        if (bucketWidth == null || bucketWidth.isZero() || bucketWidth.isNegative()) {
            throw new IllegalArgumentException("Bucket width must be positive");
        }
        if (watermarkDelay.isNegative() || allowedLateness.isNegative()) {
            throw new IllegalArgumentException("Watermark delay and allowed lateness must not be negative");
        }
        this.bucketWidth = bucketWidth;
        this.watermarkDelay = watermarkDelay;
        this.allowedLateness = allowedLateness;
    }

    public Duration getBucketWidth() {
        return bucketWidth;
    }

    public Duration getWatermarkDelay() {
        return watermarkDelay;
    }

    /**
     * Floor of the timestamp to its bucket start (epoch aligned).
     */
    public Instant bucketStart(Instant timestamp) {
        long widthMs = bucketWidth.toMillis();
        long epochMs = timestamp.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(epochMs, widthMs) * widthMs);
    }

    public Instant bucketEnd(Instant bucketStart) {
        return bucketStart.plus(bucketWidth);
    }

    public Instant closesAt(Instant bucketStart) {
        return bucketEnd(bucketStart).plus(watermarkDelay);
    }

    public Instant graceDeadline(Instant bucketStart) {
        return closesAt(bucketStart).plus(allowedLateness);
    }

    public boolean isClosed(Instant bucketStart, Instant now) {
        return !now.isBefore(closesAt(bucketStart));
    }

    public boolean isFrozen(Instant bucketStart, Instant now) {
        return now.isAfter(graceDeadline(bucketStart));
    }

    /**
     * Start of the newest bucket that is closed at {@code now}.
     */
    public Instant latestClosedBucketStart(Instant now) {
        return bucketStart(now.minus(watermarkDelay)).minus(bucketWidth);
    }

    /**
     * Bucket starts covering [from, to): the first is the bucket containing {@code from}.
     */
    public List<Instant> bucketStartsBetween(Instant from, Instant to) {
        List<Instant> starts = new ArrayList<>();
        for (Instant start = bucketStart(from); start.isBefore(to); start = start.plus(bucketWidth)) {
            starts.add(start);
        }
        return starts;
    }
}
