package com.company.incidentrisk.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BucketWindowsTest {

    private static final Instant T0 = Instant.parse("2026-01-05T00:00:00Z");

    private final BucketWindows windows = new BucketWindows(
            Duration.ofMinutes(5), Duration.ofMinutes(5), Duration.ofMinutes(10));

    @Test
    void floorsTimestampsToEpochAlignedBuckets() {
        assertThat(windows.bucketStart(T0.plusSeconds(299))).isEqualTo(T0);
        assertThat(windows.bucketStart(T0.plusSeconds(300))).isEqualTo(T0.plusSeconds(300));
        assertThat(windows.bucketStart(Instant.ofEpochMilli(-1))).isEqualTo(Instant.ofEpochSecond(-300));
    }

    @Test
    void bucketClosesAfterWatermarkAndFreezesAfterGrace() {
        assertThat(windows.closesAt(T0)).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(windows.graceDeadline(T0)).isEqualTo(T0.plus(Duration.ofMinutes(20)));

        assertThat(windows.isClosed(T0, T0.plus(Duration.ofMinutes(9)))).isFalse();
        assertThat(windows.isClosed(T0, T0.plus(Duration.ofMinutes(10)))).isTrue();
        assertThat(windows.isFrozen(T0, T0.plus(Duration.ofMinutes(20)))).isFalse();
        assertThat(windows.isFrozen(T0, T0.plus(Duration.ofMinutes(20)).plusMillis(1))).isTrue();
    }

    @Test
    void latestClosedBucketIsClosedAtNow() {
        Instant now = T0.plus(Duration.ofMinutes(17));

        Instant latest = windows.latestClosedBucketStart(now);

        assertThat(latest).isEqualTo(T0.plus(Duration.ofMinutes(5)));
        assertThat(windows.isClosed(latest, now)).isTrue();
        assertThat(windows.isClosed(latest.plus(Duration.ofMinutes(5)), now)).isFalse();
    }

    @Test
    void enumeratesBucketsCoveringRange() {
        assertThat(windows.bucketStartsBetween(T0.plusSeconds(60), T0.plus(Duration.ofMinutes(15))))
                .containsExactly(T0, T0.plus(Duration.ofMinutes(5)), T0.plus(Duration.ofMinutes(10)));
    }

    @Test
    void rejectsNonPositiveWidth() {
        assertThatThrownBy(() -> new BucketWindows(Duration.ZERO, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
