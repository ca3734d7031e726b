package com.company.incidentrisk.util;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop signal for long loops (training iterations, backtest replay).
 * Trips on an explicit {@link #cancel()} or when the deadline passes.
 */
public class CancellationToken {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    private CancellationToken(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static CancellationToken withBudget(Clock clock, Duration budget) {
        if (budget == null) {
            return new CancellationToken(clock, null);
        }
        return new CancellationToken(clock, clock.instant().plus(budget));
    }

    public static CancellationToken none() {
        return new CancellationToken(Clock.systemUTC(), null);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get() || (deadline != null && clock.instant().isAfter(deadline));
    }

    public String reason() {
        if (cancelled.get()) {
            return "cancelled";
        }
        if (deadline != null && clock.instant().isAfter(deadline)) {
            return "time budget exceeded (deadline " + deadline + ")";
        }
        return "running";
    }
}
