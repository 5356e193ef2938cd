package com.manufacturing.semanticlayer.service;

import com.manufacturing.semanticlayer.exception.OperationCancelledException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline plus cancellation flag handed to blocking operations. Long-running
 * loops call {@link #checkpoint(String)} between units of work.
 */
public final class OperationDeadline {

    private static final OperationDeadline NONE = new OperationDeadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private OperationDeadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static OperationDeadline none() {
        return NONE;
    }

    public static OperationDeadline after(Duration timeout) {
        return after(timeout, Clock.systemUTC());
    }

    public static OperationDeadline after(Duration timeout, Clock clock) {
        return new OperationDeadline(clock.instant().plus(timeout), clock);
    }

    /**
     * Requests cancellation. Has no effect on {@link #none()}.
     */
    public void cancel() {
        if (this != NONE) {
            cancelled.set(true);
        }
    }

    public boolean isExpired() {
        return cancelled.get() || (expiresAt != null && !clock.instant().isBefore(expiresAt));
    }

    public void checkpoint(String stage) {
        if (cancelled.get()) {
            throw new OperationCancelledException("Cancelled during " + stage);
        }
        if (expiresAt != null && !clock.instant().isBefore(expiresAt)) {
            throw new OperationCancelledException("Deadline " + expiresAt + " passed during " + stage);
        }
    }
}
