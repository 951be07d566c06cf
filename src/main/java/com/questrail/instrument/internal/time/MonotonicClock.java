package com.questrail.instrument.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for elapsed-time computations.
 *
 * <h2>Binding invariant</h2>
 * Timeout budgets (the shrinking {@code io_timeout} of a multi-chunk read,
 * the discovery receive window) MUST use a monotonic time source. Wall-clock
 * time (e.g. {@code Instant.now()}) is permitted only for observability.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     *
     * <p>Values are only meaningful for elapsed time computations.</p>
     */
    long nowNanos();
}
