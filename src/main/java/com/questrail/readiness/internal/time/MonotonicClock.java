package com.questrail.readiness.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every duration the readiness layer measures.
 *
 * <h2>Binding invariant</h2>
 * Handshake durations, elapsed times and timer deadlines MUST use a monotonic
 * source. Wall-clock time ({@code Instant.now()}) is for transition and pattern
 * timestamps only.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();
}
