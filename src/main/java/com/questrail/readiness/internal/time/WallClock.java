package com.questrail.readiness.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Wall-clock source for human-readable timestamps on transitions and detected
 * patterns, and for age-based pattern eviction.
 *
 * <p>
 * This clock may jump (NTP, manual adjustment). It MUST NOT be used to measure
 * handshake durations or to compute timer deadlines.
 * </p>
 */
public interface WallClock
{
    Instant now();
}
