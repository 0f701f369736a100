package com.questrail.readiness.state;

import com.questrail.readiness.api.ConnectionState;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a connection's append-only transition log.
 *
 * @param from    state before the transition
 * @param to      state after the transition
 * @param at      wall-clock timestamp, for observability
 * @param atNanos monotonic timestamp, for ordering and elapsed-time math
 */
public record StateTransition(
        ConnectionState from,
        ConnectionState to,
        Instant at,
        long atNanos
) {
    public StateTransition {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(at, "at");
    }

    /**
     * {@code true} if the edge is in {@link ConnectionState}'s edge table.
     */
    public boolean isAllowed() {
        return from.canTransitionTo(to);
    }
}
