package com.questrail.readiness.api;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * ConnectionState
 * -----------------------------------------------------------------------------
 * Readiness state of a single real-time connection, from "transport accepted"
 * to "safe to process application messages".
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   INITIALIZING → HANDSHAKE_PENDING → CONNECTED → READY_FOR_MESSAGES
 *        \               \                 \               \
 *         +---------------+-----------------+---------------+→ ERROR → CLOSED
 *                                                            → CLOSED
 * </pre>
 *
 * <p>
 * {@link #ERROR} and {@link #CLOSED} are reachable from every non-terminal state.
 * {@link #READY_FOR_MESSAGES} is the success state and the only state in which
 * application messages may be delivered.
 * </p>
 *
 * <h2>Edge table</h2>
 * The edge table below is consulted only by audits
 * ({@code ConnectionStateMachine#validateStateSequence()}); writing a transition
 * never checks it.
 */
public enum ConnectionState
{
    INITIALIZING,
    HANDSHAKE_PENDING,
    CONNECTED,
    READY_FOR_MESSAGES,
    ERROR,
    CLOSED;

    public boolean isInitial() {
        return this == INITIALIZING;
    }

    /**
     * {@code true} for states that end the handshake, whether it succeeded or not.
     */
    public boolean isTerminal() {
        return this == READY_FOR_MESSAGES || this == ERROR || this == CLOSED;
    }

    public boolean isSuccessTerminal() {
        return this == READY_FOR_MESSAGES;
    }

    /**
     * {@code true} while the handshake has not yet delivered a connected transport.
     * Delivering messages in these states is a premature-access bug.
     */
    public boolean isSetupPhase() {
        return this == INITIALIZING || this == HANDSHAKE_PENDING;
    }

    /**
     * States this state may legally move to.
     */
    public Set<ConnectionState> allowedTargets() {
        return switch (this) {
            case INITIALIZING -> immutable(EnumSet.of(HANDSHAKE_PENDING, ERROR, CLOSED));
            case HANDSHAKE_PENDING -> immutable(EnumSet.of(CONNECTED, ERROR, CLOSED));
            case CONNECTED -> immutable(EnumSet.of(READY_FOR_MESSAGES, ERROR, CLOSED));
            case READY_FOR_MESSAGES -> immutable(EnumSet.of(ERROR, CLOSED));
            case ERROR -> immutable(EnumSet.of(CLOSED));
            case CLOSED -> Collections.emptySet();
        };
    }

    public boolean canTransitionTo(ConnectionState target) {
        return target != null && allowedTargets().contains(target);
    }

    private static Set<ConnectionState> immutable(EnumSet<ConnectionState> states) {
        return Collections.unmodifiableSet(states);
    }
}
