package com.questrail.readiness.state;

import com.questrail.readiness.api.ConnectionState;
import com.questrail.readiness.internal.time.MonotonicClock;
import com.questrail.readiness.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ConnectionStateMachine
 * =============================================================================
 * Readiness state machine for one connection.
 *
 * <h2>Write path</h2>
 * {@link #transition(ConnectionState)} appends to the log and moves the
 * current state. It does <strong>not</strong> consult the edge table: callers
 * such as an administrative force-to-error rely on being able to write any edge.
 *
 * <h2>Audit path</h2>
 * {@link #validateStateSequence()} replays the log against the edge table out of
 * band and reports the first violation.
 *
 * <h2>Invariants</h2>
 * <ul>
 *   <li>The current state equals the {@code to} of the last transition, or
 *       {@link ConnectionState#INITIALIZING} when the log is empty.</li>
 *   <li>Each transition's {@code from} is the previous transition's {@code to}.</li>
 *   <li>Monotonic timestamps in the log are non-decreasing.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * Single writer. The current state is volatile and the log is copy-on-write,
 * so readiness polls and history snapshots from other threads are safe.
 */
public final class ConnectionStateMachine
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionStateMachine.class);

    private final MonotonicClock monotonicClock;
    private final WallClock wallClock;
    private final List<StateTransition> transitions = new CopyOnWriteArrayList<>();

    private volatile ConnectionState currentState = ConnectionState.INITIALIZING;

    public ConnectionStateMachine(MonotonicClock monotonicClock, WallClock wallClock) {
        this.monotonicClock = Objects.requireNonNull(monotonicClock, "monotonicClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Append a transition from the current state to {@code to}.
     *
     * @return the appended transition
     */
    public StateTransition transition(ConnectionState to) {
        Objects.requireNonNull(to, "to");
        StateTransition t = new StateTransition(currentState, to, wallClock.now(), monotonicClock.nowNanos());
        transitions.add(t);
        currentState = to;
        return t;
    }

    public ConnectionState currentState() {
        return currentState;
    }

    public boolean isReadyForMessages() {
        return currentState == ConnectionState.READY_FOR_MESSAGES;
    }

    /**
     * Ordered, immutable snapshot of the transition log.
     */
    public List<StateTransition> history() {
        return List.copyOf(transitions);
    }

    /**
     * Replay the log against the edge table.
     *
     * @return {@code false} on the first disallowed or discontinuous transition
     */
    public boolean validateStateSequence() {
        ConnectionState expectedFrom = ConnectionState.INITIALIZING;
        int index = 0;
        for (StateTransition t : transitions) {
            if (t.from() != expectedFrom) {
                log.warn("State sequence broken at transition {}: expected from {}, found {} -> {}",
                        index, expectedFrom, t.from(), t.to());
                return false;
            }
            if (!t.isAllowed()) {
                log.warn("Invalid state transition at index {}: {} -> {}", index, t.from(), t.to());
                return false;
            }
            expectedFrom = t.to();
            index++;
        }
        return true;
    }

    /**
     * Clear the log and return to {@link ConnectionState#INITIALIZING}.
     * For tests and reuse only.
     */
    public void reset() {
        transitions.clear();
        currentState = ConnectionState.INITIALIZING;
    }
}
