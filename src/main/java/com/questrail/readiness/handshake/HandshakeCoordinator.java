package com.questrail.readiness.handshake;

import com.questrail.readiness.api.ConnectionState;
import com.questrail.readiness.api.ReadinessGate;
import com.questrail.readiness.detector.PatternSeverity;
import com.questrail.readiness.detector.PatternTypes;
import com.questrail.readiness.detector.RaceConditionDetector;
import com.questrail.readiness.internal.time.Cancellable;
import com.questrail.readiness.internal.time.MonotonicClock;
import com.questrail.readiness.internal.time.MonotonicScheduler;
import com.questrail.readiness.internal.time.SystemMonotonicClock;
import com.questrail.readiness.internal.time.SystemWallClock;
import com.questrail.readiness.internal.time.WallClock;
import com.questrail.readiness.observability.HandshakeErrorEvent;
import com.questrail.readiness.observability.ReadinessObservabilitySink;
import com.questrail.readiness.observability.Slf4jReadinessObservabilitySink;
import com.questrail.readiness.observability.StateTransitionEvent;
import com.questrail.readiness.state.ConnectionStateMachine;
import com.questrail.readiness.state.StateTransition;
import com.questrail.readiness.timing.DeploymentEnvironment;
import com.questrail.readiness.timing.TimingProfile;
import com.questrail.readiness.timing.TimingProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * HandshakeCoordinator
 * =============================================================================
 * Drives one connection's {@link ConnectionStateMachine} from
 * {@code INITIALIZING} to {@code READY_FOR_MESSAGES} (or {@code ERROR}) using the
 * environment's {@link TimingProfile}.
 *
 * <h2>Sequence</h2>
 * <pre>
 *   coordinateHandshake()
 *     → HANDSHAKE_PENDING
 *     ·· handshakeDelay ··
 *     → CONNECTED
 *     ·· stabilizationDelay ··   (staging / production only)
 *     → READY_FOR_MESSAGES        future completes true
 * </pre>
 *
 * <p>Suspensions are timers on a {@link MonotonicScheduler}; no thread blocks
 * while a handshake is pending.</p>
 *
 * <h2>Failure and cancellation</h2>
 * <ul>
 *   <li>Any exception thrown while scheduling or running a step forces
 *       {@code ERROR} and completes the future with {@code false}.</li>
 *   <li>{@link #cancel(String)} forces {@code ERROR} and completes the future
 *       with {@code false}.</li>
 *   <li>Cancelling the returned future forces {@code ERROR} first, then lets the
 *       caller observe the {@link java.util.concurrent.CancellationException}.</li>
 *   <li>Completing the returned future from outside ({@code complete},
 *       {@code completeExceptionally}, {@code orTimeout},
 *       {@code completeOnTimeout}) aborts the handshake the same way.</li>
 * </ul>
 * Exactly one {@code ERROR} transition is appended per failed handshake.
 * Failures are never retried here; see {@link HandshakeRetryRunner}.
 *
 * <h2>Thread Safety</h2>
 * One coordination routine per connection. Timer callbacks, cancellation and
 * administrative operations serialise on the coordinator's monitor, and the
 * handshake future is completed while holding it. Readiness accessors do not
 * lock.
 */
public final class HandshakeCoordinator implements ReadinessGate
{
    private static final Logger log = LoggerFactory.getLogger(HandshakeCoordinator.class);

    private static final long NOT_SET = Long.MIN_VALUE;

    private final String connectionId;
    private final TimingProfile profile;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final MonotonicScheduler scheduler;
    private final ReadinessObservabilitySink observabilitySink;
    private final RaceConditionDetector detector;
    private final ConnectionStateMachine stateMachine;

    private final Object lock = new Object();

    // Guarded by lock.
    private HandshakeFuture inFlight;
    private Cancellable pendingStep;

    private volatile long startNanos = NOT_SET;
    private volatile long readyNanos = NOT_SET;
    private volatile long failedNanos = NOT_SET;

    private HandshakeCoordinator(Builder b) {
        this.connectionId = b.connectionId;
        this.profile = TimingProfiles.get(b.environment);
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.scheduler = b.scheduler;
        this.observabilitySink = b.observabilitySink;
        this.detector = b.detector;
        this.stateMachine = new ConnectionStateMachine(clock, wallClock);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------------
    // Coordination
    // ---------------------------------------------------------------------

    /**
     * Start the handshake sequence.
     *
     * <p>While a handshake is in flight the same future is returned. Once the
     * machine has left {@code INITIALIZING}, a new handshake requires
     * {@link #reset()}; until then this returns an already-completed
     * {@code false} future and leaves the machine untouched.</p>
     *
     * @return future completing {@code true} once the connection is ready for
     *         messages, {@code false} if the handshake failed or was cancelled
     */
    public CompletableFuture<Boolean> coordinateHandshake() {
        synchronized (lock) {
            if (inFlight != null && !inFlight.settled) {
                return inFlight;
            }
            if (stateMachine.currentState() != ConnectionState.INITIALIZING) {
                log.warn("Connection {} [{}]: handshake already ran (state {}); reset before coordinating again",
                        connectionId, profile.environment(), stateMachine.currentState());
                return CompletableFuture.completedFuture(false);
            }

            HandshakeFuture future = new HandshakeFuture();
            inFlight = future;
            startNanos = clock.nowNanos();
            readyNanos = NOT_SET;
            failedNanos = NOT_SET;

            try {
                record(ConnectionState.HANDSHAKE_PENDING);
                pendingStep = scheduler.scheduleAfter(profile.handshakeDelay(), clock,
                        () -> runStep(future, this::onHandshakeDelayElapsed));
            } catch (RuntimeException e) {
                failLocked(future, "Handshake could not be scheduled", e);
            }
            return future;
        }
    }

    /**
     * Cancel an in-flight handshake: the machine moves to {@code ERROR} and the
     * handshake future completes with {@code false}.
     *
     * @return {@code true} if a pending handshake was cancelled
     */
    public boolean cancel(String reason) {
        synchronized (lock) {
            HandshakeFuture future = inFlight;
            if (future == null || future.settled) {
                return false;
            }
            failLocked(future, "Handshake cancelled: " + reason, null);
            return true;
        }
    }

    private void runStep(HandshakeFuture future, Function<HandshakeFuture, Boolean> step) {
        synchronized (lock) {
            if (inFlight != future || future.settled) {
                // Cancelled or reset while the timer was pending.
                return;
            }
            pendingStep = null;
            try {
                Boolean outcome = step.apply(future);
                if (outcome != null) {
                    settleLocked(future, outcome);
                }
            } catch (RuntimeException e) {
                failLocked(future, "Handshake step failed in state " + stateMachine.currentState(), e);
            }
        }
    }

    private Boolean onHandshakeDelayElapsed(HandshakeFuture future) {
        record(ConnectionState.CONNECTED);
        if (profile.environment().isCloud()) {
            pendingStep = scheduler.scheduleAfter(profile.stabilizationDelay(), clock,
                    () -> runStep(future, this::onStabilized));
            return null;
        }
        return onStabilized(future);
    }

    private Boolean onStabilized(HandshakeFuture future) {
        StateTransition ready = record(ConnectionState.READY_FOR_MESSAGES);
        readyNanos = ready.atNanos();
        if (detector != null) {
            detector.detectTimingViolation(startNanos, readyNanos, profile.handshakeTimeout());
        }
        return Boolean.TRUE;
    }

    private void failLocked(HandshakeFuture future, String message, Throwable cause) {
        try {
            driveToErrorLocked(message, cause);
        } finally {
            settleLocked(future, false);
        }
    }

    private void driveToErrorLocked(String message, Throwable cause) {
        Cancellable step = pendingStep;
        pendingStep = null;
        if (step != null) {
            step.cancel();
        }

        ConnectionState failedIn = stateMachine.currentState();
        StateTransition error = record(ConnectionState.ERROR);
        failedNanos = error.atNanos();

        notifyError(message, cause);
        if (detector != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("connection_id", connectionId);
            details.put("failed_in_state", failedIn.name());
            details.put("reason", message);
            detector.addDetectedPattern(PatternTypes.HANDSHAKE_FAILURE, PatternSeverity.WARNING, details);
        }
    }

    private void settleLocked(HandshakeFuture future, boolean outcome) {
        future.settle(outcome);
    }

    // ---------------------------------------------------------------------
    // Readiness and diagnostics
    // ---------------------------------------------------------------------

    @Override
    public boolean isReadyForMessages() {
        return stateMachine.isReadyForMessages();
    }

    @Override
    public ConnectionState getCurrentState() {
        return stateMachine.currentState();
    }

    public List<StateTransition> getStateHistory() {
        return stateMachine.history();
    }

    /**
     * Time from start to {@code READY_FOR_MESSAGES} if reached, to {@code ERROR}
     * if the handshake failed, otherwise elapsed so far.
     *
     * @return {@code null} if no handshake was started
     */
    public Duration getHandshakeDuration() {
        long start = startNanos;
        if (start == NOT_SET) {
            return null;
        }
        long ready = readyNanos;
        if (ready != NOT_SET) {
            return Duration.ofNanos(ready - start);
        }
        long failed = failedNanos;
        if (failed != NOT_SET) {
            return Duration.ofNanos(failed - start);
        }
        return Duration.ofNanos(clock.nowNanos() - start);
    }

    public boolean validateStateSequence() {
        return stateMachine.validateStateSequence();
    }

    public CoordinationSummary getCoordinationSummary() {
        return new CoordinationSummary(
                connectionId,
                profile.environment(),
                getCurrentState(),
                isReadyForMessages(),
                getStateHistory().size(),
                getHandshakeDuration(),
                profile,
                validateStateSequence()
        );
    }

    public String connectionId() {
        return connectionId;
    }

    public DeploymentEnvironment environment() {
        return profile.environment();
    }

    public TimingProfile timingProfile() {
        return profile;
    }

    // ---------------------------------------------------------------------
    // Administrative
    // ---------------------------------------------------------------------

    /**
     * Move to {@code ERROR} from any state, without consulting the edge table.
     * An in-flight handshake completes with {@code false}. For administrative
     * and test use; forcing from a terminal state makes
     * {@link #validateStateSequence()} fail.
     */
    public void forceErrorState(String reason) {
        synchronized (lock) {
            log.warn("Connection {} [{}]: forcing ERROR from {}: {}",
                    connectionId, profile.environment(), stateMachine.currentState(), reason);

            HandshakeFuture future = inFlight;
            if (future != null && !future.settled) {
                failLocked(future, "Forced error: " + reason, null);
                return;
            }
            StateTransition error = record(ConnectionState.ERROR);
            failedNanos = error.atNanos();
            notifyError("Forced error: " + reason, null);
        }
    }

    /**
     * Return to a freshly constructed state. An in-flight handshake is abandoned
     * and its future completes with {@code false}. For tests only.
     */
    public void reset() {
        synchronized (lock) {
            Cancellable step = pendingStep;
            pendingStep = null;
            if (step != null) {
                step.cancel();
            }
            HandshakeFuture future = inFlight;
            inFlight = null;
            if (future != null && !future.settled) {
                settleLocked(future, false);
            }
            stateMachine.reset();
            startNanos = NOT_SET;
            readyNanos = NOT_SET;
            failedNanos = NOT_SET;
        }
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private StateTransition record(ConnectionState to) {
        StateTransition t = stateMachine.transition(to);
        long start = startNanos;
        Duration elapsed = start == NOT_SET ? Duration.ZERO : Duration.ofNanos(t.atNanos() - start);
        try {
            observabilitySink.onStateTransition(
                    new StateTransitionEvent(connectionId, profile.environment(), t, elapsed));
        } catch (RuntimeException e) {
            log.warn("Observability sink rejected transition {} -> {} on connection {}",
                    t.from(), t.to(), connectionId, e);
        }
        return t;
    }

    private void notifyError(String message, Throwable cause) {
        try {
            observabilitySink.onError(new HandshakeErrorEvent(
                    wallClock.now(), connectionId, profile.environment(), message, cause));
        } catch (RuntimeException e) {
            log.warn("Observability sink rejected error event on connection {}", connectionId, e);
        }
    }

    /**
     * Future handed to the caller. Cancelling or completing it from outside
     * before the handshake settles drives the machine to {@code ERROR} before
     * the outcome becomes visible. An outside {@code complete} always yields
     * {@code false}: only the coordinator reports readiness.
     */
    private final class HandshakeFuture extends CompletableFuture<Boolean> {
        // Guarded by the coordinator lock.
        private boolean settled;

        private void settle(boolean outcome) {
            settled = true;
            super.complete(outcome);
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            synchronized (lock) {
                if (settled) {
                    return false;
                }
                boolean cancelled;
                try {
                    driveToErrorLocked("Handshake future cancelled", null);
                } finally {
                    settled = true;
                    cancelled = super.cancel(mayInterruptIfRunning);
                }
                return cancelled;
            }
        }

        @Override
        public boolean complete(Boolean value) {
            synchronized (lock) {
                if (settled) {
                    return super.complete(value);
                }
                boolean completed;
                try {
                    driveToErrorLocked("Handshake future completed by caller", null);
                } finally {
                    settled = true;
                    completed = super.complete(Boolean.FALSE);
                }
                return completed;
            }
        }

        @Override
        public boolean completeExceptionally(Throwable ex) {
            Objects.requireNonNull(ex, "ex");
            synchronized (lock) {
                if (settled) {
                    return super.completeExceptionally(ex);
                }
                boolean completed;
                try {
                    driveToErrorLocked("Handshake future failed by caller: " + ex, null);
                } finally {
                    settled = true;
                    completed = super.completeExceptionally(ex);
                }
                return completed;
            }
        }
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class Builder {
        private String connectionId = "unassigned";
        private DeploymentEnvironment environment = DeploymentEnvironment.DEVELOPMENT;
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ReadinessObservabilitySink observabilitySink = new Slf4jReadinessObservabilitySink();
        private RaceConditionDetector detector;

        private Builder() {
        }

        public Builder withConnectionId(String connectionId) {
            this.connectionId = connectionId;
            return this;
        }

        public Builder withEnvironment(DeploymentEnvironment environment) {
            this.environment = environment;
            return this;
        }

        /**
         * Environment by name; unknown names fall back to development.
         */
        public Builder withEnvironment(String environmentName) {
            this.environment = DeploymentEnvironment.fromName(environmentName);
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withObservabilitySink(ReadinessObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Optional shared detector that receives handshake timing and failure patterns.
         */
        public Builder withDetector(RaceConditionDetector detector) {
            this.detector = detector;
            return this;
        }

        public HandshakeCoordinator build() {
            Objects.requireNonNull(connectionId, "connectionId");
            Objects.requireNonNull(environment, "environment");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(scheduler, "scheduler");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            return new HandshakeCoordinator(this);
        }
    }
}
