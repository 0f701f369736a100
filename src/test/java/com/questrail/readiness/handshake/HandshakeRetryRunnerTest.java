package com.questrail.readiness.handshake;

import com.questrail.readiness.api.ConnectionState;
import com.questrail.readiness.detector.PatternTypes;
import com.questrail.readiness.detector.RaceConditionDetector;
import com.questrail.readiness.internal.time.MonotonicScheduler;
import com.questrail.readiness.observability.NullObservabilitySink;
import com.questrail.readiness.time.DeterministicScheduler;
import com.questrail.readiness.time.ManualMonotonicClock;
import com.questrail.readiness.time.ManualWallClock;
import com.questrail.readiness.timing.DeploymentEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandshakeRetryRunnerTest
 * -----------------------------------------------------------------------------
 * Retry attempts are fresh coordinators separated by the detector's
 * progressive backoff.
 */
class HandshakeRetryRunnerTest {

    private static final MonotonicScheduler REJECTING = (deadline, task) -> {
        throw new RejectedExecutionException("step scheduler unavailable");
    };

    private ManualMonotonicClock clock;
    private ManualWallClock wallClock;
    private DeterministicScheduler scheduler;
    private List<Long> attemptStartsMillis;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        wallClock = new ManualWallClock();
        scheduler = new DeterministicScheduler(clock);
        attemptStartsMillis = new ArrayList<>();
    }

    private RaceConditionDetector detector(DeploymentEnvironment env) {
        return new RaceConditionDetector(env, wallClock, NullObservabilitySink.INSTANCE);
    }

    private HandshakeCoordinator coordinator(DeploymentEnvironment env,
                                             RaceConditionDetector detector,
                                             int attempt,
                                             int failingAttempts) {
        attemptStartsMillis.add(clock.nowNanos() / 1_000_000L);
        return HandshakeCoordinator.builder()
                .withConnectionId("conn-" + attempt)
                .withEnvironment(env)
                .withClock(clock)
                .withWallClock(wallClock)
                .withScheduler(attempt < failingAttempts ? REJECTING : scheduler)
                .withObservabilitySink(NullObservabilitySink.INSTANCE)
                .withDetector(detector)
                .build();
    }

    private void advance(long millis) {
        clock.advanceMillis(millis);
        scheduler.runDueTasks();
    }

    @Test
    void firstSuccessCompletesWithoutRetry() {
        RaceConditionDetector detector = detector(DeploymentEnvironment.TESTING);
        HandshakeRetryRunner runner = new HandshakeRetryRunner(
                attempt -> coordinator(DeploymentEnvironment.TESTING, detector, attempt, 0),
                detector, scheduler, clock, 3);

        CompletableFuture<HandshakeCoordinator> result = runner.run();
        advance(5);

        assertTrue(result.isDone());
        assertTrue(result.join().isReadyForMessages());
        assertEquals(List.of(0L), attemptStartsMillis);
    }

    @Test
    void retriesAfterBackoffUntilSuccess() {
        RaceConditionDetector detector = detector(DeploymentEnvironment.TESTING);
        HandshakeRetryRunner runner = new HandshakeRetryRunner(
                attempt -> coordinator(DeploymentEnvironment.TESTING, detector, attempt, 2),
                detector, scheduler, clock, 3);

        CompletableFuture<HandshakeCoordinator> result = runner.run();
        assertEquals(1, attemptStartsMillis.size());

        advance(5);
        assertEquals(2, attemptStartsMillis.size());
        advance(5);
        assertEquals(3, attemptStartsMillis.size());
        assertFalse(result.isDone());

        advance(5);

        HandshakeCoordinator winner = result.join();
        assertEquals("conn-2", winner.connectionId());
        assertEquals(ConnectionState.READY_FOR_MESSAGES, winner.getCurrentState());
        assertEquals(List.of(0L, 5L, 10L), attemptStartsMillis);
        assertEquals(2, detector.getDetectedPatterns(null, PatternTypes.HANDSHAKE_FAILURE, null).size());
    }

    @Test
    void cloudBackoffGrowsBetweenAttempts() {
        RaceConditionDetector detector = detector(DeploymentEnvironment.STAGING);
        HandshakeRetryRunner runner = new HandshakeRetryRunner(
                attempt -> coordinator(DeploymentEnvironment.STAGING, detector, attempt, Integer.MAX_VALUE),
                detector, scheduler, clock, 3);

        CompletableFuture<HandshakeCoordinator> result = runner.run();
        for (int i = 0; i < 100 && !result.isDone(); i++) {
            advance(1);
        }

        assertEquals(List.of(0L, 25L, 75L), attemptStartsMillis);
        HandshakeCoordinator last = result.join();
        assertEquals("conn-2", last.connectionId());
        assertEquals(ConnectionState.ERROR, last.getCurrentState());
    }

    @Test
    void exhaustedAttemptsCompleteWithLastFailedCoordinator() {
        RaceConditionDetector detector = detector(DeploymentEnvironment.DEVELOPMENT);
        HandshakeRetryRunner runner = new HandshakeRetryRunner(
                attempt -> coordinator(DeploymentEnvironment.DEVELOPMENT, detector, attempt, Integer.MAX_VALUE),
                detector, scheduler, clock, 2);

        CompletableFuture<HandshakeCoordinator> result = runner.run();
        advance(10);

        assertTrue(result.isDone());
        assertFalse(result.join().isReadyForMessages());
        assertEquals(2, attemptStartsMillis.size());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void factoryFailureCompletesExceptionally() {
        RaceConditionDetector detector = detector(DeploymentEnvironment.TESTING);
        HandshakeRetryRunner runner = new HandshakeRetryRunner(
                attempt -> {
                    throw new IllegalStateException("no coordinator");
                },
                detector, scheduler, clock, 3);

        CompletionException e = assertThrows(CompletionException.class, () -> runner.run().join());
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void rejectsNonPositiveAttempts() {
        RaceConditionDetector detector = detector(DeploymentEnvironment.TESTING);

        assertThrows(IllegalArgumentException.class,
                () -> new HandshakeRetryRunner(a -> null, detector, scheduler, clock, 0));
    }
}
