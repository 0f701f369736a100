package com.questrail.readiness.handshake;

import com.questrail.readiness.detector.RaceConditionDetector;
import com.questrail.readiness.internal.time.MonotonicClock;
import com.questrail.readiness.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.IntFunction;

/**
 * HandshakeRetryRunner
 * -----------------------------------------------------------------------------
 * Caller-side retry for connection handshakes.
 *
 * <p>The coordinator never retries. This runner builds a fresh
 * {@link HandshakeCoordinator} per attempt and, after a failed attempt, waits
 * {@link RaceConditionDetector#calculateProgressiveDelay(int)} on the scheduler
 * before the next one. Waiting never blocks a thread.</p>
 *
 * <p>The runner decides <em>when</em> to retry; whether an attempt succeeded is
 * solely the coordinator's answer.</p>
 */
public final class HandshakeRetryRunner
{
    private static final Logger log = LoggerFactory.getLogger(HandshakeRetryRunner.class);

    private final IntFunction<HandshakeCoordinator> coordinatorFactory;
    private final RaceConditionDetector detector;
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final int maxAttempts;

    /**
     * @param coordinatorFactory builds the coordinator for a 0-based attempt index
     * @param maxAttempts        total attempts, at least 1
     */
    public HandshakeRetryRunner(IntFunction<HandshakeCoordinator> coordinatorFactory,
                                RaceConditionDetector detector,
                                MonotonicScheduler scheduler,
                                MonotonicClock clock,
                                int maxAttempts) {
        this.coordinatorFactory = Objects.requireNonNull(coordinatorFactory, "coordinatorFactory");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Run attempts until one succeeds or {@code maxAttempts} have failed.
     *
     * @return future completing with the coordinator of the successful attempt,
     *         or of the last failed attempt
     */
    public CompletableFuture<HandshakeCoordinator> run() {
        CompletableFuture<HandshakeCoordinator> result = new CompletableFuture<>();
        attempt(0, result);
        return result;
    }

    private void attempt(int attemptIndex, CompletableFuture<HandshakeCoordinator> result) {
        HandshakeCoordinator coordinator;
        try {
            coordinator = coordinatorFactory.apply(attemptIndex);
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }

        coordinator.coordinateHandshake().whenComplete((ready, error) -> {
            if (error == null && Boolean.TRUE.equals(ready)) {
                result.complete(coordinator);
                return;
            }
            if (attemptIndex + 1 >= maxAttempts) {
                log.warn("Connection {} [{}]: handshake failed after {} attempts",
                        coordinator.connectionId(), coordinator.environment(), maxAttempts);
                result.complete(coordinator);
                return;
            }

            Duration backoff = detector.calculateProgressiveDelay(attemptIndex);
            log.info("Connection {} [{}]: handshake attempt {} failed, retrying in {}ms",
                    coordinator.connectionId(), coordinator.environment(), attemptIndex + 1, backoff.toMillis());
            try {
                scheduler.scheduleAfter(backoff, clock, () -> attempt(attemptIndex + 1, result));
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
    }
}
