package com.questrail.readiness.runtime;

import com.questrail.readiness.config.ReadinessRuntimeConfig;
import com.questrail.readiness.detector.RaceConditionDetector;
import com.questrail.readiness.handshake.HandshakeCoordinator;
import com.questrail.readiness.handshake.HandshakeRetryRunner;
import com.questrail.readiness.internal.time.MonotonicScheduler;
import com.questrail.readiness.internal.time.ScheduledExecutorScheduler;
import com.questrail.readiness.timing.DeploymentEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ReadinessRuntime
 * =============================================================================
 * Composition root and lifecycle owner for connection readiness in one
 * environment.
 *
 * <p>Owns the scheduler thread that carries every handshake suspension and the
 * single {@link RaceConditionDetector} shared by the environment's connections.
 * Coordinators receive the detector by reference; there is no hidden singleton.</p>
 *
 * <p>{@link #start()} schedules periodic eviction of detected patterns, which
 * is the only bound on the detector's memory.</p>
 */
public final class ReadinessRuntime {
    private static final Logger log = LoggerFactory.getLogger(ReadinessRuntime.class);

    static final Duration EVICTION_INTERVAL = Duration.ofHours(1);

    private final ReadinessRuntimeConfig config;
    private final ScheduledExecutorService schedulerExecutor;
    private final MonotonicScheduler scheduler;
    private final RaceConditionDetector detector;

    private ScheduledFuture<?> evictionTask;

    public ReadinessRuntime(ReadinessRuntimeConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.schedulerExecutor = Executors.newScheduledThreadPool(1);
        this.scheduler = new ScheduledExecutorScheduler(schedulerExecutor, config.monotonicClock());
        this.detector = new RaceConditionDetector(
            config.environment(),
            config.wallClock(),
            config.observabilitySink()
        );
    }

    public synchronized void start() {
        if (evictionTask != null) {
            return;
        }
        long intervalMillis = EVICTION_INTERVAL.toMillis();
        evictionTask = schedulerExecutor.scheduleAtFixedRate(
            this::evictOldPatterns, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Readiness runtime started for {}", config.environment());
    }

    public synchronized void stop() {
        if (evictionTask != null) {
            evictionTask.cancel(false);
            evictionTask = null;
        }
        schedulerExecutor.shutdown();
        try {
            if (!schedulerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                schedulerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            schedulerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Readiness runtime stopped for {}", config.environment());
    }

    /**
     * Fresh coordinator for one accepted connection, wired to this runtime's
     * scheduler, clocks, sink and detector. The caller starts the handshake.
     */
    public HandshakeCoordinator newCoordinator(String connectionId) {
        return newCoordinator(connectionId, scheduler);
    }

    /**
     * Coordinator whose suspensions run on {@code stepScheduler} instead of the
     * runtime's own thread, e.g. the connection's event loop.
     */
    public HandshakeCoordinator newCoordinator(String connectionId, MonotonicScheduler stepScheduler) {
        return HandshakeCoordinator.builder()
            .withConnectionId(connectionId)
            .withEnvironment(config.environment())
            .withClock(config.monotonicClock())
            .withWallClock(config.wallClock())
            .withScheduler(stepScheduler)
            .withObservabilitySink(config.observabilitySink())
            .withDetector(detector)
            .build();
    }

    /**
     * Coordinate a connection's handshake, retrying with progressive backoff up
     * to {@link ReadinessRuntimeConfig#maxHandshakeAttempts()} times.
     *
     * @return future completing with the final coordinator; check
     *         {@link HandshakeCoordinator#isReadyForMessages()} for the outcome
     */
    public CompletableFuture<HandshakeCoordinator> connect(String connectionId) {
        HandshakeRetryRunner runner = new HandshakeRetryRunner(
            attempt -> newCoordinator(connectionId),
            detector,
            scheduler,
            config.monotonicClock(),
            config.maxHandshakeAttempts()
        );
        return runner.run();
    }

    public RaceConditionDetector detector() {
        return detector;
    }

    public MonotonicScheduler scheduler() {
        return scheduler;
    }

    public DeploymentEnvironment environment() {
        return config.environment();
    }

    public ReadinessRuntimeConfig config() {
        return config;
    }

    void evictOldPatterns() {
        try {
            detector.clearOldPatterns();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the periodic task.
            log.error("Race condition pattern eviction failed in {}", config.environment(), e);
        }
    }
}
