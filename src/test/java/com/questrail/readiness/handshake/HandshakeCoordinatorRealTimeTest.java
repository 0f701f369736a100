package com.questrail.readiness.handshake;

import com.questrail.readiness.api.ConnectionState;
import com.questrail.readiness.internal.time.ScheduledExecutorScheduler;
import com.questrail.readiness.internal.time.SystemMonotonicClock;
import com.questrail.readiness.observability.RecordingObservabilitySink;
import com.questrail.readiness.timing.DeploymentEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandshakeCoordinatorRealTimeTest
 * -----------------------------------------------------------------------------
 * End-to-end handshakes on the production scheduler and system clock.
 *
 * Note: upper bounds are generous; only the lower bounds are strict.
 */
class HandshakeCoordinatorRealTimeTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private HandshakeCoordinator coordinator(DeploymentEnvironment env) {
        return HandshakeCoordinator.builder()
                .withConnectionId("rt-" + env.environmentName())
                .withEnvironment(env)
                .withScheduler(scheduler)
                .withObservabilitySink(new RecordingObservabilitySink())
                .build();
    }

    @Test
    void stagingHandshakeTakesAtLeastDelayPlusStabilization() throws Exception {
        HandshakeCoordinator c = coordinator(DeploymentEnvironment.STAGING);

        assertTrue(c.coordinateHandshake().get(2, TimeUnit.SECONDS));

        Duration d = c.getHandshakeDuration();
        assertTrue(d.compareTo(Duration.ofMillis(120)) >= 0, "duration " + d);
        assertTrue(d.compareTo(Duration.ofSeconds(1)) <= 0, "duration " + d);
        assertEquals(3, c.getStateHistory().size());
        assertTrue(c.validateStateSequence());
    }

    @Test
    void testingHandshakeIsFast() throws Exception {
        // First handshake on a cold JVM pays for class loading and lambda linkage.
        assertTrue(coordinator(DeploymentEnvironment.TESTING).coordinateHandshake().get(2, TimeUnit.SECONDS));
        HandshakeCoordinator c = coordinator(DeploymentEnvironment.TESTING);

        assertTrue(c.coordinateHandshake().get(2, TimeUnit.SECONDS));

        Duration d = c.getHandshakeDuration();
        assertTrue(d.compareTo(Duration.ofMillis(4)) >= 0, "duration " + d);
        assertTrue(d.compareTo(Duration.ofMillis(50)) <= 0, "duration " + d);
        assertEquals(3, c.getStateHistory().size());
    }

    @Test
    void cancelFromAnotherThreadStopsPendingHandshake() throws Exception {
        HandshakeCoordinator c = coordinator(DeploymentEnvironment.PRODUCTION);
        CompletableFuture<Boolean> result = c.coordinateHandshake();

        Thread.sleep(20);
        assertTrue(c.cancel("client disconnected"));

        assertFalse(result.get(1, TimeUnit.SECONDS));
        Thread.sleep(150);
        assertEquals(ConnectionState.ERROR, c.getCurrentState());
        assertEquals(2, c.getStateHistory().size());
    }
}
