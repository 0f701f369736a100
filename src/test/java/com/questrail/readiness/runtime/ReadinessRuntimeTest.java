package com.questrail.readiness.runtime;

import com.questrail.readiness.config.ReadinessRuntimeConfig;
import com.questrail.readiness.detector.PatternTypes;
import com.questrail.readiness.handshake.HandshakeCoordinator;
import com.questrail.readiness.observability.RecordingObservabilitySink;
import com.questrail.readiness.time.ManualWallClock;
import com.questrail.readiness.timing.DeploymentEnvironment;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ReadinessRuntimeTest
 * -----------------------------------------------------------------------------
 * Smoke tests for the composition root: wiring, lifecycle and eviction.
 */
class ReadinessRuntimeTest {

    private ManualWallClock wallClock;
    private RecordingObservabilitySink sink;
    private ReadinessRuntime runtime;

    @BeforeEach
    void setUp() {
        wallClock = new ManualWallClock();
        sink = new RecordingObservabilitySink();
        runtime = new ReadinessRuntime(ReadinessRuntimeConfig.builder()
                .withEnvironment(DeploymentEnvironment.TESTING)
                .withWallClock(wallClock)
                .withObservabilitySink(sink)
                .build());
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void connectCompletesWithReadyCoordinator() throws Exception {
        HandshakeCoordinator c = runtime.connect("client-1").get(2, TimeUnit.SECONDS);

        assertTrue(c.isReadyForMessages());
        assertEquals("client-1", c.connectionId());
        assertEquals(DeploymentEnvironment.TESTING, c.environment());
        assertEquals(3, sink.getStateTransitions().size());
    }

    @Test
    void coordinatorsShareTheRuntimeDetector() {
        HandshakeCoordinator a = runtime.newCoordinator("a");
        HandshakeCoordinator b = runtime.newCoordinator("b");

        a.coordinateHandshake();
        b.coordinateHandshake();
        a.cancel("test");
        b.cancel("test");

        assertEquals(2, runtime.detector()
                .getDetectedPatterns(null, PatternTypes.HANDSHAKE_FAILURE, null).size());
    }

    @Test
    void evictionRemovesExpiredPatterns() {
        runtime.detector().addDetectedPattern(PatternTypes.TIMING_VIOLATION);
        wallClock.advance(Duration.ofHours(25));
        runtime.detector().addDetectedPattern(PatternTypes.TIMING_VIOLATION);

        runtime.evictOldPatterns();

        assertEquals(1, runtime.detector().getDetectedPatterns().size());
    }

    @Test
    void startIsIdempotent() {
        assertDoesNotThrow(runtime::start);
        assertEquals(Duration.ofHours(1), ReadinessRuntime.EVICTION_INTERVAL);
    }
}
