package com.questrail.readiness.observability;

import com.questrail.readiness.detector.PatternSeverity;
import com.questrail.readiness.detector.RaceConditionPattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of ReadinessObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jReadinessObservabilitySink implements ReadinessObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jReadinessObservabilitySink.class);

    @Override
    public void onStateTransition(StateTransitionEvent event) {
        log.info("Connection {} [{}]: {} -> {} after {}ms",
            event.connectionId(),
            event.environment(),
            event.transition().from(),
            event.transition().to(),
            event.elapsed().toMillis());
    }

    @Override
    public void onPatternDetected(RaceConditionPattern pattern) {
        if (pattern.severity() == PatternSeverity.CRITICAL) {
            log.error("Race condition pattern [{}] {} ({}): {}",
                pattern.environment(), pattern.type(), pattern.severity(), pattern.details());
        } else {
            log.info("Race condition pattern [{}] {} ({}): {}",
                pattern.environment(), pattern.type(), pattern.severity(), pattern.details());
        }
    }

    @Override
    public void onError(HandshakeErrorEvent event) {
        log.error("Handshake error on connection {} [{}]: {}",
            event.connectionId(), event.environment(), event.message(), event.cause());
    }
}
