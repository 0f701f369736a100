package com.questrail.readiness.observability;

import com.questrail.readiness.detector.RaceConditionPattern;

/**
 * Receives readiness observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface ReadinessObservabilitySink {
    /**
     * Called after a connection's state machine records a transition.
     * @param event the transition event details
     */
    void onStateTransition(StateTransitionEvent event);

    /**
     * Called when a race-condition pattern is recorded by a detector.
     * @param pattern the recorded pattern
     */
    void onPatternDetected(RaceConditionPattern pattern);

    /**
     * Called when a handshake fails or is cancelled.
     * @param event the error event
     */
    void onError(HandshakeErrorEvent event);
}
