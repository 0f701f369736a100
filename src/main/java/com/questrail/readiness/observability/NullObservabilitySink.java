package com.questrail.readiness.observability;

import com.questrail.readiness.detector.RaceConditionPattern;

/**
 * No-op implementation of ReadinessObservabilitySink.
 */
public final class NullObservabilitySink implements ReadinessObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(StateTransitionEvent event) {}

    @Override
    public void onPatternDetected(RaceConditionPattern pattern) {}

    @Override
    public void onError(HandshakeErrorEvent event) {}
}
