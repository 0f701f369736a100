package com.questrail.readiness.observability;

import com.questrail.readiness.state.StateTransition;
import com.questrail.readiness.timing.DeploymentEnvironment;

import java.time.Duration;

/**
 * Record representing a transition of one connection's readiness state.
 *
 * @param connectionId connection label, for correlating log lines
 * @param environment  environment whose timing profile drives the connection
 * @param transition   the appended transition
 * @param elapsed      time since the handshake started
 */
public record StateTransitionEvent(
    String connectionId,
    DeploymentEnvironment environment,
    StateTransition transition,
    Duration elapsed
) {
}
