package com.questrail.readiness.handshake;

import com.questrail.readiness.api.ConnectionState;
import com.questrail.readiness.timing.DeploymentEnvironment;
import com.questrail.readiness.timing.TimingProfile;

import java.time.Duration;

/**
 * Point-in-time view of one coordinator, for observability endpoints.
 *
 * @param handshakeDuration {@code null} if no handshake was started
 * @param sequenceValid     result of replaying the transition log against the edge table
 */
public record CoordinationSummary(
        String connectionId,
        DeploymentEnvironment environment,
        ConnectionState currentState,
        boolean readyForMessages,
        int transitionCount,
        Duration handshakeDuration,
        TimingProfile timingProfile,
        boolean sequenceValid
) {
}
