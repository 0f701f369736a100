package com.questrail.readiness.timing;

import java.time.Duration;
import java.util.Objects;

/**
 * TimingProfile
 * -----------------------------------------------------------------------------
 * Environment-calibrated timing constants for the connection handshake.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>handshakeDelay</b>: suspension between entering
 *       {@code HANDSHAKE_PENDING} and declaring the transport {@code CONNECTED}.</li>
 *   <li><b>stabilizationDelay</b>: additional suspension after {@code CONNECTED}
 *       before {@code READY_FOR_MESSAGES}. Applied in cloud environments only.</li>
 *   <li><b>messageDelay</b>: minimum gap a dispatcher should leave between the
 *       connection becoming ready and its first delivery.</li>
 *   <li><b>handshakeTimeout</b>: upper bound on a healthy handshake. A longer
 *       handshake is reported as a timing violation.</li>
 * </ul>
 *
 * <p>Profiles are immutable and built once from a static table; see
 * {@link TimingProfiles}.</p>
 */
public record TimingProfile(
        DeploymentEnvironment environment,
        Duration handshakeDelay,
        Duration stabilizationDelay,
        Duration messageDelay,
        Duration handshakeTimeout
) {
    public TimingProfile {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(handshakeDelay, "handshakeDelay");
        Objects.requireNonNull(stabilizationDelay, "stabilizationDelay");
        Objects.requireNonNull(messageDelay, "messageDelay");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");

        if (handshakeDelay.isNegative()) {
            throw new IllegalArgumentException("handshakeDelay must be non-negative");
        }
        if (stabilizationDelay.isNegative()) {
            throw new IllegalArgumentException("stabilizationDelay must be non-negative");
        }
        if (messageDelay.isNegative()) {
            throw new IllegalArgumentException("messageDelay must be non-negative");
        }
        if (handshakeTimeout.isNegative()) {
            throw new IllegalArgumentException("handshakeTimeout must be non-negative");
        }
    }

    /**
     * Total suspension the coordinator spends in this environment: the
     * handshake delay, plus the stabilization delay where it applies.
     */
    public Duration expectedHandshakeDuration() {
        return environment.isCloud()
                ? handshakeDelay.plus(stabilizationDelay)
                : handshakeDelay;
    }
}
