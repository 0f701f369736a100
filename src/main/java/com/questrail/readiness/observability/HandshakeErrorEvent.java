package com.questrail.readiness.observability;

import com.questrail.readiness.timing.DeploymentEnvironment;

import java.time.Instant;

/**
 * Record representing a failed or cancelled handshake.
 * {@code cause} is {@code null} for cancellations and administrative errors.
 */
public record HandshakeErrorEvent(
    Instant timestamp,
    String connectionId,
    DeploymentEnvironment environment,
    String message,
    Throwable cause
) {
}
