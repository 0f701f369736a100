package com.questrail.readiness.detector;

import com.questrail.readiness.timing.DeploymentEnvironment;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A recorded, classified timing anomaly. Immutable once created.
 *
 * <p>{@code details} keeps insertion order and may contain {@code null} values
 * (for example a connection id that was not assigned yet).</p>
 */
public record RaceConditionPattern(
        String type,
        PatternSeverity severity,
        DeploymentEnvironment environment,
        Map<String, Object> details,
        Instant detectedAt
) {
    public RaceConditionPattern {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(detectedAt, "detectedAt");
        details = details == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public boolean isCritical() {
        return severity == PatternSeverity.CRITICAL;
    }
}
