package com.questrail.readiness.timing;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * TimingProfiles
 * -----------------------------------------------------------------------------
 * Static repository of {@link TimingProfile}s, one per
 * {@link DeploymentEnvironment}. Lookups are pure and need no locking.
 *
 * <h2>Table</h2>
 * <pre>
 *   environment   handshake  stabilization  message  timeout
 *   testing          5ms          0ms          1ms     100ms
 *   development     10ms          0ms          5ms     200ms
 *   staging        100ms         25ms         25ms     500ms
 *   production     100ms         25ms         25ms    1000ms
 * </pre>
 */
public final class TimingProfiles
{
    private static final Duration CLOUD_BACKOFF_STEP = Duration.ofMillis(25);
    private static final Duration TESTING_BACKOFF = Duration.ofMillis(5);
    private static final Duration DEFAULT_BACKOFF = Duration.ofMillis(10);

    private static final Map<DeploymentEnvironment, TimingProfile> PROFILES = buildTable();

    private TimingProfiles() {
    }

    /**
     * Profile for the given environment.
     */
    public static TimingProfile get(DeploymentEnvironment environment) {
        Objects.requireNonNull(environment, "environment");
        return PROFILES.get(environment);
    }

    /**
     * Profile for the given environment name; unknown or {@code null} names
     * return the development profile.
     */
    public static TimingProfile get(String environmentName) {
        return get(DeploymentEnvironment.fromName(environmentName));
    }

    /**
     * Progressive backoff for retry attempt {@code attemptIndex} (0-based).
     *
     * <ul>
     *   <li>staging/production: {@code 25ms * (attemptIndex + 1)}</li>
     *   <li>testing: 5ms</li>
     *   <li>development: 10ms</li>
     * </ul>
     *
     * Negative attempt indexes are treated as 0. The result is never negative
     * and is non-decreasing in {@code attemptIndex}; callers treat it as a
     * minimum wait.
     */
    public static Duration progressiveDelay(DeploymentEnvironment environment, int attemptIndex) {
        Objects.requireNonNull(environment, "environment");
        int attempt = Math.max(0, attemptIndex);

        return switch (environment) {
            case STAGING, PRODUCTION -> CLOUD_BACKOFF_STEP.multipliedBy(attempt + 1L);
            case TESTING -> TESTING_BACKOFF;
            case DEVELOPMENT -> DEFAULT_BACKOFF;
        };
    }

    private static Map<DeploymentEnvironment, TimingProfile> buildTable() {
        EnumMap<DeploymentEnvironment, TimingProfile> table = new EnumMap<>(DeploymentEnvironment.class);
        table.put(DeploymentEnvironment.TESTING, profile(DeploymentEnvironment.TESTING, 5, 0, 1, 100));
        table.put(DeploymentEnvironment.DEVELOPMENT, profile(DeploymentEnvironment.DEVELOPMENT, 10, 0, 5, 200));
        table.put(DeploymentEnvironment.STAGING, profile(DeploymentEnvironment.STAGING, 100, 25, 25, 500));
        table.put(DeploymentEnvironment.PRODUCTION, profile(DeploymentEnvironment.PRODUCTION, 100, 25, 25, 1000));
        return Collections.unmodifiableMap(table);
    }

    private static TimingProfile profile(DeploymentEnvironment environment,
                                         long handshakeMs,
                                         long stabilizationMs,
                                         long messageMs,
                                         long timeoutMs) {
        return new TimingProfile(
                environment,
                Duration.ofMillis(handshakeMs),
                Duration.ofMillis(stabilizationMs),
                Duration.ofMillis(messageMs),
                Duration.ofMillis(timeoutMs)
        );
    }
}
