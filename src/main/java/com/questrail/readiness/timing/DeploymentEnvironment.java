package com.questrail.readiness.timing;

import java.util.Locale;

/**
 * DeploymentEnvironment
 * -----------------------------------------------------------------------------
 * Deployment environments with a dedicated {@link TimingProfile}.
 *
 * <p>
 * Staging and production run on container-scheduled cloud runtimes whose
 * startup and network latency is variable; they get the longer, stabilized
 * handshake. Any name not recognised resolves to {@link #DEVELOPMENT}.
 * </p>
 */
public enum DeploymentEnvironment
{
    TESTING("testing", "test"),
    DEVELOPMENT("development", "dev"),
    STAGING("staging", "stage"),
    PRODUCTION("production", "prod");

    private final String environmentName;
    private final String alias;

    DeploymentEnvironment(String environmentName, String alias) {
        this.environmentName = environmentName;
        this.alias = alias;
    }

    /**
     * Lower-case name used in logs and pattern records.
     */
    public String environmentName() {
        return environmentName;
    }

    /**
     * Cloud environments apply the post-connect stabilization delay and the
     * linear progressive backoff.
     */
    public boolean isCloud() {
        return this == STAGING || this == PRODUCTION;
    }

    /**
     * Resolve an environment name. Case and surrounding whitespace are ignored;
     * {@code null}, blank and unknown names resolve to {@link #DEVELOPMENT}.
     */
    public static DeploymentEnvironment fromName(String name) {
        DeploymentEnvironment match = lookup(name);
        return match != null ? match : DEVELOPMENT;
    }

    /**
     * {@code true} if {@code name} matches one of the environments by name or
     * alias, i.e. {@link #fromName(String)} did not fall back.
     */
    public static boolean isRecognized(String name) {
        return lookup(name) != null;
    }

    private static DeploymentEnvironment lookup(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (DeploymentEnvironment env : values()) {
            if (env.environmentName.equals(normalized) || env.alias.equals(normalized)) {
                return env;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return environmentName;
    }
}
