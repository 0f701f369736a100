package com.questrail.readiness.config;

import com.questrail.readiness.internal.time.MonotonicClock;
import com.questrail.readiness.internal.time.SystemMonotonicClock;
import com.questrail.readiness.internal.time.SystemWallClock;
import com.questrail.readiness.internal.time.WallClock;
import com.questrail.readiness.observability.ReadinessObservabilitySink;
import com.questrail.readiness.observability.Slf4jReadinessObservabilitySink;
import com.questrail.readiness.timing.DeploymentEnvironment;

import java.util.Objects;

/**
 * Aggregated configuration for a {@code ReadinessRuntime}.
 *
 * @param maxHandshakeAttempts attempts the runtime's retry runner makes per connection
 */
public record ReadinessRuntimeConfig(
    DeploymentEnvironment environment,
    MonotonicClock monotonicClock,
    WallClock wallClock,
    ReadinessObservabilitySink observabilitySink,
    int maxHandshakeAttempts
) {
    public ReadinessRuntimeConfig {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(monotonicClock, "monotonicClock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        if (maxHandshakeAttempts < 1) {
            throw new IllegalArgumentException("maxHandshakeAttempts must be >= 1");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private DeploymentEnvironment environment;
        private MonotonicClock monotonicClock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private ReadinessObservabilitySink observabilitySink;
        private int maxHandshakeAttempts = 3;

        public Builder withEnvironment(DeploymentEnvironment environment) {
            this.environment = environment;
            return this;
        }

        public Builder withEnvironment(String environmentName) {
            this.environment = DeploymentEnvironment.fromName(environmentName);
            return this;
        }

        public Builder withMonotonicClock(MonotonicClock clock) {
            this.monotonicClock = clock;
            return this;
        }

        public Builder withWallClock(WallClock clock) {
            this.wallClock = clock;
            return this;
        }

        public Builder withObservabilitySink(ReadinessObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withMaxHandshakeAttempts(int attempts) {
            this.maxHandshakeAttempts = attempts;
            return this;
        }

        /**
         * Unset environment resolves through {@link EnvironmentResolver#system()};
         * unset sink logs through SLF4J.
         */
        public ReadinessRuntimeConfig build() {
            DeploymentEnvironment env = environment != null
                ? environment
                : EnvironmentResolver.system().resolve();
            ReadinessObservabilitySink sink = observabilitySink != null
                ? observabilitySink
                : new Slf4jReadinessObservabilitySink();
            return new ReadinessRuntimeConfig(env, monotonicClock, wallClock, sink, maxHandshakeAttempts);
        }
    }
}
