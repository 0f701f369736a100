package com.questrail.readiness.config;

import com.questrail.readiness.timing.DeploymentEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Resolves the deployment environment of the running process.
 *
 * <p>Lookup order: the {@value #SYSTEM_PROPERTY} system property, then the
 * {@value #ENVIRONMENT_VARIABLE} environment variable, then development.
 * Unrecognised names resolve to development and are logged.</p>
 */
public final class EnvironmentResolver
{
    private static final Logger log = LoggerFactory.getLogger(EnvironmentResolver.class);

    public static final String SYSTEM_PROPERTY = "readiness.environment";
    public static final String ENVIRONMENT_VARIABLE = "ENVIRONMENT";

    private final UnaryOperator<String> systemProperties;
    private final UnaryOperator<String> environmentVariables;

    public EnvironmentResolver(UnaryOperator<String> systemProperties, UnaryOperator<String> environmentVariables) {
        this.systemProperties = Objects.requireNonNull(systemProperties, "systemProperties");
        this.environmentVariables = Objects.requireNonNull(environmentVariables, "environmentVariables");
    }

    /**
     * Resolver over {@link System#getProperty(String)} and {@link System#getenv(String)}.
     */
    public static EnvironmentResolver system() {
        return new EnvironmentResolver(System::getProperty, System::getenv);
    }

    public DeploymentEnvironment resolve() {
        String configured = systemProperties.apply(SYSTEM_PROPERTY);
        String source = SYSTEM_PROPERTY;
        if (isBlank(configured)) {
            configured = environmentVariables.apply(ENVIRONMENT_VARIABLE);
            source = ENVIRONMENT_VARIABLE;
        }
        if (isBlank(configured)) {
            return DeploymentEnvironment.DEVELOPMENT;
        }
        if (!DeploymentEnvironment.isRecognized(configured)) {
            log.warn("Unknown environment '{}' from {}; using development timing", configured, source);
        }
        return DeploymentEnvironment.fromName(configured);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
