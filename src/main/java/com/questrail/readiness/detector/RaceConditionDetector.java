package com.questrail.readiness.detector;

import com.questrail.readiness.api.ConnectionState;
import com.questrail.readiness.api.ReadinessGate;
import com.questrail.readiness.internal.time.SystemWallClock;
import com.questrail.readiness.internal.time.WallClock;
import com.questrail.readiness.observability.ReadinessObservabilitySink;
import com.questrail.readiness.observability.Slf4jReadinessObservabilitySink;
import com.questrail.readiness.timing.DeploymentEnvironment;
import com.questrail.readiness.timing.TimingProfile;
import com.questrail.readiness.timing.TimingProfiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * RaceConditionDetector
 * =============================================================================
 * Diagnostic engine for connection-readiness timing, normally one instance per
 * environment shared by every connection in it.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Compute progressive backoff delays for handshake retries.</li>
 *   <li>Flag durations that exceed their expected maximum.</li>
 *   <li>Validate that a connection is in the single authorized ready state, and
 *       record premature access so isolated occurrences become visible in
 *       aggregate.</li>
 *   <li>Hold a queryable, in-memory log of {@link RaceConditionPattern}s.</li>
 * </ul>
 *
 * <h2>Failure model</h2>
 * Every operation is fail-open: malformed input is logged and answered with
 * "no violation". Nothing here throws into the caller's connection path.
 *
 * <h2>Growth</h2>
 * The pattern log only shrinks through {@link #clearOldPatterns(Duration)} and
 * {@link #resetPatterns()}. An external scheduler must call
 * {@code clearOldPatterns} periodically.
 *
 * <h2>Thread Safety</h2>
 * All mutations and snapshot reads hold the detector's monitor. Readers always
 * see a complete collection. Sink notification happens outside the monitor.
 */
public final class RaceConditionDetector
{
    private static final Logger log = LoggerFactory.getLogger(RaceConditionDetector.class);

    public static final Duration DEFAULT_MAX_PATTERN_AGE = Duration.ofHours(24);
    static final Duration RECENT_WINDOW = Duration.ofMinutes(5);

    private final DeploymentEnvironment environment;
    private final TimingProfile timingProfile;
    private final WallClock wallClock;
    private final ReadinessObservabilitySink observabilitySink;

    private final Object lock = new Object();
    private final List<RaceConditionPattern> patterns = new ArrayList<>();

    public RaceConditionDetector(DeploymentEnvironment environment,
                                 WallClock wallClock,
                                 ReadinessObservabilitySink observabilitySink) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.observabilitySink = Objects.requireNonNull(observabilitySink, "observabilitySink");
        this.timingProfile = TimingProfiles.get(environment);
    }

    /**
     * Detector for the named environment with system time and SLF4J logging.
     * Unknown names fall back to development.
     */
    public RaceConditionDetector(String environmentName) {
        this(DeploymentEnvironment.fromName(environmentName),
                SystemWallClock.INSTANCE,
                new Slf4jReadinessObservabilitySink());
    }

    public DeploymentEnvironment environment() {
        return environment;
    }

    public TimingProfile timingProfile() {
        return timingProfile;
    }

    // ---------------------------------------------------------------------
    // Timing
    // ---------------------------------------------------------------------

    /**
     * Backoff before retry attempt {@code attemptIndex} (0-based).
     *
     * @see TimingProfiles#progressiveDelay(DeploymentEnvironment, int)
     */
    public Duration calculateProgressiveDelay(int attemptIndex) {
        if (attemptIndex < 0) {
            log.warn("Negative retry attempt index {} in {}; using attempt 0", attemptIndex, environment);
        }
        return TimingProfiles.progressiveDelay(environment, attemptIndex);
    }

    /**
     * Wall-clock variant of {@link #detectTimingViolation(long, long, Duration)}.
     */
    public boolean detectTimingViolation(Instant start, Instant end, Duration expectedMaxDuration) {
        if (start == null || end == null) {
            log.warn("Timing check skipped in {}: start={} end={}", environment, start, end);
            return false;
        }
        return checkViolation(Duration.between(start, end), expectedMaxDuration);
    }

    /**
     * Check whether {@code end - start} exceeds {@code expectedMaxDuration}.
     * A violation records a {@link PatternTypes#TIMING_VIOLATION} warning with the
     * actual, expected and overshoot durations in milliseconds.
     *
     * @param startNanos monotonic start tick
     * @param endNanos   monotonic end tick
     * @return {@code true} iff the duration is strictly greater than the bound;
     *         malformed input yields {@code false}
     */
    public boolean detectTimingViolation(long startNanos, long endNanos, Duration expectedMaxDuration) {
        return checkViolation(Duration.ofNanos(endNanos - startNanos), expectedMaxDuration);
    }

    private boolean checkViolation(Duration actual, Duration expectedMaxDuration) {
        if (expectedMaxDuration == null || expectedMaxDuration.isNegative()) {
            log.warn("Timing check skipped in {}: invalid expected duration {}", environment, expectedMaxDuration);
            return false;
        }
        if (actual.isNegative()) {
            log.warn("Timing check skipped in {}: end precedes start by {}", environment, actual.negated());
            return false;
        }
        if (actual.compareTo(expectedMaxDuration) <= 0) {
            return false;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        try {
            details.put("actual_ms", toMillis(actual));
            details.put("expected_ms", toMillis(expectedMaxDuration));
            details.put("overshoot_ms", toMillis(actual.minus(expectedMaxDuration)));
        } catch (ArithmeticException e) {
            log.warn("Timing check skipped in {}: duration {} out of range", environment, actual, e);
            return false;
        }
        addDetectedPattern(PatternTypes.TIMING_VIOLATION, PatternSeverity.WARNING, details);
        return true;
    }

    // ---------------------------------------------------------------------
    // Readiness
    // ---------------------------------------------------------------------

    /**
     * {@code true} iff {@code state} is {@link ConnectionState#READY_FOR_MESSAGES}.
     * A state still in setup ({@code INITIALIZING}, {@code HANDSHAKE_PENDING})
     * additionally records one critical {@link PatternTypes#PREMATURE_MESSAGE_HANDLING}
     * pattern per call.
     */
    public boolean validateConnectionReadiness(ConnectionState state) {
        if (state == null) {
            log.warn("Readiness check in {} received no state; treating as not ready", environment);
            return false;
        }
        if (state.isSetupPhase()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("state", state.name());
            details.put("environment", environment.environmentName());
            addDetectedPattern(PatternTypes.PREMATURE_MESSAGE_HANDLING, PatternSeverity.CRITICAL, details);
        }
        return state == ConnectionState.READY_FOR_MESSAGES;
    }

    /**
     * Validate a connection's gate on behalf of a dispatcher. A closed gate
     * records a {@link PatternTypes#CONNECTION_VALIDATION_FAILED} warning, on top
     * of whatever {@link #validateConnectionReadiness(ConnectionState)} records.
     *
     * @param connectionId optional label for the pattern details
     */
    public boolean validateConnection(ReadinessGate gate, String connectionId) {
        if (gate == null) {
            log.warn("Connection validation in {} received no gate for connection {}", environment, connectionId);
            return false;
        }
        ConnectionState state = gate.getCurrentState();
        boolean ready = validateConnectionReadiness(state) && gate.isReadyForMessages();
        if (!ready) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("connection_id", connectionId);
            details.put("environment", environment.environmentName());
            details.put("state", state == null ? null : state.name());
            addDetectedPattern(PatternTypes.CONNECTION_VALIDATION_FAILED, PatternSeverity.WARNING, details);
        }
        return ready;
    }

    // ---------------------------------------------------------------------
    // Pattern log
    // ---------------------------------------------------------------------

    public RaceConditionPattern addDetectedPattern(String type) {
        return addDetectedPattern(type, PatternSeverity.WARNING, Map.of());
    }

    public RaceConditionPattern addDetectedPattern(String type, PatternSeverity severity) {
        return addDetectedPattern(type, severity, Map.of());
    }

    /**
     * Record a pattern stamped with the current time and this detector's
     * environment. {@code null} severity records a warning.
     *
     * @return the stored pattern, or {@code null} if {@code type} is {@code null}
     *         and nothing was recorded
     */
    public RaceConditionPattern addDetectedPattern(String type, PatternSeverity severity, Map<String, ?> details) {
        if (type == null) {
            log.warn("Pattern without a type ignored in {} (severity {}, details {})", environment, severity, details);
            return null;
        }
        RaceConditionPattern pattern = new RaceConditionPattern(
                type,
                severity == null ? PatternSeverity.WARNING : severity,
                environment,
                details == null ? null : new LinkedHashMap<>(details),
                wallClock.now()
        );

        synchronized (lock) {
            patterns.add(pattern);
        }

        try {
            observabilitySink.onPatternDetected(pattern);
        } catch (RuntimeException e) {
            log.warn("Observability sink rejected pattern {} in {}", pattern.type(), environment, e);
        }
        return pattern;
    }

    public List<RaceConditionPattern> getDetectedPatterns() {
        synchronized (lock) {
            return List.copyOf(patterns);
        }
    }

    /**
     * Patterns matching every given filter. A {@code null} filter matches all.
     *
     * @param since    keep patterns detected at or after this instant
     * @param type     keep patterns of this type
     * @param severity keep patterns of this severity
     */
    public List<RaceConditionPattern> getDetectedPatterns(Instant since, String type, PatternSeverity severity) {
        List<RaceConditionPattern> snapshot = getDetectedPatterns();
        List<RaceConditionPattern> result = new ArrayList<>();
        for (RaceConditionPattern p : snapshot) {
            if (since != null && p.detectedAt().isBefore(since)) {
                continue;
            }
            if (type != null && !type.equals(p.type())) {
                continue;
            }
            if (severity != null && severity != p.severity()) {
                continue;
            }
            result.add(p);
        }
        return List.copyOf(result);
    }

    public PatternSummary getPatternSummary() {
        List<RaceConditionPattern> snapshot = getDetectedPatterns();
        Instant recentCutoff = wallClock.now().minus(RECENT_WINDOW);

        Map<String, Long> byType = new TreeMap<>();
        Map<PatternSeverity, Long> bySeverity = new EnumMap<>(PatternSeverity.class);
        int recent = 0;
        for (RaceConditionPattern p : snapshot) {
            byType.merge(p.type(), 1L, Long::sum);
            bySeverity.merge(p.severity(), 1L, Long::sum);
            if (!p.detectedAt().isBefore(recentCutoff)) {
                recent++;
            }
        }

        return new PatternSummary(snapshot.size(), byType, bySeverity, recent, environment, timingProfile);
    }

    /**
     * Evict patterns older than 24 hours.
     */
    public int clearOldPatterns() {
        return clearOldPatterns(DEFAULT_MAX_PATTERN_AGE);
    }

    /**
     * Evict patterns detected before {@code now - maxAge}.
     *
     * @return number of evicted patterns
     */
    public int clearOldPatterns(Duration maxAge) {
        if (maxAge == null || maxAge.isNegative()) {
            log.warn("Pattern eviction skipped in {}: invalid max age {}", environment, maxAge);
            return 0;
        }
        Instant cutoff = wallClock.now().minus(maxAge);

        int removed;
        synchronized (lock) {
            int before = patterns.size();
            patterns.removeIf(p -> p.detectedAt().isBefore(cutoff));
            removed = before - patterns.size();
        }

        if (removed > 0) {
            log.debug("Evicted {} race condition patterns older than {} in {}", removed, maxAge, environment);
        }
        return removed;
    }

    /**
     * Drop every pattern. For tests only.
     */
    public void resetPatterns() {
        synchronized (lock) {
            patterns.clear();
        }
    }

    private static double toMillis(Duration d) {
        // toMillis() carries the whole range that toNanos() cannot.
        return d.toMillis() + (d.toNanosPart() % 1_000_000) / 1_000_000.0;
    }
}
