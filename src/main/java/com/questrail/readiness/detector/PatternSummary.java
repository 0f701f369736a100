package com.questrail.readiness.detector;

import com.questrail.readiness.timing.DeploymentEnvironment;
import com.questrail.readiness.timing.TimingProfile;

import java.util.Map;

/**
 * Aggregate view of a detector's pattern collection, for monitoring and alerting.
 *
 * @param totalPatterns    number of patterns currently held
 * @param countsByType     pattern count per type
 * @param countsBySeverity pattern count per severity
 * @param recentCount      patterns recorded within the last five minutes
 * @param environment      the detector's environment
 * @param timingThresholds the environment's timing profile
 */
public record PatternSummary(
        int totalPatterns,
        Map<String, Long> countsByType,
        Map<PatternSeverity, Long> countsBySeverity,
        int recentCount,
        DeploymentEnvironment environment,
        TimingProfile timingThresholds
) {
    public PatternSummary {
        countsByType = Map.copyOf(countsByType);
        countsBySeverity = Map.copyOf(countsBySeverity);
    }

    public long criticalCount() {
        return countsBySeverity.getOrDefault(PatternSeverity.CRITICAL, 0L);
    }
}
