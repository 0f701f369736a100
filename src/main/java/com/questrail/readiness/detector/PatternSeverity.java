package com.questrail.readiness.detector;

import java.util.Locale;

/**
 * Severity of a recorded race-condition pattern.
 */
public enum PatternSeverity
{
    WARNING("warning"),
    CRITICAL("critical");

    private final String severityName;

    PatternSeverity(String severityName) {
        this.severityName = severityName;
    }

    public String severityName() {
        return severityName;
    }

    /**
     * Case-insensitive parse; {@code null} and unknown names map to {@link #WARNING}.
     */
    public static PatternSeverity fromName(String name) {
        if (name != null && CRITICAL.severityName.equals(name.trim().toLowerCase(Locale.ROOT))) {
            return CRITICAL;
        }
        return WARNING;
    }

    @Override
    public String toString() {
        return severityName;
    }
}
