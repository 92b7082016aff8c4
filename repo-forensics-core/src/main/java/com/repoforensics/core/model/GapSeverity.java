package com.repoforensics.core.model;

/**
 * Severity level for quality gaps detected while loading and reconciling inputs.
 *
 * <p>Used to indicate how much a gap weakens the hotspot table or the developer ranking.</p>
 *
 * @since 1.0.0
 */
public enum GapSeverity {
    /**
     * Informational - no action required, just for awareness.
     */
    INFO,

    /**
     * Warning - a signal is degraded or missing and should be reviewed.
     */
    WARNING,

    /**
     * Error - an input could not be read at all.
     */
    ERROR
}
