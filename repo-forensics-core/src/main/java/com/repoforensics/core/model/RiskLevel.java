package com.repoforensics.core.model;

/**
 * Discrete risk classification of a hotspot file.
 *
 * <p>Constants are declared from least to most severe so that {@link #compareTo(Enum)}
 * orders them by severity.
 *
 * @since 1.0.0
 */
public enum RiskLevel {
    /** Neither frequently changed nor complex. */
    LOW,

    /** Frequently changed or moderately complex. */
    MEDIUM,

    /** Frequently changed and complex. */
    HIGH,

    /** Very frequently changed and very complex. */
    CRITICAL
}
