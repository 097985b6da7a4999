package com.indiaforecast.common.model;

/**
 * Outcome of comparing a forecast with its actual. A higher-than-predicted achieved
 * value, or an earlier achievement, is {@link #EARLY}.
 */
public enum ClassificationStatus {
    EARLY,
    ON_TIME,
    LATE,
    UNRESOLVED;

    /** Counts towards a sector's historical accuracy rate. */
    public boolean isAccurate() {
        return this == EARLY || this == ON_TIME;
    }

    public boolean isResolved() {
        return this != UNRESOLVED;
    }
}
