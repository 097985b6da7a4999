package com.indiaforecast.common.model;

/**
 * Schedule label for an unresolved prediction. {@link #LATE_RISK} never appears on a
 * resolved classification.
 */
public enum LikelihoodOutlook {
    LIKELY_EARLY,
    ON_TIME,
    LATE_RISK
}
