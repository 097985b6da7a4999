package com.indiaforecast.common.model;

/**
 * Named deviation thresholds. The numeric threshold for each band is configured in
 * {@link com.indiaforecast.common.classification.ToleranceBands}.
 */
public enum ToleranceBand {
    STRICT,
    MODERATE,
    LOOSE;

    public static ToleranceBand fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return MODERATE;
        }
        try {
            return valueOf(label.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tolerance band: " + label, e);
        }
    }
}
