package com.indiaforecast.common.model;

/** Confidence the publishing source itself attached to a forecast. */
public enum RawConfidence {
    LOW,
    MEDIUM,
    HIGH
}
