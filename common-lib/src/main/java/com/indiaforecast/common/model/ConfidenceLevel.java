package com.indiaforecast.common.model;

public enum ConfidenceLevel {
    LOW,
    MEDIUM,
    HIGH
}
