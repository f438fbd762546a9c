package com.marketpulse.domain.enums;

/**
 * Top-level category of a {@link com.marketpulse.domain.model.MarketEvent}.
 * Every event produced by the rule engine is an anomaly detection.
 */
public enum EventCategory {
    ANOMALY_DETECTION
}
