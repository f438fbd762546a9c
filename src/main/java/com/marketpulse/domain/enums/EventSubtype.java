package com.marketpulse.domain.enums;

import java.util.Locale;

/**
 * The anomaly conditions detected by the rule engine.
 *
 * <p>Each subtype carries the fixed weight it contributes to the sentiment score
 * when an event of that kind is folded into the market state. Positive weights
 * push the market toward GREEN, negative weights toward RED.
 */
public enum EventSubtype {

    /** Volume spike while the index rises. */
    SENTIMENT_TURNING_UP(10),

    /** Falling index with a cluster of limit-down names and a high bomb rate. */
    SENTIMENT_TURNING_DOWN(-10),

    /** Northbound net flow turns positive after a negative reading. */
    FLOW_REVERSAL(5),

    /** Large single-cycle northbound outflow. */
    FLOW_WITHDRAWAL(-10),

    /** A new leading sector compared to 15 cycles ago. */
    THEME_EMERGENCE(5),

    /** The leading sector is selling off. */
    THEME_EXHAUSTION(-5);

    private final int scoreWeight;

    EventSubtype(int scoreWeight) {
        this.scoreWeight = scoreWeight;
    }

    public int getScoreWeight() {
        return scoreWeight;
    }

    /** Lowercase display name, e.g. {@code theme_emergence}. */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
