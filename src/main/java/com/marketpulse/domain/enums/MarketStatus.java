package com.marketpulse.domain.enums;

/**
 * Traffic-light classification of the running sentiment score.
 *
 * <p>Status is derived from the score alone:
 * <ul>
 *   <li>GREEN: score &gt;= 70 (safe / positive)</li>
 *   <li>RED: score &lt;= 30 (risk / overheated)</li>
 *   <li>YELLOW: anything in between (oscillating / observing)</li>
 * </ul>
 */
public enum MarketStatus {
    RED,
    YELLOW,
    GREEN;

    public static final double GREEN_THRESHOLD = 70.0;
    public static final double RED_THRESHOLD = 30.0;

    public static MarketStatus fromScore(double sentimentScore) {
        if (sentimentScore >= GREEN_THRESHOLD) {
            return GREEN;
        }
        if (sentimentScore <= RED_THRESHOLD) {
            return RED;
        }
        return YELLOW;
    }
}
