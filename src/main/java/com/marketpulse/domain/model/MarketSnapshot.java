package com.marketpulse.domain.model;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time reading of market-wide conditions, supplied once per update cycle.
 *
 * <p>Every metric is optional. Providers that cannot compute a field (limit-down
 * counts are expensive intraday, northbound flow is not always published) leave it
 * null. Rules never read the raw fields directly; they go through the
 * {@code ...OrZero()} accessors so that an absent metric is treated as neutral
 * instead of failing the cycle.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MarketSnapshot {

    LocalDateTime timestamp;

    /** Traded turnover for the sampling interval. */
    @PositiveOrZero
    Double volume;

    /** Percent change of the reference index versus previous close. */
    Double indexChangePct;

    /** Net cross-border (northbound) capital flow. Negative = outflow. */
    Double northBoundFlow;

    /** Number of names sitting at the daily limit-down price. */
    @PositiveOrZero
    Integer limitDownCount;

    /** Percentage (0-100) of limit-up names that failed to hold the limit. */
    @DecimalMin("0")
    @DecimalMax("100")
    Double bombRate;

    /** Name of the currently leading sector. */
    String topSector;

    /** Percent change of the leading sector. */
    Double topSectorChangePct;

    /**
     * Snapshot with every metric at its neutral value. Upstream providers hand this to
     * the pipeline when they fail, so a bad fetch never aborts a cycle.
     */
    public static MarketSnapshot neutral(LocalDateTime timestamp) {
        return MarketSnapshot.builder()
                .timestamp(timestamp)
                .volume(0.0)
                .indexChangePct(0.0)
                .northBoundFlow(0.0)
                .limitDownCount(0)
                .bombRate(0.0)
                .topSector("")
                .topSectorChangePct(0.0)
                .build();
    }

    public double volumeOrZero() {
        return volume != null ? volume : 0.0;
    }

    public double indexChangePctOrZero() {
        return indexChangePct != null ? indexChangePct : 0.0;
    }

    public double northBoundFlowOrZero() {
        return northBoundFlow != null ? northBoundFlow : 0.0;
    }

    public int limitDownCountOrZero() {
        return limitDownCount != null ? limitDownCount : 0;
    }

    public double bombRateOrZero() {
        return bombRate != null ? bombRate : 0.0;
    }

    public String topSectorOrEmpty() {
        return topSector != null ? topSector : "";
    }

    public double topSectorChangePctOrZero() {
        return topSectorChangePct != null ? topSectorChangePct : 0.0;
    }
}
