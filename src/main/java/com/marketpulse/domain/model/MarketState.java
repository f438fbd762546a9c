package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.MarketStatus;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The running market sentiment as of one update cycle.
 *
 * <p>Exactly one live instance exists, owned by the StateManager. Each cycle builds
 * a new instance; the previous one is never modified.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MarketState {

    LocalDateTime timestamp;

    MarketStatus status;

    /** Always within [0, 100]. */
    double sentimentScore;

    /** Description of the event that last moved the state. */
    String mainDriver;

    String summary;
}
