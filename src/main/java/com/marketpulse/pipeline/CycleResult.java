package com.marketpulse.pipeline;

import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * The three outputs of one update cycle, together with the snapshot that produced them.
 */
@Value
@Builder
public class CycleResult {

    MarketSnapshot snapshot;

    /** Detected events in rule registration order. */
    List<MarketEvent> events;

    MarketState state;

    /** Empty or a single notification. */
    List<Notification> notifications;
}
