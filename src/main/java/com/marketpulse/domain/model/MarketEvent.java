package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.EventCategory;
import com.marketpulse.domain.enums.EventSeverity;
import com.marketpulse.domain.enums.EventSubtype;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * An anomaly detected by one rule in one update cycle.
 *
 * <p>Created only by rule evaluation and never modified afterwards. The same
 * instance is read by the StateManager (score folding, recent-events window) and
 * the NotificationService (throttling, formatting).
 *
 * <p>{@code data} holds the rule-specific diagnostics, e.g. {@code value} and
 * {@code baseline} for a volume spike or {@code sector}/{@code oldLeader} for a
 * theme change.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class MarketEvent {

    String eventId;

    LocalDateTime timestamp;

    @Builder.Default
    EventCategory category = EventCategory.ANOMALY_DETECTION;

    EventSubtype subtype;

    EventSeverity severity;

    @Builder.Default
    Map<String, Object> data = Map.of();

    String description;
}
