package com.marketpulse.rule;

import com.marketpulse.domain.enums.EventCategory;
import com.marketpulse.domain.enums.EventSeverity;
import com.marketpulse.domain.enums.EventSubtype;
import com.marketpulse.domain.model.MarketEvent;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Base class for the built-in rules. Holds the clock and assembles the emitted
 * {@link MarketEvent} so that concrete rules only express their trigger predicate.
 */
public abstract class AbstractAnomalyRule implements AnomalyRule {

    private final Clock clock;
    private final EventSubtype subtype;
    private final EventSeverity severity;

    protected AbstractAnomalyRule(Clock clock, EventSubtype subtype, EventSeverity severity) {
        this.clock = clock;
        this.subtype = subtype;
        this.severity = severity;
    }

    @Override
    public EventSubtype getSubtype() {
        return subtype;
    }

    protected MarketEvent buildEvent(Map<String, Object> data, String description) {
        return MarketEvent.builder()
                .eventId(newEventId())
                .timestamp(LocalDateTime.now(clock))
                .category(EventCategory.ANOMALY_DETECTION)
                .subtype(subtype)
                .severity(severity)
                .data(Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                .description(description)
                .build();
    }

    /** {@code evt_} followed by the first 8 hex chars of a random UUID. */
    static String newEventId() {
        return "evt_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
