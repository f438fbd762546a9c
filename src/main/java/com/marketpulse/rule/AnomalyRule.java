package com.marketpulse.rule;

import com.marketpulse.domain.enums.EventSubtype;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketSnapshot;
import java.util.List;
import java.util.Optional;

/**
 * Contract for a single anomaly detector.
 *
 * <p>Rules are stateless: the only inputs are the current snapshot and the
 * history window of earlier snapshots (oldest first, current snapshot excluded).
 * A rule never reads another rule's output and never throws for a missing metric.
 */
public interface AnomalyRule {

    /**
     * Evaluates the rule against the current cycle.
     *
     * @param snapshot the current snapshot
     * @param history  earlier snapshots, oldest first; read-only
     * @return the detected event, or empty when the condition does not hold
     */
    Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history);

    /** The subtype of every event this rule emits. */
    EventSubtype getSubtype();
}
