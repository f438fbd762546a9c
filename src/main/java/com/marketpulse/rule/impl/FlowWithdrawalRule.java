package com.marketpulse.rule.impl;

import com.marketpulse.domain.enums.EventSeverity;
import com.marketpulse.domain.enums.EventSubtype;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.rule.AbstractAnomalyRule;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Net northbound outflow of more than 10 million in a single snapshot.
 */
public class FlowWithdrawalRule extends AbstractAnomalyRule {

    static final double OUTFLOW_THRESHOLD = -10_000_000;

    public FlowWithdrawalRule(Clock clock) {
        super(clock, EventSubtype.FLOW_WITHDRAWAL, EventSeverity.HIGH);
    }

    @Override
    public Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        double currentFlow = snapshot.northBoundFlowOrZero();

        if (currentFlow < OUTFLOW_THRESHOLD) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("metric", "rapid_outflow");
            data.put("value", currentFlow);
            return Optional.of(buildEvent(data, "Significant capital withdrawal detected."));
        }
        return Optional.empty();
    }
}
