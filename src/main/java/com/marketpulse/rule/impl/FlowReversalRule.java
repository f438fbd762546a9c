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
 * Northbound flow turns positive right after a negative reading.
 *
 * <p>Only the immediately preceding history entry is compared. Since it requires a
 * positive current flow, it can never fire in the same cycle as {@link FlowWithdrawalRule}.
 */
public class FlowReversalRule extends AbstractAnomalyRule {

    public FlowReversalRule(Clock clock) {
        super(clock, EventSubtype.FLOW_REVERSAL, EventSeverity.MEDIUM);
    }

    @Override
    public Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        if (history.isEmpty()) {
            return Optional.empty();
        }

        double currentFlow = snapshot.northBoundFlowOrZero();
        double previousFlow = history.get(history.size() - 1).northBoundFlowOrZero();

        if (currentFlow > 0 && previousFlow < 0) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("metric", "flow_reversal");
            data.put("current", currentFlow);
            data.put("previous", previousFlow);
            return Optional.of(buildEvent(data, "Capital flow reversal: Northbound funds turning positive."));
        }
        return Optional.empty();
    }
}
