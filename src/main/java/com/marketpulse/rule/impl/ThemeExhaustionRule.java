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
 * Leading sector down more than 2%.
 */
public class ThemeExhaustionRule extends AbstractAnomalyRule {

    static final double SECTOR_DROP_THRESHOLD = -2.0;

    public ThemeExhaustionRule(Clock clock) {
        super(clock, EventSubtype.THEME_EXHAUSTION, EventSeverity.MEDIUM);
    }

    @Override
    public Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        double sectorChange = snapshot.topSectorChangePctOrZero();

        if (sectorChange < SECTOR_DROP_THRESHOLD) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("metric", "sector_drop");
            data.put("value", sectorChange);
            return Optional.of(buildEvent(data, "Leading theme shows signs of exhaustion."));
        }
        return Optional.empty();
    }
}
