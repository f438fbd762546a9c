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
 * The leading sector differs from the leader {@value #LOOKBACK} cycles ago.
 *
 * <p>Needs at least {@value #LOOKBACK} history entries. An empty current sector
 * name never counts as a new theme.
 */
public class ThemeEmergenceRule extends AbstractAnomalyRule {

    static final int LOOKBACK = 15;

    public ThemeEmergenceRule(Clock clock) {
        super(clock, EventSubtype.THEME_EMERGENCE, EventSeverity.MEDIUM);
    }

    @Override
    public Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        if (history.size() < LOOKBACK) {
            return Optional.empty();
        }

        String currentLeader = snapshot.topSectorOrEmpty();
        String pastLeader = history.get(history.size() - LOOKBACK).topSectorOrEmpty();

        if (!currentLeader.isEmpty() && !currentLeader.equals(pastLeader)) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("metric", "new_leader");
            data.put("sector", currentLeader);
            data.put("oldLeader", pastLeader);
            return Optional.of(buildEvent(data, "New market theme emerging: " + currentLeader + "."));
        }
        return Optional.empty();
    }
}
