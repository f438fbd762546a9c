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
 * Falling index with more than 3 limit-down names and a bomb rate above 30%.
 */
public class SentimentTurningDownRule extends AbstractAnomalyRule {

    static final int LIMIT_DOWN_THRESHOLD = 3;
    static final double BOMB_RATE_THRESHOLD = 30.0;

    public SentimentTurningDownRule(Clock clock) {
        super(clock, EventSubtype.SENTIMENT_TURNING_DOWN, EventSeverity.HIGH);
    }

    @Override
    public Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        double indexChange = snapshot.indexChangePctOrZero();
        int limitDown = snapshot.limitDownCountOrZero();
        double bombRate = snapshot.bombRateOrZero();

        if (indexChange < 0 && limitDown > LIMIT_DOWN_THRESHOLD && bombRate > BOMB_RATE_THRESHOLD) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("metric", "sentiment_drop");
            data.put("limitDown", limitDown);
            data.put("bombRate", bombRate);
            return Optional.of(buildEvent(data, "Market sentiment turning down: Limit downs increasing."));
        }
        return Optional.empty();
    }
}
