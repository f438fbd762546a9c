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
 * Volume spike with a rising index.
 *
 * <p>Fires when current volume exceeds 1.3x the mean volume of the trailing
 * (up to) 30 history entries and the index change is positive. An empty history
 * or a zero baseline never fires.
 */
public class SentimentTurningUpRule extends AbstractAnomalyRule {

    static final int BASELINE_WINDOW = 30;
    static final double SPIKE_MULTIPLIER = 1.3;

    public SentimentTurningUpRule(Clock clock) {
        super(clock, EventSubtype.SENTIMENT_TURNING_UP, EventSeverity.MEDIUM);
    }

    @Override
    public Optional<MarketEvent> evaluate(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        if (history.isEmpty()) {
            return Optional.empty();
        }

        double averageVolume = averageVolume(history);
        double currentVolume = snapshot.volumeOrZero();
        double indexChange = snapshot.indexChangePctOrZero();

        if (averageVolume > 0 && currentVolume > averageVolume * SPIKE_MULTIPLIER && indexChange > 0) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("metric", "volume_spike");
            data.put("value", currentVolume);
            data.put("baseline", averageVolume);
            data.put("changePct", (currentVolume - averageVolume) / averageVolume);
            return Optional.of(buildEvent(data, "Market sentiment turning up: Volume spike with index rise."));
        }
        return Optional.empty();
    }

    /** Mean volume over the last {@value #BASELINE_WINDOW} entries, 0 for an empty window. */
    static double averageVolume(List<MarketSnapshot> history) {
        List<MarketSnapshot> window = history.subList(Math.max(0, history.size() - BASELINE_WINDOW), history.size());
        return window.stream().mapToDouble(MarketSnapshot::volumeOrZero).average().orElse(0.0);
    }
}
