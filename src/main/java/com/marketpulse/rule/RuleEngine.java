package com.marketpulse.rule;

import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketSnapshot;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates the registered anomaly rules against one snapshot.
 *
 * <p>Rules run in registration order and the returned events keep that order.
 * Downstream consumers depend on it: the StateManager takes its main driver from
 * the last event, and notification lines are taken from the first events.
 *
 * <p>Rules are independent. A rule that throws is logged and skipped so the
 * remaining rules, and the cycle, still complete.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final List<AnomalyRule> rules = new CopyOnWriteArrayList<>();

    public void addRule(AnomalyRule rule) {
        rules.add(rule);
        log.debug("Registered rule {} ({})", rule.getClass().getSimpleName(), rule.getSubtype());
    }

    public List<AnomalyRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Runs every rule against the snapshot.
     *
     * @param snapshot the current snapshot
     * @param history  earlier snapshots, oldest first, excluding {@code snapshot}
     * @return detected events in rule registration order
     */
    public List<MarketEvent> evaluateAll(MarketSnapshot snapshot, List<MarketSnapshot> history) {
        List<MarketSnapshot> lookback = history != null ? history : List.of();
        List<MarketEvent> events = new ArrayList<>();

        for (AnomalyRule rule : rules) {
            try {
                Optional<MarketEvent> event = rule.evaluate(snapshot, lookback);
                event.ifPresent(events::add);
            } catch (RuntimeException e) {
                log.error("Rule {} failed, skipping for this cycle", rule.getSubtype(), e);
            }
        }

        if (!events.isEmpty()) {
            log.info(
                    "Detected {} event(s): {}",
                    events.size(),
                    events.stream().map(e -> e.getSubtype().name()).toList());
        }
        return events;
    }
}
