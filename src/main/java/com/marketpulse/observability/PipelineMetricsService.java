package com.marketpulse.observability;

import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.event.MarketCycleEvent;
import com.marketpulse.event.MarketStatusChangedEvent;
import com.marketpulse.event.NotificationIssuedEvent;
import com.marketpulse.state.StateManager;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Registers and updates the pipeline's Micrometer meters:
 * <ul>
 *   <li><b>market.cycles</b> (counter): completed update cycles</li>
 *   <li><b>market.events.detected</b> (counter, tag subtype): events emitted by the rule engine</li>
 *   <li><b>market.notifications.emitted</b> (counter, tag format): notifications issued</li>
 *   <li><b>market.status.transitions</b> (counter, tag to): status threshold crossings</li>
 *   <li><b>market.sentiment.score</b> (gauge): current sentiment score</li>
 * </ul>
 *
 * <p>The gauge is polled from the StateManager at scrape time; counters are driven by
 * application events published by the pipeline.
 */
@Service
public class PipelineMetricsService {

    private static final Logger log = LoggerFactory.getLogger(PipelineMetricsService.class);

    private final MeterRegistry meterRegistry;
    private final Counter cycleCounter;

    public PipelineMetricsService(MeterRegistry meterRegistry, StateManager stateManager) {
        this.meterRegistry = meterRegistry;

        this.cycleCounter = Counter.builder("market.cycles")
                .description("Completed pipeline update cycles")
                .register(meterRegistry);

        meterRegistry.gauge(
                "market.sentiment.score",
                stateManager,
                manager -> manager.getCurrentState().getSentimentScore());
    }

    @EventListener
    public void onCycleCompleted(MarketCycleEvent event) {
        cycleCounter.increment();
        for (MarketEvent marketEvent : event.getCycleResult().getEvents()) {
            meterRegistry
                    .counter("market.events.detected", "subtype", marketEvent.getSubtype().name())
                    .increment();
        }
    }

    @EventListener
    public void onNotificationIssued(NotificationIssuedEvent event) {
        meterRegistry
                .counter("market.notifications.emitted", "format", event.getNotification().getFormat().name())
                .increment();
    }

    @EventListener
    public void onStatusChanged(MarketStatusChangedEvent event) {
        meterRegistry
                .counter("market.status.transitions", "to", event.getCurrentStatus().name())
                .increment();
        log.debug("Recorded status transition {} -> {}", event.getPreviousStatus(), event.getCurrentStatus());
    }
}
