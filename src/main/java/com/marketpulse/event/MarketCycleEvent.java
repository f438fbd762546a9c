package com.marketpulse.event;

import com.marketpulse.pipeline.CycleResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every completed update cycle, including quiet ones.
 *
 * <p>Consumed by {@code PipelineMetricsService} to count detected events and
 * emitted notifications.
 */
public class MarketCycleEvent extends ApplicationEvent {

    private final CycleResult cycleResult;

    public MarketCycleEvent(Object source, CycleResult cycleResult) {
        super(source);
        this.cycleResult = cycleResult;
    }

    public CycleResult getCycleResult() {
        return cycleResult;
    }
}
