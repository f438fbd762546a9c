package com.marketpulse.event;

import com.marketpulse.domain.enums.MarketStatus;
import com.marketpulse.domain.model.MarketState;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a cycle moves the market status across a threshold (e.g. YELLOW -> RED).
 */
public class MarketStatusChangedEvent extends ApplicationEvent {

    private final MarketStatus previousStatus;
    private final MarketState currentState;

    public MarketStatusChangedEvent(Object source, MarketStatus previousStatus, MarketState currentState) {
        super(source);
        this.previousStatus = previousStatus;
        this.currentState = currentState;
    }

    public MarketStatus getPreviousStatus() {
        return previousStatus;
    }

    public MarketStatus getCurrentStatus() {
        return currentState.getStatus();
    }
}
