package com.marketpulse.event;

import com.marketpulse.domain.enums.MarketStatus;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import com.marketpulse.pipeline.CycleResult;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed methods
 * for the pipeline's application events.
 *
 * <p>Delivery is synchronous unless a listener opts into {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishCycleCompleted(Object source, CycleResult cycleResult) {
        applicationEventPublisher.publishEvent(new MarketCycleEvent(source, cycleResult));
    }

    public void publishStatusChanged(Object source, MarketStatus previousStatus, MarketState currentState) {
        applicationEventPublisher.publishEvent(new MarketStatusChangedEvent(source, previousStatus, currentState));
    }

    public void publishNotificationIssued(Object source, Notification notification) {
        applicationEventPublisher.publishEvent(new NotificationIssuedEvent(source, notification));
    }
}
