package com.marketpulse.event;

import com.marketpulse.domain.model.Notification;
import org.springframework.context.ApplicationEvent;

/**
 * Published for each notification the pipeline emits, for delivery channels
 * (dashboard feed, push, log sink) to pick up.
 */
public class NotificationIssuedEvent extends ApplicationEvent {

    private final Notification notification;

    public NotificationIssuedEvent(Object source, Notification notification) {
        super(source);
        this.notification = notification;
    }

    public Notification getNotification() {
        return notification;
    }
}
