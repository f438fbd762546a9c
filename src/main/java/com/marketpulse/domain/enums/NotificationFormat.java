package com.marketpulse.domain.enums;

/**
 * Display format of a user notification.
 * FLASH is a single line, CARD is up to three lines, ALERT is the strong-signal format.
 */
public enum NotificationFormat {
    FLASH,
    CARD,
    ALERT
}
