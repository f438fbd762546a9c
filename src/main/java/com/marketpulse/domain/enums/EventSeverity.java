package com.marketpulse.domain.enums;

/**
 * Severity of a detected market event.
 *
 * <p>HIGH events escalate straight to an ALERT notification and suppress any
 * lower-severity events admitted in the same cycle.
 */
public enum EventSeverity {
    LOW,
    MEDIUM,
    HIGH
}
