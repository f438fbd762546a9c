package com.marketpulse.domain.model;

import com.marketpulse.domain.enums.NotificationFormat;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A user-facing message built from the admitted events of a single cycle.
 * {@code relatedEvents} only ever holds ids of events from that same cycle.
 */
@Value
@Builder
@Jacksonized
public class Notification {

    String notificationId;

    LocalDateTime timestamp;

    NotificationFormat format;

    String title;

    @Builder.Default
    List<String> lines = List.of();

    @Builder.Default
    List<String> relatedEvents = List.of();
}
