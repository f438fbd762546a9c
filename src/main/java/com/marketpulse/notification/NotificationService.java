package com.marketpulse.notification;

import com.marketpulse.config.MarketPulseConfig;
import com.marketpulse.domain.enums.EventSeverity;
import com.marketpulse.domain.enums.EventSubtype;
import com.marketpulse.domain.enums.NotificationFormat;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns one cycle's events into at most one user notification.
 *
 * <p>Steps:
 * <ol>
 *   <li>Throttle: an event is admitted only if its subtype has not been admitted within
 *       the throttle window. Admission stamps the subtype immediately, so a second event of
 *       the same subtype later in the same cycle is dropped.</li>
 *   <li>Any HIGH admitted event escalates to a single ALERT built from the HIGH events only.
 *       Medium/low events admitted in that cycle are consumed by the throttle but not shown.</li>
 *   <li>Otherwise two or more admitted events become a CARD, a single one a FLASH.</li>
 * </ol>
 *
 * <p>Every emitted notification is appended to an in-memory log for the dashboard feed.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationTemplateEngine notificationTemplateEngine;
    private final Clock clock;
    private final Duration throttleWindow;

    /** Last admission time per subtype. */
    private final Map<EventSubtype, LocalDateTime> lastSentTime = new EnumMap<>(EventSubtype.class);

    private final List<Notification> sentNotifications = new ArrayList<>();

    public NotificationService(
            NotificationTemplateEngine notificationTemplateEngine, MarketPulseConfig marketPulseConfig, Clock clock) {
        this.notificationTemplateEngine = notificationTemplateEngine;
        this.clock = clock;
        this.throttleWindow = marketPulseConfig.getNotificationThrottle();
    }

    /**
     * Builds the notifications for one cycle.
     *
     * @param events      this cycle's events in rule order
     * @param marketState the state already updated with these events
     * @return an empty list or a list with exactly one notification
     */
    public synchronized List<Notification> generateNotifications(List<MarketEvent> events, MarketState marketState) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        List<MarketEvent> admitted = admit(events, now);
        if (admitted.isEmpty()) {
            return List.of();
        }

        List<MarketEvent> highSeverity = admitted.stream()
                .filter(event -> event.getSeverity() == EventSeverity.HIGH)
                .toList();

        Notification notification;
        if (!highSeverity.isEmpty()) {
            int suppressed = admitted.size() - highSeverity.size();
            if (suppressed > 0) {
                log.debug("{} lower-severity event(s) folded into alert and not notified", suppressed);
            }
            notification = build(NotificationFormat.ALERT, highSeverity, marketState, now);
        } else if (admitted.size() >= 2) {
            notification = build(NotificationFormat.CARD, admitted, marketState, now);
        } else {
            notification = build(NotificationFormat.FLASH, admitted, marketState, now);
        }

        sentNotifications.add(notification);
        log.info(
                "Notification {} [{}] {} with {} line(s)",
                notification.getNotificationId(),
                notification.getFormat(),
                notification.getTitle(),
                notification.getLines().size());
        return List.of(notification);
    }

    /** Full notification log, oldest first. */
    public synchronized List<Notification> getSentNotifications() {
        return List.copyOf(sentNotifications);
    }

    private List<MarketEvent> admit(List<MarketEvent> events, LocalDateTime now) {
        List<MarketEvent> admitted = new ArrayList<>();
        for (MarketEvent event : events) {
            if (event.getSubtype() == null) {
                log.warn("Dropping event {} without subtype", event.getEventId());
                continue;
            }
            LocalDateTime lastSent = lastSentTime.get(event.getSubtype());
            if (lastSent == null || Duration.between(lastSent, now).compareTo(throttleWindow) > 0) {
                admitted.add(event);
                lastSentTime.put(event.getSubtype(), now);
            } else {
                log.debug("Throttled {} event {} (last sent {})", event.getSubtype(), event.getEventId(), lastSent);
            }
        }
        return admitted;
    }

    private Notification build(
            NotificationFormat format, List<MarketEvent> events, MarketState marketState, LocalDateTime now) {
        return Notification.builder()
                .notificationId(newNotificationId())
                .timestamp(now)
                .format(format)
                .title(notificationTemplateEngine.title(format))
                .lines(notificationTemplateEngine.renderLines(format, events, marketState))
                .relatedEvents(events.stream().map(MarketEvent::getEventId).toList())
                .build();
    }

    private static String newNotificationId() {
        return "notif_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    }
}
