package com.marketpulse.notification;

import com.marketpulse.domain.enums.NotificationFormat;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketState;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders the title and display lines for each notification format.
 *
 * <ul>
 *   <li>ALERT: up to {@value #MAX_ALERT_LINES} high-severity descriptions plus the market status</li>
 *   <li>CARD: the first {@value #MAX_CARD_LINES} descriptions plus the sentiment score</li>
 *   <li>FLASH: the single event description</li>
 * </ul>
 */
@Component
public class NotificationTemplateEngine {

    static final int MAX_ALERT_LINES = 3;
    static final int MAX_CARD_LINES = 2;

    public String title(NotificationFormat format) {
        return switch (format) {
            case ALERT -> "Important Market Alert";
            case CARD -> "Multi-Signal Market Update";
            case FLASH -> "Market Flash";
        };
    }

    public List<String> renderLines(NotificationFormat format, List<MarketEvent> events, MarketState marketState) {
        return switch (format) {
            case ALERT -> renderAlertLines(events, marketState);
            case CARD -> renderCardLines(events, marketState);
            case FLASH -> List.of(events.get(0).getDescription());
        };
    }

    private List<String> renderAlertLines(List<MarketEvent> events, MarketState marketState) {
        List<String> lines = new ArrayList<>(descriptions(events, MAX_ALERT_LINES));
        lines.add("Market Status: " + marketState.getStatus().name());
        return List.copyOf(lines);
    }

    private List<String> renderCardLines(List<MarketEvent> events, MarketState marketState) {
        List<String> lines = new ArrayList<>(descriptions(events, MAX_CARD_LINES));
        lines.add("Sentiment Score: " + marketState.getSentimentScore());
        return List.copyOf(lines);
    }

    private List<String> descriptions(List<MarketEvent> events, int limit) {
        return events.stream().limit(limit).map(MarketEvent::getDescription).toList();
    }
}
