package com.marketpulse.state;

import com.marketpulse.config.MarketPulseConfig;
import com.marketpulse.domain.enums.MarketStatus;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketState;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns the single live {@link MarketState} and folds each cycle's events into it.
 *
 * <p>Per cycle:
 * <ol>
 *   <li>Prunes the recent-events window to the retention period, then appends the new events</li>
 *   <li>Sums the fixed per-subtype weights of this cycle's events into a score delta</li>
 *   <li>Clamps the new score to [0, 100] and derives the status from it</li>
 *   <li>Takes main driver and summary from the last event, or carries them forward when
 *       the cycle was quiet</li>
 * </ol>
 *
 * <p>Status is level-triggered: it follows the score on every cycle, so it can stay
 * GREEN or RED for many cycles and flip on a single threshold crossing.
 *
 * <p>The recent-events window does not feed the score; it is kept for diagnostics and
 * exposed through the API.
 */
@Service
public class StateManager {

    private static final Logger log = LoggerFactory.getLogger(StateManager.class);

    static final double MIN_SCORE = 0.0;
    static final double MAX_SCORE = 100.0;

    private final Clock clock;
    private final Duration recentEventRetention;

    private final List<MarketEvent> recentEvents = new ArrayList<>();
    private volatile MarketState currentState;

    public StateManager(MarketPulseConfig marketPulseConfig, Clock clock) {
        this.clock = clock;
        this.recentEventRetention = marketPulseConfig.getRecentEventRetention();

        double initialScore = clamp(marketPulseConfig.getInitialSentimentScore());
        this.currentState = MarketState.builder()
                .timestamp(LocalDateTime.now(clock))
                .status(MarketStatus.fromScore(initialScore))
                .sentimentScore(initialScore)
                .mainDriver("Initialization")
                .summary("System starting up...")
                .build();
    }

    /**
     * Folds this cycle's events into a new state and makes it the current one.
     * Always returns a state, also for an empty event list.
     */
    public synchronized MarketState updateState(List<MarketEvent> events) {
        List<MarketEvent> cycleEvents = events != null ? events : List.of();
        LocalDateTime now = LocalDateTime.now(clock);

        pruneRecentEvents(now);
        recentEvents.addAll(cycleEvents);

        int scoreDelta = cycleEvents.stream()
                .filter(event -> event.getSubtype() != null)
                .mapToInt(event -> event.getSubtype().getScoreWeight())
                .sum();

        MarketState previous = currentState;
        double newScore = clamp(previous.getSentimentScore() + scoreDelta);
        MarketStatus newStatus = MarketStatus.fromScore(newScore);

        String mainDriver = previous.getMainDriver();
        String summary = previous.getSummary();
        if (!cycleEvents.isEmpty()) {
            MarketEvent lastEvent = cycleEvents.get(cycleEvents.size() - 1);
            mainDriver = lastEvent.getDescription();
            if (lastEvent.getSubtype() != null) {
                summary = "Updated by " + lastEvent.getSubtype().getValue();
            }
        }

        MarketState next = MarketState.builder()
                .timestamp(now)
                .status(newStatus)
                .sentimentScore(newScore)
                .mainDriver(mainDriver)
                .summary(summary)
                .build();

        if (newStatus != previous.getStatus()) {
            log.info(
                    "Market status {} -> {} (score {} -> {})",
                    previous.getStatus(),
                    newStatus,
                    previous.getSentimentScore(),
                    newScore);
        } else {
            log.debug("Market status {} (score {}, delta {})", newStatus, newScore, scoreDelta);
        }

        currentState = next;
        return next;
    }

    public MarketState getCurrentState() {
        return currentState;
    }

    /** Events of the retention window as of the last update, oldest first. */
    public synchronized List<MarketEvent> getRecentEvents() {
        return List.copyOf(recentEvents);
    }

    private void pruneRecentEvents(LocalDateTime now) {
        LocalDateTime cutoff = now.minus(recentEventRetention);
        int before = recentEvents.size();
        recentEvents.removeIf(
                event -> event.getTimestamp() == null || !event.getTimestamp().isAfter(cutoff));
        int pruned = before - recentEvents.size();
        if (pruned > 0) {
            log.debug("Pruned {} event(s) older than {}", pruned, cutoff);
        }
    }

    static double clamp(double score) {
        return Math.max(MIN_SCORE, Math.min(MAX_SCORE, score));
    }
}
