package com.marketpulse.pipeline;

import com.marketpulse.config.MarketPulseConfig;
import com.marketpulse.domain.enums.MarketStatus;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import com.marketpulse.event.EventPublisherHelper;
import com.marketpulse.exception.InvalidSnapshotException;
import com.marketpulse.history.HistoryWindow;
import com.marketpulse.notification.NotificationService;
import com.marketpulse.rule.RuleEngine;
import com.marketpulse.state.StateManager;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drives one update cycle through the three pipeline stages.
 *
 * <p>snapshot -> {@link RuleEngine} (events) -> {@link StateManager} (new state)
 * -> {@link NotificationService} (notifications). The history window is copied
 * before evaluation and the snapshot is appended only after the cycle, so rules
 * never see the current snapshot in their lookback.
 *
 * <p>Cycles are serialized per pipeline instance: the scheduler thread and the
 * manual step endpoint may both call {@link #runCycle(MarketSnapshot)}.
 */
@Service
public class MarketPulsePipeline {

    private static final Logger log = LoggerFactory.getLogger(MarketPulsePipeline.class);

    private final RuleEngine ruleEngine;
    private final StateManager stateManager;
    private final NotificationService notificationService;
    private final EventPublisherHelper eventPublisherHelper;
    private final HistoryWindow historyWindow;

    public MarketPulsePipeline(
            RuleEngine ruleEngine,
            StateManager stateManager,
            NotificationService notificationService,
            EventPublisherHelper eventPublisherHelper,
            MarketPulseConfig marketPulseConfig) {
        this.ruleEngine = ruleEngine;
        this.stateManager = stateManager;
        this.notificationService = notificationService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.historyWindow = new HistoryWindow(marketPulseConfig.getHistoryCapacity());
    }

    public synchronized CycleResult runCycle(MarketSnapshot snapshot) {
        if (snapshot == null) {
            throw new InvalidSnapshotException("Cannot run a cycle without a snapshot");
        }

        MarketStatus previousStatus = stateManager.getCurrentState().getStatus();

        List<MarketEvent> events = ruleEngine.evaluateAll(snapshot, historyWindow.snapshots());
        MarketState state = stateManager.updateState(events);
        List<Notification> notifications = notificationService.generateNotifications(events, state);

        historyWindow.append(snapshot);

        CycleResult cycleResult = CycleResult.builder()
                .snapshot(snapshot)
                .events(events)
                .state(state)
                .notifications(notifications)
                .build();

        if (events.isEmpty()) {
            log.debug("Quiet cycle: {} score={}", state.getStatus(), state.getSentimentScore());
        } else {
            log.info(
                    "Cycle complete: {} event(s), {} score={}, {} notification(s)",
                    events.size(),
                    state.getStatus(),
                    state.getSentimentScore(),
                    notifications.size());
        }

        eventPublisherHelper.publishCycleCompleted(this, cycleResult);
        if (state.getStatus() != previousStatus) {
            eventPublisherHelper.publishStatusChanged(this, previousStatus, state);
        }
        for (Notification notification : notifications) {
            eventPublisherHelper.publishNotificationIssued(this, notification);
        }

        return cycleResult;
    }

    public HistoryWindow getHistoryWindow() {
        return historyWindow;
    }
}
