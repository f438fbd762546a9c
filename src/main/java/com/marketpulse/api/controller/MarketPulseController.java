package com.marketpulse.api.controller;

import com.marketpulse.api.dto.response.CycleResponse;
import com.marketpulse.api.dto.response.HistoryResponse;
import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import com.marketpulse.history.HistoryWindow;
import com.marketpulse.notification.NotificationService;
import com.marketpulse.pipeline.CycleResult;
import com.marketpulse.pipeline.MarketPulsePipeline;
import com.marketpulse.state.StateManager;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API over the pipeline's live state for the dashboard.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /api/market/state} -- current market state</li>
 *   <li>{@code GET /api/market/events/recent} -- events of the last 30 minutes</li>
 *   <li>{@code GET /api/market/notifications?limit=N} -- notification feed, newest first</li>
 *   <li>{@code GET /api/market/history} -- history window fill level</li>
 *   <li>{@code POST /api/market/snapshots} -- run one cycle on the posted snapshot</li>
 * </ul>
 */
@Validated
@RestController
@RequestMapping("/api/market")
public class MarketPulseController {

    private final MarketPulsePipeline marketPulsePipeline;
    private final StateManager stateManager;
    private final NotificationService notificationService;
    private final Clock clock;

    public MarketPulseController(
            MarketPulsePipeline marketPulsePipeline,
            StateManager stateManager,
            NotificationService notificationService,
            Clock clock) {
        this.marketPulsePipeline = marketPulsePipeline;
        this.stateManager = stateManager;
        this.notificationService = notificationService;
        this.clock = clock;
    }

    @GetMapping("/state")
    public MarketState getState() {
        return stateManager.getCurrentState();
    }

    @GetMapping("/events/recent")
    public List<MarketEvent> getRecentEvents() {
        return stateManager.getRecentEvents();
    }

    @GetMapping("/notifications")
    public List<Notification> getNotifications(
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        List<Notification> newestFirst = new ArrayList<>(notificationService.getSentNotifications());
        Collections.reverse(newestFirst);
        return newestFirst.subList(0, Math.min(limit, newestFirst.size()));
    }

    @GetMapping("/history")
    public HistoryResponse getHistory() {
        HistoryWindow historyWindow = marketPulsePipeline.getHistoryWindow();
        return HistoryResponse.builder()
                .size(historyWindow.size())
                .capacity(historyWindow.getCapacity())
                .latest(historyWindow.latest().orElse(null))
                .build();
    }

    @PostMapping("/snapshots")
    @ResponseStatus(HttpStatus.CREATED)
    public CycleResponse submitSnapshot(@Valid @RequestBody MarketSnapshot snapshot) {
        MarketSnapshot stamped = snapshot.getTimestamp() != null
                ? snapshot
                : snapshot.toBuilder().timestamp(LocalDateTime.now(clock)).build();
        CycleResult cycleResult = marketPulsePipeline.runCycle(stamped);
        return CycleResponse.from(cycleResult, marketPulsePipeline.getHistoryWindow().size());
    }
}
