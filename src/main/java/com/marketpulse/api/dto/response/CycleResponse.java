package com.marketpulse.api.dto.response;

import com.marketpulse.domain.model.MarketEvent;
import com.marketpulse.domain.model.MarketState;
import com.marketpulse.domain.model.Notification;
import com.marketpulse.pipeline.CycleResult;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Response body for a manually triggered update cycle.
 */
@Getter
@Builder
public class CycleResponse {

    private final List<MarketEvent> events;
    private final MarketState state;
    private final List<Notification> notifications;
    private final int historySize;

    public static CycleResponse from(CycleResult cycleResult, int historySize) {
        return CycleResponse.builder()
                .events(cycleResult.getEvents())
                .state(cycleResult.getState())
                .notifications(cycleResult.getNotifications())
                .historySize(historySize)
                .build();
    }
}
