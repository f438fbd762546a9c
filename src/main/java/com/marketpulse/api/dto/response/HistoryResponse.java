package com.marketpulse.api.dto.response;

import com.marketpulse.domain.model.MarketSnapshot;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class HistoryResponse {

    private final int size;
    private final int capacity;

    /** Most recent snapshot in the window, null while the window is empty. */
    private final MarketSnapshot latest;
}
