package com.marketpulse.scheduler;

import com.marketpulse.config.MarketPulseConfig;
import com.marketpulse.domain.model.MarketSnapshot;
import com.marketpulse.pipeline.CycleResult;
import com.marketpulse.pipeline.MarketPulsePipeline;
import com.marketpulse.simulator.SnapshotProvider;
import java.time.Clock;
import java.time.LocalDateTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Auto-refresh driver: pulls a snapshot from the {@link SnapshotProvider} on a fixed
 * rate and runs one pipeline cycle.
 *
 * <p>Disabled unless {@code market-pulse.scheduler.enabled=true}. A provider failure is
 * logged and replaced with a neutral snapshot, so the cycle still runs and the state
 * keeps its timestamp moving.
 */
@Component
public class MarketPulseScheduler {

    private static final Logger log = LoggerFactory.getLogger(MarketPulseScheduler.class);

    private final MarketPulseConfig marketPulseConfig;
    private final SnapshotProvider snapshotProvider;
    private final MarketPulsePipeline marketPulsePipeline;
    private final Clock clock;

    public MarketPulseScheduler(
            MarketPulseConfig marketPulseConfig,
            SnapshotProvider snapshotProvider,
            MarketPulsePipeline marketPulsePipeline,
            Clock clock) {
        this.marketPulseConfig = marketPulseConfig;
        this.snapshotProvider = snapshotProvider;
        this.marketPulsePipeline = marketPulsePipeline;
        this.clock = clock;
    }

    @Scheduled(fixedRateString = "${market-pulse.scheduler.refresh-interval-ms:60000}")
    public void refresh() {
        if (!marketPulseConfig.getScheduler().isEnabled()) {
            return;
        }

        MarketSnapshot snapshot = fetchSnapshot();
        CycleResult cycleResult = marketPulsePipeline.runCycle(snapshot);
        log.debug(
                "Scheduled cycle done: status={} events={}",
                cycleResult.getState().getStatus(),
                cycleResult.getEvents().size());
    }

    MarketSnapshot fetchSnapshot() {
        try {
            MarketSnapshot snapshot = snapshotProvider.latestSnapshot();
            if (snapshot != null) {
                return snapshot;
            }
            log.warn("Snapshot provider returned nothing, using neutral snapshot");
        } catch (RuntimeException e) {
            log.warn("Snapshot provider failed, using neutral snapshot: {}", e.getMessage());
        }
        return MarketSnapshot.neutral(LocalDateTime.now(clock));
    }
}
