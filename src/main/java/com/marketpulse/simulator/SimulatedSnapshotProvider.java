package com.marketpulse.simulator;

import com.marketpulse.config.MarketPulseConfig;
import com.marketpulse.domain.model.MarketSnapshot;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates plausible snapshots from a bounded random walk on a market "trend" in [-1, 1].
 *
 * <p>A positive trend lifts the index, northbound flow and the leading sector while
 * lowering limit-down counts and the bomb rate; a negative trend does the opposite.
 * Volume fluctuates between -20% and +50% around the base volume, so volume spikes
 * show up regularly.
 *
 * <p>Set {@code market-pulse.simulator.seed} for a reproducible sequence.
 */
@Component
public class SimulatedSnapshotProvider implements SnapshotProvider {

    private static final Logger log = LoggerFactory.getLogger(SimulatedSnapshotProvider.class);

    static final double BASE_VOLUME = 1_000_000;
    static final List<String> SECTORS = List.of("Semiconductor", "Banking", "Liquor", "New Energy", "Medicine");

    private final Clock clock;
    private final Random random;
    private double trend = 0.0;

    public SimulatedSnapshotProvider(MarketPulseConfig marketPulseConfig, Clock clock) {
        this.clock = clock;
        Long seed = marketPulseConfig.getSimulator().getSeed();
        this.random = seed != null ? new Random(seed) : new Random();
        log.info("Simulated snapshot provider initialised (seed={})", seed);
    }

    @Override
    public synchronized MarketSnapshot latestSnapshot() {
        trend = clamp(trend + uniform(-0.1, 0.1), -1.0, 1.0);

        return MarketSnapshot.builder()
                .timestamp(LocalDateTime.now(clock))
                .volume(BASE_VOLUME * (1 + uniform(-0.2, 0.5)))
                .indexChangePct(trend + uniform(-0.2, 0.2))
                .northBoundFlow(uniform(-10_000_000, 10_000_000) + trend * 5_000_000)
                .limitDownCount((int) Math.max(0, 5 - trend * 5 + randomInt(-1, 2)))
                .bombRate(clamp(20 - trend * 10 + uniform(-5, 5), 0, 100))
                .topSector(SECTORS.get(random.nextInt(SECTORS.size())))
                .topSectorChangePct(trend * 2 + uniform(-0.5, 0.5))
                .build();
    }

    double getTrend() {
        return trend;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    /** Inclusive on both ends. */
    private int randomInt(int min, int max) {
        return min + random.nextInt(max - min + 1);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
