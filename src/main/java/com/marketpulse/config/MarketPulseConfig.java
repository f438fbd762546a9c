package com.marketpulse.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the market pulse pipeline under the {@code market-pulse} prefix.
 *
 * <ul>
 *   <li>{@code historyCapacity} -- max snapshots kept for rule lookback (oldest evicted first)</li>
 *   <li>{@code initialSentimentScore} -- score of the state the StateManager starts from</li>
 *   <li>{@code recentEventRetention} -- how long events stay in the recent-events window</li>
 *   <li>{@code notificationThrottle} -- minimum gap before the same subtype is notified again</li>
 *   <li>{@code scheduler.*} -- auto-refresh driver, off by default</li>
 *   <li>{@code simulator.seed} -- fixed seed for the simulated provider (null = random)</li>
 * </ul>
 *
 * <p>Rule thresholds are not properties; they are constants in the rule classes.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "market-pulse")
public class MarketPulseConfig {

    private int historyCapacity = 100;
    private double initialSentimentScore = 50.0;
    private Duration recentEventRetention = Duration.ofMinutes(30);
    private Duration notificationThrottle = Duration.ofMinutes(30);
    private Scheduler scheduler = new Scheduler();
    private Simulator simulator = new Simulator();

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = false;
        private long refreshIntervalMs = 60000;
    }

    @Getter
    @Setter
    public static class Simulator {
        private Long seed;
    }
}
