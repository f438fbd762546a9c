package com.marketpulse.rule;

import com.marketpulse.rule.impl.FlowReversalRule;
import com.marketpulse.rule.impl.FlowWithdrawalRule;
import com.marketpulse.rule.impl.SentimentTurningDownRule;
import com.marketpulse.rule.impl.SentimentTurningUpRule;
import com.marketpulse.rule.impl.ThemeEmergenceRule;
import com.marketpulse.rule.impl.ThemeExhaustionRule;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link RuleEngine} with the six canonical rules.
 *
 * <p>Registration order is fixed here and is the order events appear in within a cycle.
 */
@Configuration
public class RuleEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RuleEngineConfig.class);

    @Bean
    public RuleEngine ruleEngine(Clock clock) {
        RuleEngine ruleEngine = createDefault(clock);
        log.info("Rule engine ready with {} rules", ruleEngine.getRules().size());
        return ruleEngine;
    }

    public static RuleEngine createDefault(Clock clock) {
        RuleEngine ruleEngine = new RuleEngine();
        ruleEngine.addRule(new SentimentTurningUpRule(clock));
        ruleEngine.addRule(new SentimentTurningDownRule(clock));
        ruleEngine.addRule(new FlowReversalRule(clock));
        ruleEngine.addRule(new FlowWithdrawalRule(clock));
        ruleEngine.addRule(new ThemeEmergenceRule(clock));
        ruleEngine.addRule(new ThemeExhaustionRule(clock));
        return ruleEngine;
    }
}
