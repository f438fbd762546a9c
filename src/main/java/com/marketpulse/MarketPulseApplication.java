package com.marketpulse;

import com.marketpulse.config.MarketPulseConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(MarketPulseConfig.class)
public class MarketPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketPulseApplication.class, args);
    }
}
