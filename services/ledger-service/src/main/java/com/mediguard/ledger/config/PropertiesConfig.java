package com.mediguard.ledger.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class PropertiesConfig {

    @Bean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }
}
