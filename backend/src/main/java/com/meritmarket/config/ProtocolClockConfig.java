package com.meritmarket.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ProtocolClockConfig {

    private static final Logger log = LoggerFactory.getLogger(ProtocolClockConfig.class);

    @Bean
    public Clock protocolClock() {
        log.info("Protocol windows evaluated against the UTC system clock");
        return Clock.systemUTC();
    }
}
