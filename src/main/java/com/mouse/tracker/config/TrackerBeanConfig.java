package com.mouse.tracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class TrackerBeanConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
