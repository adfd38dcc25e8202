package com.vita.causality.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class CausalityConfig {

    @Bean
    public Clock clock(CausalityProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
