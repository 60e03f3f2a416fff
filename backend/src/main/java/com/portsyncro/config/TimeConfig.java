package com.portsyncro.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single time source for rate limiting, price timestamps and snapshot dates. The zone decides which calendar day a
 * snapshot belongs to. Tests substitute a fixed clock.
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock(@Value("${portsyncro.time-zone:Asia/Jakarta}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
