package com.sentimento.service.core.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Single time source for event timestamps, sample {@code recordedAt} and connection times. Kept in
 * UTC so every stamped timestamp ends in {@code Z}; tests replace it with a fixed clock.
 */
@Configuration
public class HubClockConfig {

    @Bean
    public Clock hubClock() {
        return Clock.systemUTC();
    }
}
