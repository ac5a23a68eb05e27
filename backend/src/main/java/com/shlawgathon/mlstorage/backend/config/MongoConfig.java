package com.shlawgathon.mlstorage.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MongoConfig {

    /**
     * Time source for start, stop and heartbeat timestamps. Always UTC.
     */
    @Bean
    public Clock experimentClock() {
        return Clock.systemUTC();
    }
}
