package com.example.studentrecords.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    // Record timestamps are local wall-clock time.
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
