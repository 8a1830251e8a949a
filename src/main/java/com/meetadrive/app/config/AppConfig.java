package com.meetadrive.app.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // Source of createdAt/updatedAt timestamps
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
