package com.meetadrive.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * "meeta.session.*": how long a session may sit unused before it is dropped.
 */
@ConfigurationProperties(prefix = "meeta.session")
public class SessionProperties {
    private Duration idleTimeout = Duration.ofMinutes(30);

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(Duration idleTimeout) {
        this.idleTimeout = idleTimeout;
    }
}
