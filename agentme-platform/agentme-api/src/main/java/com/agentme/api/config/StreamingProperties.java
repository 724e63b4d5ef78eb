package com.agentme.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "agentme.streaming")
public class StreamingProperties {

    private Duration maxDuration = Duration.ofDays(3_650);
    private Duration healthWarningWindow = Duration.ofMinutes(5);

    public Duration getMaxDuration() { return maxDuration; }
    public void setMaxDuration(Duration maxDuration) { this.maxDuration = maxDuration; }
    public Duration getHealthWarningWindow() { return healthWarningWindow; }
    public void setHealthWarningWindow(Duration window) { this.healthWarningWindow = window; }
}
