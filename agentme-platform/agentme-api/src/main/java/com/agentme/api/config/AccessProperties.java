package com.agentme.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Principals holding roles from configuration rather than from a governance grant.
 * The arbiter principal is the identity dispute resolution acts as.
 */
@Configuration
@ConfigurationProperties(prefix = "agentme.access")
public class AccessProperties {

    private String governance = "governance";
    private String arbiter = "dispute-resolution";
    private List<String> oracles = new ArrayList<>();

    public String getGovernance() { return governance; }
    public void setGovernance(String governance) { this.governance = governance; }
    public String getArbiter() { return arbiter; }
    public void setArbiter(String arbiter) { this.arbiter = arbiter; }
    public List<String> getOracles() { return oracles; }
    public void setOracles(List<String> oracles) { this.oracles = oracles; }
}
