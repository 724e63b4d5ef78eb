package com.agentme.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * AgentMe settlement layer.
 *
 * Trust scoring, escrow and streaming payments, and tiered dispute resolution for the
 * agent marketplace, run as serialized database transactions.
 */
@SpringBootApplication(scanBasePackages = "com.agentme")
@EntityScan(basePackages = "com.agentme.core.domain")
@EnableJpaRepositories(basePackages = "com.agentme.core.repository")
public class AgentMeSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentMeSettlementApplication.class, args);
    }
}
