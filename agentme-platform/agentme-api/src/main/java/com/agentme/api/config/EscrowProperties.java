package com.agentme.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Trust gating for escrow creation. Collateral is disabled while the ratio is zero.
 */
@Configuration
@ConfigurationProperties(prefix = "agentme.escrow")
public class EscrowProperties {

    private int minProviderTrustScore = 0;
    private int collateralRatioBps = 0;
    private int trustedProviderScore = 7_000;

    public int getMinProviderTrustScore() { return minProviderTrustScore; }
    public void setMinProviderTrustScore(int score) { this.minProviderTrustScore = score; }
    public int getCollateralRatioBps() { return collateralRatioBps; }
    public void setCollateralRatioBps(int bps) { this.collateralRatioBps = bps; }
    public int getTrustedProviderScore() { return trustedProviderScore; }
    public void setTrustedProviderScore(int score) { this.trustedProviderScore = score; }
}
