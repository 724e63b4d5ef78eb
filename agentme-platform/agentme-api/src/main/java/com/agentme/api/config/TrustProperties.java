package com.agentme.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Trust scoring and staking parameters.
 */
@Configuration
@ConfigurationProperties(prefix = "agentme.trust")
public class TrustProperties {

    private String stakeToken = "USDC";
    private int reputationWeightBps = 5_000;
    private int stakeWeightBps = 3_000;
    private int endorsementWeightBps = 2_000;
    private double decayRate = 0.05;
    private Duration decayPeriod = Duration.ofDays(14);
    private double disputePenalty = 0.10;
    private long referenceStake = 10_000_000_000L; // 10,000 USDC
    private long referenceVolume = 100_000_000_000L; // 100,000 USDC
    private int maxEndorsementHops = 3;
    private double endorsementHopDecay = 0.90;
    private int maxEndorsementsCounted = 10;
    private Duration withdrawCooldown = Duration.ofDays(7);

    public String getStakeToken() { return stakeToken; }
    public void setStakeToken(String stakeToken) { this.stakeToken = stakeToken; }
    public int getReputationWeightBps() { return reputationWeightBps; }
    public void setReputationWeightBps(int bps) { this.reputationWeightBps = bps; }
    public int getStakeWeightBps() { return stakeWeightBps; }
    public void setStakeWeightBps(int bps) { this.stakeWeightBps = bps; }
    public int getEndorsementWeightBps() { return endorsementWeightBps; }
    public void setEndorsementWeightBps(int bps) { this.endorsementWeightBps = bps; }
    public double getDecayRate() { return decayRate; }
    public void setDecayRate(double decayRate) { this.decayRate = decayRate; }
    public Duration getDecayPeriod() { return decayPeriod; }
    public void setDecayPeriod(Duration decayPeriod) { this.decayPeriod = decayPeriod; }
    public double getDisputePenalty() { return disputePenalty; }
    public void setDisputePenalty(double disputePenalty) { this.disputePenalty = disputePenalty; }
    public long getReferenceStake() { return referenceStake; }
    public void setReferenceStake(long referenceStake) { this.referenceStake = referenceStake; }
    public long getReferenceVolume() { return referenceVolume; }
    public void setReferenceVolume(long referenceVolume) { this.referenceVolume = referenceVolume; }
    public int getMaxEndorsementHops() { return maxEndorsementHops; }
    public void setMaxEndorsementHops(int hops) { this.maxEndorsementHops = hops; }
    public double getEndorsementHopDecay() { return endorsementHopDecay; }
    public void setEndorsementHopDecay(double decay) { this.endorsementHopDecay = decay; }
    public int getMaxEndorsementsCounted() { return maxEndorsementsCounted; }
    public void setMaxEndorsementsCounted(int count) { this.maxEndorsementsCounted = count; }
    public Duration getWithdrawCooldown() { return withdrawCooldown; }
    public void setWithdrawCooldown(Duration withdrawCooldown) { this.withdrawCooldown = withdrawCooldown; }
}
