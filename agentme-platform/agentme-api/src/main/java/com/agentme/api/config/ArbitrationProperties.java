package com.agentme.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tier boundaries, fees, voting windows and juror economics.
 * Amounts are token base units (6 decimals).
 */
@Configuration
@ConfigurationProperties(prefix = "agentme.arbitration")
public class ArbitrationProperties {

    private long tier1Ceiling = 10_000_000L;      // 10 USDC
    private long tier2Ceiling = 1_000_000_000L;   // 1,000 USDC

    private int feeBps = 300;
    private long minFee = 5_000_000L;             // 5 USDC
    private long maxFee = 100_000_000L;           // 100 USDC

    private Duration evidencePeriod = Duration.ofHours(24);
    private Duration votingPeriod = Duration.ofHours(48);
    private Duration commitPeriod = Duration.ofHours(12);
    private Duration revealPeriod = Duration.ofHours(12);
    private Duration appealPeriod = Duration.ofHours(72);
    private Duration deliveryGracePeriod = Duration.ofHours(24);

    private int tier2Jurors = 3;
    private int tier3MinJurors = 5;
    private int maxJurors = 11;
    private int maxAppealRounds = 2;

    private long minJurorStake = 100_000_000L;    // 100 USDC
    private int jurorTrustFloor = 2_000;
    private int jurorSlashBps = 1_000;
    private int partySlashBps = 500;

    public long getTier1Ceiling() { return tier1Ceiling; }
    public void setTier1Ceiling(long tier1Ceiling) { this.tier1Ceiling = tier1Ceiling; }
    public long getTier2Ceiling() { return tier2Ceiling; }
    public void setTier2Ceiling(long tier2Ceiling) { this.tier2Ceiling = tier2Ceiling; }
    public int getFeeBps() { return feeBps; }
    public void setFeeBps(int feeBps) { this.feeBps = feeBps; }
    public long getMinFee() { return minFee; }
    public void setMinFee(long minFee) { this.minFee = minFee; }
    public long getMaxFee() { return maxFee; }
    public void setMaxFee(long maxFee) { this.maxFee = maxFee; }
    public Duration getEvidencePeriod() { return evidencePeriod; }
    public void setEvidencePeriod(Duration evidencePeriod) { this.evidencePeriod = evidencePeriod; }
    public Duration getVotingPeriod() { return votingPeriod; }
    public void setVotingPeriod(Duration votingPeriod) { this.votingPeriod = votingPeriod; }
    public Duration getCommitPeriod() { return commitPeriod; }
    public void setCommitPeriod(Duration commitPeriod) { this.commitPeriod = commitPeriod; }
    public Duration getRevealPeriod() { return revealPeriod; }
    public void setRevealPeriod(Duration revealPeriod) { this.revealPeriod = revealPeriod; }
    public Duration getAppealPeriod() { return appealPeriod; }
    public void setAppealPeriod(Duration appealPeriod) { this.appealPeriod = appealPeriod; }
    public Duration getDeliveryGracePeriod() { return deliveryGracePeriod; }
    public void setDeliveryGracePeriod(Duration period) { this.deliveryGracePeriod = period; }
    public int getTier2Jurors() { return tier2Jurors; }
    public void setTier2Jurors(int tier2Jurors) { this.tier2Jurors = tier2Jurors; }
    public int getTier3MinJurors() { return tier3MinJurors; }
    public void setTier3MinJurors(int tier3MinJurors) { this.tier3MinJurors = tier3MinJurors; }
    public int getMaxJurors() { return maxJurors; }
    public void setMaxJurors(int maxJurors) { this.maxJurors = maxJurors; }
    public int getMaxAppealRounds() { return maxAppealRounds; }
    public void setMaxAppealRounds(int maxAppealRounds) { this.maxAppealRounds = maxAppealRounds; }
    public long getMinJurorStake() { return minJurorStake; }
    public void setMinJurorStake(long minJurorStake) { this.minJurorStake = minJurorStake; }
    public int getJurorTrustFloor() { return jurorTrustFloor; }
    public void setJurorTrustFloor(int jurorTrustFloor) { this.jurorTrustFloor = jurorTrustFloor; }
    public int getJurorSlashBps() { return jurorSlashBps; }
    public void setJurorSlashBps(int jurorSlashBps) { this.jurorSlashBps = jurorSlashBps; }
    public int getPartySlashBps() { return partySlashBps; }
    public void setPartySlashBps(int partySlashBps) { this.partySlashBps = partySlashBps; }
}
