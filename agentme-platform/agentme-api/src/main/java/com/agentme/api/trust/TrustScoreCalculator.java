package com.agentme.api.trust;

import com.agentme.api.config.TrustProperties;
import com.agentme.core.domain.TrustRecord;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Composite trust score on a 0..10000 scale:
 * <pre>
 *   score = wR * reputation + wS * stakeFactor + wE * endorsementFactor
 * </pre>
 * with weights in basis points summing to 10000 and every factor in [0, 1].
 */
@Component
public class TrustScoreCalculator {

    public static final int MAX_SCORE = 10_000;

    private final TrustProperties properties;

    public TrustScoreCalculator(TrustProperties properties) {
        int weights = properties.getReputationWeightBps()
                + properties.getStakeWeightBps()
                + properties.getEndorsementWeightBps();
        if (weights != MAX_SCORE) {
            throw new IllegalArgumentException("Trust weights must sum to 10000 bps, got " + weights);
        }
        this.properties = properties;
    }

    public double reputation(TrustRecord record, Instant now) {
        return reputation(
                record.getTotalTransactions(),
                record.getSuccessfulTransactions(),
                record.getTotalVolume(),
                record.getDisputesLost(),
                record.getLastActivityAt(),
                now);
    }

    /**
     * successRate x volume weighting x recency decay x dispute penalty, clamped to [0, 1].
     * Zero for an agent with no transactions.
     */
    public double reputation(
            long totalTransactions,
            long successfulTransactions,
            BigInteger totalVolume,
            long disputesLost,
            Instant lastActivityAt,
            Instant now) {

        if (totalTransactions <= 0) {
            return 0.0;
        }
        double successRate = (double) successfulTransactions / totalTransactions;
        double volumeFactor = volumeFactor(totalVolume);
        double base = successRate * (0.5 + 0.5 * volumeFactor);
        double penalty = Math.max(0.0, 1.0 - properties.getDisputePenalty() * disputesLost);
        return clamp(base * recency(lastActivityAt, now) * penalty);
    }

    /**
     * Logarithmic in volume, reaching 1 at the reference volume.
     */
    double volumeFactor(BigInteger totalVolume) {
        if (totalVolume == null || totalVolume.signum() <= 0) {
            return 0.0;
        }
        double factor = Math.log10(1.0 + totalVolume.doubleValue())
                / Math.log10(1.0 + properties.getReferenceVolume());
        return Math.min(1.0, factor);
    }

    /**
     * Compounds once per full decay period elapsed since the last activity.
     */
    double recency(Instant lastActivityAt, Instant now) {
        if (lastActivityAt == null || !now.isAfter(lastActivityAt)) {
            return 1.0;
        }
        long periods = Duration.between(lastActivityAt, now).getSeconds()
                / properties.getDecayPeriod().getSeconds();
        return Math.max(0.0, Math.pow(1.0 - properties.getDecayRate(), periods));
    }

    public double stakeFactor(BigInteger stakedAmount) {
        if (stakedAmount == null || stakedAmount.signum() <= 0) {
            return 0.0;
        }
        double ratio = stakedAmount.doubleValue() / properties.getReferenceStake();
        return Math.min(1.0, Math.sqrt(ratio));
    }

    public int composite(double reputation, double stakeFactor, double endorsementFactor) {
        double score = properties.getReputationWeightBps() * clamp(reputation)
                + properties.getStakeWeightBps() * clamp(stakeFactor)
                + properties.getEndorsementWeightBps() * clamp(endorsementFactor);
        return (int) Math.max(0, Math.min(MAX_SCORE, Math.round(score)));
    }

    public static int toBps(double factor) {
        return (int) Math.round(clamp(factor) * MAX_SCORE);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
