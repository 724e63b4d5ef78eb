package com.agentme.api.dispute;

import com.agentme.api.config.ArbitrationProperties;
import com.agentme.core.domain.Dispute.DisputeTier;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Value-based tiering, fee schedule and juror-pool sizing for disputes.
 */
@Component
public class DisputeTierPolicy {

    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final ArbitrationProperties properties;

    public DisputeTierPolicy(ArbitrationProperties properties) {
        this.properties = properties;
    }

    public DisputeTier tierFor(BigInteger disputedAmount) {
        if (disputedAmount.compareTo(BigInteger.valueOf(properties.getTier1Ceiling())) < 0) {
            return DisputeTier.TIER_1;
        }
        if (disputedAmount.compareTo(BigInteger.valueOf(properties.getTier2Ceiling())) < 0) {
            return DisputeTier.TIER_2;
        }
        return DisputeTier.TIER_3;
    }

    /**
     * Fee for a round: a percentage of the disputed value clamped to the configured bounds,
     * doubling with each appeal round. Tier 1 is free.
     */
    public BigInteger feeFor(BigInteger disputedAmount, DisputeTier tier, int round) {
        if (tier == DisputeTier.TIER_1) {
            return BigInteger.ZERO;
        }
        BigInteger fee = disputedAmount.multiply(BigInteger.valueOf(properties.getFeeBps())).divide(BPS);
        fee = fee.max(BigInteger.valueOf(properties.getMinFee())).min(BigInteger.valueOf(properties.getMaxFee()));
        return fee.shiftLeft(round);
    }

    /**
     * Jurors for the next round given the previous round's pool size.
     * Tier 3 starts at its minimum and then grows 2n+1 up to the cap.
     */
    public int jurorCountFor(DisputeTier tier, int previousCount) {
        return switch (tier) {
            case TIER_1 -> 0;
            case TIER_2 -> properties.getTier2Jurors();
            case TIER_3 -> previousCount < properties.getTier3MinJurors()
                    ? properties.getTier3MinJurors()
                    : Math.min(properties.getMaxJurors(), 2 * previousCount + 1);
        };
    }

    public BigInteger requiredJurorStake(int round) {
        return BigInteger.valueOf(properties.getMinJurorStake()).shiftLeft(round);
    }

    public boolean isFinalRound(int round) {
        return round >= properties.getMaxAppealRounds();
    }

    public static BigInteger shareOf(BigInteger amount, int shareBps) {
        return amount.multiply(BigInteger.valueOf(shareBps)).divide(BPS);
    }

    public static int shareBpsOf(BigInteger part, BigInteger whole) {
        if (whole.signum() == 0) {
            return 0;
        }
        return part.multiply(BPS).divide(whole).intValueExact();
    }
}
