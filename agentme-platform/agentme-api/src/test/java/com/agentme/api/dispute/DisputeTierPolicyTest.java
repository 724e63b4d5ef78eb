package com.agentme.api.dispute;

import com.agentme.api.config.ArbitrationProperties;
import com.agentme.core.domain.Dispute.DisputeTier;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tiering, fees and jury sizing with the default arbitration settings.
 */
class DisputeTierPolicyTest {

    private final DisputeTierPolicy policy = new DisputeTierPolicy(new ArbitrationProperties());

    private static BigInteger usdc(long whole) {
        return BigInteger.valueOf(whole * 1_000_000L);
    }

    @Test
    void tierFor_boundaries() {
        assertEquals(DisputeTier.TIER_1, policy.tierFor(BigInteger.ZERO));
        assertEquals(DisputeTier.TIER_1, policy.tierFor(usdc(10).subtract(BigInteger.ONE)));
        assertEquals(DisputeTier.TIER_2, policy.tierFor(usdc(10)));
        assertEquals(DisputeTier.TIER_2, policy.tierFor(usdc(1_000).subtract(BigInteger.ONE)));
        assertEquals(DisputeTier.TIER_3, policy.tierFor(usdc(1_000)));
    }

    @Test
    void feeFor_clampsAndDoublesPerRound() {
        assertEquals(BigInteger.ZERO, policy.feeFor(usdc(5), DisputeTier.TIER_1, 0));
        assertEquals(usdc(5), policy.feeFor(usdc(100), DisputeTier.TIER_2, 0));
        assertEquals(usdc(30), policy.feeFor(usdc(1_000), DisputeTier.TIER_3, 0));
        assertEquals(usdc(60), policy.feeFor(usdc(1_000), DisputeTier.TIER_3, 1));
        assertEquals(usdc(100), policy.feeFor(usdc(1_000_000), DisputeTier.TIER_3, 0));
        assertEquals(usdc(400), policy.feeFor(usdc(1_000_000), DisputeTier.TIER_3, 2));
    }

    @Test
    void jurorCountFor_growsToCap() {
        assertEquals(0, policy.jurorCountFor(DisputeTier.TIER_1, 0));
        assertEquals(3, policy.jurorCountFor(DisputeTier.TIER_2, 0));
        assertEquals(5, policy.jurorCountFor(DisputeTier.TIER_3, 0));
        assertEquals(5, policy.jurorCountFor(DisputeTier.TIER_3, 3));
        assertEquals(11, policy.jurorCountFor(DisputeTier.TIER_3, 5));
        assertEquals(11, policy.jurorCountFor(DisputeTier.TIER_3, 11));
    }

    @Test
    void requiredJurorStake_doublesPerRound() {
        assertEquals(usdc(100), policy.requiredJurorStake(0));
        assertEquals(usdc(200), policy.requiredJurorStake(1));
        assertEquals(usdc(400), policy.requiredJurorStake(2));
    }

    @Test
    void isFinalRound_afterMaxAppeals() {
        assertFalse(policy.isFinalRound(0));
        assertFalse(policy.isFinalRound(1));
        assertTrue(policy.isFinalRound(2));
    }

    @Test
    void shareHelpers() {
        assertEquals(BigInteger.valueOf(33), DisputeTierPolicy.shareOf(BigInteger.valueOf(100), 3_333));
        assertEquals(4_000, DisputeTierPolicy.shareBpsOf(BigInteger.valueOf(1_200), BigInteger.valueOf(3_000)));
        assertEquals(0, DisputeTierPolicy.shareBpsOf(BigInteger.ZERO, BigInteger.ZERO));
    }

    @Property
    void feeStaysWithinBoundsTimesRoundMultiplier(
            @ForAll @LongRange(min = 10_000_000L, max = Long.MAX_VALUE / 2) long amount,
            @ForAll @IntRange(min = 0, max = 2) int round) {

        BigInteger fee = policy.feeFor(BigInteger.valueOf(amount), DisputeTier.TIER_3, round);

        assertTrue(fee.compareTo(usdc(5).shiftLeft(round)) >= 0);
        assertTrue(fee.compareTo(usdc(100).shiftLeft(round)) <= 0);
    }

    @Property
    void shareOfNeverExceedsWhole(
            @ForAll @LongRange(min = 0, max = Long.MAX_VALUE / 2) long amount,
            @ForAll @IntRange(min = 0, max = 10_000) int shareBps) {

        BigInteger part = DisputeTierPolicy.shareOf(BigInteger.valueOf(amount), shareBps);

        assertTrue(part.signum() >= 0);
        assertTrue(part.compareTo(BigInteger.valueOf(amount)) <= 0);
    }
}
