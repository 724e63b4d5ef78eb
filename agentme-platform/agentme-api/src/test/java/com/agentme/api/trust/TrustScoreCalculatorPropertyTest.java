package com.agentme.api.trust;

import com.agentme.api.config.TrustProperties;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Property-based tests for the composite trust score.
 * <p>
 * Every factor stays in [0, 1] and the composite in [0, 10000] for any transaction history,
 * stake and endorsement input.
 */
class TrustScoreCalculatorPropertyTest {

    private static final Instant NOW = Instant.parse("2026-01-05T00:00:00Z");

    private final TrustScoreCalculator calculator = new TrustScoreCalculator(new TrustProperties());

    @Property(tries = 200)
    void reputation_staysWithinUnitInterval(
            @ForAll @LongRange(min = 0, max = 10_000) long total,
            @ForAll @LongRange(min = 0, max = 10_000) long successful,
            @ForAll @BigRange(min = "0", max = "1000000000000000") BigInteger volume,
            @ForAll @LongRange(min = 0, max = 50) long disputesLost,
            @ForAll @LongRange(min = 0, max = 3_650) long idleDays) {

        Assume.that(successful <= total);
        double reputation = calculator.reputation(
                total, successful, volume, disputesLost, NOW.minus(Duration.ofDays(idleDays)), NOW);

        assert reputation >= 0.0 && reputation <= 1.0 : "Reputation out of range: " + reputation;
    }

    @Property(tries = 200)
    void composite_staysWithinScale(
            @ForAll @DoubleRange(min = -1.0, max = 2.0) double reputation,
            @ForAll @DoubleRange(min = -1.0, max = 2.0) double stake,
            @ForAll @DoubleRange(min = -1.0, max = 2.0) double endorsement) {

        int score = calculator.composite(reputation, stake, endorsement);

        assert score >= 0 && score <= TrustScoreCalculator.MAX_SCORE : "Score out of range: " + score;
    }

    @Property(tries = 100)
    void stakeFactor_isMonotonicAndCapped(
            @ForAll @LongRange(min = 0, max = 100_000_000_000L) long smaller,
            @ForAll @LongRange(min = 0, max = 100_000_000_000L) long delta) {

        double low = calculator.stakeFactor(BigInteger.valueOf(smaller));
        double high = calculator.stakeFactor(BigInteger.valueOf(smaller).add(BigInteger.valueOf(delta)));

        assert low <= high;
        assert high <= 1.0;
    }

    @Property(tries = 100)
    void moreFailures_neverRaiseReputation(
            @ForAll @LongRange(min = 1, max = 1_000) long successful,
            @ForAll @LongRange(min = 0, max = 1_000) long failures) {

        double clean = calculator.reputation(successful, successful, BigInteger.ZERO, 0, NOW, NOW);
        double failing = calculator.reputation(successful + failures, successful, BigInteger.ZERO, 0, NOW, NOW);

        assert failing <= clean;
    }

    @Test
    void noHistory_hasZeroReputation() {
        assertEquals(0.0, calculator.reputation(0, 0, BigInteger.ZERO, 0, null, NOW));
    }

    @Test
    void referenceStake_givesFullStakeFactor() {
        assertEquals(1.0, calculator.stakeFactor(BigInteger.valueOf(10_000_000_000L)));
        assertEquals(0.5, calculator.stakeFactor(BigInteger.valueOf(2_500_000_000L)), 1e-12);
    }

    @Test
    void recency_compoundsPerFullPeriod() {
        Instant last = NOW.minus(Duration.ofDays(28));

        assertThat(calculator.recency(last, NOW)).isCloseTo(0.9025, within(1e-12));
        assertThat(calculator.recency(NOW.minus(Duration.ofDays(13)), NOW)).isEqualTo(1.0);
    }

    @Test
    void weightsMustSumToFullScale() {
        TrustProperties properties = new TrustProperties();
        properties.setEndorsementWeightBps(1_000);

        assertThrows(IllegalArgumentException.class, () -> new TrustScoreCalculator(properties));
    }
}
