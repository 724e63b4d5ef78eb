package com.agentme.core.domain;

import java.math.BigInteger;

/**
 * Fixed-point accrual arithmetic for payment streams.
 * <p>
 * Rates are kept scaled by 10^18 so that small deposits over long durations do not truncate to
 * a zero per-second rate. The streamed amount is piecewise linear from a checkpoint:
 * <pre>
 *   streamed(t) = checkpointAmount + scaledRate * (t - checkpointTime) / 10^18
 * </pre>
 * clamped to the deposit, and exactly the deposit at or after the end time.
 */
public final class StreamAccrual {

    public static final BigInteger SCALE = BigInteger.TEN.pow(18);

    private StreamAccrual() {}

    public static BigInteger scaledRate(BigInteger amount, long durationSeconds) {
        if (durationSeconds <= 0) {
            throw new IllegalArgumentException("Duration must be positive");
        }
        return amount.multiply(SCALE).divide(BigInteger.valueOf(durationSeconds));
    }

    /**
     * Amount streamed at time {@code t}, never exceeding {@code deposit}.
     */
    public static BigInteger streamedAt(
            BigInteger deposit,
            BigInteger checkpointAmount,
            long checkpointTime,
            BigInteger scaledRate,
            long endTime,
            long t) {

        if (t >= endTime) {
            return deposit;
        }
        if (t <= checkpointTime) {
            return checkpointAmount;
        }
        BigInteger accrued = scaledRate.multiply(BigInteger.valueOf(t - checkpointTime)).divide(SCALE);
        return checkpointAmount.add(accrued).min(deposit);
    }

    /**
     * Seconds of extension bought by {@code amount} at the given scaled rate.
     */
    public static long extensionSeconds(BigInteger amount, BigInteger scaledRate) {
        return amount.multiply(SCALE).divide(scaledRate).longValueExact();
    }

    /**
     * Integer per-second rate for display; may be zero for tiny deposits.
     */
    public static BigInteger displayRate(BigInteger scaledRate) {
        return scaledRate.divide(SCALE);
    }
}
