package com.agentme.core.domain;

import com.agentme.core.domain.PaymentStream.CancellationSplit;
import com.agentme.core.domain.PaymentStream.StreamStatus;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.PrecisionException;
import com.agentme.core.error.TemporalException;
import com.agentme.core.error.ValidationException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Lifecycle tests for PaymentStream: withdrawal bounds, top-up continuity, pause and resume,
 * cancellation and dispute freezing.
 */
class PaymentStreamTest {

    private static final long T0 = 1_767_571_200L;

    private static Instant at(long offset) {
        return Instant.ofEpochSecond(T0 + offset);
    }

    private static PaymentStream stream(long deposit, long duration) {
        return PaymentStream.create("did:agentme:alice", "0xalice", "did:agentme:bob", "0xbob", "USDC",
                BigInteger.valueOf(deposit), T0, T0 + duration, true, true, at(0));
    }

    // ==================== Creation ====================

    @Test
    void create_rejectsInvalidInputs() {
        ValidationException zero = assertThrows(ValidationException.class, () -> stream(0, 3600));
        assertEquals(ErrorCode.INVALID_AMOUNT, zero.getCode());

        ValidationException range = assertThrows(ValidationException.class, () ->
                PaymentStream.create("did:agentme:alice", "0xalice", "did:agentme:bob", "0xbob", "USDC",
                        BigInteger.TEN, T0 + 10, T0 + 10, true, true, at(0)));
        assertEquals(ErrorCode.INVALID_TIME_RANGE, range.getCode());

        ValidationException past = assertThrows(ValidationException.class, () ->
                PaymentStream.create("did:agentme:alice", "0xalice", "did:agentme:bob", "0xbob", "USDC",
                        BigInteger.TEN, T0 - 1, T0 + 10, true, true, at(0)));
        assertEquals(ErrorCode.INVALID_TIME_RANGE, past.getCode());

        ValidationException self = assertThrows(ValidationException.class, () ->
                PaymentStream.create("did:agentme:alice", "0xalice", "did:agentme:alice", "0xalice", "USDC",
                        BigInteger.TEN, T0, T0 + 10, true, true, at(0)));
        assertEquals(ErrorCode.INVALID_IDENTIFIER, self.getCode());
    }

    @Test
    void create_keepsSubUnitRateScaled() {
        PaymentStream stream = stream(1, 365L * 24 * 3600);

        assertThat(stream.getRatePerSecond()).isZero();
        assertThat(stream.getScaledRate()).isPositive();
        assertThat(stream.streamedAmount(T0 + 365L * 24 * 3600)).isEqualTo(BigInteger.ONE);
    }

    // ==================== Withdrawal ====================

    @Test
    void withdraw_boundedByStreamedAmount() {
        PaymentStream stream = stream(3600, 3600);

        stream.withdraw(BigInteger.valueOf(600), at(600));

        assertThat(stream.getWithdrawnAmount()).isEqualTo(BigInteger.valueOf(600));
        assertThat(stream.withdrawableAmount(T0 + 600)).isZero();
        InsufficientResourceException e = assertThrows(InsufficientResourceException.class,
                () -> stream.withdraw(BigInteger.ONE, at(600)));
        assertEquals(ErrorCode.EXCEEDS_WITHDRAWABLE, e.getCode());
    }

    @Test
    void withdraw_fullDepositAfterEndCompletesStream() {
        PaymentStream stream = stream(3600, 3600);

        stream.withdraw(BigInteger.valueOf(3600), at(4000));

        assertEquals(StreamStatus.COMPLETED, stream.getStatus());
        assertThat(stream.remainingBalance()).isZero();
        assertThrows(InvalidStateException.class, () -> stream.withdraw(BigInteger.ONE, at(4001)));
    }

    @Property(tries = 100)
    void withdrawnNeverExceedsStreamed(
            @ForAll @LongRange(min = 1, max = 1_000_000_000L) long deposit,
            @ForAll @LongRange(min = 60, max = 86_400) long duration,
            @ForAll @LongRange(min = 0, max = 100_000) long elapsed) {

        PaymentStream stream = stream(deposit, duration);
        long now = T0 + elapsed;
        BigInteger available = stream.withdrawableAmount(now);
        if (available.signum() > 0) {
            stream.withdraw(available, Instant.ofEpochSecond(now));
        }

        assert stream.getWithdrawnAmount().compareTo(stream.streamedAmount(now)) <= 0;
        assert stream.streamedAmount(now).compareTo(stream.getDepositAmount()) <= 0;
    }

    // ==================== Top-up ====================

    @Test
    void topUp_noJumpInStreamedAmount() {
        PaymentStream stream = stream(3600, 3600);
        BigInteger before = stream.streamedAmount(T0 + 1800);

        stream.topUp(BigInteger.valueOf(3600), at(1800));

        assertThat(stream.streamedAmount(T0 + 1800)).isEqualTo(before);
        assertThat(stream.getEndTime()).isEqualTo(T0 + 7200);
        assertThat(stream.getDepositAmount()).isEqualTo(BigInteger.valueOf(7200));
        assertThat(stream.streamedAmount(T0 + 2400)).isEqualTo(BigInteger.valueOf(2400));
        assertThat(stream.streamedAmount(T0 + 7200)).isEqualTo(BigInteger.valueOf(7200));
    }

    @Property(tries = 100)
    void topUp_isContinuous(
            @ForAll @LongRange(min = 1_000, max = 1_000_000_000L) long deposit,
            @ForAll @LongRange(min = 100, max = 86_400) long duration,
            @ForAll @DoubleRange(min = 0.0, max = 0.99) double fraction,
            @ForAll @LongRange(min = 1_000, max = 1_000_000_000L) long extra) {

        PaymentStream stream = stream(deposit, duration);
        long now = T0 + (long) (fraction * duration);
        BigInteger before = stream.streamedAmount(now);
        try {
            stream.topUp(BigInteger.valueOf(extra), Instant.ofEpochSecond(now));
        } catch (PrecisionException e) {
            return;
        }

        assert stream.streamedAmount(now).equals(before) : "Top-up changed the streamed amount";
        assert stream.streamedAmount(stream.getEndTime()).equals(stream.getDepositAmount());
    }

    @Test
    void topUp_afterEndRejected() {
        PaymentStream stream = stream(3600, 3600);

        TemporalException e = assertThrows(TemporalException.class,
                () -> stream.topUp(BigInteger.TEN, at(3600)));
        assertEquals(ErrorCode.STREAM_ENDED, e.getCode());
    }

    @Test
    void topUp_pastTheClockRejectedWithoutChange() {
        PaymentStream stream = stream(1, 3600);
        // extension fits in a long, the new end time does not
        BigInteger amount = BigInteger.valueOf(2_562_047_787_737_437L);

        assertThrows(PrecisionException.class, () -> stream.topUp(amount, at(0)));
        assertEquals(T0 + 3600, stream.getEndTime());
        assertEquals(BigInteger.ONE, stream.getDepositAmount());
    }

    // ==================== Pause / resume ====================

    @Test
    void pauseFreezesAccrualAndResumeShiftsWindow() {
        PaymentStream stream = stream(3600, 3600);

        stream.pause(at(1000));
        assertThat(stream.streamedAmount(T0 + 2000)).isEqualTo(BigInteger.valueOf(1000));

        long shift = stream.resume(at(1500));

        assertThat(shift).isEqualTo(500);
        assertThat(stream.getEndTime()).isEqualTo(T0 + 4100);
        assertThat(stream.getTotalPausedSeconds()).isEqualTo(500);
        assertThat(stream.streamedAmount(T0 + 1500)).isEqualTo(BigInteger.valueOf(1000));
        assertThat(stream.streamedAmount(T0 + 4100)).isEqualTo(BigInteger.valueOf(3600));
    }

    @Test
    void pause_requiresActive() {
        PaymentStream stream = stream(3600, 3600);
        stream.pause(at(10));

        assertThrows(InvalidStateException.class, () -> stream.pause(at(20)));
        assertThrows(InvalidStateException.class, () -> stream.topUp(BigInteger.TEN, at(20)));
    }

    // ==================== Cancel ====================

    @Test
    void cancel_splitsStreamedAndUnstreamed() {
        PaymentStream stream = stream(3600, 3600);
        stream.withdraw(BigInteger.valueOf(500), at(900));

        CancellationSplit split = stream.cancel(at(1200));

        assertThat(split.recipientAmount()).isEqualTo(BigInteger.valueOf(700));
        assertThat(split.senderRefund()).isEqualTo(BigInteger.valueOf(2400));
        assertEquals(StreamStatus.CANCELED, stream.getStatus());
        assertThat(stream.streamedAmount(T0 + 3600)).isEqualTo(BigInteger.valueOf(1200));
    }

    @Test
    void canBeCanceledBy_respectsFlags() {
        PaymentStream stream = PaymentStream.create("did:agentme:alice", "0xalice", "did:agentme:bob", "0xbob", "USDC",
                BigInteger.valueOf(100), T0, T0 + 100, true, false, at(0));

        assertTrue(stream.canBeCanceledBy("0xalice"));
        assertFalse(stream.canBeCanceledBy("0xbob"));
        assertFalse(stream.canBeCanceledBy("0xmallory"));
    }

    // ==================== Dispute ====================

    @Test
    void disputeFreezesAndSettlesRemainingBalance() {
        PaymentStream stream = stream(3600, 3600);
        stream.withdraw(BigInteger.valueOf(600), at(600));

        stream.freezeForDispute(at(1200));
        assertThat(stream.streamedAmount(T0 + 3000)).isEqualTo(BigInteger.valueOf(1200));
        assertThrows(InvalidStateException.class, () -> stream.withdraw(BigInteger.ONE, at(1300)));

        BigInteger refund = stream.settleDispute(BigInteger.valueOf(1000), at(2000));

        assertThat(refund).isEqualTo(BigInteger.valueOf(2000));
        assertThat(stream.getWithdrawnAmount()).isEqualTo(BigInteger.valueOf(1600));
        assertEquals(StreamStatus.CANCELED, stream.getStatus());
    }

    @Test
    void settleDispute_rejectsAmountAboveRemaining() {
        PaymentStream stream = stream(3600, 3600);
        stream.freezeForDispute(at(100));

        ValidationException e = assertThrows(ValidationException.class,
                () -> stream.settleDispute(BigInteger.valueOf(3601), at(200)));
        assertEquals(ErrorCode.INVALID_SHARE, e.getCode());
    }
}
