package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.TemporalException;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TrustRecordTest {

    private static final Instant NOW = Instant.parse("2026-01-05T00:00:00Z");
    private static final Duration COOLDOWN = Duration.ofDays(7);

    @Test
    void withdraw_honoursCooldown() {
        TrustRecord record = TrustRecord.open("did:agentme:alice");
        record.addStake(BigInteger.valueOf(1_000));
        record.requestWithdraw(BigInteger.valueOf(400), NOW);

        TemporalException early = assertThrows(TemporalException.class,
                () -> record.completeWithdraw(COOLDOWN, NOW.plus(COOLDOWN).minusSeconds(1)));
        assertEquals(ErrorCode.COOLDOWN_ACTIVE, early.getCode());

        BigInteger paid = record.completeWithdraw(COOLDOWN, NOW.plus(COOLDOWN));

        assertThat(paid).isEqualTo(BigInteger.valueOf(400));
        assertThat(record.getStakedAmount()).isEqualTo(BigInteger.valueOf(600));
        assertThat(record.getPendingWithdrawAmount()).isZero();
        assertThat(record.getWithdrawRequestedAt()).isNull();
    }

    @Test
    void withdraw_withoutRequestRejected() {
        TrustRecord record = TrustRecord.open("did:agentme:alice");

        InvalidStateException e = assertThrows(InvalidStateException.class, () -> record.completeWithdraw(COOLDOWN, NOW));
        assertEquals(ErrorCode.NO_WITHDRAWAL_PENDING, e.getCode());
    }

    @Test
    void requestWithdraw_aboveStakeRejected() {
        TrustRecord record = TrustRecord.open("did:agentme:alice");
        record.addStake(BigInteger.TEN);

        InsufficientResourceException e = assertThrows(InsufficientResourceException.class,
                () -> record.requestWithdraw(BigInteger.valueOf(11), NOW));
        assertEquals(ErrorCode.INSUFFICIENT_STAKE, e.getCode());
    }

    @Test
    void slash_clampsPendingWithdrawal() {
        TrustRecord record = TrustRecord.open("did:agentme:alice");
        record.addStake(BigInteger.valueOf(1_000));
        record.requestWithdraw(BigInteger.valueOf(900), NOW);

        record.slash(BigInteger.valueOf(500));

        assertThat(record.getStakedAmount()).isEqualTo(BigInteger.valueOf(500));
        assertThat(record.getPendingWithdrawAmount()).isEqualTo(BigInteger.valueOf(500));
    }

    @Test
    void disputeLoss_countsAsFailedTransaction() {
        TrustRecord record = TrustRecord.open("did:agentme:alice");
        record.recordTransaction(BigInteger.valueOf(50), true, NOW);

        record.recordDisputeLoss(NOW.plusSeconds(1));

        assertThat(record.getTotalTransactions()).isEqualTo(2);
        assertThat(record.getSuccessfulTransactions()).isEqualTo(1);
        assertThat(record.getDisputesLost()).isEqualTo(1);
        assertThat(record.getLastActivityAt()).isEqualTo(NOW.plusSeconds(1));
    }

    @Property(tries = 100)
    void successfulNeverExceedsTotal(@ForAll @Size(max = 50) List<Boolean> outcomes) {
        TrustRecord record = TrustRecord.open("did:agentme:alice");
        for (boolean successful : outcomes) {
            record.recordTransaction(BigInteger.ONE, successful, NOW);
        }

        assert record.getSuccessfulTransactions() <= record.getTotalTransactions();
        assert record.getTotalTransactions() == outcomes.size();
    }
}
