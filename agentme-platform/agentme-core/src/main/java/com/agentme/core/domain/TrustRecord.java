package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.TemporalException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Transaction history and staked collateral of one agent.
 * Reputation is derived from these counters at read time and never stored.
 *
 * Invariants: successfulTransactions <= totalTransactions,
 * 0 <= pendingWithdrawAmount <= stakedAmount.
 */
@Entity
@Table(name = "trust_records", indexes = {
    @Index(name = "idx_trust_did", columnList = "did", unique = true),
    @Index(name = "idx_trust_staked", columnList = "staked_amount")
})
public class TrustRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(nullable = false, unique = true, length = Agent.MAX_DID_LENGTH)
    private String did;

    @PositiveOrZero
    @Column(name = "total_transactions", nullable = false)
    private long totalTransactions;

    @PositiveOrZero
    @Column(name = "successful_transactions", nullable = false)
    private long successfulTransactions;

    @NotNull
    @PositiveOrZero
    @Column(name = "total_volume", nullable = false, precision = 38, scale = 0)
    private BigInteger totalVolume;

    @PositiveOrZero
    @Column(name = "disputes_lost", nullable = false)
    private long disputesLost;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @NotNull
    @PositiveOrZero
    @Column(name = "staked_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger stakedAmount;

    @NotNull
    @PositiveOrZero
    @Column(name = "pending_withdraw_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger pendingWithdrawAmount;

    @Column(name = "withdraw_requested_at")
    private Instant withdrawRequestedAt;

    @Version
    private Long version;

    protected TrustRecord() {}

    public static TrustRecord open(String did) {
        var record = new TrustRecord();
        record.did = did;
        record.totalVolume = BigInteger.ZERO;
        record.stakedAmount = BigInteger.ZERO;
        record.pendingWithdrawAmount = BigInteger.ZERO;
        return record;
    }

    public void recordTransaction(BigInteger volume, boolean successful, Instant now) {
        if (volume == null || volume.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Volume cannot be negative");
        }
        totalTransactions++;
        if (successful) {
            successfulTransactions++;
        }
        totalVolume = totalVolume.add(volume);
        lastActivityAt = now;
    }

    public void recordDisputeLoss(Instant now) {
        totalTransactions++;
        disputesLost++;
        lastActivityAt = now;
    }

    public void addStake(BigInteger amount) {
        requirePositive(amount);
        stakedAmount = stakedAmount.add(amount);
    }

    /**
     * Starts or restarts the withdrawal cooldown for the given amount.
     */
    public void requestWithdraw(BigInteger amount, Instant now) {
        requirePositive(amount);
        if (amount.compareTo(stakedAmount) > 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_STAKE,
                    "Requested " + amount + " but only " + stakedAmount + " staked");
        }
        pendingWithdrawAmount = amount;
        withdrawRequestedAt = now;
    }

    /**
     * Clears the pending request and debits the stake. Returns the amount to pay out.
     */
    public BigInteger completeWithdraw(Duration cooldown, Instant now) {
        if (pendingWithdrawAmount.signum() == 0 || withdrawRequestedAt == null) {
            throw new InvalidStateException(ErrorCode.NO_WITHDRAWAL_PENDING, "No withdrawal pending for " + did);
        }
        Instant unlock = withdrawRequestedAt.plus(cooldown);
        if (now.isBefore(unlock)) {
            throw new TemporalException(ErrorCode.COOLDOWN_ACTIVE, "Stake withdrawal unlocks at " + unlock);
        }
        BigInteger amount = pendingWithdrawAmount;
        stakedAmount = stakedAmount.subtract(amount);
        pendingWithdrawAmount = BigInteger.ZERO;
        withdrawRequestedAt = null;
        return amount;
    }

    public void slash(BigInteger amount) {
        requirePositive(amount);
        if (amount.compareTo(stakedAmount) > 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_STAKE,
                    "Cannot slash " + amount + " from stake of " + stakedAmount);
        }
        stakedAmount = stakedAmount.subtract(amount);
        if (pendingWithdrawAmount.compareTo(stakedAmount) > 0) {
            pendingWithdrawAmount = stakedAmount;
        }
        if (pendingWithdrawAmount.signum() == 0) {
            withdrawRequestedAt = null;
        }
    }

    public Instant getWithdrawUnlockTime(Duration cooldown) {
        return withdrawRequestedAt == null ? null : withdrawRequestedAt.plus(cooldown);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
    }

    // Getters
    public UUID getId() { return id; }
    public String getDid() { return did; }
    public long getTotalTransactions() { return totalTransactions; }
    public long getSuccessfulTransactions() { return successfulTransactions; }
    public BigInteger getTotalVolume() { return totalVolume; }
    public long getDisputesLost() { return disputesLost; }
    public Instant getLastActivityAt() { return lastActivityAt; }
    public BigInteger getStakedAmount() { return stakedAmount; }
    public BigInteger getPendingWithdrawAmount() { return pendingWithdrawAmount; }
    public Instant getWithdrawRequestedAt() { return withdrawRequestedAt; }
}
