package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.PrecisionException;
import com.agentme.core.error.TemporalException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Per-second payment stream from a sender agent to a recipient agent.
 * <p>
 * Times are epoch seconds. Accrual is frozen while PAUSED or DISPUTED; after close the
 * checkpoint amount holds the final streamed total.
 *
 * Invariant: withdrawnAmount <= streamedAmount(now) <= depositAmount.
 */
@Entity
@Table(name = "payment_streams", indexes = {
    @Index(name = "idx_stream_sender", columnList = "sender_did"),
    @Index(name = "idx_stream_recipient", columnList = "recipient_did"),
    @Index(name = "idx_stream_status", columnList = "status")
})
public class PaymentStream {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Column(name = "sender_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String senderDid;

    @NotBlank
    @Column(name = "recipient_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String recipientDid;

    @NotBlank
    @Column(name = "sender_address", nullable = false)
    private String senderAddress;

    @NotBlank
    @Column(name = "recipient_address", nullable = false)
    private String recipientAddress;

    @NotBlank
    @Column(nullable = false)
    private String token;

    @NotNull
    @Positive
    @Column(name = "deposit_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger depositAmount;

    @NotNull
    @PositiveOrZero
    @Column(name = "withdrawn_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger withdrawnAmount;

    @Column(name = "start_time", nullable = false)
    private long startTime;

    @Column(name = "end_time", nullable = false)
    private long endTime;

    @NotNull
    @Column(name = "scaled_rate", nullable = false, precision = 60, scale = 0)
    private BigInteger scaledRate;

    @NotNull
    @Column(name = "rate_per_second", nullable = false, precision = 38, scale = 0)
    private BigInteger ratePerSecond;

    @Column(name = "checkpoint_time", nullable = false)
    private long checkpointTime;

    @NotNull
    @Column(name = "streamed_at_checkpoint", nullable = false, precision = 38, scale = 0)
    private BigInteger streamedAtCheckpoint;

    @Column(name = "paused_at")
    private Long pausedAt;

    @Column(name = "total_paused_seconds", nullable = false)
    private long totalPausedSeconds;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private StreamStatus status;

    @Column(name = "cancelable_by_sender", nullable = false)
    private boolean cancelableBySender;

    @Column(name = "cancelable_by_recipient", nullable = false)
    private boolean cancelableByRecipient;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    private Long version;

    protected PaymentStream() {}

    public static PaymentStream create(
            String senderDid,
            String senderAddress,
            String recipientDid,
            String recipientAddress,
            String token,
            BigInteger depositAmount,
            long startTime,
            long endTime,
            boolean cancelableBySender,
            boolean cancelableByRecipient,
            Instant now) {

        if (depositAmount == null || depositAmount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Stream deposit must be positive");
        }
        if (endTime <= startTime) {
            throw new ValidationException(ErrorCode.INVALID_TIME_RANGE, "Stream end must be after start");
        }
        if (startTime < now.getEpochSecond()) {
            throw new ValidationException(ErrorCode.INVALID_TIME_RANGE, "Stream cannot start in the past");
        }
        if (token == null || token.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Token cannot be blank");
        }
        if (senderDid.equals(recipientDid)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Sender and recipient must differ");
        }
        BigInteger rate = StreamAccrual.scaledRate(depositAmount, endTime - startTime);
        if (rate.signum() == 0) {
            throw new PrecisionException("Deposit too small for stream duration");
        }

        var stream = new PaymentStream();
        stream.senderDid = senderDid;
        stream.senderAddress = senderAddress;
        stream.recipientDid = recipientDid;
        stream.recipientAddress = recipientAddress;
        stream.token = token;
        stream.depositAmount = depositAmount;
        stream.withdrawnAmount = BigInteger.ZERO;
        stream.startTime = startTime;
        stream.endTime = endTime;
        stream.scaledRate = rate;
        stream.ratePerSecond = StreamAccrual.displayRate(rate);
        stream.checkpointTime = startTime;
        stream.streamedAtCheckpoint = BigInteger.ZERO;
        stream.totalPausedSeconds = 0;
        stream.status = StreamStatus.ACTIVE;
        stream.cancelableBySender = cancelableBySender;
        stream.cancelableByRecipient = cancelableByRecipient;
        stream.createdAt = now;
        return stream;
    }

    // ==================== Accrual ====================

    public BigInteger streamedAmount(long now) {
        if (status.isClosed()) {
            return streamedAtCheckpoint;
        }
        long t = pausedAt != null ? pausedAt : now;
        return StreamAccrual.streamedAt(depositAmount, streamedAtCheckpoint, checkpointTime, scaledRate, endTime, t);
    }

    public BigInteger withdrawableAmount(long now) {
        return streamedAmount(now).subtract(withdrawnAmount);
    }

    public BigInteger remainingBalance() {
        return depositAmount.subtract(withdrawnAmount);
    }

    public long timeRemaining(long now) {
        if (status.isClosed()) {
            return 0;
        }
        long reference = pausedAt != null ? pausedAt : now;
        return Math.max(0, endTime - Math.max(reference, startTime));
    }

    // ==================== Lifecycle ====================

    public void withdraw(BigInteger amount, Instant now) {
        requireStatus(EnumSet.of(StreamStatus.ACTIVE, StreamStatus.PAUSED), "withdraw from");
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Withdrawal must be positive");
        }
        long t = now.getEpochSecond();
        BigInteger available = withdrawableAmount(t);
        if (amount.compareTo(available) > 0) {
            throw new InsufficientResourceException(ErrorCode.EXCEEDS_WITHDRAWABLE,
                    "Requested " + amount + " but only " + available + " withdrawable");
        }
        withdrawnAmount = withdrawnAmount.add(amount);
        if (withdrawnAmount.equals(depositAmount) && t >= endTime) {
            streamedAtCheckpoint = depositAmount;
            status = StreamStatus.COMPLETED;
            closedAt = now;
        }
    }

    /**
     * Adds funds without an instantaneous jump in the streamed amount: the already-streamed
     * amount is checkpointed, the end time is extended at the current rate and the rate is
     * recomputed over the remaining window.
     */
    public void topUp(BigInteger amount, Instant at) {
        requireStatus(EnumSet.of(StreamStatus.ACTIVE), "top up");
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Top-up must be positive");
        }
        long now = at.getEpochSecond();
        if (now >= endTime) {
            throw new TemporalException(ErrorCode.STREAM_ENDED, "Stream " + id + " has already ended");
        }
        BigInteger streamed = streamedAmount(now);
        long checkpoint = Math.max(now, startTime);
        long newEnd;
        try {
            newEnd = Math.addExact(endTime, StreamAccrual.extensionSeconds(amount, scaledRate));
        } catch (ArithmeticException e) {
            throw new PrecisionException("Top-up extension overflows the stream clock");
        }
        BigInteger newDeposit = depositAmount.add(amount);
        BigInteger newRate = StreamAccrual.scaledRate(newDeposit.subtract(streamed), newEnd - checkpoint);
        if (newRate.signum() == 0) {
            throw new PrecisionException("Top-up would reduce the stream rate to zero");
        }

        streamedAtCheckpoint = streamed;
        checkpointTime = checkpoint;
        endTime = newEnd;
        depositAmount = newDeposit;
        scaledRate = newRate;
        ratePerSecond = StreamAccrual.displayRate(newRate);
    }

    public void pause(Instant at) {
        requireStatus(EnumSet.of(StreamStatus.ACTIVE), "pause");
        long now = at.getEpochSecond();
        if (now >= endTime) {
            throw new TemporalException(ErrorCode.STREAM_ENDED, "Stream " + id + " has already ended");
        }
        pausedAt = now;
        status = StreamStatus.PAUSED;
    }

    /**
     * Shifts the accrual window forward by the time accrual was actually frozen.
     */
    public long resume(Instant at) {
        requireStatus(EnumSet.of(StreamStatus.PAUSED), "resume");
        long now = at.getEpochSecond();
        long shift = Math.max(0, now - Math.max(pausedAt, checkpointTime));
        checkpointTime += shift;
        endTime += shift;
        totalPausedSeconds += shift;
        pausedAt = null;
        status = StreamStatus.ACTIVE;
        return shift;
    }

    public CancellationSplit cancel(Instant now) {
        requireStatus(EnumSet.of(StreamStatus.ACTIVE, StreamStatus.PAUSED), "cancel");
        CancellationSplit split = previewCancellation(now.getEpochSecond());
        BigInteger streamed = split.recipientAmount().add(withdrawnAmount);
        withdrawnAmount = streamed;
        streamedAtCheckpoint = streamed;
        pausedAt = null;
        status = StreamStatus.CANCELED;
        closedAt = now;
        return split;
    }

    /**
     * What a cancellation at {@code now} would pay each side.
     */
    public CancellationSplit previewCancellation(long now) {
        BigInteger streamed = streamedAmount(now);
        return new CancellationSplit(streamed.subtract(withdrawnAmount), depositAmount.subtract(streamed));
    }

    public boolean canBeCanceledBy(String principal) {
        return (cancelableBySender && senderAddress.equals(principal))
                || (cancelableByRecipient && recipientAddress.equals(principal));
    }

    // ==================== Dispute ====================

    public void freezeForDispute(Instant now) {
        requireStatus(EnumSet.of(StreamStatus.ACTIVE, StreamStatus.PAUSED), "dispute");
        if (pausedAt == null) {
            pausedAt = now.getEpochSecond();
        }
        status = StreamStatus.DISPUTED;
    }

    /**
     * Splits the unwithdrawn balance; returns the sender's refund.
     */
    public BigInteger settleDispute(BigInteger recipientAmount, Instant now) {
        requireStatus(EnumSet.of(StreamStatus.DISPUTED), "settle");
        BigInteger pot = remainingBalance();
        if (recipientAmount == null || recipientAmount.signum() < 0 || recipientAmount.compareTo(pot) > 0) {
            throw new ValidationException(ErrorCode.INVALID_SHARE,
                    "Recipient amount must be between 0 and " + pot);
        }
        withdrawnAmount = withdrawnAmount.add(recipientAmount);
        streamedAtCheckpoint = withdrawnAmount;
        pausedAt = null;
        status = StreamStatus.CANCELED;
        closedAt = now;
        return pot.subtract(recipientAmount);
    }

    public boolean isParty(String principal) {
        return senderAddress.equals(principal) || recipientAddress.equals(principal);
    }

    private void requireStatus(Set<StreamStatus> allowed, String action) {
        if (!allowed.contains(status)) {
            throw new InvalidStateException("Cannot " + action + " stream " + id + " in status " + status);
        }
    }

    // Getters
    public UUID getId() { return id; }
    public String getSenderDid() { return senderDid; }
    public String getRecipientDid() { return recipientDid; }
    public String getSenderAddress() { return senderAddress; }
    public String getRecipientAddress() { return recipientAddress; }
    public String getToken() { return token; }
    public BigInteger getDepositAmount() { return depositAmount; }
    public BigInteger getWithdrawnAmount() { return withdrawnAmount; }
    public long getStartTime() { return startTime; }
    public long getEndTime() { return endTime; }
    public BigInteger getScaledRate() { return scaledRate; }
    public BigInteger getRatePerSecond() { return ratePerSecond; }
    public long getCheckpointTime() { return checkpointTime; }
    public BigInteger getStreamedAtCheckpoint() { return streamedAtCheckpoint; }
    public Long getPausedAt() { return pausedAt; }
    public long getTotalPausedSeconds() { return totalPausedSeconds; }
    public StreamStatus getStatus() { return status; }
    public boolean isCancelableBySender() { return cancelableBySender; }
    public boolean isCancelableByRecipient() { return cancelableByRecipient; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getClosedAt() { return closedAt; }

    public record CancellationSplit(BigInteger recipientAmount, BigInteger senderRefund) {}

    public enum StreamStatus {
        ACTIVE, PAUSED, DISPUTED, CANCELED, COMPLETED;

        public boolean isClosed() {
            return this == CANCELED || this == COMPLETED;
        }
    }
}
