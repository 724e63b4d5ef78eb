package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Lump-sum escrow between a client and a provider agent.
 *
 * AWAITING_DEPOSIT -> FUNDED -> DELIVERED -> RELEASED
 * FUNDED -> REFUNDED (timeout)
 * {FUNDED, DELIVERED} -> DISPUTED -> {RELEASED, REFUNDED}
 */
@Entity
@Table(name = "escrows", indexes = {
    @Index(name = "idx_escrow_client", columnList = "client_did"),
    @Index(name = "idx_escrow_provider", columnList = "provider_did"),
    @Index(name = "idx_escrow_state", columnList = "state")
})
public class Escrow {

    public static final String ZERO_HASH = "0x" + "0".repeat(64);

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Column(name = "client_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String clientDid;

    @NotBlank
    @Column(name = "provider_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String providerDid;

    @NotBlank
    @Column(name = "client_address", nullable = false)
    private String clientAddress;

    @NotBlank
    @Column(name = "provider_address", nullable = false)
    private String providerAddress;

    @NotBlank
    @Column(nullable = false)
    private String token;

    @NotNull
    @Positive
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger amount;

    @NotBlank
    @Column(name = "task_hash", nullable = false)
    private String taskHash;

    @NotBlank
    @Column(name = "output_hash", nullable = false)
    private String outputHash;

    @NotNull
    @Column(nullable = false)
    private Instant deadline;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EscrowState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "state_before_dispute", length = 32)
    private EscrowState stateBeforeDispute;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "funded_at")
    private Instant fundedAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "closed_at")
    private Instant closedAt;

    @Version
    private Long version;

    protected Escrow() {}

    public static Escrow create(
            String clientDid,
            String clientAddress,
            String providerDid,
            String providerAddress,
            String token,
            BigInteger amount,
            String taskHash,
            Instant deadline,
            Instant now) {

        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Escrow amount must be positive");
        }
        if (deadline == null || !deadline.isAfter(now)) {
            throw new ValidationException(ErrorCode.INVALID_DEADLINE, "Escrow deadline must be in the future");
        }
        if (token == null || token.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Token cannot be blank");
        }
        if (taskHash == null || taskHash.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Task hash cannot be blank");
        }
        if (clientDid.equals(providerDid)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Client and provider must differ");
        }

        var escrow = new Escrow();
        escrow.clientDid = clientDid;
        escrow.clientAddress = clientAddress;
        escrow.providerDid = providerDid;
        escrow.providerAddress = providerAddress;
        escrow.token = token;
        escrow.amount = amount;
        escrow.taskHash = taskHash;
        escrow.outputHash = ZERO_HASH;
        escrow.deadline = deadline;
        escrow.state = EscrowState.AWAITING_DEPOSIT;
        escrow.createdAt = now;
        return escrow;
    }

    public void markFunded(Instant now) {
        requireState(EnumSet.of(EscrowState.AWAITING_DEPOSIT), "fund");
        this.state = EscrowState.FUNDED;
        this.fundedAt = now;
    }

    public void markDelivered(String outputHash, Instant now) {
        requireState(EnumSet.of(EscrowState.FUNDED), "confirm delivery");
        if (outputHash == null || outputHash.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Output hash cannot be blank");
        }
        this.outputHash = outputHash;
        this.deliveredAt = now;
        this.state = EscrowState.DELIVERED;
    }

    public void markReleased(Instant now) {
        requireState(EnumSet.of(EscrowState.FUNDED, EscrowState.DELIVERED), "release");
        close(EscrowState.RELEASED, now);
    }

    public void markRefunded(Instant now) {
        requireState(EnumSet.of(EscrowState.FUNDED), "refund");
        close(EscrowState.REFUNDED, now);
    }

    public void markDisputed() {
        requireState(EnumSet.of(EscrowState.FUNDED, EscrowState.DELIVERED), "dispute");
        this.stateBeforeDispute = state;
        this.state = EscrowState.DISPUTED;
    }

    /**
     * Closes a disputed escrow. RELEASED if the provider receives anything, REFUNDED otherwise.
     */
    public void settleDispute(BigInteger providerAmount, Instant now) {
        requireState(EnumSet.of(EscrowState.DISPUTED), "settle");
        if (providerAmount == null || providerAmount.signum() < 0 || providerAmount.compareTo(amount) > 0) {
            throw new ValidationException(ErrorCode.INVALID_SHARE,
                    "Provider amount must be between 0 and " + amount);
        }
        close(providerAmount.signum() > 0 ? EscrowState.RELEASED : EscrowState.REFUNDED, now);
    }

    /**
     * True from the deadline instant on. Funding is open strictly before the deadline, so every
     * instant is either fundable or timed out.
     */
    public boolean isDeadlinePassed(Instant now) {
        return !now.isBefore(deadline);
    }

    public boolean isParty(String principal) {
        return clientAddress.equals(principal) || providerAddress.equals(principal);
    }

    private void close(EscrowState terminal, Instant now) {
        this.state = terminal;
        this.closedAt = now;
    }

    private void requireState(Set<EscrowState> allowed, String action) {
        if (!allowed.contains(state)) {
            throw new InvalidStateException("Cannot " + action + " escrow " + id + " in state " + state);
        }
    }

    // Getters
    public UUID getId() { return id; }
    public String getClientDid() { return clientDid; }
    public String getProviderDid() { return providerDid; }
    public String getClientAddress() { return clientAddress; }
    public String getProviderAddress() { return providerAddress; }
    public String getToken() { return token; }
    public BigInteger getAmount() { return amount; }
    public String getTaskHash() { return taskHash; }
    public String getOutputHash() { return outputHash; }
    public Instant getDeadline() { return deadline; }
    public EscrowState getState() { return state; }
    public EscrowState getStateBeforeDispute() { return stateBeforeDispute; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getFundedAt() { return fundedAt; }
    public Instant getDeliveredAt() { return deliveredAt; }
    public Instant getClosedAt() { return closedAt; }

    public enum EscrowState {
        AWAITING_DEPOSIT, FUNDED, DELIVERED, DISPUTED, RELEASED, REFUNDED;

        public boolean isTerminal() {
            return this == RELEASED || this == REFUNDED;
        }
    }
}
