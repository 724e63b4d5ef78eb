package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * A dispute over an escrow or a payment stream.
 * <p>
 * Holds only a foreign key to its subject plus the facts captured at filing time. Each round
 * of juror voting is identified by {@code appealRound}; appeals open a new round at a higher
 * tier until the final round.
 */
@Entity
@Table(name = "disputes", indexes = {
    @Index(name = "idx_dispute_subject", columnList = "subject_type, subject_id"),
    @Index(name = "idx_dispute_client", columnList = "client_did"),
    @Index(name = "idx_dispute_provider", columnList = "provider_did"),
    @Index(name = "idx_dispute_status", columnList = "status")
})
public class Dispute {

    public static final int MAX_SHARE_BPS = 10_000;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "subject_type", nullable = false, length = 16)
    private SubjectType subjectType;

    @NotNull
    @Column(name = "subject_id", nullable = false)
    private UUID subjectId;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DisputeTier tier;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private DisputeStatus status;

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
    @Column(name = "initiated_by", nullable = false)
    private String initiatedBy;

    @NotBlank
    @Column(nullable = false)
    private String token;

    @NotNull
    @PositiveOrZero
    @Column(name = "disputed_amount", nullable = false, precision = 38, scale = 0)
    private BigInteger disputedAmount;

    @NotNull
    @PositiveOrZero
    @Column(name = "accrued_to_provider", nullable = false, precision = 38, scale = 0)
    private BigInteger accruedToProvider;

    @NotBlank
    @Column(name = "state_at_filing", nullable = false, length = 32)
    private String stateAtFiling;

    @Column(name = "subject_deadline")
    private Instant subjectDeadline;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "output_hash")
    private String outputHash;

    @Column(name = "client_evidence_hash")
    private String clientEvidenceHash;

    @Column(name = "provider_evidence_hash")
    private String providerEvidenceHash;

    @Column(name = "client_cancel_consent", nullable = false)
    private boolean clientCancelConsent;

    @Column(name = "provider_cancel_consent", nullable = false)
    private boolean providerCancelConsent;

    @Column(name = "evidence_deadline")
    private Instant evidenceDeadline;

    @Column(name = "voting_deadline")
    private Instant votingDeadline;

    @Column(name = "reveal_deadline")
    private Instant revealDeadline;

    @Column(name = "appeal_deadline")
    private Instant appealDeadline;

    @Column(name = "appeal_round", nullable = false)
    private int appealRound;

    @Column(name = "juror_count", nullable = false)
    private int jurorCount;

    @NotNull
    @Column(name = "required_juror_stake", nullable = false, precision = 38, scale = 0)
    private BigInteger requiredJurorStake;

    @NotNull
    @PositiveOrZero
    @Column(name = "fee_pool", nullable = false, precision = 38, scale = 0)
    private BigInteger feePool;

    @Column(name = "ai_provider_share_bps")
    private Integer aiProviderShareBps;

    @Column(name = "ai_confidence_bps")
    private Integer aiConfidenceBps;

    @Column(name = "ai_rationale_hash")
    private String aiRationaleHash;

    @Column(name = "ruling_provider_share_bps")
    private Integer rulingProviderShareBps;

    @Column(name = "provider_amount", precision = 38, scale = 0)
    private BigInteger providerAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "automatic_rule", length = 32)
    private AutomaticRule automaticRule;

    @Column(nullable = false)
    private boolean resolved;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Version
    private Long version;

    protected Dispute() {}

    /**
     * Snapshot of the disputed subject captured when the dispute is filed.
     */
    public record Filing(
            SubjectType subjectType,
            UUID subjectId,
            String clientDid,
            String clientAddress,
            String providerDid,
            String providerAddress,
            String token,
            BigInteger disputedAmount,
            BigInteger accruedToProvider,
            String stateAtFiling,
            Instant subjectDeadline,
            Instant deliveredAt,
            String outputHash
    ) {}

    public static Dispute open(Filing filing, DisputeTier tier, String initiatedBy, Instant now) {
        var dispute = new Dispute();
        dispute.subjectType = filing.subjectType();
        dispute.subjectId = filing.subjectId();
        dispute.clientDid = filing.clientDid();
        dispute.clientAddress = filing.clientAddress();
        dispute.providerDid = filing.providerDid();
        dispute.providerAddress = filing.providerAddress();
        dispute.token = filing.token();
        dispute.disputedAmount = filing.disputedAmount();
        dispute.accruedToProvider = filing.accruedToProvider();
        dispute.stateAtFiling = filing.stateAtFiling();
        dispute.subjectDeadline = filing.subjectDeadline();
        dispute.deliveredAt = filing.deliveredAt();
        dispute.outputHash = filing.outputHash();
        dispute.initiatedBy = initiatedBy;
        dispute.tier = tier;
        dispute.status = DisputeStatus.EVIDENCE;
        dispute.appealRound = 0;
        dispute.jurorCount = 0;
        dispute.requiredJurorStake = BigInteger.ZERO;
        dispute.feePool = BigInteger.ZERO;
        dispute.createdAt = now;
        return dispute;
    }

    // ==================== Parties ====================

    public boolean isParty(String principal) {
        return clientAddress.equals(principal) || providerAddress.equals(principal);
    }

    public boolean isPartyDid(String did) {
        return clientDid.equals(did) || providerDid.equals(did);
    }

    public void requireParty(String principal) {
        if (!isParty(principal)) {
            throw new UnauthorizedException(ErrorCode.NOT_PARTY, "Caller is not a party to dispute " + id);
        }
    }

    // ==================== Evidence ====================

    public void recordEvidence(String principal, String evidenceHash) {
        requireParty(principal);
        if (evidenceHash == null || evidenceHash.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Evidence hash cannot be blank");
        }
        if (clientAddress.equals(principal)) {
            clientEvidenceHash = evidenceHash;
        } else {
            providerEvidenceHash = evidenceHash;
        }
    }

    public void recordCancelConsent(String principal) {
        requireParty(principal);
        if (clientAddress.equals(principal)) {
            clientCancelConsent = true;
        } else {
            providerCancelConsent = true;
        }
    }

    public boolean hasMutualCancelConsent() {
        return clientCancelConsent && providerCancelConsent;
    }

    public boolean hasClientEvidence() {
        return clientEvidenceHash != null;
    }

    // ==================== Rounds ====================

    public void openEvidencePeriod(Instant deadline) {
        this.status = DisputeStatus.EVIDENCE;
        this.evidenceDeadline = deadline;
        this.votingDeadline = null;
        this.revealDeadline = null;
    }

    public void recordAiRuling(int providerShareBps, int confidenceBps, String rationaleHash) {
        requireStatus(DisputeStatus.EVIDENCE, "record an AI ruling for");
        if (tier != DisputeTier.TIER_2) {
            throw new InvalidStateException("AI rulings only apply to Tier 2 disputes");
        }
        requireShare(providerShareBps);
        requireShare(confidenceBps);
        this.aiProviderShareBps = providerShareBps;
        this.aiConfidenceBps = confidenceBps;
        this.aiRationaleHash = rationaleHash;
    }

    public void openVoting(int jurorCount, BigInteger requiredStake, Instant votingDeadline, Instant revealDeadline) {
        this.jurorCount = jurorCount;
        this.requiredJurorStake = requiredStake;
        this.votingDeadline = votingDeadline;
        this.revealDeadline = revealDeadline;
        this.status = DisputeStatus.VOTING;
    }

    public void markAppealable(int providerShareBps, Instant appealDeadline) {
        requireStatus(DisputeStatus.VOTING, "tally");
        requireShare(providerShareBps);
        this.rulingProviderShareBps = providerShareBps;
        this.appealDeadline = appealDeadline;
        this.status = DisputeStatus.APPEALABLE;
    }

    /**
     * Moves to the next round at the given tier. Deadlines are set by the caller.
     */
    public void advanceRound(DisputeTier nextTier) {
        if (status == DisputeStatus.RESOLVED) {
            throw new InvalidStateException("Dispute " + id + " is already resolved");
        }
        this.appealRound++;
        this.tier = nextTier;
        this.rulingProviderShareBps = null;
        this.appealDeadline = null;
    }

    /**
     * Moves to a higher tier within the same round, after Tier 1 found no automatic rule or the
     * oracle missed the Tier 2 evidence deadline.
     */
    public void escalateTier(DisputeTier nextTier) {
        requireStatus(DisputeStatus.EVIDENCE, "escalate");
        if (nextTier.ordinal() <= tier.ordinal()) {
            throw new InvalidStateException("Dispute " + id + " is already at " + tier);
        }
        this.tier = nextTier;
    }

    public void addFees(BigInteger amount) {
        this.feePool = feePool.add(amount);
    }

    public void drainFees(BigInteger amount) {
        if (amount.compareTo(feePool) > 0) {
            throw new IllegalStateException("Cannot drain more than the fee pool holds");
        }
        this.feePool = feePool.subtract(amount);
    }

    public void resolve(int providerShareBps, BigInteger providerAmount, AutomaticRule rule, Instant now) {
        if (resolved) {
            throw new InvalidStateException("Dispute " + id + " is already resolved");
        }
        this.rulingProviderShareBps = providerShareBps;
        this.providerAmount = providerAmount;
        this.automaticRule = rule;
        this.resolved = true;
        this.resolvedAt = now;
        this.status = DisputeStatus.RESOLVED;
    }

    public void requireStatus(DisputeStatus expected, String action) {
        if (status != expected) {
            throw new InvalidStateException("Cannot " + action + " dispute " + id + " in status " + status);
        }
    }

    public static void requireShare(int bps) {
        if (bps < 0 || bps > MAX_SHARE_BPS) {
            throw new ValidationException(ErrorCode.INVALID_SHARE, "Share must be between 0 and 10000 bps: " + bps);
        }
    }

    // Getters
    public UUID getId() { return id; }
    public SubjectType getSubjectType() { return subjectType; }
    public UUID getSubjectId() { return subjectId; }
    public DisputeTier getTier() { return tier; }
    public DisputeStatus getStatus() { return status; }
    public String getClientDid() { return clientDid; }
    public String getProviderDid() { return providerDid; }
    public String getClientAddress() { return clientAddress; }
    public String getProviderAddress() { return providerAddress; }
    public String getInitiatedBy() { return initiatedBy; }
    public String getToken() { return token; }
    public BigInteger getDisputedAmount() { return disputedAmount; }
    public BigInteger getAccruedToProvider() { return accruedToProvider; }
    public String getStateAtFiling() { return stateAtFiling; }
    public Instant getSubjectDeadline() { return subjectDeadline; }
    public Instant getDeliveredAt() { return deliveredAt; }
    public String getOutputHash() { return outputHash; }
    public String getClientEvidenceHash() { return clientEvidenceHash; }
    public String getProviderEvidenceHash() { return providerEvidenceHash; }
    public boolean isClientCancelConsent() { return clientCancelConsent; }
    public boolean isProviderCancelConsent() { return providerCancelConsent; }
    public Instant getEvidenceDeadline() { return evidenceDeadline; }
    public Instant getVotingDeadline() { return votingDeadline; }
    public Instant getRevealDeadline() { return revealDeadline; }
    public Instant getAppealDeadline() { return appealDeadline; }
    public int getAppealRound() { return appealRound; }
    public int getJurorCount() { return jurorCount; }
    public BigInteger getRequiredJurorStake() { return requiredJurorStake; }
    public BigInteger getFeePool() { return feePool; }
    public Integer getAiProviderShareBps() { return aiProviderShareBps; }
    public Integer getAiConfidenceBps() { return aiConfidenceBps; }
    public String getAiRationaleHash() { return aiRationaleHash; }
    public Integer getRulingProviderShareBps() { return rulingProviderShareBps; }
    public BigInteger getProviderAmount() { return providerAmount; }
    public AutomaticRule getAutomaticRule() { return automaticRule; }
    public boolean isResolved() { return resolved; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getResolvedAt() { return resolvedAt; }

    public enum SubjectType {
        ESCROW, STREAM
    }

    public enum DisputeTier {
        TIER_1, TIER_2, TIER_3;

        public DisputeTier escalate() {
            return this == TIER_1 ? TIER_2 : TIER_3;
        }
    }

    public enum DisputeStatus {
        EVIDENCE,    // awaiting evidence, automatic rules or the AI ruling
        VOTING,      // jurors drafted; Tier 3 commits then reveals
        APPEALABLE,  // round tallied, ruling open to appeal
        RESOLVED
    }

    public enum AutomaticRule {
        MUTUAL_CANCEL,
        INVALID_OUTPUT,
        TIMEOUT,
        UNCHALLENGED_DELIVERY,
        STREAM_COMPLETED
    }
}
