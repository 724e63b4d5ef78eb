package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * A juror's seat in one round of a dispute, and the vote cast from it.
 * Weight is the stake x trust snapshot taken when the juror was drafted.
 */
@Entity
@Table(name = "juror_votes", indexes = {
    @Index(name = "idx_juror_vote_round", columnList = "dispute_id, round_number"),
    @Index(name = "idx_juror_vote_seat", columnList = "dispute_id, round_number, juror_did", unique = true)
})
public class JurorVote {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "dispute_id", nullable = false)
    private UUID disputeId;

    @Column(name = "round_number", nullable = false)
    private int roundNumber;

    @NotBlank
    @Column(name = "juror_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String jurorDid;

    @NotBlank
    @Column(name = "juror_address", nullable = false)
    private String jurorAddress;

    @NotNull
    @Column(nullable = false, precision = 60, scale = 0)
    private BigInteger weight;

    @Column(length = 66)
    private String commitment;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Verdict verdict;

    @Column(name = "provider_share_bps")
    private Integer providerShareBps;

    @Column(nullable = false)
    private boolean voted;

    @Column(nullable = false)
    private boolean revealed;

    @Column(name = "voted_at")
    private Instant votedAt;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private VoteOutcome outcome;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger reward;

    @NotNull
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger slashed;

    @Version
    private Long version;

    protected JurorVote() {}

    public static JurorVote draft(UUID disputeId, int roundNumber, String jurorDid, String jurorAddress, BigInteger weight) {
        var vote = new JurorVote();
        vote.disputeId = disputeId;
        vote.roundNumber = roundNumber;
        vote.jurorDid = jurorDid;
        vote.jurorAddress = jurorAddress;
        vote.weight = weight;
        vote.outcome = VoteOutcome.PENDING;
        vote.reward = BigInteger.ZERO;
        vote.slashed = BigInteger.ZERO;
        return vote;
    }

    /**
     * Open (Tier 2) validation vote on the AI ruling.
     */
    public void castValidation(Verdict verdict, int providerShareBps, Instant now) {
        if (voted) {
            throw new InvalidStateException(ErrorCode.ALREADY_VOTED, "Juror " + jurorDid + " already voted");
        }
        Dispute.requireShare(providerShareBps);
        this.verdict = verdict;
        this.providerShareBps = providerShareBps;
        this.voted = true;
        this.revealed = true;
        this.votedAt = now;
    }

    public void commit(String commitment, Instant now) {
        if (voted) {
            throw new InvalidStateException(ErrorCode.ALREADY_VOTED, "Juror " + jurorDid + " already committed");
        }
        if (commitment == null || !commitment.matches("0x[0-9a-fA-F]{64}")) {
            throw new ValidationException(ErrorCode.INVALID_COMMITMENT, "Commitment must be a 32-byte hex hash");
        }
        this.commitment = commitment.toLowerCase();
        this.voted = true;
        this.votedAt = now;
    }

    public void reveal(String recomputedCommitment, int providerShareBps) {
        if (!voted || commitment == null) {
            throw new InvalidStateException("Juror " + jurorDid + " has no commitment to reveal");
        }
        if (revealed) {
            throw new InvalidStateException(ErrorCode.ALREADY_VOTED, "Juror " + jurorDid + " already revealed");
        }
        Dispute.requireShare(providerShareBps);
        if (!commitment.equalsIgnoreCase(recomputedCommitment)) {
            throw new ValidationException(ErrorCode.INVALID_COMMITMENT, "Revealed vote does not match commitment");
        }
        this.providerShareBps = providerShareBps;
        this.revealed = true;
    }

    /**
     * A vote counts once it is visible: cast for Tier 2, revealed for Tier 3.
     */
    public boolean isCounted() {
        return voted && revealed && providerShareBps != null;
    }

    public void settle(VoteOutcome outcome, BigInteger reward, BigInteger slashed) {
        if (this.outcome != VoteOutcome.PENDING) {
            throw new InvalidStateException("Juror seat already settled: " + jurorDid);
        }
        this.outcome = outcome;
        this.reward = reward;
        this.slashed = slashed;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getDisputeId() { return disputeId; }
    public int getRoundNumber() { return roundNumber; }
    public String getJurorDid() { return jurorDid; }
    public String getJurorAddress() { return jurorAddress; }
    public BigInteger getWeight() { return weight; }
    public String getCommitment() { return commitment; }
    public Verdict getVerdict() { return verdict; }
    public Integer getProviderShareBps() { return providerShareBps; }
    public boolean isVoted() { return voted; }
    public boolean isRevealed() { return revealed; }
    public Instant getVotedAt() { return votedAt; }
    public VoteOutcome getOutcome() { return outcome; }
    public BigInteger getReward() { return reward; }
    public BigInteger getSlashed() { return slashed; }

    public enum Verdict {
        AGREE, DISAGREE, MODIFY
    }

    public enum VoteOutcome {
        PENDING,
        COHERENT,
        INCOHERENT,
        ABSENT,
        TIED    // counted, but the round had no majority
    }
}
