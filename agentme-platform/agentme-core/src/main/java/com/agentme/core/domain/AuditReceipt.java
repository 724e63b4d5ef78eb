package com.agentme.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Immutable receipt for every settlement event.
 * Receipts form a hash chain ordered by sequence number.
 */
@Entity
@Table(name = "audit_receipts", indexes = {
    @Index(name = "idx_audit_seq", columnList = "seq_no", unique = true),
    @Index(name = "idx_audit_actor", columnList = "actor_id"),
    @Index(name = "idx_audit_resource", columnList = "resource_id"),
    @Index(name = "idx_audit_event_type", columnList = "event_type")
})
public class AuditReceipt {

    public static final String GENESIS = "GENESIS";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "seq_no", nullable = false, unique = true)
    private long seqNo;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 48)
    private EventType eventType;

    @NotNull
    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @NotNull
    @Column(name = "actor_id", nullable = false)
    private String actorId;

    @NotNull
    @Column(name = "resource_id", nullable = false)
    private String resourceId;

    @NotNull
    @Column(name = "resource_type", nullable = false, length = 32)
    private String resourceType;

    @NotNull
    @Column(name = "details_hash", nullable = false, length = 64)
    private String detailsHash;

    @NotNull
    @Column(name = "previous_receipt_hash", nullable = false, length = 64)
    private String previousReceiptHash;

    @Column(name = "receipt_hash", length = 64)
    private String receiptHash;

    protected AuditReceipt() {}

    public static AuditReceipt create(
            long seqNo,
            EventType eventType,
            String actorId,
            String resourceId,
            String resourceType,
            String detailsHash,
            String previousReceiptHash,
            Instant recordedAt) {

        var receipt = new AuditReceipt();
        receipt.seqNo = seqNo;
        receipt.eventType = eventType;
        // Stored precision, so the hash recomputes identically after a reload
        receipt.recordedAt = recordedAt.truncatedTo(ChronoUnit.MICROS);
        receipt.actorId = actorId;
        receipt.resourceId = resourceId;
        receipt.resourceType = resourceType;
        receipt.detailsHash = detailsHash;
        receipt.previousReceiptHash = previousReceiptHash;
        return receipt;
    }

    /**
     * Canonical string the receipt hash is computed over.
     */
    public String canonicalContent() {
        return String.join("|",
                Long.toString(seqNo),
                eventType.name(),
                recordedAt.toString(),
                actorId,
                resourceId,
                resourceType,
                detailsHash,
                previousReceiptHash);
    }

    // Getters
    public UUID getId() { return id; }
    public long getSeqNo() { return seqNo; }
    public EventType getEventType() { return eventType; }
    public Instant getRecordedAt() { return recordedAt; }
    public String getActorId() { return actorId; }
    public String getResourceId() { return resourceId; }
    public String getResourceType() { return resourceType; }
    public String getDetailsHash() { return detailsHash; }
    public String getPreviousReceiptHash() { return previousReceiptHash; }
    public String getReceiptHash() { return receiptHash; }

    public void setReceiptHash(String hash) { this.receiptHash = hash; }

    public enum EventType {
        // Trust registry
        AGENT_REGISTERED,
        AGENT_UPDATED,
        AGENT_DEACTIVATED,
        TRANSACTION_RECORDED,
        STAKE_DEPOSITED,
        STAKE_WITHDRAW_REQUESTED,
        STAKE_WITHDRAWN,
        STAKE_SLASHED,
        REPUTATION_ADJUSTED,
        ENDORSEMENT_ADDED,
        ENDORSEMENT_REVOKED,
        // Escrow
        ESCROW_CREATED,
        ESCROW_FUNDED,
        ESCROW_DELIVERED,
        ESCROW_RELEASED,
        ESCROW_REFUNDED,
        ESCROW_DISPUTED,
        // Streams
        STREAM_CREATED,
        STREAM_WITHDRAWN,
        STREAM_TOPPED_UP,
        STREAM_PAUSED,
        STREAM_RESUMED,
        STREAM_CANCELED,
        STREAM_DISPUTED,
        STREAM_SETTLED,
        // Disputes
        DISPUTE_OPENED,
        DISPUTE_EVIDENCE_SUBMITTED,
        DISPUTE_CANCEL_CONSENT,
        DISPUTE_AI_RULING,
        DISPUTE_JURORS_DRAFTED,
        DISPUTE_VOTE_CAST,
        DISPUTE_VOTE_REVEALED,
        DISPUTE_ROUND_TALLIED,
        DISPUTE_ESCALATED,
        DISPUTE_APPEALED,
        DISPUTE_RESOLVED,
        // Access control
        ROLE_GRANTED,
        ROLE_REVOKED
    }
}
