package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.UUID;

/**
 * Directed trust edge endorser -> endorsee. Revocation keeps the row for history.
 */
@Entity
@Table(name = "endorsements", indexes = {
    @Index(name = "idx_endorsement_endorsee", columnList = "endorsee_did, active, created_at"),
    @Index(name = "idx_endorsement_endorser", columnList = "endorser_did")
})
public class Endorsement {

    public static final int MAX_MESSAGE_LENGTH = 280;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "endorser_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String endorserDid;

    @NotNull
    @Column(name = "endorsee_did", nullable = false, length = Agent.MAX_DID_LENGTH)
    private String endorseeDid;

    @Size(max = MAX_MESSAGE_LENGTH)
    @Column(length = MAX_MESSAGE_LENGTH)
    private String message;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Version
    private Long version;

    protected Endorsement() {}

    public static Endorsement create(String endorserDid, String endorseeDid, String message, Instant now) {
        if (endorserDid.equals(endorseeDid)) {
            throw new ValidationException(ErrorCode.SELF_ENDORSEMENT, "Agents cannot endorse themselves");
        }
        if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER,
                    "Endorsement message exceeds " + MAX_MESSAGE_LENGTH + " characters");
        }
        var endorsement = new Endorsement();
        endorsement.endorserDid = endorserDid;
        endorsement.endorseeDid = endorseeDid;
        endorsement.message = message;
        endorsement.createdAt = now;
        endorsement.active = true;
        return endorsement;
    }

    public void revoke(Instant now) {
        if (!active) {
            throw new InvalidStateException("Endorsement already revoked");
        }
        this.active = false;
        this.revokedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public String getEndorserDid() { return endorserDid; }
    public String getEndorseeDid() { return endorseeDid; }
    public String getMessage() { return message; }
    public Instant getCreatedAt() { return createdAt; }
    public boolean isActive() { return active; }
    public Instant getRevokedAt() { return revokedAt; }
}
