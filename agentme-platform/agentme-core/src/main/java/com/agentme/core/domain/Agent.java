package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.web3j.crypto.Hash;

import java.time.Instant;
import java.util.UUID;

/**
 * A registered marketplace agent. One agent per owning principal.
 * Never deleted; deactivation is terminal for participation but keeps history.
 */
@Entity
@Table(name = "agents", indexes = {
    @Index(name = "idx_agent_did", columnList = "did", unique = true),
    @Index(name = "idx_agent_did_hash", columnList = "did_hash", unique = true),
    @Index(name = "idx_agent_owner", columnList = "owner", unique = true)
})
public class Agent {

    public static final String DID_PREFIX = "did:";
    public static final int MAX_DID_LENGTH = 256;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Column(nullable = false, unique = true, length = MAX_DID_LENGTH)
    private String did;

    @NotBlank
    @Column(name = "did_hash", nullable = false, unique = true, length = 66)
    private String didHash;

    @NotBlank
    @Column(nullable = false, unique = true)
    private String owner;

    @NotBlank
    @Column(name = "capability_cid", nullable = false)
    private String capabilityCid;

    @Column(nullable = false)
    private boolean active;

    @NotNull
    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @NotNull
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    protected Agent() {}

    public static Agent register(String owner, String did, String capabilityCid, Instant now) {
        requireValidDid(did);
        if (owner == null || owner.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Owner cannot be blank");
        }
        if (capabilityCid == null || capabilityCid.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Capability card CID cannot be blank");
        }
        var agent = new Agent();
        agent.did = did;
        agent.didHash = hashDid(did);
        agent.owner = owner;
        agent.capabilityCid = capabilityCid;
        agent.active = true;
        agent.registeredAt = now;
        agent.updatedAt = now;
        return agent;
    }

    /**
     * Keccak-256 of the DID string, the stable identifier used by discovery.
     */
    public static String hashDid(String did) {
        return Hash.sha3String(did);
    }

    public static void requireValidDid(String did) {
        if (did == null || !did.startsWith(DID_PREFIX) || did.length() <= DID_PREFIX.length()
                || did.length() > MAX_DID_LENGTH) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Invalid DID: " + did);
        }
    }

    public boolean isOwnedBy(String principal) {
        return owner.equals(principal);
    }

    public void updateCapability(String capabilityCid, Instant now) {
        requireActive();
        if (capabilityCid == null || capabilityCid.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Capability card CID cannot be blank");
        }
        this.capabilityCid = capabilityCid;
        this.updatedAt = now;
    }

    public void deactivate(Instant now) {
        if (!active) {
            throw new InvalidStateException("Agent already deactivated: " + did);
        }
        this.active = false;
        this.updatedAt = now;
    }

    public void requireActive() {
        if (!active) {
            throw new ValidationException(ErrorCode.AGENT_INACTIVE, "Agent is not active: " + did);
        }
    }

    // Getters
    public UUID getId() { return id; }
    public String getDid() { return did; }
    public String getDidHash() { return didHash; }
    public String getOwner() { return owner; }
    public String getCapabilityCid() { return capabilityCid; }
    public boolean isActive() { return active; }
    public Instant getRegisteredAt() { return registeredAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
