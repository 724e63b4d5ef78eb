package com.agentme.core.domain;

import com.agentme.core.error.InvalidStateException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * A privileged role granted to a principal by governance.
 */
@Entity
@Table(name = "role_grants", indexes = {
    @Index(name = "idx_role_grant_principal", columnList = "principal, active")
})
public class RoleGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotBlank
    @Column(nullable = false)
    private String principal;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(name = "role_name", nullable = false, length = 32)
    private Role role;

    @NotBlank
    @Column(name = "granted_by", nullable = false)
    private String grantedBy;

    @NotNull
    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "revoked_at")
    private Instant revokedAt;

    @Version
    private Long version;

    protected RoleGrant() {}

    public static RoleGrant grant(String principal, Role role, String grantedBy, Instant now) {
        var grant = new RoleGrant();
        grant.principal = principal;
        grant.role = role;
        grant.grantedBy = grantedBy;
        grant.grantedAt = now;
        grant.active = true;
        return grant;
    }

    public void revoke(Instant now) {
        if (!active) {
            throw new InvalidStateException("Role grant already revoked");
        }
        this.active = false;
        this.revokedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public String getPrincipal() { return principal; }
    public Role getRole() { return role; }
    public String getGrantedBy() { return grantedBy; }
    public Instant getGrantedAt() { return grantedAt; }
    public boolean isActive() { return active; }
    public Instant getRevokedAt() { return revokedAt; }

    public enum Role {
        ORACLE,      // records transactions, submits AI rulings
        ARBITER,     // settles disputes, adjusts reputation
        GOVERNANCE   // manages role grants
    }
}
