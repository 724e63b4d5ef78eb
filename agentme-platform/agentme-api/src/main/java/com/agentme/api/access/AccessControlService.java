package com.agentme.api.access;

import com.agentme.api.audit.AuditService;
import com.agentme.api.config.AccessProperties;
import com.agentme.core.domain.AuditReceipt.EventType;
import com.agentme.core.domain.RoleGrant;
import com.agentme.core.domain.RoleGrant.Role;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import com.agentme.core.repository.RoleGrantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Role-based guard for privileged operations.
 * <p>
 * Roles come from configuration (governance, arbiter and oracle principals) or from grants
 * issued by governance. Each role maps to a fixed set of operations.
 */
@Service
public class AccessControlService {

    private static final Logger log = LoggerFactory.getLogger(AccessControlService.class);

    private static final Map<Role, Set<Operation>> PERMISSIONS = new EnumMap<>(Role.class);

    static {
        PERMISSIONS.put(Role.ORACLE, EnumSet.of(
                Operation.RECORD_TRANSACTION, Operation.SLASH_STAKE, Operation.SUBMIT_AI_RULING));
        PERMISSIONS.put(Role.ARBITER, EnumSet.of(
                Operation.SLASH_STAKE, Operation.ADJUST_REPUTATION, Operation.SETTLE_DISPUTE));
        PERMISSIONS.put(Role.GOVERNANCE, EnumSet.of(Operation.MANAGE_ROLES));
    }

    private final RoleGrantRepository roleGrantRepository;
    private final AccessProperties accessProperties;
    private final AuditService auditService;
    private final Clock clock;

    public AccessControlService(
            RoleGrantRepository roleGrantRepository,
            AccessProperties accessProperties,
            AuditService auditService,
            Clock clock) {
        this.roleGrantRepository = roleGrantRepository;
        this.accessProperties = accessProperties;
        this.auditService = auditService;
        this.clock = clock;
    }

    public static Set<Operation> operationsFor(Role role) {
        return EnumSet.copyOf(PERMISSIONS.get(role));
    }

    public Set<Role> rolesOf(String principal) {
        Set<Role> roles = EnumSet.noneOf(Role.class);
        if (principal == null) {
            return roles;
        }
        if (principal.equals(accessProperties.getGovernance())) {
            roles.add(Role.GOVERNANCE);
        }
        if (principal.equals(accessProperties.getArbiter())) {
            roles.add(Role.ARBITER);
        }
        if (accessProperties.getOracles().contains(principal)) {
            roles.add(Role.ORACLE);
        }
        roleGrantRepository.findByPrincipalAndActiveTrue(principal)
                .forEach(grant -> roles.add(grant.getRole()));
        return roles;
    }

    public boolean hasPermission(String principal, Operation operation) {
        return rolesOf(principal).stream()
                .anyMatch(role -> PERMISSIONS.get(role).contains(operation));
    }

    public void require(String principal, Operation operation) {
        if (!hasPermission(principal, operation)) {
            log.warn("Rejected {} by {}: missing role", operation, principal);
            throw new UnauthorizedException(ErrorCode.MISSING_ROLE,
                    "Principal " + principal + " may not perform " + operation);
        }
    }

    /**
     * The identity dispute resolution acts as when settling and slashing.
     */
    public String arbiterPrincipal() {
        return accessProperties.getArbiter();
    }

    @Transactional
    public void grantRole(String caller, String principal, Role role) {
        require(caller, Operation.MANAGE_ROLES);
        if (principal == null || principal.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Principal cannot be blank");
        }
        if (roleGrantRepository.findByPrincipalAndRoleAndActiveTrue(principal, role).isPresent()) {
            return;
        }
        RoleGrant grant = roleGrantRepository.save(RoleGrant.grant(principal, role, caller, clock.instant()));
        auditService.appendReceipt(EventType.ROLE_GRANTED, caller, grant.getId(), "RoleGrant",
                principal + "|" + role);
        log.info("Granted {} to {}", role, principal);
    }

    @Transactional
    public void revokeRole(String caller, String principal, Role role) {
        require(caller, Operation.MANAGE_ROLES);
        RoleGrant grant = roleGrantRepository.findByPrincipalAndRoleAndActiveTrue(principal, role)
                .orElseThrow(() -> new ValidationException(ErrorCode.INVALID_IDENTIFIER,
                        "No active " + role + " grant for " + principal));
        grant.revoke(clock.instant());
        roleGrantRepository.save(grant);
        auditService.appendReceipt(EventType.ROLE_REVOKED, caller, grant.getId(), "RoleGrant",
                principal + "|" + role);
        log.info("Revoked {} from {}", role, principal);
    }
}
