package com.agentme.core.repository;

import com.agentme.core.domain.RoleGrant;
import com.agentme.core.domain.RoleGrant.Role;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface RoleGrantRepository extends JpaRepository<RoleGrant, UUID> {

    List<RoleGrant> findByPrincipalAndActiveTrue(String principal);

    Optional<RoleGrant> findByPrincipalAndRoleAndActiveTrue(String principal, Role role);
}
