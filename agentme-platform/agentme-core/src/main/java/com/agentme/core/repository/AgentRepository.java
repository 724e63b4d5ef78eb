package com.agentme.core.repository;

import com.agentme.core.domain.Agent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface AgentRepository extends JpaRepository<Agent, UUID> {

    Optional<Agent> findByDid(String did);

    Optional<Agent> findByDidHash(String didHash);

    Optional<Agent> findByOwner(String owner);

    boolean existsByDid(String did);

    boolean existsByOwner(String owner);

    List<Agent> findByDidIn(List<String> dids);
}
