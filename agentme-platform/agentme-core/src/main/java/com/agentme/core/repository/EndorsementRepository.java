package com.agentme.core.repository;

import com.agentme.core.domain.Endorsement;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EndorsementRepository extends JpaRepository<Endorsement, UUID> {

    /**
     * Most recent active endorsements received by an agent, newest first.
     */
    List<Endorsement> findByEndorseeDidAndActiveTrueOrderByCreatedAtDesc(String endorseeDid, Pageable pageable);

    Optional<Endorsement> findByEndorserDidAndEndorseeDidAndActiveTrue(String endorserDid, String endorseeDid);

    List<Endorsement> findByEndorseeDidOrderByCreatedAtDesc(String endorseeDid);

    List<Endorsement> findByEndorserDidOrderByCreatedAtDesc(String endorserDid);
}
