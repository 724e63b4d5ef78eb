package com.agentme.core.repository;

import com.agentme.core.domain.JurorVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JurorVoteRepository extends JpaRepository<JurorVote, UUID> {

    List<JurorVote> findByDisputeIdAndRoundNumberOrderByJurorDidAsc(UUID disputeId, int roundNumber);

    Optional<JurorVote> findByDisputeIdAndRoundNumberAndJurorDid(UUID disputeId, int roundNumber, String jurorDid);

    List<JurorVote> findByDisputeIdOrderByRoundNumberAscJurorDidAsc(UUID disputeId);
}
