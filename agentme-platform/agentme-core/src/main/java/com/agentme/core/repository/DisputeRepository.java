package com.agentme.core.repository;

import com.agentme.core.domain.Dispute;
import com.agentme.core.domain.Dispute.SubjectType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface DisputeRepository extends JpaRepository<Dispute, UUID> {

    List<Dispute> findBySubjectTypeAndSubjectId(SubjectType subjectType, UUID subjectId);

    List<Dispute> findByClientDidOrProviderDidOrderByCreatedAtDesc(String clientDid, String providerDid);
}
