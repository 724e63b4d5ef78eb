package com.agentme.core.repository;

import com.agentme.core.domain.Escrow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface EscrowRepository extends JpaRepository<Escrow, UUID> {

    List<Escrow> findByClientDidOrderByCreatedAtDesc(String clientDid);

    List<Escrow> findByProviderDidOrderByCreatedAtDesc(String providerDid);
}
