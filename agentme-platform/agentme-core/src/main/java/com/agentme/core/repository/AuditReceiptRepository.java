package com.agentme.core.repository;

import com.agentme.core.domain.AuditReceipt;
import com.agentme.core.domain.AuditReceipt.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Append-only: receipts are never updated after their hash is set, never deleted.
 */
@Repository
public interface AuditReceiptRepository extends JpaRepository<AuditReceipt, UUID> {

    Optional<AuditReceipt> findTopByOrderBySeqNoDesc();

    List<AuditReceipt> findAllByOrderBySeqNoAsc();

    List<AuditReceipt> findByResourceIdOrderBySeqNoAsc(String resourceId);

    List<AuditReceipt> findByEventTypeOrderBySeqNoAsc(EventType eventType);
}
