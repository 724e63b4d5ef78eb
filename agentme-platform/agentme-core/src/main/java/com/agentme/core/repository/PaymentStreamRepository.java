package com.agentme.core.repository;

import com.agentme.core.domain.PaymentStream;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface PaymentStreamRepository extends JpaRepository<PaymentStream, UUID> {

    List<PaymentStream> findBySenderDidOrderByCreatedAtDesc(String senderDid);

    List<PaymentStream> findByRecipientDidOrderByCreatedAtDesc(String recipientDid);
}
