package com.agentme.core.repository;

import com.agentme.core.domain.TrustRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TrustRecordRepository extends JpaRepository<TrustRecord, UUID> {

    Optional<TrustRecord> findByDid(String did);

    /**
     * Juror candidates: records holding at least the given stake, in stable DID order.
     */
    List<TrustRecord> findByStakedAmountGreaterThanEqualOrderByDidAsc(BigInteger minimumStake);
}
