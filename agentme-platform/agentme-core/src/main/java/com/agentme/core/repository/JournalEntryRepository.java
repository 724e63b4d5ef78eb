package com.agentme.core.repository;

import com.agentme.core.domain.JournalEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

@Repository
public interface JournalEntryRepository extends JpaRepository<JournalEntry, UUID> {

    List<JournalEntry> findByRefOrderByPostedAtAsc(String ref);

    /**
     * Null when the account never received the token.
     */
    @Query("SELECT SUM(j.amount) FROM JournalEntry j WHERE j.creditAccount = :account AND j.token = :token")
    BigInteger sumCredits(@Param("account") String account, @Param("token") String token);

    @Query("SELECT SUM(j.amount) FROM JournalEntry j WHERE j.debitAccount = :account AND j.token = :token")
    BigInteger sumDebits(@Param("account") String account, @Param("token") String token);
}
