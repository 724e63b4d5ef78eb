package com.agentme.core.repository;

import com.agentme.core.domain.TokenBalance;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TokenBalanceRepository extends JpaRepository<TokenBalance, UUID> {

    Optional<TokenBalance> findByAccountAndToken(String account, String token);
}
