package com.agentme.api.support;

import com.agentme.api.custody.CustodyService;
import com.agentme.api.trust.TrustRegistryService;
import com.agentme.core.repository.AgentRepository;
import com.agentme.core.repository.AuditReceiptRepository;
import com.agentme.core.repository.DisputeRepository;
import com.agentme.core.repository.EndorsementRepository;
import com.agentme.core.repository.EscrowRepository;
import com.agentme.core.repository.JournalEntryRepository;
import com.agentme.core.repository.JurorVoteRepository;
import com.agentme.core.repository.PaymentStreamRepository;
import com.agentme.core.repository.RoleGrantRepository;
import com.agentme.core.repository.TokenBalanceRepository;
import com.agentme.core.repository.TrustRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigInteger;

/**
 * Base for service tests against the in-memory database. Every test starts from empty tables
 * and the same clock instant.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
public abstract class SettlementIntegrationTest {

    public static final String USDC = "USDC";
    public static final String ORACLE = "oracle";
    public static final String GOVERNANCE = "governance";

    /** One USDC in base units. */
    public static final long UNIT = 1_000_000L;

    @Autowired protected MutableClock clock;
    @Autowired protected TrustRegistryService trustRegistry;
    @Autowired protected CustodyService custody;

    @Autowired private AgentRepository agentRepository;
    @Autowired private TrustRecordRepository trustRecordRepository;
    @Autowired private EndorsementRepository endorsementRepository;
    @Autowired private EscrowRepository escrowRepository;
    @Autowired private PaymentStreamRepository streamRepository;
    @Autowired private DisputeRepository disputeRepository;
    @Autowired private JurorVoteRepository jurorVoteRepository;
    @Autowired private TokenBalanceRepository tokenBalanceRepository;
    @Autowired private JournalEntryRepository journalEntryRepository;
    @Autowired private RoleGrantRepository roleGrantRepository;
    @Autowired protected AuditReceiptRepository auditReceiptRepository;

    @BeforeEach
    void resetState() {
        jurorVoteRepository.deleteAll();
        disputeRepository.deleteAll();
        escrowRepository.deleteAll();
        streamRepository.deleteAll();
        endorsementRepository.deleteAll();
        trustRecordRepository.deleteAll();
        agentRepository.deleteAll();
        tokenBalanceRepository.deleteAll();
        journalEntryRepository.deleteAll();
        roleGrantRepository.deleteAll();
        auditReceiptRepository.deleteAll();
        clock.set(TestClockConfiguration.START);
    }

    protected static BigInteger usdc(long whole) {
        return BigInteger.valueOf(whole * UNIT);
    }

    protected void register(String owner, String did) {
        trustRegistry.registerAgent(owner, did, "ipfs://capability/" + did.substring(did.lastIndexOf(':') + 1));
    }

    protected void fund(String owner, BigInteger amount) {
        custody.depositExternal(owner, USDC, amount);
    }

    protected void stake(String owner, String did, BigInteger amount) {
        fund(owner, amount);
        trustRegistry.depositStake(owner, did, amount);
    }

    protected BigInteger wallet(String owner) {
        return custody.walletBalance(owner, USDC);
    }

    /**
     * Registers an agent with one successful transaction and 1,000 USDC staked, enough to clear
     * the default juror trust floor.
     */
    protected void registerJuror(String owner, String did) {
        register(owner, did);
        trustRegistry.recordTransaction(ORACLE, did, BigInteger.ZERO, true);
        stake(owner, did, usdc(1_000));
    }
}
