package com.agentme.api.trust;

import com.agentme.api.support.SettlementIntegrationTest;
import com.agentme.api.trust.TrustRegistryService.AgentView;
import com.agentme.api.trust.TrustRegistryService.TrustDetails;
import com.agentme.core.domain.Agent;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.SettlementException;
import com.agentme.core.error.TemporalException;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for agent registration, staking, endorsements and trust scores.
 */
class TrustRegistryServiceTest extends SettlementIntegrationTest {

    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";
    private static final String CAROL = "0xcarol";
    private static final String ALICE_DID = "did:agentme:alice";
    private static final String BOB_DID = "did:agentme:bob";
    private static final String CAROL_DID = "did:agentme:carol";

    // ==================== Registration ====================

    @Test
    void registerAgent_hashesDidAndStartsActive() {
        AgentView view = trustRegistry.registerAgent(ALICE, ALICE_DID, "ipfs://card-alice");

        assertTrue(view.active());
        assertEquals(ALICE, view.owner());
        assertEquals(Agent.hashDid(ALICE_DID), view.didHash());
        assertThat(trustRegistry.getAgentByDidHash(view.didHash()).map(AgentView::did)).contains(ALICE_DID);
        assertEquals(0, trustRegistry.getTrustScore(ALICE_DID));
    }

    @Test
    void registerAgent_onePerOwnerAndDid() {
        register(ALICE, ALICE_DID);

        ValidationException sameOwner = assertThrows(ValidationException.class,
                () -> trustRegistry.registerAgent(ALICE, "did:agentme:other", "ipfs://x"));
        assertEquals(ErrorCode.AGENT_ALREADY_REGISTERED, sameOwner.getCode());

        ValidationException sameDid = assertThrows(ValidationException.class,
                () -> trustRegistry.registerAgent(BOB, ALICE_DID, "ipfs://x"));
        assertEquals(ErrorCode.AGENT_ALREADY_REGISTERED, sameDid.getCode());
    }

    @Test
    void registerAgent_rejectsMalformedDid() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> trustRegistry.registerAgent(ALICE, "agentme:alice", "ipfs://x"));
        assertEquals(ErrorCode.INVALID_IDENTIFIER, e.getCode());
    }

    @Test
    void updateAndDeactivate_requireOwner() {
        register(ALICE, ALICE_DID);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> trustRegistry.updateMetadata(BOB, ALICE_DID, "ipfs://stolen"));
        assertEquals(ErrorCode.NOT_AGENT_OWNER, e.getCode());

        clock.advance(Duration.ofMinutes(5));
        AgentView updated = trustRegistry.updateMetadata(ALICE, ALICE_DID, "ipfs://card-v2");
        assertEquals("ipfs://card-v2", updated.capabilityCid());
        assertThat(updated.updatedAt()).isAfter(updated.registeredAt());

        trustRegistry.deactivate(ALICE, ALICE_DID);
        assertFalse(trustRegistry.isAgentActive(ALICE_DID));
        assertThrows(InvalidStateException.class, () -> trustRegistry.deactivate(ALICE, ALICE_DID));
        ValidationException inactive = assertThrows(ValidationException.class,
                () -> trustRegistry.updateMetadata(ALICE, ALICE_DID, "ipfs://card-v3"));
        assertEquals(ErrorCode.AGENT_INACTIVE, inactive.getCode());
    }

    // ==================== Reputation ====================

    @Test
    void recordTransaction_requiresOracle() {
        register(ALICE, ALICE_DID);

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> trustRegistry.recordTransaction(ALICE, ALICE_DID, usdc(10), true));
        assertEquals(ErrorCode.MISSING_ROLE, e.getCode());
    }

    @Test
    void trustScore_combinesReputationAndStake() {
        register(ALICE, ALICE_DID);
        trustRegistry.recordTransaction(ORACLE, ALICE_DID, BigInteger.ZERO, true);
        stake(ALICE, ALICE_DID, usdc(1_000));

        TrustDetails details = trustRegistry.getTrustDetails(ALICE_DID);

        assertEquals(5_000, details.reputationBps());
        assertEquals(3_162, details.stakeBps());
        assertEquals(0, details.endorsementBps());
        assertEquals(3_449, details.compositeScore());
        assertEquals(3_449, trustRegistry.getTrustScore(ALICE_DID));
        assertTrue(trustRegistry.meetsTrustRequirement(ALICE_DID, 3_000));
    }

    @Test
    void trustScore_decaysWithInactivity() {
        register(ALICE, ALICE_DID);
        trustRegistry.recordTransaction(ORACLE, ALICE_DID, BigInteger.ZERO, true);
        int fresh = trustRegistry.getTrustScore(ALICE_DID);

        clock.advance(Duration.ofDays(15));

        assertThat(trustRegistry.getTrustScore(ALICE_DID)).isLessThan(fresh);
    }

    @Test
    void disputeLoss_lowersReputation() {
        register(ALICE, ALICE_DID);
        trustRegistry.recordTransaction(ORACLE, ALICE_DID, BigInteger.ZERO, true);
        int before = trustRegistry.getTrustScore(ALICE_DID);

        trustRegistry.adjustReputation("dispute-resolution", ALICE_DID, ReputationEvent.DISPUTE_LOST);

        TrustDetails details = trustRegistry.getTrustDetails(ALICE_DID);
        assertEquals(1, details.disputesLost());
        assertThat(details.compositeScore()).isLessThan(before);
        assertThrows(UnauthorizedException.class,
                () -> trustRegistry.adjustReputation(ORACLE, ALICE_DID, ReputationEvent.DISPUTE_WON));
    }

    // ==================== Staking ====================

    @Test
    void depositStake_movesWalletIntoStake() {
        register(ALICE, ALICE_DID);
        fund(ALICE, usdc(500));

        trustRegistry.depositStake(ALICE, ALICE_DID, usdc(200));

        assertEquals(usdc(200), trustRegistry.getStakedAmount(ALICE_DID));
        assertEquals(usdc(300), wallet(ALICE));
        SettlementException broke = assertThrows(SettlementException.class,
                () -> trustRegistry.depositStake(ALICE, ALICE_DID, usdc(301)));
        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, broke.getCode());
        assertEquals(usdc(200), trustRegistry.getStakedAmount(ALICE_DID));
    }

    @Test
    void withdraw_waitsForCooldown() {
        register(ALICE, ALICE_DID);
        stake(ALICE, ALICE_DID, usdc(100));

        Instant unlock = trustRegistry.requestWithdraw(ALICE, ALICE_DID, usdc(40));
        assertEquals(clock.instant().plus(Duration.ofDays(7)), unlock);

        clock.advance(Duration.ofDays(6));
        TemporalException early = assertThrows(TemporalException.class,
                () -> trustRegistry.executeWithdraw(ALICE, ALICE_DID));
        assertEquals(ErrorCode.COOLDOWN_ACTIVE, early.getCode());

        clock.advance(Duration.ofDays(1));
        BigInteger paid = trustRegistry.executeWithdraw(ALICE, ALICE_DID);

        assertEquals(usdc(40), paid);
        assertEquals(usdc(60), trustRegistry.getStakedAmount(ALICE_DID));
        assertEquals(usdc(40), wallet(ALICE));
    }

    @Test
    void slash_requiresRoleAndPaysTreasury() {
        register(ALICE, ALICE_DID);
        stake(ALICE, ALICE_DID, usdc(100));

        UnauthorizedException e = assertThrows(UnauthorizedException.class,
                () -> trustRegistry.slash(BOB, ALICE_DID, usdc(10), "spam"));
        assertEquals(ErrorCode.MISSING_ROLE, e.getCode());

        trustRegistry.slash(ORACLE, ALICE_DID, usdc(10), "fraudulent output");

        assertEquals(usdc(90), trustRegistry.getStakedAmount(ALICE_DID));
        assertEquals(usdc(10), custody.balanceOf("TREASURY", USDC));
    }

    // ==================== Endorsements ====================

    @Test
    void endorsement_liftsEndorseeScore() {
        register(ALICE, ALICE_DID);
        register(BOB, BOB_DID);
        trustRegistry.recordTransaction(ORACLE, ALICE_DID, BigInteger.ZERO, true);
        int before = trustRegistry.getTrustScore(BOB_DID);

        trustRegistry.endorse(ALICE, ALICE_DID, BOB_DID, "reliable summarizer");

        TrustDetails details = trustRegistry.getTrustDetails(BOB_DID);
        assertEquals(4_500, details.endorsementBps());
        assertEquals(before + 900, details.compositeScore());
    }

    @Test
    void endorsement_rejectsSelfAndDuplicate() {
        register(ALICE, ALICE_DID);
        register(BOB, BOB_DID);

        ValidationException self = assertThrows(ValidationException.class,
                () -> trustRegistry.endorse(ALICE, ALICE_DID, ALICE_DID, "me"));
        assertEquals(ErrorCode.SELF_ENDORSEMENT, self.getCode());

        trustRegistry.endorse(ALICE, ALICE_DID, BOB_DID, "good");
        ValidationException duplicate = assertThrows(ValidationException.class,
                () -> trustRegistry.endorse(ALICE, ALICE_DID, BOB_DID, "still good"));
        assertEquals(ErrorCode.DUPLICATE_ENDORSEMENT, duplicate.getCode());
    }

    @Test
    void revokedEndorsement_stopsCountingButStaysInHistory() {
        register(ALICE, ALICE_DID);
        register(BOB, BOB_DID);
        register(CAROL, CAROL_DID);
        trustRegistry.recordTransaction(ORACLE, ALICE_DID, BigInteger.ZERO, true);
        trustRegistry.endorse(ALICE, ALICE_DID, BOB_DID, "good");
        trustRegistry.endorse(BOB, BOB_DID, CAROL_DID, "good");

        assertThat(trustRegistry.getTrustDetails(CAROL_DID).endorsementBps()).isPositive();

        trustRegistry.revokeEndorsement(ALICE, ALICE_DID, BOB_DID);

        assertEquals(0, trustRegistry.getTrustDetails(BOB_DID).endorsementBps());
        assertEquals(0, trustRegistry.getTrustDetails(CAROL_DID).endorsementBps());
        assertThat(trustRegistry.getEndorsements(BOB_DID)).singleElement()
                .satisfies(view -> assertFalse(view.active()));
        ValidationException missing = assertThrows(ValidationException.class,
                () -> trustRegistry.revokeEndorsement(ALICE, ALICE_DID, BOB_DID));
        assertEquals(ErrorCode.ENDORSEMENT_NOT_FOUND, missing.getCode());
    }
}
