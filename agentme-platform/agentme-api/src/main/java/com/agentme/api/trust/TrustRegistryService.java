package com.agentme.api.trust;

import com.agentme.api.access.AccessControlService;
import com.agentme.api.access.Operation;
import com.agentme.api.audit.AuditService;
import com.agentme.api.config.TrustProperties;
import com.agentme.api.custody.CustodyAccounts;
import com.agentme.api.custody.CustodyService;
import com.agentme.core.domain.Agent;
import com.agentme.core.domain.AuditReceipt.EventType;
import com.agentme.core.domain.Endorsement;
import com.agentme.core.domain.TrustRecord;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import com.agentme.core.repository.AgentRepository;
import com.agentme.core.repository.EndorsementRepository;
import com.agentme.core.repository.TrustRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Agent identity, staking, endorsements and composite trust scores.
 * <p>
 * Scores are computed on read from the stored counters; nothing derived is persisted.
 * Every mutation validates fully before touching state.
 */
@Service
public class TrustRegistryService {

    private static final Logger log = LoggerFactory.getLogger(TrustRegistryService.class);

    private final AgentRepository agentRepository;
    private final TrustRecordRepository trustRecordRepository;
    private final EndorsementRepository endorsementRepository;
    private final CustodyService custodyService;
    private final AccessControlService accessControl;
    private final AuditService auditService;
    private final TrustScoreCalculator calculator;
    private final TrustProperties properties;
    private final Clock clock;

    public TrustRegistryService(
            AgentRepository agentRepository,
            TrustRecordRepository trustRecordRepository,
            EndorsementRepository endorsementRepository,
            CustodyService custodyService,
            AccessControlService accessControl,
            AuditService auditService,
            TrustScoreCalculator calculator,
            TrustProperties properties,
            Clock clock) {
        this.agentRepository = agentRepository;
        this.trustRecordRepository = trustRecordRepository;
        this.endorsementRepository = endorsementRepository;
        this.custodyService = custodyService;
        this.accessControl = accessControl;
        this.auditService = auditService;
        this.calculator = calculator;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Agents ====================

    @Transactional
    public AgentView registerAgent(String owner, String did, String capabilityCid) {
        Instant now = clock.instant();
        Agent agent = Agent.register(owner, did, capabilityCid, now);
        if (agentRepository.existsByOwner(owner)) {
            throw new ValidationException(ErrorCode.AGENT_ALREADY_REGISTERED,
                    "Principal already owns an agent: " + owner);
        }
        if (agentRepository.existsByDid(did)) {
            throw new ValidationException(ErrorCode.AGENT_ALREADY_REGISTERED, "DID already registered: " + did);
        }

        Agent saved = agentRepository.save(agent);
        trustRecordRepository.save(TrustRecord.open(did));

        auditService.appendReceipt(EventType.AGENT_REGISTERED, owner, did, "Agent", saved.getDidHash());
        log.info("Registered agent {} for {}", did, owner);
        return toView(saved);
    }

    @Transactional
    public AgentView updateMetadata(String caller, String did, String capabilityCid) {
        Agent agent = requireOwnedAgent(caller, did);
        agent.updateCapability(capabilityCid, clock.instant());
        Agent saved = agentRepository.save(agent);

        auditService.appendReceipt(EventType.AGENT_UPDATED, caller, did, "Agent", capabilityCid);
        return toView(saved);
    }

    @Transactional
    public void deactivate(String caller, String did) {
        Agent agent = requireOwnedAgent(caller, did);
        agent.deactivate(clock.instant());
        agentRepository.save(agent);

        auditService.appendReceipt(EventType.AGENT_DEACTIVATED, caller, did, "Agent", did);
        log.info("Deactivated agent {}", did);
    }

    @Transactional(readOnly = true)
    public Optional<AgentView> getAgent(String did) {
        return agentRepository.findByDid(did).map(this::toView);
    }

    @Transactional(readOnly = true)
    public Optional<AgentView> getAgentByDidHash(String didHash) {
        return agentRepository.findByDidHash(didHash).map(this::toView);
    }

    @Transactional(readOnly = true)
    public boolean isAgentActive(String did) {
        return agentRepository.findByDid(did).map(Agent::isActive).orElse(false);
    }

    public Agent requireAgent(String did) {
        return agentRepository.findByDid(did)
                .orElseThrow(() -> new ValidationException(ErrorCode.AGENT_NOT_REGISTERED, "Agent not registered: " + did));
    }

    public Agent requireActiveAgent(String did) {
        Agent agent = requireAgent(did);
        agent.requireActive();
        return agent;
    }

    public Agent requireOwnedAgent(String caller, String did) {
        Agent agent = requireAgent(did);
        if (!agent.isOwnedBy(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_AGENT_OWNER, caller + " does not own " + did);
        }
        return agent;
    }

    public Agent requireOwnedActiveAgent(String caller, String did) {
        Agent agent = requireOwnedAgent(caller, did);
        agent.requireActive();
        return agent;
    }

    // ==================== Transactions & Reputation ====================

    @Transactional
    public void recordTransaction(String caller, String did, BigInteger volume, boolean successful) {
        accessControl.require(caller, Operation.RECORD_TRANSACTION);
        TrustRecord record = requireRecord(did);
        record.recordTransaction(volume, successful, clock.instant());
        trustRecordRepository.save(record);

        auditService.appendReceipt(EventType.TRANSACTION_RECORDED, caller, did, "TrustRecord",
                volume + "|" + successful);
    }

    @Transactional
    public void adjustReputation(String caller, String did, ReputationEvent event) {
        accessControl.require(caller, Operation.ADJUST_REPUTATION);
        TrustRecord record = requireRecord(did);
        Instant now = clock.instant();
        switch (event) {
            case COHERENT_VOTE, DISPUTE_WON -> record.recordTransaction(BigInteger.ZERO, true, now);
            case DISPUTE_LOST -> record.recordDisputeLoss(now);
        }
        trustRecordRepository.save(record);

        auditService.appendReceipt(EventType.REPUTATION_ADJUSTED, caller, did, "TrustRecord", event.name());
        log.debug("Reputation event {} for {}", event, did);
    }

    // ==================== Staking ====================

    @Transactional
    public void depositStake(String caller, String did, BigInteger amount) {
        Agent agent = requireOwnedActiveAgent(caller, did);
        TrustRecord record = requireRecord(did);
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Stake amount must be positive");
        }

        custodyService.transfer(
                CustodyAccounts.wallet(agent.getOwner()),
                CustodyAccounts.stake(did),
                properties.getStakeToken(),
                amount,
                "STAKE_DEPOSIT:" + did);
        record.addStake(amount);
        trustRecordRepository.save(record);

        auditService.appendReceipt(EventType.STAKE_DEPOSITED, caller, did, "TrustRecord", amount.toString());
        log.info("Agent {} staked {} (total {})", did, amount, record.getStakedAmount());
    }

    /**
     * Starts the withdrawal cooldown. A new request replaces any pending one.
     *
     * @return when the withdrawal unlocks
     */
    @Transactional
    public Instant requestWithdraw(String caller, String did, BigInteger amount) {
        requireOwnedAgent(caller, did);
        TrustRecord record = requireRecord(did);
        Instant now = clock.instant();
        record.requestWithdraw(amount, now);
        trustRecordRepository.save(record);

        Instant unlock = record.getWithdrawUnlockTime(properties.getWithdrawCooldown());
        auditService.appendReceipt(EventType.STAKE_WITHDRAW_REQUESTED, caller, did, "TrustRecord",
                amount + "|" + unlock);
        return unlock;
    }

    /**
     * Pays out a matured withdrawal request. The record is debited before tokens move.
     */
    @Transactional
    public BigInteger executeWithdraw(String caller, String did) {
        Agent agent = requireOwnedAgent(caller, did);
        TrustRecord record = requireRecord(did);
        BigInteger amount = record.completeWithdraw(properties.getWithdrawCooldown(), clock.instant());
        trustRecordRepository.save(record);

        custodyService.transfer(
                CustodyAccounts.stake(did),
                CustodyAccounts.wallet(agent.getOwner()),
                properties.getStakeToken(),
                amount,
                "STAKE_WITHDRAW:" + did);

        auditService.appendReceipt(EventType.STAKE_WITHDRAWN, caller, did, "TrustRecord", amount.toString());
        log.info("Agent {} withdrew {} stake", did, amount);
        return amount;
    }

    /**
     * Removes stake as a penalty; slashed tokens go to the treasury.
     */
    @Transactional
    public void slash(String caller, String did, BigInteger amount, String reason) {
        accessControl.require(caller, Operation.SLASH_STAKE);
        TrustRecord record = requireRecord(did);
        record.slash(amount);
        trustRecordRepository.save(record);

        custodyService.transfer(
                CustodyAccounts.stake(did),
                CustodyAccounts.TREASURY,
                properties.getStakeToken(),
                amount,
                "SLASH:" + did);

        auditService.appendReceipt(EventType.STAKE_SLASHED, caller, did, "TrustRecord", amount + "|" + reason);
        log.warn("Slashed {} from {}: {}", amount, did, reason);
    }

    @Transactional(readOnly = true)
    public BigInteger getStakedAmount(String did) {
        return trustRecordRepository.findByDid(did)
                .map(TrustRecord::getStakedAmount)
                .orElse(BigInteger.ZERO);
    }

    // ==================== Endorsements ====================

    @Transactional
    public EndorsementView endorse(String caller, String endorserDid, String endorseeDid, String message) {
        requireOwnedActiveAgent(caller, endorserDid);
        requireActiveAgent(endorseeDid);
        Endorsement endorsement = Endorsement.create(endorserDid, endorseeDid, message, clock.instant());
        if (endorsementRepository.findByEndorserDidAndEndorseeDidAndActiveTrue(endorserDid, endorseeDid).isPresent()) {
            throw new ValidationException(ErrorCode.DUPLICATE_ENDORSEMENT,
                    endorserDid + " already endorses " + endorseeDid);
        }

        Endorsement saved = endorsementRepository.save(endorsement);
        auditService.appendReceipt(EventType.ENDORSEMENT_ADDED, caller, saved.getId(), "Endorsement",
                endorserDid + "|" + endorseeDid);
        log.info("{} endorsed {}", endorserDid, endorseeDid);
        return toView(saved);
    }

    @Transactional
    public void revokeEndorsement(String caller, String endorserDid, String endorseeDid) {
        requireOwnedAgent(caller, endorserDid);
        Endorsement endorsement = endorsementRepository
                .findByEndorserDidAndEndorseeDidAndActiveTrue(endorserDid, endorseeDid)
                .orElseThrow(() -> new ValidationException(ErrorCode.ENDORSEMENT_NOT_FOUND,
                        "No active endorsement from " + endorserDid + " to " + endorseeDid));
        endorsement.revoke(clock.instant());
        endorsementRepository.save(endorsement);

        auditService.appendReceipt(EventType.ENDORSEMENT_REVOKED, caller, endorsement.getId(), "Endorsement",
                endorserDid + "|" + endorseeDid);
    }

    /**
     * Full endorsement history received by an agent, including revoked ones.
     */
    @Transactional(readOnly = true)
    public List<EndorsementView> getEndorsements(String did) {
        return endorsementRepository.findByEndorseeDidOrderByCreatedAtDesc(did).stream()
                .map(this::toView)
                .toList();
    }

    // ==================== Scores ====================

    /**
     * Composite score in 0..10000; 0 for an unregistered agent.
     */
    @Transactional(readOnly = true)
    public int getTrustScore(String did) {
        if (!agentRepository.existsByDid(did)) {
            return 0;
        }
        return computeDetails(requireRecord(did), clock.instant()).compositeScore();
    }

    @Transactional(readOnly = true)
    public TrustDetails getTrustDetails(String did) {
        requireAgent(did);
        return computeDetails(requireRecord(did), clock.instant());
    }

    @Transactional(readOnly = true)
    public boolean meetsTrustRequirement(String did, int minScore) {
        return getTrustScore(did) >= minScore;
    }

    private TrustDetails computeDetails(TrustRecord record, Instant now) {
        double reputation = calculator.reputation(record, now);
        double stake = calculator.stakeFactor(record.getStakedAmount());
        double endorsement = endorsementFactor(record.getDid(), now);
        return new TrustDetails(
                record.getDid(),
                TrustScoreCalculator.toBps(reputation),
                TrustScoreCalculator.toBps(stake),
                TrustScoreCalculator.toBps(endorsement),
                calculator.composite(reputation, stake, endorsement),
                record.getTotalTransactions(),
                record.getSuccessfulTransactions(),
                record.getTotalVolume(),
                record.getDisputesLost(),
                record.getStakedAmount(),
                record.getPendingWithdrawAmount(),
                record.getWithdrawUnlockTime(properties.getWithdrawCooldown()),
                record.getLastActivityAt()
        );
    }

    private double endorsementFactor(String did, Instant now) {
        EndorsementGraph graph = new EndorsementGraph(
                properties.getMaxEndorsementHops(), properties.getEndorsementHopDecay());
        PageRequest recent = PageRequest.of(0, properties.getMaxEndorsementsCounted());
        Map<String, Double> reputations = new HashMap<>();

        return graph.endorsementFactor(
                did,
                endorsee -> endorsementRepository
                        .findByEndorseeDidAndActiveTrueOrderByCreatedAtDesc(endorsee, recent).stream()
                        .map(Endorsement::getEndorserDid)
                        .filter(this::isAgentActive)
                        .toList(),
                endorser -> reputations.computeIfAbsent(endorser, key -> trustRecordRepository.findByDid(key)
                        .map(r -> calculator.reputation(r, now))
                        .orElse(0.0)));
    }

    private TrustRecord requireRecord(String did) {
        return trustRecordRepository.findByDid(did)
                .orElseThrow(() -> new ValidationException(ErrorCode.AGENT_NOT_REGISTERED, "Agent not registered: " + did));
    }

    private AgentView toView(Agent agent) {
        return new AgentView(
                agent.getDid(),
                agent.getDidHash(),
                agent.getOwner(),
                agent.getCapabilityCid(),
                agent.isActive(),
                agent.getRegisteredAt(),
                agent.getUpdatedAt()
        );
    }

    private EndorsementView toView(Endorsement endorsement) {
        return new EndorsementView(
                endorsement.getId(),
                endorsement.getEndorserDid(),
                endorsement.getEndorseeDid(),
                endorsement.getMessage(),
                endorsement.getCreatedAt(),
                endorsement.isActive(),
                endorsement.getRevokedAt()
        );
    }

    // DTOs
    public record AgentView(
            String did,
            String didHash,
            String owner,
            String capabilityCid,
            boolean active,
            Instant registeredAt,
            Instant updatedAt
    ) {}

    public record EndorsementView(
            UUID id,
            String endorserDid,
            String endorseeDid,
            String message,
            Instant createdAt,
            boolean active,
            Instant revokedAt
    ) {}

    /**
     * Score breakdown; factor components in basis points.
     */
    public record TrustDetails(
            String did,
            int reputationBps,
            int stakeBps,
            int endorsementBps,
            int compositeScore,
            long totalTransactions,
            long successfulTransactions,
            BigInteger totalVolume,
            long disputesLost,
            BigInteger stakedAmount,
            BigInteger pendingWithdrawAmount,
            Instant withdrawUnlockTime,
            Instant lastActivityAt
    ) {}
}
