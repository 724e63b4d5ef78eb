package com.agentme.api.escrow;

import com.agentme.api.access.AccessControlService;
import com.agentme.api.access.Operation;
import com.agentme.api.audit.AuditService;
import com.agentme.api.config.EscrowProperties;
import com.agentme.api.custody.CustodyAccounts;
import com.agentme.api.custody.CustodyService;
import com.agentme.api.dispute.DisputeResolutionService;
import com.agentme.api.dispute.DisputeResolutionService.DisputeView;
import com.agentme.api.settlement.DisputableSettlement;
import com.agentme.api.trust.TrustRegistryService;
import com.agentme.core.domain.Agent;
import com.agentme.core.domain.AuditReceipt.EventType;
import com.agentme.core.domain.Dispute.Filing;
import com.agentme.core.domain.Dispute.SubjectType;
import com.agentme.core.domain.Escrow;
import com.agentme.core.domain.Escrow.EscrowState;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.TemporalException;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import com.agentme.core.repository.EscrowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Lump-sum escrow between a client agent and a provider agent.
 * <p>
 * Funding moves tokens into custody before the state flips; payouts flip the state before
 * tokens leave custody. Disputed escrows are frozen until dispute resolution settles them.
 */
@Service
public class EscrowService implements DisputableSettlement {

    private static final Logger log = LoggerFactory.getLogger(EscrowService.class);

    private final EscrowRepository escrowRepository;
    private final TrustRegistryService trustRegistry;
    private final CustodyService custodyService;
    private final AccessControlService accessControl;
    private final AuditService auditService;
    private final EscrowProperties properties;
    private final ObjectProvider<DisputeResolutionService> disputeResolution;
    private final Clock clock;

    public EscrowService(
            EscrowRepository escrowRepository,
            TrustRegistryService trustRegistry,
            CustodyService custodyService,
            AccessControlService accessControl,
            AuditService auditService,
            EscrowProperties properties,
            ObjectProvider<DisputeResolutionService> disputeResolution,
            Clock clock) {
        this.escrowRepository = escrowRepository;
        this.trustRegistry = trustRegistry;
        this.custodyService = custodyService;
        this.accessControl = accessControl;
        this.auditService = auditService;
        this.properties = properties;
        this.disputeResolution = disputeResolution;
        this.clock = clock;
    }

    @Transactional
    public EscrowView createEscrow(
            String caller,
            String clientDid,
            String providerDid,
            String token,
            BigInteger amount,
            String taskHash,
            Instant deadline) {

        Agent client = trustRegistry.requireOwnedActiveAgent(caller, clientDid);
        Agent provider = trustRegistry.requireActiveAgent(providerDid);
        Escrow escrow = Escrow.create(
                client.getDid(),
                client.getOwner(),
                provider.getDid(),
                provider.getOwner(),
                token,
                amount,
                taskHash,
                deadline,
                clock.instant());
        requireProviderTrust(providerDid, amount);

        Escrow saved = escrowRepository.save(escrow);
        auditService.appendReceipt(EventType.ESCROW_CREATED, caller, saved.getId(), "Escrow",
                clientDid + "|" + providerDid + "|" + amount + "|" + token);
        log.info("Escrow {} created: {} -> {} for {} {}", saved.getId(), clientDid, providerDid, amount, token);
        return toView(saved);
    }

    @Transactional
    public EscrowView fundEscrow(String caller, UUID escrowId) {
        Escrow escrow = requireEscrow(escrowId);
        requireClient(escrow, caller);
        if (escrow.getState() != EscrowState.AWAITING_DEPOSIT) {
            throw new InvalidStateException("Escrow " + escrowId + " is already " + escrow.getState());
        }
        Instant now = clock.instant();
        if (escrow.isDeadlinePassed(now)) {
            throw new TemporalException(ErrorCode.DEADLINE_PASSED, "Escrow " + escrowId + " deadline has passed");
        }

        custodyService.transfer(
                CustodyAccounts.wallet(caller),
                CustodyAccounts.escrow(escrowId),
                escrow.getToken(),
                escrow.getAmount(),
                "ESCROW_FUND:" + escrowId);
        escrow.markFunded(now);
        Escrow saved = escrowRepository.save(escrow);

        auditService.appendReceipt(EventType.ESCROW_FUNDED, caller, escrowId, "Escrow", escrow.getAmount().toString());
        log.info("Escrow {} funded", escrowId);
        return toView(saved);
    }

    @Transactional
    public EscrowView confirmDelivery(String caller, UUID escrowId, String outputHash) {
        Escrow escrow = requireEscrow(escrowId);
        if (!escrow.getProviderAddress().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_PROVIDER, "Only the provider can confirm delivery");
        }
        escrow.markDelivered(outputHash, clock.instant());
        Escrow saved = escrowRepository.save(escrow);

        auditService.appendReceipt(EventType.ESCROW_DELIVERED, caller, escrowId, "Escrow", outputHash);
        log.info("Escrow {} delivered", escrowId);
        return toView(saved);
    }

    @Transactional
    public EscrowView releaseEscrow(String caller, UUID escrowId) {
        Escrow escrow = requireEscrow(escrowId);
        requireClient(escrow, caller);
        escrow.markReleased(clock.instant());
        Escrow saved = escrowRepository.save(escrow);

        custodyService.transfer(
                CustodyAccounts.escrow(escrowId),
                CustodyAccounts.wallet(escrow.getProviderAddress()),
                escrow.getToken(),
                escrow.getAmount(),
                "ESCROW_RELEASE:" + escrowId);

        auditService.appendReceipt(EventType.ESCROW_RELEASED, caller, escrowId, "Escrow", escrow.getAmount().toString());
        log.info("Escrow {} released to {}", escrowId, escrow.getProviderDid());
        return toView(saved);
    }

    @Transactional
    public EscrowView claimTimeout(String caller, UUID escrowId) {
        Escrow escrow = requireEscrow(escrowId);
        requireClient(escrow, caller);
        Instant now = clock.instant();
        if (escrow.getState() == EscrowState.FUNDED && !escrow.isDeadlinePassed(now)) {
            throw new TemporalException(ErrorCode.DEADLINE_NOT_REACHED,
                    "Escrow " + escrowId + " deadline is " + escrow.getDeadline());
        }
        escrow.markRefunded(now);
        Escrow saved = escrowRepository.save(escrow);

        custodyService.transfer(
                CustodyAccounts.escrow(escrowId),
                CustodyAccounts.wallet(escrow.getClientAddress()),
                escrow.getToken(),
                escrow.getAmount(),
                "ESCROW_REFUND:" + escrowId);

        auditService.appendReceipt(EventType.ESCROW_REFUNDED, caller, escrowId, "Escrow", "TIMEOUT");
        log.info("Escrow {} refunded after timeout", escrowId);
        return toView(saved);
    }

    /**
     * Party-facing dispute filing. Opens the dispute through dispute resolution, which freezes
     * the escrow and records the filing, so a disputed escrow always has a dispute to settle it.
     */
    public DisputeView initiateDispute(String caller, UUID escrowId) {
        return disputeResolution.getObject().openDispute(caller, SubjectType.ESCROW, escrowId, null);
    }

    // ==================== Dispute seam ====================

    @Override
    public SubjectType subjectType() {
        return SubjectType.ESCROW;
    }

    @Override
    @Transactional
    public Filing freezeForDispute(String arbiter, String party, UUID escrowId) {
        accessControl.require(arbiter, Operation.SETTLE_DISPUTE);
        Escrow escrow = requireEscrow(escrowId);
        if (!escrow.isParty(party)) {
            throw new UnauthorizedException(ErrorCode.NOT_PARTY, "Only escrow parties can dispute");
        }
        escrow.markDisputed();
        escrowRepository.save(escrow);

        auditService.appendReceipt(EventType.ESCROW_DISPUTED, party, escrowId, "Escrow",
                escrow.getStateBeforeDispute().name());
        log.info("Escrow {} disputed by {}", escrowId, party);

        return new Filing(
                SubjectType.ESCROW,
                escrowId,
                escrow.getClientDid(),
                escrow.getClientAddress(),
                escrow.getProviderDid(),
                escrow.getProviderAddress(),
                escrow.getToken(),
                escrow.getAmount(),
                BigInteger.ZERO,
                escrow.getStateBeforeDispute().name(),
                escrow.getDeadline(),
                escrow.getDeliveredAt(),
                escrow.getOutputHash()
        );
    }

    @Override
    @Transactional
    public void settleDispute(String caller, UUID escrowId, BigInteger providerAmount) {
        accessControl.require(caller, Operation.SETTLE_DISPUTE);
        Escrow escrow = requireEscrow(escrowId);
        escrow.settleDispute(providerAmount, clock.instant());
        escrowRepository.save(escrow);

        BigInteger clientAmount = escrow.getAmount().subtract(providerAmount);
        String ref = "ESCROW_SETTLE:" + escrowId;
        custodyService.transfer(CustodyAccounts.escrow(escrowId),
                CustodyAccounts.wallet(escrow.getProviderAddress()), escrow.getToken(), providerAmount, ref);
        custodyService.transfer(CustodyAccounts.escrow(escrowId),
                CustodyAccounts.wallet(escrow.getClientAddress()), escrow.getToken(), clientAmount, ref);

        EventType event = escrow.getState() == EscrowState.RELEASED ? EventType.ESCROW_RELEASED : EventType.ESCROW_REFUNDED;
        auditService.appendReceipt(event, caller, escrowId, "Escrow", providerAmount + "|" + clientAmount);
        log.info("Escrow {} settled by dispute: provider {}, client {}", escrowId, providerAmount, clientAmount);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public EscrowView getEscrow(UUID escrowId) {
        return toView(requireEscrow(escrowId));
    }

    @Transactional(readOnly = true)
    public List<EscrowView> getEscrowsByClient(String clientDid) {
        return escrowRepository.findByClientDidOrderByCreatedAtDesc(clientDid).stream().map(this::toView).toList();
    }

    @Transactional(readOnly = true)
    public List<EscrowView> getEscrowsByProvider(String providerDid) {
        return escrowRepository.findByProviderDidOrderByCreatedAtDesc(providerDid).stream().map(this::toView).toList();
    }

    /**
     * Stake a provider must hold to take an escrow of this size; zero for trusted providers
     * or when collateral is disabled.
     */
    @Transactional(readOnly = true)
    public BigInteger requiredProviderCollateral(String providerDid, BigInteger amount) {
        if (properties.getCollateralRatioBps() <= 0
                || trustRegistry.getTrustScore(providerDid) >= properties.getTrustedProviderScore()) {
            return BigInteger.ZERO;
        }
        return amount.multiply(BigInteger.valueOf(properties.getCollateralRatioBps()))
                .divide(BigInteger.valueOf(10_000));
    }

    private void requireProviderTrust(String providerDid, BigInteger amount) {
        int score = trustRegistry.getTrustScore(providerDid);
        if (score < properties.getMinProviderTrustScore()) {
            throw new ValidationException(ErrorCode.TRUST_BELOW_MINIMUM,
                    "Provider trust " + score + " below required " + properties.getMinProviderTrustScore());
        }
        BigInteger collateral = requiredProviderCollateral(providerDid, amount);
        BigInteger staked = trustRegistry.getStakedAmount(providerDid);
        if (staked.compareTo(collateral) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_STAKE,
                    "Provider must stake " + collateral + " for this escrow, has " + staked);
        }
    }

    private Escrow requireEscrow(UUID escrowId) {
        return escrowRepository.findById(escrowId)
                .orElseThrow(() -> new ValidationException(ErrorCode.ESCROW_NOT_FOUND, "Escrow not found: " + escrowId));
    }

    private static void requireClient(Escrow escrow, String caller) {
        if (!escrow.getClientAddress().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_CLIENT, "Only the client can perform this action");
        }
    }

    private EscrowView toView(Escrow escrow) {
        return new EscrowView(
                escrow.getId(),
                escrow.getClientDid(),
                escrow.getProviderDid(),
                escrow.getClientAddress(),
                escrow.getProviderAddress(),
                escrow.getToken(),
                escrow.getAmount(),
                escrow.getTaskHash(),
                escrow.getOutputHash(),
                escrow.getDeadline(),
                escrow.getState(),
                escrow.getCreatedAt(),
                escrow.getDeliveredAt(),
                escrow.getClosedAt()
        );
    }

    // DTO
    public record EscrowView(
            UUID id,
            String clientDid,
            String providerDid,
            String clientAddress,
            String providerAddress,
            String token,
            BigInteger amount,
            String taskHash,
            String outputHash,
            Instant deadline,
            EscrowState state,
            Instant createdAt,
            Instant deliveredAt,
            Instant closedAt
    ) {}
}
