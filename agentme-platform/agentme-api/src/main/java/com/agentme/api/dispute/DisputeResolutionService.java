package com.agentme.api.dispute;

import com.agentme.api.access.AccessControlService;
import com.agentme.api.access.Operation;
import com.agentme.api.audit.AuditService;
import com.agentme.api.config.ArbitrationProperties;
import com.agentme.api.custody.CustodyAccounts;
import com.agentme.api.custody.CustodyService;
import com.agentme.api.settlement.DisputableSettlement;
import com.agentme.api.trust.ReputationEvent;
import com.agentme.api.trust.TrustRegistryService;
import com.agentme.core.domain.AuditReceipt.EventType;
import com.agentme.core.domain.Dispute;
import com.agentme.core.domain.Dispute.AutomaticRule;
import com.agentme.core.domain.Dispute.DisputeStatus;
import com.agentme.core.domain.Dispute.DisputeTier;
import com.agentme.core.domain.Dispute.Filing;
import com.agentme.core.domain.Dispute.SubjectType;
import com.agentme.core.domain.JurorVote;
import com.agentme.core.domain.JurorVote.Verdict;
import com.agentme.core.domain.JurorVote.VoteOutcome;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.TemporalException;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import com.agentme.core.repository.DisputeRepository;
import com.agentme.core.repository.JurorVoteRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Tiered dispute resolution over escrows and streams.
 * <p>
 * Tier 1 applies automatic rules. Tier 2 has three randomly drafted jurors validate an advisory
 * AI ruling in the open. Tier 3 drafts a stake x trust weighted jury that votes by commit and
 * reveal. Tallied rounds can be appealed up to the final round, each appeal doubling the fee and
 * growing the jury. Jurors who vote with the outcome split the round's fees; the others, and
 * jurors who never vote, are slashed.
 */
@Service
public class DisputeResolutionService {

    private static final Logger log = LoggerFactory.getLogger(DisputeResolutionService.class);

    private static final int EVEN_SPLIT_BPS = Dispute.MAX_SHARE_BPS / 2;

    private final DisputeRepository disputeRepository;
    private final JurorVoteRepository jurorVoteRepository;
    private final Map<SubjectType, DisputableSettlement> settlements;
    private final TrustRegistryService trustRegistry;
    private final CustodyService custodyService;
    private final AccessControlService accessControl;
    private final AuditService auditService;
    private final DisputeTierPolicy tierPolicy;
    private final AutomaticRuleEvaluator ruleEvaluator;
    private final JurorSelector jurorSelector;
    private final ArbitrationProperties properties;
    private final Clock clock;

    public DisputeResolutionService(
            DisputeRepository disputeRepository,
            JurorVoteRepository jurorVoteRepository,
            List<DisputableSettlement> settlements,
            TrustRegistryService trustRegistry,
            CustodyService custodyService,
            AccessControlService accessControl,
            AuditService auditService,
            DisputeTierPolicy tierPolicy,
            AutomaticRuleEvaluator ruleEvaluator,
            JurorSelector jurorSelector,
            ArbitrationProperties properties,
            Clock clock) {
        this.disputeRepository = disputeRepository;
        this.jurorVoteRepository = jurorVoteRepository;
        this.settlements = new EnumMap<>(SubjectType.class);
        for (DisputableSettlement settlement : settlements) {
            this.settlements.put(settlement.subjectType(), settlement);
        }
        this.trustRegistry = trustRegistry;
        this.custodyService = custodyService;
        this.accessControl = accessControl;
        this.auditService = auditService;
        this.tierPolicy = tierPolicy;
        this.ruleEvaluator = ruleEvaluator;
        this.jurorSelector = jurorSelector;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Filing ====================

    /**
     * Freezes the subject and opens a dispute at the tier its value calls for.
     * The initiator pays the first round's fee. A Tier 3 dispute that cannot draft its jury is
     * split evenly at once, without a fee.
     */
    @Transactional
    public DisputeView openDispute(String caller, SubjectType subjectType, UUID subjectId, String evidenceHash) {
        DisputableSettlement settlement = settlementFor(subjectType);
        Filing filing = settlement.freezeForDispute(accessControl.arbiterPrincipal(), caller, subjectId);
        Instant now = clock.instant();

        DisputeTier tier = tierPolicy.tierFor(filing.disputedAmount());
        Dispute dispute = Dispute.open(filing, tier, caller, now);
        dispute.openEvidencePeriod(now.plus(properties.getEvidencePeriod()));
        if (evidenceHash != null) {
            dispute.recordEvidence(caller, evidenceHash);
        }
        Dispute saved = disputeRepository.save(dispute);

        auditService.appendReceipt(EventType.DISPUTE_OPENED, caller, saved.getId(), "Dispute",
                subjectType + "|" + subjectId + "|" + tier + "|" + filing.disputedAmount());
        log.info("Dispute {} opened on {} {} at {} for {}", saved.getId(), subjectType, subjectId, tier,
                filing.disputedAmount());

        if (tier == DisputeTier.TIER_3
                && !draftTier3Jury(saved, tierPolicy.jurorCountFor(DisputeTier.TIER_3, 0), now)) {
            splitWithoutJury(saved);
            return toView(saved);
        }
        collectFee(saved, caller, tierPolicy.feeFor(filing.disputedAmount(), tier, 0));
        return toView(disputeRepository.save(saved));
    }

    @Transactional
    public DisputeView submitEvidence(String caller, UUID disputeId, String evidenceHash) {
        Dispute dispute = requireDispute(disputeId);
        requireOpen(dispute);
        Instant now = clock.instant();
        if (dispute.getEvidenceDeadline() != null && !now.isBefore(dispute.getEvidenceDeadline())) {
            throw new TemporalException(ErrorCode.EVIDENCE_CLOSED, "Evidence period closed for dispute " + disputeId);
        }
        dispute.recordEvidence(caller, evidenceHash);
        Dispute saved = disputeRepository.save(dispute);

        auditService.appendReceipt(EventType.DISPUTE_EVIDENCE_SUBMITTED, caller, disputeId, "Dispute", evidenceHash);
        return toView(saved);
    }

    @Transactional
    public DisputeView consentToCancel(String caller, UUID disputeId) {
        Dispute dispute = requireDispute(disputeId);
        dispute.requireStatus(DisputeStatus.EVIDENCE, "consent to cancel");
        if (dispute.getTier() != DisputeTier.TIER_1) {
            throw new InvalidStateException("Mutual cancel only applies to Tier 1 disputes");
        }
        dispute.recordCancelConsent(caller);
        Dispute saved = disputeRepository.save(dispute);

        auditService.appendReceipt(EventType.DISPUTE_CANCEL_CONSENT, caller, disputeId, "Dispute", null);
        return toView(saved);
    }

    // ==================== Tier 1 ====================

    @Transactional
    public DisputeView resolveAutomatically(UUID disputeId) {
        Dispute dispute = requireDispute(disputeId);
        dispute.requireStatus(DisputeStatus.EVIDENCE, "resolve automatically");
        if (dispute.getTier() != DisputeTier.TIER_1) {
            throw new InvalidStateException("Automatic rules only apply to Tier 1 disputes");
        }
        AutomaticRuleEvaluator.Outcome outcome = ruleEvaluator.evaluate(dispute, clock.instant())
                .orElseThrow(() -> new InvalidStateException(ErrorCode.NO_AUTOMATIC_RULE,
                        "No automatic rule applies to dispute " + disputeId));

        int shareBps = DisputeTierPolicy.shareBpsOf(outcome.providerAmount(), dispute.getDisputedAmount());
        settle(dispute, outcome.providerAmount(), shareBps, outcome.rule());
        log.info("Dispute {} resolved by rule {}", disputeId, outcome.rule());
        return toView(dispute);
    }

    /**
     * Moves a dispute up a tier: from Tier 1 when no automatic rule applies, or from Tier 2 when
     * the evidence period ended without an AI ruling. The escalating party pays the new tier's fee.
     */
    @Transactional
    public DisputeView escalate(String caller, UUID disputeId) {
        Dispute dispute = requireDispute(disputeId);
        dispute.requireParty(caller);
        dispute.requireStatus(DisputeStatus.EVIDENCE, "escalate");
        Instant now = clock.instant();

        switch (dispute.getTier()) {
            case TIER_1 -> {
                if (ruleEvaluator.evaluate(dispute, now).isPresent()) {
                    throw new InvalidStateException("An automatic rule applies to dispute " + disputeId);
                }
            }
            case TIER_2 -> {
                if (dispute.getAiProviderShareBps() != null) {
                    throw new InvalidStateException("Dispute " + disputeId + " already has an AI ruling");
                }
                if (now.isBefore(dispute.getEvidenceDeadline())) {
                    throw new TemporalException(ErrorCode.DEADLINE_NOT_REACHED,
                            "Oracle may still rule until " + dispute.getEvidenceDeadline());
                }
            }
            case TIER_3 -> throw new InvalidStateException("Dispute " + disputeId + " is already at the top tier");
        }

        DisputeTier next = dispute.getTier().escalate();
        dispute.escalateTier(next);
        dispute.openEvidencePeriod(now.plus(properties.getEvidencePeriod()));
        auditService.appendReceipt(EventType.DISPUTE_ESCALATED, caller, disputeId, "Dispute", next.name());
        log.info("Dispute {} escalated to {}", disputeId, next);

        if (next == DisputeTier.TIER_3
                && !draftTier3Jury(dispute, tierPolicy.jurorCountFor(DisputeTier.TIER_3, dispute.getJurorCount()), now)) {
            splitWithoutJury(dispute);
            return toView(dispute);
        }
        collectFee(dispute, caller, tierPolicy.feeFor(dispute.getDisputedAmount(), next, dispute.getAppealRound()));
        return toView(disputeRepository.save(dispute));
    }

    // ==================== Tier 2 ====================

    /**
     * Records the oracle's advisory ruling and drafts the validation jury. With too few eligible
     * jurors to validate the ruling, the dispute is split evenly.
     */
    @Transactional
    public DisputeView submitAiRuling(
            String caller,
            UUID disputeId,
            int providerShareBps,
            int confidenceBps,
            String rationaleHash) {

        accessControl.require(caller, Operation.SUBMIT_AI_RULING);
        Dispute dispute = requireDispute(disputeId);
        dispute.recordAiRuling(providerShareBps, confidenceBps, rationaleHash);

        auditService.appendReceipt(EventType.DISPUTE_AI_RULING, caller, disputeId, "Dispute",
                providerShareBps + "|" + confidenceBps + "|" + rationaleHash);

        Instant now = clock.instant();
        int count = tierPolicy.jurorCountFor(DisputeTier.TIER_2, dispute.getJurorCount());
        BigInteger requiredStake = tierPolicy.requiredJurorStake(dispute.getAppealRound());
        List<JurorSelector.Candidate> candidates = jurorSelector.eligibleCandidates(dispute, requiredStake);
        if (candidates.size() < count) {
            splitWithoutJury(dispute);
            return toView(dispute);
        }
        List<JurorSelector.Candidate> drafted = JurorSelector.selectUniform(
                candidates, count, JurorSelector.seed(disputeId, dispute.getAppealRound()));
        seatJurors(dispute, drafted, false);
        dispute.openVoting(count, requiredStake, now.plus(properties.getVotingPeriod()), null);
        Dispute saved = disputeRepository.save(dispute);

        log.info("Dispute {} AI ruling {} bps (confidence {}), {} jurors drafted",
                disputeId, providerShareBps, confidenceBps, count);
        return toView(saved);
    }

    @Transactional
    public void castValidationVote(
            String caller,
            UUID disputeId,
            String jurorDid,
            Verdict verdict,
            Integer modifiedShareBps) {

        Dispute dispute = requireDispute(disputeId);
        requireVotingTier(dispute, DisputeTier.TIER_2);
        if (!clock.instant().isBefore(dispute.getVotingDeadline())) {
            throw new TemporalException(ErrorCode.VOTING_WINDOW_CLOSED, "Voting closed for dispute " + disputeId);
        }
        JurorVote seat = requireSeat(dispute, caller, jurorDid);
        int share = VoteTally.validationShare(verdict, dispute.getAiProviderShareBps(), modifiedShareBps);
        seat.castValidation(verdict, share, clock.instant());
        jurorVoteRepository.save(seat);

        auditService.appendReceipt(EventType.DISPUTE_VOTE_CAST, caller, disputeId, "Dispute",
                jurorDid + "|" + verdict + "|" + share);
    }

    // ==================== Tier 3 ====================

    @Transactional
    public void commitVote(String caller, UUID disputeId, String jurorDid, String commitment) {
        Dispute dispute = requireDispute(disputeId);
        requireVotingTier(dispute, DisputeTier.TIER_3);
        if (!clock.instant().isBefore(dispute.getVotingDeadline())) {
            throw new TemporalException(ErrorCode.VOTING_WINDOW_CLOSED, "Commit period closed for dispute " + disputeId);
        }
        JurorVote seat = requireSeat(dispute, caller, jurorDid);
        seat.commit(commitment, clock.instant());
        jurorVoteRepository.save(seat);

        auditService.appendReceipt(EventType.DISPUTE_VOTE_CAST, caller, disputeId, "Dispute",
                jurorDid + "|" + seat.getCommitment());
    }

    @Transactional
    public void revealVote(String caller, UUID disputeId, String jurorDid, int providerShareBps, String salt) {
        Dispute dispute = requireDispute(disputeId);
        requireVotingTier(dispute, DisputeTier.TIER_3);
        Instant now = clock.instant();
        if (now.isBefore(dispute.getVotingDeadline())) {
            throw new TemporalException(ErrorCode.VOTING_WINDOW_OPEN, "Commit period still open for dispute " + disputeId);
        }
        if (!now.isBefore(dispute.getRevealDeadline())) {
            throw new TemporalException(ErrorCode.VOTING_WINDOW_CLOSED, "Reveal period closed for dispute " + disputeId);
        }
        JurorVote seat = requireSeat(dispute, caller, jurorDid);
        String recomputed = VoteCommitments.commitment(
                disputeId, dispute.getAppealRound(), jurorDid, providerShareBps, salt);
        seat.reveal(recomputed, providerShareBps);
        jurorVoteRepository.save(seat);

        auditService.appendReceipt(EventType.DISPUTE_VOTE_REVEALED, caller, disputeId, "Dispute",
                jurorDid + "|" + providerShareBps);
    }

    // ==================== Rounds ====================

    /**
     * Tallies the current round once its window has closed, pays and slashes jurors, and opens
     * the appeal window. A tie or an empty round moves straight to the next round; in the final
     * round, or when no further jury can be drafted, it splits the value evenly.
     */
    @Transactional
    public DisputeView finalizeRound(UUID disputeId) {
        Dispute dispute = requireDispute(disputeId);
        dispute.requireStatus(DisputeStatus.VOTING, "finalize");
        Instant now = clock.instant();
        Instant closesAt = dispute.getTier() == DisputeTier.TIER_3
                ? dispute.getRevealDeadline()
                : dispute.getVotingDeadline();
        if (now.isBefore(closesAt)) {
            throw new TemporalException(ErrorCode.VOTING_WINDOW_OPEN, "Voting open until " + closesAt);
        }

        List<JurorVote> seats = jurorVoteRepository
                .findByDisputeIdAndRoundNumberOrderByJurorDidAsc(disputeId, dispute.getAppealRound());
        boolean weighted = dispute.getTier() == DisputeTier.TIER_3;
        List<VoteTally.Ballot> ballots = seats.stream()
                .filter(JurorVote::isCounted)
                .map(seat -> new VoteTally.Ballot(seat.getJurorDid(), seat.getProviderShareBps(),
                        weighted ? seat.getWeight() : BigInteger.ONE))
                .toList();
        VoteTally.Result result = VoteTally.tally(ballots);
        settleJurors(dispute, seats, result, weighted);

        auditService.appendReceipt(EventType.DISPUTE_ROUND_TALLIED, "system", disputeId, "Dispute",
                dispute.getAppealRound() + "|" + result.winningShareBps() + "|" + ballots.size() + "/" + seats.size());

        if (!result.hasMajority()) {
            log.info("Dispute {} round {} had no majority", disputeId, dispute.getAppealRound());
            if (!tierPolicy.isFinalRound(dispute.getAppealRound()) && redraft(dispute, now)) {
                return toView(disputeRepository.save(dispute));
            }
            settle(dispute, DisputeTierPolicy.shareOf(dispute.getDisputedAmount(), EVEN_SPLIT_BPS), EVEN_SPLIT_BPS, null);
            return toView(dispute);
        }

        int winningShare = result.winningShareBps();
        if (tierPolicy.isFinalRound(dispute.getAppealRound())) {
            settle(dispute, DisputeTierPolicy.shareOf(dispute.getDisputedAmount(), winningShare), winningShare, null);
            return toView(dispute);
        }
        dispute.markAppealable(winningShare, now.plus(properties.getAppealPeriod()));
        Dispute saved = disputeRepository.save(dispute);
        log.info("Dispute {} round {} ruled {} bps to provider, appealable until {}",
                disputeId, saved.getAppealRound(), winningShare, saved.getAppealDeadline());
        return toView(saved);
    }

    /**
     * Reopens a tallied ruling at the next round. Fails, leaving the ruling appealable, when too
     * few jurors are eligible for the larger jury.
     */
    @Transactional
    public DisputeView appeal(String caller, UUID disputeId) {
        Dispute dispute = requireDispute(disputeId);
        dispute.requireParty(caller);
        dispute.requireStatus(DisputeStatus.APPEALABLE, "appeal");
        Instant now = clock.instant();
        if (!now.isBefore(dispute.getAppealDeadline())) {
            throw new TemporalException(ErrorCode.APPEAL_WINDOW_CLOSED, "Appeal window closed for dispute " + disputeId);
        }
        if (tierPolicy.isFinalRound(dispute.getAppealRound())) {
            throw new InvalidStateException(ErrorCode.FINAL_ROUND_REACHED, "Dispute " + disputeId + " is in its final round");
        }

        int nextRound = dispute.getAppealRound() + 1;
        DisputeTier nextTier = dispute.getTier().escalate();
        int count = tierPolicy.jurorCountFor(nextTier, dispute.getJurorCount());
        BigInteger requiredStake = tierPolicy.requiredJurorStake(nextRound);
        List<JurorSelector.Candidate> candidates = jurorSelector.eligibleCandidates(dispute, requiredStake);
        if (candidates.size() < count) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_JURORS,
                    "Appeal needs " + count + " eligible jurors, found " + candidates.size());
        }

        collectFee(dispute, caller, tierPolicy.feeFor(dispute.getDisputedAmount(), nextTier, nextRound));
        dispute.advanceRound(nextTier);
        seatWeightedJury(dispute, candidates, count, requiredStake, now);
        Dispute saved = disputeRepository.save(dispute);

        auditService.appendReceipt(EventType.DISPUTE_APPEALED, caller, disputeId, "Dispute",
                nextRound + "|" + nextTier + "|" + count);
        log.info("Dispute {} appealed by {} to round {} ({} jurors)", disputeId, caller, nextRound, count);
        return toView(saved);
    }

    /**
     * Settles the subject according to the tallied ruling once the appeal window has passed.
     */
    @Transactional
    public DisputeView executeRuling(UUID disputeId) {
        Dispute dispute = requireDispute(disputeId);
        dispute.requireStatus(DisputeStatus.APPEALABLE, "execute");
        if (clock.instant().isBefore(dispute.getAppealDeadline())) {
            throw new TemporalException(ErrorCode.APPEAL_WINDOW_OPEN, "Appeal window open until " + dispute.getAppealDeadline());
        }
        int share = dispute.getRulingProviderShareBps();
        settle(dispute, DisputeTierPolicy.shareOf(dispute.getDisputedAmount(), share), share, null);
        return toView(dispute);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public DisputeView getDispute(UUID disputeId) {
        return toView(requireDispute(disputeId));
    }

    @Transactional(readOnly = true)
    public List<JurorView> getJurors(UUID disputeId) {
        requireDispute(disputeId);
        return jurorVoteRepository.findByDisputeIdOrderByRoundNumberAscJurorDidAsc(disputeId).stream()
                .map(this::toView)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<DisputeView> getDisputesForParty(String did) {
        return disputeRepository.findByClientDidOrProviderDidOrderByCreatedAtDesc(did, did).stream()
                .map(this::toView)
                .toList();
    }

    // ==================== Internals ====================

    /**
     * Seats a Tier 3 jury for the current round. Returns false, seating nobody, when fewer than
     * {@code count} jurors are eligible.
     */
    private boolean draftTier3Jury(Dispute dispute, int count, Instant now) {
        BigInteger requiredStake = tierPolicy.requiredJurorStake(dispute.getAppealRound());
        List<JurorSelector.Candidate> candidates = jurorSelector.eligibleCandidates(dispute, requiredStake);
        if (candidates.size() < count) {
            return false;
        }
        seatWeightedJury(dispute, candidates, count, requiredStake, now);
        return true;
    }

    private void splitWithoutJury(Dispute dispute) {
        log.warn("Dispute {} cannot draft a {} jury, splitting evenly", dispute.getId(), dispute.getTier());
        settle(dispute, DisputeTierPolicy.shareOf(dispute.getDisputedAmount(), EVEN_SPLIT_BPS), EVEN_SPLIT_BPS, null);
    }

    private void seatWeightedJury(
            Dispute dispute,
            List<JurorSelector.Candidate> candidates,
            int count,
            BigInteger requiredStake,
            Instant now) {

        List<JurorSelector.Candidate> drafted = JurorSelector.selectWeighted(
                candidates, count, JurorSelector.seed(dispute.getId(), dispute.getAppealRound()));
        seatJurors(dispute, drafted, true);

        Instant evidenceDeadline = now.plus(properties.getEvidencePeriod());
        Instant commitDeadline = evidenceDeadline.plus(properties.getCommitPeriod());
        dispute.openEvidencePeriod(evidenceDeadline);
        dispute.openVoting(count, requiredStake, commitDeadline, commitDeadline.plus(properties.getRevealPeriod()));
    }

    private void seatJurors(Dispute dispute, List<JurorSelector.Candidate> drafted, boolean weighted) {
        for (JurorSelector.Candidate candidate : drafted) {
            jurorVoteRepository.save(JurorVote.draft(
                    dispute.getId(),
                    dispute.getAppealRound(),
                    candidate.did(),
                    candidate.address(),
                    weighted ? candidate.weight() : BigInteger.ONE));
        }
        auditService.appendReceipt(EventType.DISPUTE_JURORS_DRAFTED, "system", dispute.getId(), "Dispute",
                dispute.getAppealRound() + "|" + drafted.stream().map(JurorSelector.Candidate::did).toList());
    }

    /**
     * Opens the next round after a round without a majority. Returns false if no jury of the
     * required size can be drafted.
     */
    private boolean redraft(Dispute dispute, Instant now) {
        int nextRound = dispute.getAppealRound() + 1;
        DisputeTier nextTier = dispute.getTier().escalate();
        int count = tierPolicy.jurorCountFor(nextTier, dispute.getJurorCount());
        BigInteger requiredStake = tierPolicy.requiredJurorStake(nextRound);
        List<JurorSelector.Candidate> candidates = jurorSelector.eligibleCandidates(dispute, requiredStake);
        if (candidates.size() < count) {
            log.warn("Dispute {} cannot draft {} jurors for round {}, splitting evenly",
                    dispute.getId(), count, nextRound);
            return false;
        }
        dispute.advanceRound(nextTier);
        seatWeightedJury(dispute, candidates, count, requiredStake, now);
        return true;
    }

    private void settleJurors(Dispute dispute, List<JurorVote> seats, VoteTally.Result result, boolean weighted) {
        String arbiter = accessControl.arbiterPrincipal();
        BigInteger pool = dispute.getFeePool();
        BigInteger paid = BigInteger.ZERO;

        for (JurorVote seat : seats) {
            if (!seat.isCounted()) {
                seat.settle(VoteOutcome.ABSENT, BigInteger.ZERO, slashJuror(arbiter, seat, "absent"));
            } else if (!result.hasMajority()) {
                seat.settle(VoteOutcome.TIED, BigInteger.ZERO, BigInteger.ZERO);
            } else if (seat.getProviderShareBps().equals(result.winningShareBps())) {
                BigInteger weight = weighted ? seat.getWeight() : BigInteger.ONE;
                BigInteger reward = pool.multiply(weight).divide(result.winningWeight());
                custodyService.transfer(
                        CustodyAccounts.disputeFees(dispute.getId()),
                        CustodyAccounts.wallet(seat.getJurorAddress()),
                        dispute.getToken(),
                        reward,
                        "JUROR_REWARD:" + dispute.getId());
                paid = paid.add(reward);
                seat.settle(VoteOutcome.COHERENT, reward, BigInteger.ZERO);
                trustRegistry.adjustReputation(arbiter, seat.getJurorDid(), ReputationEvent.COHERENT_VOTE);
            } else {
                seat.settle(VoteOutcome.INCOHERENT, BigInteger.ZERO, slashJuror(arbiter, seat, "incoherent vote"));
            }
            jurorVoteRepository.save(seat);
        }
        dispute.drainFees(paid);
    }

    private BigInteger slashJuror(String arbiter, JurorVote seat, String reason) {
        BigInteger stake = trustRegistry.getStakedAmount(seat.getJurorDid());
        BigInteger amount = stake.multiply(BigInteger.valueOf(properties.getJurorSlashBps()))
                .divide(BigInteger.valueOf(Dispute.MAX_SHARE_BPS));
        if (amount.signum() > 0) {
            trustRegistry.slash(arbiter, seat.getJurorDid(), amount,
                    "juror " + reason + " in dispute " + seat.getDisputeId());
        }
        return amount;
    }

    /**
     * Pays out the subject, closes the dispute, sweeps leftover fees to the treasury and applies
     * party outcomes.
     */
    private void settle(Dispute dispute, BigInteger providerAmount, int shareBps, AutomaticRule rule) {
        String arbiter = accessControl.arbiterPrincipal();
        settlementFor(dispute.getSubjectType()).settleDispute(arbiter, dispute.getSubjectId(), providerAmount);
        dispute.resolve(shareBps, providerAmount, rule, clock.instant());

        BigInteger leftover = dispute.getFeePool();
        if (leftover.signum() > 0) {
            custodyService.transfer(CustodyAccounts.disputeFees(dispute.getId()), CustodyAccounts.TREASURY,
                    dispute.getToken(), leftover, "DISPUTE_FEES_SWEEP:" + dispute.getId());
            dispute.drainFees(leftover);
        }
        if (rule != AutomaticRule.MUTUAL_CANCEL && shareBps != EVEN_SPLIT_BPS) {
            boolean providerWon = shareBps > EVEN_SPLIT_BPS;
            applyPartyOutcome(arbiter, providerWon ? dispute.getProviderDid() : dispute.getClientDid(),
                    providerWon ? dispute.getClientDid() : dispute.getProviderDid(), dispute.getId());
        }
        disputeRepository.save(dispute);

        auditService.appendReceipt(EventType.DISPUTE_RESOLVED, arbiter, dispute.getId(), "Dispute",
                shareBps + "|" + providerAmount + "|" + rule);
        log.info("Dispute {} resolved: {} bps, {} to provider", dispute.getId(), shareBps, providerAmount);
    }

    private void applyPartyOutcome(String arbiter, String winnerDid, String loserDid, UUID disputeId) {
        trustRegistry.adjustReputation(arbiter, winnerDid, ReputationEvent.DISPUTE_WON);
        trustRegistry.adjustReputation(arbiter, loserDid, ReputationEvent.DISPUTE_LOST);
        BigInteger stake = trustRegistry.getStakedAmount(loserDid);
        BigInteger penalty = stake.multiply(BigInteger.valueOf(properties.getPartySlashBps()))
                .divide(BigInteger.valueOf(Dispute.MAX_SHARE_BPS));
        if (penalty.signum() > 0) {
            trustRegistry.slash(arbiter, loserDid, penalty, "lost dispute " + disputeId);
        }
    }

    private void collectFee(Dispute dispute, String payer, BigInteger fee) {
        if (fee.signum() == 0) {
            return;
        }
        custodyService.transfer(
                CustodyAccounts.wallet(payer),
                CustodyAccounts.disputeFees(dispute.getId()),
                dispute.getToken(),
                fee,
                "DISPUTE_FEE:" + dispute.getId());
        dispute.addFees(fee);
    }

    private DisputableSettlement settlementFor(SubjectType subjectType) {
        DisputableSettlement settlement = settlements.get(subjectType);
        if (settlement == null) {
            throw new IllegalStateException("No settlement engine for " + subjectType);
        }
        return settlement;
    }

    private Dispute requireDispute(UUID disputeId) {
        return disputeRepository.findById(disputeId)
                .orElseThrow(() -> new ValidationException(ErrorCode.DISPUTE_NOT_FOUND, "Dispute not found: " + disputeId));
    }

    private static void requireOpen(Dispute dispute) {
        if (dispute.isResolved()) {
            throw new InvalidStateException("Dispute " + dispute.getId() + " is already resolved");
        }
    }

    private static void requireVotingTier(Dispute dispute, DisputeTier tier) {
        dispute.requireStatus(DisputeStatus.VOTING, "vote on");
        if (dispute.getTier() != tier) {
            throw new InvalidStateException("Dispute " + dispute.getId() + " is at " + dispute.getTier());
        }
    }

    private JurorVote requireSeat(Dispute dispute, String caller, String jurorDid) {
        JurorVote seat = jurorVoteRepository
                .findByDisputeIdAndRoundNumberAndJurorDid(dispute.getId(), dispute.getAppealRound(), jurorDid)
                .orElseThrow(() -> new UnauthorizedException(ErrorCode.NOT_JUROR,
                        jurorDid + " is not a juror in this round"));
        if (!seat.getJurorAddress().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_JUROR, "Caller does not control juror " + jurorDid);
        }
        return seat;
    }

    private DisputeView toView(Dispute dispute) {
        return new DisputeView(
                dispute.getId(),
                dispute.getSubjectType(),
                dispute.getSubjectId(),
                dispute.getTier(),
                dispute.getStatus(),
                dispute.getClientDid(),
                dispute.getProviderDid(),
                dispute.getToken(),
                dispute.getDisputedAmount(),
                dispute.getClientEvidenceHash(),
                dispute.getProviderEvidenceHash(),
                dispute.getEvidenceDeadline(),
                dispute.getVotingDeadline(),
                dispute.getRevealDeadline(),
                dispute.getAppealDeadline(),
                dispute.getAppealRound(),
                dispute.getJurorCount(),
                dispute.getFeePool(),
                dispute.getAiProviderShareBps(),
                dispute.getRulingProviderShareBps(),
                dispute.getProviderAmount(),
                dispute.getAutomaticRule(),
                dispute.isResolved()
        );
    }

    private JurorView toView(JurorVote vote) {
        return new JurorView(
                vote.getRoundNumber(),
                vote.getJurorDid(),
                vote.getWeight(),
                vote.isVoted(),
                vote.isRevealed(),
                vote.getVerdict(),
                vote.getProviderShareBps(),
                vote.getOutcome(),
                vote.getReward(),
                vote.getSlashed()
        );
    }

    // DTOs
    public record DisputeView(
            UUID id,
            SubjectType subjectType,
            UUID subjectId,
            DisputeTier tier,
            DisputeStatus status,
            String clientDid,
            String providerDid,
            String token,
            BigInteger disputedAmount,
            String clientEvidenceHash,
            String providerEvidenceHash,
            Instant evidenceDeadline,
            Instant votingDeadline,
            Instant revealDeadline,
            Instant appealDeadline,
            int appealRound,
            int jurorCount,
            BigInteger feePool,
            Integer aiProviderShareBps,
            Integer rulingProviderShareBps,
            BigInteger providerAmount,
            AutomaticRule automaticRule,
            boolean resolved
    ) {}

    public record JurorView(
            int round,
            String jurorDid,
            BigInteger weight,
            boolean voted,
            boolean revealed,
            Verdict verdict,
            Integer providerShareBps,
            VoteOutcome outcome,
            BigInteger reward,
            BigInteger slashed
    ) {}
}
