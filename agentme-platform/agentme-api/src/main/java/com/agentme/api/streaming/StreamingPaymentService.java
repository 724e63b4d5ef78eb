package com.agentme.api.streaming;

import com.agentme.api.access.AccessControlService;
import com.agentme.api.access.Operation;
import com.agentme.api.audit.AuditService;
import com.agentme.api.config.StreamingProperties;
import com.agentme.api.custody.CustodyAccounts;
import com.agentme.api.custody.CustodyService;
import com.agentme.api.settlement.DisputableSettlement;
import com.agentme.api.trust.TrustRegistryService;
import com.agentme.core.domain.Agent;
import com.agentme.core.domain.AuditReceipt.EventType;
import com.agentme.core.domain.Dispute.Filing;
import com.agentme.core.domain.Dispute.SubjectType;
import com.agentme.core.domain.PaymentStream;
import com.agentme.core.domain.PaymentStream.CancellationSplit;
import com.agentme.core.domain.PaymentStream.StreamStatus;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.UnauthorizedException;
import com.agentme.core.error.ValidationException;
import com.agentme.core.repository.PaymentStreamRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Per-second payment streams. The full deposit is taken into custody at creation and paid
 * out to the recipient as it accrues.
 */
@Service
public class StreamingPaymentService implements DisputableSettlement {

    private static final Logger log = LoggerFactory.getLogger(StreamingPaymentService.class);

    private final PaymentStreamRepository streamRepository;
    private final TrustRegistryService trustRegistry;
    private final CustodyService custodyService;
    private final AccessControlService accessControl;
    private final AuditService auditService;
    private final StreamingProperties properties;
    private final Clock clock;

    public StreamingPaymentService(
            PaymentStreamRepository streamRepository,
            TrustRegistryService trustRegistry,
            CustodyService custodyService,
            AccessControlService accessControl,
            AuditService auditService,
            StreamingProperties properties,
            Clock clock) {
        this.streamRepository = streamRepository;
        this.trustRegistry = trustRegistry;
        this.custodyService = custodyService;
        this.accessControl = accessControl;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Creation ====================

    /**
     * Opens a stream starting now and running for {@code duration}.
     */
    @Transactional
    public StreamView createStream(
            String caller,
            String senderDid,
            String recipientDid,
            String token,
            BigInteger depositAmount,
            Duration duration,
            boolean cancelableBySender,
            boolean cancelableByRecipient) {

        if (duration == null || duration.getSeconds() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_TIME_RANGE, "Stream duration must be positive");
        }
        long start = clock.instant().getEpochSecond();
        return createStreamWithTimestamps(caller, senderDid, recipientDid, token, depositAmount,
                start, start + duration.getSeconds(), cancelableBySender, cancelableByRecipient);
    }

    @Transactional
    public StreamView createStreamWithTimestamps(
            String caller,
            String senderDid,
            String recipientDid,
            String token,
            BigInteger depositAmount,
            long startTime,
            long endTime,
            boolean cancelableBySender,
            boolean cancelableByRecipient) {

        Agent sender = trustRegistry.requireOwnedActiveAgent(caller, senderDid);
        Agent recipient = trustRegistry.requireActiveAgent(recipientDid);
        if (endTime - startTime > properties.getMaxDuration().getSeconds()) {
            throw new ValidationException(ErrorCode.INVALID_TIME_RANGE,
                    "Stream duration exceeds " + properties.getMaxDuration());
        }
        PaymentStream stream = PaymentStream.create(
                sender.getDid(),
                sender.getOwner(),
                recipient.getDid(),
                recipient.getOwner(),
                token,
                depositAmount,
                startTime,
                endTime,
                cancelableBySender,
                cancelableByRecipient,
                clock.instant());
        custodyService.requireBalance(CustodyAccounts.wallet(caller), token, depositAmount);

        PaymentStream saved = streamRepository.save(stream);
        custodyService.transfer(
                CustodyAccounts.wallet(caller),
                CustodyAccounts.stream(saved.getId()),
                token,
                depositAmount,
                "STREAM_DEPOSIT:" + saved.getId());

        auditService.appendReceipt(EventType.STREAM_CREATED, caller, saved.getId(), "PaymentStream",
                senderDid + "|" + recipientDid + "|" + depositAmount + "|" + startTime + "|" + endTime);
        log.info("Stream {} created: {} -> {} {} {} over [{}, {}]",
                saved.getId(), senderDid, recipientDid, depositAmount, token, startTime, endTime);
        return toView(saved, clock.instant().getEpochSecond());
    }

    // ==================== Recipient ====================

    @Transactional
    public StreamView withdraw(String caller, UUID streamId, BigInteger amount) {
        PaymentStream stream = requireStream(streamId);
        requireRecipient(stream, caller);
        Instant now = clock.instant();
        stream.withdraw(amount, now);
        PaymentStream saved = streamRepository.save(stream);

        custodyService.transfer(
                CustodyAccounts.stream(streamId),
                CustodyAccounts.wallet(stream.getRecipientAddress()),
                stream.getToken(),
                amount,
                "STREAM_WITHDRAW:" + streamId);

        auditService.appendReceipt(EventType.STREAM_WITHDRAWN, caller, streamId, "PaymentStream", amount.toString());
        log.debug("Stream {} withdrew {} (status {})", streamId, amount, saved.getStatus());
        return toView(saved, now.getEpochSecond());
    }

    /**
     * Withdraws everything currently withdrawable.
     *
     * @return the amount paid out
     */
    @Transactional
    public BigInteger withdrawMax(String caller, UUID streamId) {
        PaymentStream stream = requireStream(streamId);
        requireRecipient(stream, caller);
        BigInteger available = stream.withdrawableAmount(clock.instant().getEpochSecond());
        if (available.signum() <= 0) {
            throw new InsufficientResourceException(ErrorCode.NOTHING_TO_WITHDRAW,
                    "Nothing withdrawable from stream " + streamId);
        }
        withdraw(caller, streamId, available);
        return available;
    }

    // ==================== Sender ====================

    @Transactional
    public StreamView topUp(String caller, UUID streamId, BigInteger amount) {
        PaymentStream stream = requireStream(streamId);
        requireSender(stream, caller);
        Instant now = clock.instant();
        stream.topUp(amount, now);
        long remaining = stream.getEndTime() - Math.max(now.getEpochSecond(), stream.getStartTime());
        if (remaining > properties.getMaxDuration().getSeconds()) {
            throw new ValidationException(ErrorCode.INVALID_TIME_RANGE,
                    "Top-up would extend the stream beyond " + properties.getMaxDuration());
        }
        custodyService.transfer(
                CustodyAccounts.wallet(caller),
                CustodyAccounts.stream(streamId),
                stream.getToken(),
                amount,
                "STREAM_TOPUP:" + streamId);
        PaymentStream saved = streamRepository.save(stream);

        auditService.appendReceipt(EventType.STREAM_TOPPED_UP, caller, streamId, "PaymentStream",
                amount + "|" + saved.getEndTime());
        log.info("Stream {} topped up by {}, now ends at {}", streamId, amount, saved.getEndTime());
        return toView(saved, now.getEpochSecond());
    }

    @Transactional
    public StreamView pause(String caller, UUID streamId) {
        PaymentStream stream = requireStream(streamId);
        requireSender(stream, caller);
        Instant now = clock.instant();
        stream.pause(now);
        PaymentStream saved = streamRepository.save(stream);

        auditService.appendReceipt(EventType.STREAM_PAUSED, caller, streamId, "PaymentStream",
                String.valueOf(saved.getPausedAt()));
        log.info("Stream {} paused", streamId);
        return toView(saved, now.getEpochSecond());
    }

    @Transactional
    public StreamView resume(String caller, UUID streamId) {
        PaymentStream stream = requireStream(streamId);
        requireSender(stream, caller);
        Instant now = clock.instant();
        long shift = stream.resume(now);
        PaymentStream saved = streamRepository.save(stream);

        auditService.appendReceipt(EventType.STREAM_RESUMED, caller, streamId, "PaymentStream", String.valueOf(shift));
        log.info("Stream {} resumed, end shifted by {}s", streamId, shift);
        return toView(saved, now.getEpochSecond());
    }

    // ==================== Either party ====================

    @Transactional
    public CancellationSplit cancel(String caller, UUID streamId) {
        PaymentStream stream = requireStream(streamId);
        if (!stream.isParty(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_PARTY, "Only stream parties can cancel");
        }
        if (!stream.canBeCanceledBy(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_CANCELABLE, "Stream " + streamId + " is not cancelable by caller");
        }
        CancellationSplit split = stream.cancel(clock.instant());
        streamRepository.save(stream);

        String ref = "STREAM_CANCEL:" + streamId;
        custodyService.transfer(CustodyAccounts.stream(streamId),
                CustodyAccounts.wallet(stream.getRecipientAddress()), stream.getToken(), split.recipientAmount(), ref);
        custodyService.transfer(CustodyAccounts.stream(streamId),
                CustodyAccounts.wallet(stream.getSenderAddress()), stream.getToken(), split.senderRefund(), ref);

        auditService.appendReceipt(EventType.STREAM_CANCELED, caller, streamId, "PaymentStream",
                split.recipientAmount() + "|" + split.senderRefund());
        log.info("Stream {} canceled: recipient {}, sender refund {}",
                streamId, split.recipientAmount(), split.senderRefund());
        return split;
    }

    // ==================== Dispute seam ====================

    @Override
    public SubjectType subjectType() {
        return SubjectType.STREAM;
    }

    @Override
    @Transactional
    public Filing freezeForDispute(String arbiter, String party, UUID streamId) {
        accessControl.require(arbiter, Operation.SETTLE_DISPUTE);
        PaymentStream stream = requireStream(streamId);
        if (!stream.isParty(party)) {
            throw new UnauthorizedException(ErrorCode.NOT_PARTY, "Only stream parties can dispute");
        }
        String statusAtFiling = stream.getStatus().name();
        Instant now = clock.instant();
        stream.freezeForDispute(now);
        streamRepository.save(stream);

        long frozenAt = stream.getPausedAt();
        BigInteger streamed = stream.streamedAmount(frozenAt);
        auditService.appendReceipt(EventType.STREAM_DISPUTED, party, streamId, "PaymentStream", statusAtFiling);
        log.info("Stream {} disputed by {}", streamId, party);

        // Stream disputes split the unwithdrawn balance; the sender is the client side.
        return new Filing(
                SubjectType.STREAM,
                streamId,
                stream.getSenderDid(),
                stream.getSenderAddress(),
                stream.getRecipientDid(),
                stream.getRecipientAddress(),
                stream.getToken(),
                stream.remainingBalance(),
                streamed.subtract(stream.getWithdrawnAmount()),
                frozenAt >= stream.getEndTime() ? StreamStatus.COMPLETED.name() : statusAtFiling,
                Instant.ofEpochSecond(stream.getEndTime()),
                null,
                null
        );
    }

    @Override
    @Transactional
    public void settleDispute(String caller, UUID streamId, BigInteger recipientAmount) {
        accessControl.require(caller, Operation.SETTLE_DISPUTE);
        PaymentStream stream = requireStream(streamId);
        BigInteger senderRefund = stream.settleDispute(recipientAmount, clock.instant());
        streamRepository.save(stream);

        String ref = "STREAM_SETTLE:" + streamId;
        custodyService.transfer(CustodyAccounts.stream(streamId),
                CustodyAccounts.wallet(stream.getRecipientAddress()), stream.getToken(), recipientAmount, ref);
        custodyService.transfer(CustodyAccounts.stream(streamId),
                CustodyAccounts.wallet(stream.getSenderAddress()), stream.getToken(), senderRefund, ref);

        auditService.appendReceipt(EventType.STREAM_SETTLED, caller, streamId, "PaymentStream",
                recipientAmount + "|" + senderRefund);
        log.info("Stream {} settled by dispute: recipient {}, sender {}", streamId, recipientAmount, senderRefund);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public StreamView getStream(UUID streamId) {
        return toView(requireStream(streamId), clock.instant().getEpochSecond());
    }

    @Transactional(readOnly = true)
    public BigInteger streamedAmountOf(UUID streamId) {
        return requireStream(streamId).streamedAmount(clock.instant().getEpochSecond());
    }

    @Transactional(readOnly = true)
    public BigInteger withdrawableAmountOf(UUID streamId) {
        return requireStream(streamId).withdrawableAmount(clock.instant().getEpochSecond());
    }

    @Transactional(readOnly = true)
    public List<StreamView> getStreamsBySender(String senderDid) {
        long now = clock.instant().getEpochSecond();
        return streamRepository.findBySenderDidOrderByCreatedAtDesc(senderDid).stream()
                .map(s -> toView(s, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public List<StreamView> getStreamsByRecipient(String recipientDid) {
        long now = clock.instant().getEpochSecond();
        return streamRepository.findByRecipientDidOrderByCreatedAtDesc(recipientDid).stream()
                .map(s -> toView(s, now))
                .toList();
    }

    @Transactional(readOnly = true)
    public CancellationSplit getCancellationPreview(UUID streamId) {
        return requireStream(streamId).previewCancellation(clock.instant().getEpochSecond());
    }

    @Transactional(readOnly = true)
    public StreamHealth getStreamHealth(UUID streamId) {
        PaymentStream stream = requireStream(streamId);
        long now = clock.instant().getEpochSecond();
        return switch (stream.getStatus()) {
            case COMPLETED -> StreamHealth.COMPLETED;
            case CANCELED -> StreamHealth.CANCELED;
            case DISPUTED -> StreamHealth.DISPUTED;
            case PAUSED -> now >= stream.getEndTime() ? StreamHealth.STUCK : StreamHealth.PAUSED;
            case ACTIVE -> {
                if (now >= stream.getEndTime()) {
                    yield StreamHealth.STUCK;
                }
                long warningWindow = properties.getHealthWarningWindow().getSeconds();
                yield stream.getEndTime() - now <= warningWindow ? StreamHealth.WARNING : StreamHealth.HEALTHY;
            }
        };
    }

    private PaymentStream requireStream(UUID streamId) {
        return streamRepository.findById(streamId)
                .orElseThrow(() -> new ValidationException(ErrorCode.STREAM_NOT_FOUND, "Stream not found: " + streamId));
    }

    private static void requireSender(PaymentStream stream, String caller) {
        if (!stream.getSenderAddress().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_SENDER, "Only the sender can perform this action");
        }
    }

    private static void requireRecipient(PaymentStream stream, String caller) {
        if (!stream.getRecipientAddress().equals(caller)) {
            throw new UnauthorizedException(ErrorCode.NOT_RECIPIENT, "Only the recipient can withdraw");
        }
    }

    private StreamView toView(PaymentStream stream, long now) {
        return new StreamView(
                stream.getId(),
                stream.getSenderDid(),
                stream.getRecipientDid(),
                stream.getToken(),
                stream.getDepositAmount(),
                stream.getWithdrawnAmount(),
                stream.streamedAmount(now),
                stream.withdrawableAmount(now),
                stream.getRatePerSecond(),
                stream.getStartTime(),
                stream.getEndTime(),
                stream.timeRemaining(now),
                stream.getTotalPausedSeconds(),
                stream.getStatus(),
                stream.isCancelableBySender(),
                stream.isCancelableByRecipient()
        );
    }

    // DTOs
    public record StreamView(
            UUID id,
            String senderDid,
            String recipientDid,
            String token,
            BigInteger depositAmount,
            BigInteger withdrawnAmount,
            BigInteger streamedAmount,
            BigInteger withdrawableAmount,
            BigInteger ratePerSecond,
            long startTime,
            long endTime,
            long timeRemaining,
            long totalPausedSeconds,
            StreamStatus status,
            boolean cancelableBySender,
            boolean cancelableByRecipient
    ) {}

    public enum StreamHealth {
        HEALTHY, WARNING, STUCK, PAUSED, DISPUTED, COMPLETED, CANCELED
    }
}
