package com.agentme.api.audit;

import com.agentme.core.domain.AuditReceipt;
import com.agentme.core.domain.AuditReceipt.EventType;
import com.agentme.core.repository.AuditReceiptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.List;
import java.util.UUID;

/**
 * Append-only settlement event log.
 * Each receipt commits to its predecessor's hash, so any edit or deletion breaks the chain.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditReceiptRepository auditRepository;
    private final Clock clock;

    public AuditService(AuditReceiptRepository auditRepository, Clock clock) {
        this.auditRepository = auditRepository;
        this.clock = clock;
    }

    /**
     * Appends a receipt chained to the most recent one. Joins the caller's transaction so the
     * receipt commits or rolls back with the state change it records.
     */
    @Transactional
    public AuditReceipt appendReceipt(
            EventType eventType,
            String actorId,
            Object resourceId,
            String resourceType,
            String details) {

        AuditReceipt previous = auditRepository.findTopByOrderBySeqNoDesc().orElse(null);
        long seqNo = previous == null ? 1 : previous.getSeqNo() + 1;
        String previousHash = previous == null ? AuditReceipt.GENESIS : previous.getReceiptHash();

        AuditReceipt receipt = AuditReceipt.create(
                seqNo,
                eventType,
                actorId,
                String.valueOf(resourceId),
                resourceType,
                sha256(details == null ? "" : details),
                previousHash,
                clock.instant()
        );
        receipt.setReceiptHash(sha256(receipt.canonicalContent()));

        log.debug("Audit #{} {} on {} {}", seqNo, eventType, resourceType, resourceId);
        return auditRepository.save(receipt);
    }

    /**
     * Recomputes every receipt hash and link in sequence order.
     */
    @Transactional(readOnly = true)
    public ChainVerificationResult verifyChain() {
        List<AuditReceipt> receipts = auditRepository.findAllByOrderBySeqNoAsc();
        String expectedPrevious = AuditReceipt.GENESIS;
        long expectedSeq = 1;

        for (AuditReceipt receipt : receipts) {
            boolean linkValid = receipt.getSeqNo() == expectedSeq
                    && expectedPrevious.equals(receipt.getPreviousReceiptHash());
            boolean hashValid = sha256(receipt.canonicalContent()).equals(receipt.getReceiptHash());
            if (!linkValid || !hashValid) {
                log.warn("Audit chain broken at receipt #{} (link={}, hash={})",
                        receipt.getSeqNo(), linkValid, hashValid);
                return new ChainVerificationResult(false, receipts.size(), receipt.getId());
            }
            expectedPrevious = receipt.getReceiptHash();
            expectedSeq++;
        }
        return new ChainVerificationResult(true, receipts.size(), null);
    }

    public List<AuditReceipt> getReceiptsByResource(Object resourceId) {
        return auditRepository.findByResourceIdOrderBySeqNoAsc(String.valueOf(resourceId));
    }

    public List<AuditReceipt> getReceiptsByEventType(EventType eventType) {
        return auditRepository.findByEventTypeOrderBySeqNoAsc(eventType);
    }

    static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record ChainVerificationResult(boolean valid, int receiptCount, UUID firstBrokenReceiptId) {}
}
