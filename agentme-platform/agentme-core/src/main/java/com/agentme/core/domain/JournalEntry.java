package com.agentme.core.domain;

import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.ValidationException;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * One posting in the custody journal. The debit account gives up {@code amount} of {@code token}
 * and the credit account receives it. Postings are never updated; a correction is a new posting
 * in the opposite direction.
 */
@Entity
@Table(name = "journal_entries", indexes = {
    @Index(name = "idx_journal_debit", columnList = "debit_account, token"),
    @Index(name = "idx_journal_credit", columnList = "credit_account, token"),
    @Index(name = "idx_journal_ref", columnList = "ref"),
    @Index(name = "idx_journal_idempotency", columnList = "idempotency_key", unique = true)
})
public class JournalEntry {

    /** Account name for value outside custody. */
    public static final String OUTSIDE = "EXTERNAL";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private EntryKind kind;

    @NotNull
    @Column(name = "debit_account", nullable = false, length = 320)
    private String debitAccount;

    @NotNull
    @Column(name = "credit_account", nullable = false, length = 320)
    private String creditAccount;

    @NotNull
    @Column(nullable = false)
    private String token;

    @NotNull
    @Positive
    @Column(nullable = false, precision = 38, scale = 0)
    private BigInteger amount;

    @NotNull
    @Column(nullable = false, length = 400)
    private String ref;

    @NotNull
    @Column(name = "idempotency_key", nullable = false, unique = true, length = 448)
    private String idempotencyKey;

    @NotNull
    @Column(name = "posted_at", nullable = false)
    private Instant postedAt;

    protected JournalEntry() {}

    public static JournalEntry post(
            String debitAccount,
            String creditAccount,
            String token,
            BigInteger amount,
            String ref,
            Instant postedAt) {

        if (debitAccount == null || debitAccount.isBlank() || creditAccount == null || creditAccount.isBlank()) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Journal accounts are required");
        }
        if (debitAccount.equals(creditAccount)) {
            throw new ValidationException(ErrorCode.INVALID_IDENTIFIER, "Cannot post " + debitAccount + " to itself");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Posted amount must be positive");
        }

        JournalEntry entry = new JournalEntry();
        entry.kind = EntryKind.between(debitAccount, creditAccount);
        entry.debitAccount = debitAccount;
        entry.creditAccount = creditAccount;
        entry.token = token;
        entry.amount = amount;
        entry.ref = ref;
        entry.idempotencyKey = ref + ":" + UUID.randomUUID();
        entry.postedAt = postedAt;
        return entry;
    }

    /**
     * Signed effect of this posting on {@code account}: the amount if credited, its negation if
     * debited, zero otherwise.
     */
    public BigInteger netFor(String account) {
        if (creditAccount.equals(account)) {
            return amount;
        }
        return debitAccount.equals(account) ? amount.negate() : BigInteger.ZERO;
    }

    // Getters
    public UUID getId() { return id; }
    public EntryKind getKind() { return kind; }
    public String getDebitAccount() { return debitAccount; }
    public String getCreditAccount() { return creditAccount; }
    public String getToken() { return token; }
    public BigInteger getAmount() { return amount; }
    public String getRef() { return ref; }
    public String getIdempotencyKey() { return idempotencyKey; }
    public Instant getPostedAt() { return postedAt; }

    public enum EntryKind {
        DEPOSIT,
        WITHDRAWAL,
        TRANSFER;

        static EntryKind between(String debitAccount, String creditAccount) {
            if (OUTSIDE.equals(debitAccount)) {
                return DEPOSIT;
            }
            return OUTSIDE.equals(creditAccount) ? WITHDRAWAL : TRANSFER;
        }
    }
}
