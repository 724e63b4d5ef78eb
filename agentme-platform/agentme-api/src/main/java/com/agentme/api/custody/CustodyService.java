package com.agentme.api.custody;

import com.agentme.core.domain.JournalEntry;
import com.agentme.core.domain.TokenBalance;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.error.ValidationException;
import com.agentme.core.repository.JournalEntryRepository;
import com.agentme.core.repository.TokenBalanceRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

/**
 * Token custody: balances per ledger account, every movement journaled as a double entry.
 * <p>
 * The only shared mutable resource across escrow, streams, stakes and dispute fees. Movements
 * join the caller's transaction, so a failed payout rolls back the state change that preceded it.
 */
@Service
public class CustodyService {

    private static final Logger log = LoggerFactory.getLogger(CustodyService.class);

    private final TokenBalanceRepository balanceRepository;
    private final JournalEntryRepository journalEntryRepository;
    private final Clock clock;

    public CustodyService(
            TokenBalanceRepository balanceRepository,
            JournalEntryRepository journalEntryRepository,
            Clock clock) {
        this.balanceRepository = balanceRepository;
        this.journalEntryRepository = journalEntryRepository;
        this.clock = clock;
    }

    /**
     * Tokens entering custody from outside into a principal's wallet account.
     */
    @Transactional
    public void depositExternal(String address, String token, BigInteger amount) {
        requirePositive(amount);
        String wallet = CustodyAccounts.wallet(address);
        balanceFor(wallet, token).credit(amount);
        journal(CustodyAccounts.EXTERNAL, wallet, token, amount, "DEPOSIT:" + address);
        log.info("Deposited {} {} into {}", amount, token, wallet);
    }

    /**
     * Tokens leaving custody from a principal's wallet account.
     */
    @Transactional
    public void withdrawExternal(String address, String token, BigInteger amount) {
        requirePositive(amount);
        String wallet = CustodyAccounts.wallet(address);
        balanceFor(wallet, token).debit(amount);
        journal(wallet, CustodyAccounts.EXTERNAL, token, amount, "WITHDRAW:" + address);
        log.info("Withdrew {} {} from {}", amount, token, wallet);
    }

    /**
     * Moves value between two custody accounts. Zero amounts are a no-op so payout splits
     * can pass either side unconditionally.
     */
    @Transactional
    public void transfer(String fromAccount, String toAccount, String token, BigInteger amount, String ref) {
        Objects.requireNonNull(amount, "Amount cannot be null");
        if (amount.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Transfer amount cannot be negative");
        }
        if (amount.signum() == 0) {
            return;
        }
        balanceFor(fromAccount, token).debit(amount);
        balanceFor(toAccount, token).credit(amount);
        journal(fromAccount, toAccount, token, amount, ref);
        log.debug("Transferred {} {} {} -> {} ({})", amount, token, fromAccount, toAccount, ref);
    }

    public void requireBalance(String account, String token, BigInteger amount) {
        BigInteger available = balanceOf(account, token);
        if (available.compareTo(amount) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BALANCE,
                    account + " holds " + available + " " + token + ", needs " + amount);
        }
    }

    @Transactional(readOnly = true)
    public BigInteger balanceOf(String account, String token) {
        return balanceRepository.findByAccountAndToken(account, token)
                .map(TokenBalance::getBalance)
                .orElse(BigInteger.ZERO);
    }

    public BigInteger walletBalance(String address, String token) {
        return balanceOf(CustodyAccounts.wallet(address), token);
    }

    /**
     * Net journal flow into an account; equals its balance when the ledger is consistent.
     */
    @Transactional(readOnly = true)
    public BigInteger journalNet(String account, String token) {
        BigInteger credits = journalEntryRepository.sumCredits(account, token);
        BigInteger debits = journalEntryRepository.sumDebits(account, token);
        return (credits == null ? BigInteger.ZERO : credits)
                .subtract(debits == null ? BigInteger.ZERO : debits);
    }

    private TokenBalance balanceFor(String account, String token) {
        return balanceRepository.findByAccountAndToken(account, token)
                .orElseGet(() -> balanceRepository.save(TokenBalance.open(account, token)));
    }

    private void journal(String debitAccount, String creditAccount, String token, BigInteger amount, String ref) {
        journalEntryRepository.save(
                JournalEntry.post(debitAccount, creditAccount, token, amount, ref, clock.instant()));
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Amount must be positive");
        }
    }
}
