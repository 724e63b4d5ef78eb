package com.agentme.api.custody;

import com.agentme.api.support.SettlementIntegrationTest;
import com.agentme.core.domain.JournalEntry;
import com.agentme.core.domain.JournalEntry.EntryKind;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.repository.JournalEntryRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigInteger;
import java.util.List;
import java.util.Random;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * The journal and the balance table are written side by side; replaying the journal must give
 * back every balance, whatever mix of movements got there.
 */
class CustodyJournalConsistencyTest extends SettlementIntegrationTest {

    private static final List<String> ADDRESSES = List.of("0xalice", "0xbob", "0xcarol");

    @Autowired
    private JournalEntryRepository journalEntryRepository;

    @Test
    void journalNetMatchesBalanceAfterRandomMovements() {
        UUID escrowId = UUID.randomUUID();
        List<String> accounts = List.of(
                CustodyAccounts.wallet("0xalice"),
                CustodyAccounts.wallet("0xbob"),
                CustodyAccounts.wallet("0xcarol"),
                CustodyAccounts.escrow(escrowId),
                CustodyAccounts.stream(escrowId),
                CustodyAccounts.TREASURY);
        Random random = new Random(20260105L);
        int refused = 0;

        for (int i = 0; i < 200; i++) {
            BigInteger amount = BigInteger.valueOf(1 + random.nextInt(5_000));
            int move = random.nextInt(10);
            try {
                if (move == 0) {
                    custody.depositExternal(ADDRESSES.get(random.nextInt(ADDRESSES.size())), USDC, amount);
                } else if (move == 1) {
                    custody.withdrawExternal(ADDRESSES.get(random.nextInt(ADDRESSES.size())), USDC, amount);
                } else {
                    String from = accounts.get(random.nextInt(accounts.size()));
                    String to = accounts.get(random.nextInt(accounts.size()));
                    if (!from.equals(to)) {
                        custody.transfer(from, to, USDC, amount, "MOVE:" + i);
                    }
                }
            } catch (InsufficientResourceException e) {
                refused++;
            }
        }

        BigInteger held = BigInteger.ZERO;
        for (String account : accounts) {
            BigInteger balance = custody.balanceOf(account, USDC);
            assertEquals(balance, custody.journalNet(account, USDC), account);
            assertThat(balance.signum()).isGreaterThanOrEqualTo(0);
            held = held.add(balance);
        }
        assertEquals(held.negate(), custody.journalNet(CustodyAccounts.EXTERNAL, USDC));
        assertThat(refused).isPositive();
    }

    @Test
    void refusedMovementLeavesNoPosting() {
        fund("0xalice", BigInteger.TEN);

        assertThrows(InsufficientResourceException.class,
                () -> custody.transfer(CustodyAccounts.wallet("0xalice"), CustodyAccounts.TREASURY, USDC,
                        BigInteger.valueOf(11), "OVERDRAFT"));

        assertThat(journalEntryRepository.findByRefOrderByPostedAtAsc("OVERDRAFT")).isEmpty();
        assertEquals(BigInteger.TEN, custody.journalNet(CustodyAccounts.wallet("0xalice"), USDC));
    }

    @Test
    void postingsAreClassifiedAtTheCustodyBoundary() {
        fund("0xalice", BigInteger.TEN);
        custody.transfer(CustodyAccounts.wallet("0xalice"), CustodyAccounts.TREASURY, USDC, BigInteger.ONE, "FEE");
        custody.withdrawExternal("0xalice", USDC, BigInteger.TWO);

        assertThat(journalEntryRepository.findAll()).extracting(JournalEntry::getKind)
                .containsExactlyInAnyOrder(EntryKind.DEPOSIT, EntryKind.TRANSFER, EntryKind.WITHDRAWAL);
        assertThat(journalEntryRepository.findByRefOrderByPostedAtAsc("FEE"))
                .singleElement()
                .satisfies(entry -> assertEquals(BigInteger.ONE, entry.netFor(CustodyAccounts.TREASURY)));
    }
}
