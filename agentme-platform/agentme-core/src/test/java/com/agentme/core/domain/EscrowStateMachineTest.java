package com.agentme.core.domain;

import com.agentme.core.domain.Escrow.EscrowState;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InvalidStateException;
import com.agentme.core.error.ValidationException;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Escrow lifecycle transitions.
 * <p>
 * Terminal states admit no further transition, and a disputed escrow returns to the state it
 * was disputed from only through settlement.
 */
class EscrowStateMachineTest {

    private static final Instant NOW = Instant.parse("2026-01-05T00:00:00Z");
    private static final String OUTPUT = "0x" + "ab".repeat(32);

    private static Escrow escrow() {
        return Escrow.create("did:agentme:client", "0xclient", "did:agentme:provider", "0xprovider",
                "USDC", BigInteger.valueOf(100_000_000), "0x" + "11".repeat(32), NOW.plus(Duration.ofDays(1)), NOW);
    }

    @Test
    void create_startsAwaitingDepositWithZeroOutput() {
        Escrow escrow = escrow();

        assertEquals(EscrowState.AWAITING_DEPOSIT, escrow.getState());
        assertEquals(Escrow.ZERO_HASH, escrow.getOutputHash());
    }

    @Test
    void create_rejectsPastDeadlineAndSelfDealing() {
        ValidationException deadline = assertThrows(ValidationException.class, () ->
                Escrow.create("did:agentme:client", "0xclient", "did:agentme:provider", "0xprovider",
                        "USDC", BigInteger.TEN, "task", NOW, NOW));
        assertEquals(ErrorCode.INVALID_DEADLINE, deadline.getCode());

        ValidationException self = assertThrows(ValidationException.class, () ->
                Escrow.create("did:agentme:client", "0xclient", "did:agentme:client", "0xclient",
                        "USDC", BigInteger.TEN, "task", NOW.plusSeconds(60), NOW));
        assertEquals(ErrorCode.INVALID_IDENTIFIER, self.getCode());
    }

    @Test
    void happyPath_fundDeliverRelease() {
        Escrow escrow = escrow();

        escrow.markFunded(NOW);
        escrow.markDelivered(OUTPUT, NOW.plusSeconds(60));
        escrow.markReleased(NOW.plusSeconds(120));

        assertEquals(EscrowState.RELEASED, escrow.getState());
        assertEquals(OUTPUT, escrow.getOutputHash());
        assertEquals(NOW.plusSeconds(120), escrow.getClosedAt());
    }

    @Test
    void refund_onlyFromFunded() {
        Escrow escrow = escrow();
        escrow.markFunded(NOW);
        escrow.markDelivered(OUTPUT, NOW);

        assertThrows(InvalidStateException.class, () -> escrow.markRefunded(NOW));
    }

    @Test
    void dispute_remembersPriorStateAndSettles() {
        Escrow escrow = escrow();
        escrow.markFunded(NOW);
        escrow.markDelivered(OUTPUT, NOW);

        escrow.markDisputed();
        assertEquals(EscrowState.DISPUTED, escrow.getState());
        assertEquals(EscrowState.DELIVERED, escrow.getStateBeforeDispute());
        assertThrows(InvalidStateException.class, () -> escrow.markReleased(NOW));

        escrow.settleDispute(BigInteger.ZERO, NOW);
        assertEquals(EscrowState.REFUNDED, escrow.getState());
    }

    @Test
    void settleDispute_rejectsAmountAboveEscrow() {
        Escrow escrow = escrow();
        escrow.markFunded(NOW);
        escrow.markDisputed();

        ValidationException e = assertThrows(ValidationException.class,
                () -> escrow.settleDispute(BigInteger.valueOf(100_000_001), NOW));
        assertEquals(ErrorCode.INVALID_SHARE, e.getCode());
    }

    @Property(tries = 100)
    void terminalStatesRejectEveryTransition(@ForAll("terminalEscrow") Escrow escrow, @ForAll("transition") Transition transition) {
        assert escrow.getState().isTerminal();
        try {
            transition.apply(escrow);
            assert false : "Transition " + transition + " allowed from " + escrow.getState();
        } catch (InvalidStateException e) {
            assert e.getCode() == ErrorCode.INVALID_STATE;
        }
    }

    @Provide
    Arbitrary<Escrow> terminalEscrow() {
        return Arbitraries.of(List.of("release", "timeout", "dispute-release", "dispute-refund")).map(path -> {
            Escrow escrow = escrow();
            escrow.markFunded(NOW);
            switch (path) {
                case "release" -> escrow.markReleased(NOW);
                case "timeout" -> escrow.markRefunded(NOW);
                case "dispute-release" -> {
                    escrow.markDisputed();
                    escrow.settleDispute(BigInteger.ONE, NOW);
                }
                default -> {
                    escrow.markDisputed();
                    escrow.settleDispute(BigInteger.ZERO, NOW);
                }
            }
            return escrow;
        });
    }

    @Provide
    Arbitrary<Transition> transition() {
        return Arbitraries.of(Transition.values());
    }

    enum Transition {
        FUND, DELIVER, RELEASE, REFUND, DISPUTE, SETTLE;

        void apply(Escrow escrow) {
            switch (this) {
                case FUND -> escrow.markFunded(NOW);
                case DELIVER -> escrow.markDelivered(OUTPUT, NOW);
                case RELEASE -> escrow.markReleased(NOW);
                case REFUND -> escrow.markRefunded(NOW);
                case DISPUTE -> escrow.markDisputed();
                case SETTLE -> escrow.settleDispute(BigInteger.ZERO, NOW);
            }
        }
    }
}
