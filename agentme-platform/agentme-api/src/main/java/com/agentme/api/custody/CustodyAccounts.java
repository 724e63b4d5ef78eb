package com.agentme.api.custody;

import com.agentme.core.domain.JournalEntry;

import java.util.UUID;

/**
 * Naming of custody ledger accounts.
 */
public final class CustodyAccounts {

    public static final String EXTERNAL = JournalEntry.OUTSIDE;
    public static final String TREASURY = "TREASURY";

    private CustodyAccounts() {}

    public static String wallet(String address) {
        return "WALLET:" + address;
    }

    public static String escrow(UUID escrowId) {
        return "ESCROW:" + escrowId;
    }

    public static String stream(UUID streamId) {
        return "STREAM:" + streamId;
    }

    public static String stake(String did) {
        return "STAKE:" + did;
    }

    public static String disputeFees(UUID disputeId) {
        return "DISPUTE_FEES:" + disputeId;
    }
}
