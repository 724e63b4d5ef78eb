package com.agentme.api.dispute;

import org.web3j.crypto.Hash;

import java.util.UUID;

/**
 * Sealed-vote commitments for Tier 3: keccak256 over the round, juror, share and salt.
 */
public final class VoteCommitments {

    private VoteCommitments() {}

    public static String commitment(UUID disputeId, int round, String jurorDid, int providerShareBps, String salt) {
        return Hash.sha3String(disputeId + "|" + round + "|" + jurorDid + "|" + providerShareBps + "|" + salt);
    }
}
