package com.agentme.api.dispute;

import com.agentme.core.domain.Dispute;
import com.agentme.core.domain.JurorVote.Verdict;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.ValidationException;

import java.math.BigInteger;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 * Weighted plurality over the provider shares jurors voted for.
 */
public final class VoteTally {

    private VoteTally() {}

    public static Result tally(Collection<Ballot> ballots) {
        Map<Integer, BigInteger> weightByShare = new TreeMap<>();
        BigInteger total = BigInteger.ZERO;
        for (Ballot ballot : ballots) {
            weightByShare.merge(ballot.providerShareBps(), ballot.weight(), BigInteger::add);
            total = total.add(ballot.weight());
        }

        Integer leader = null;
        BigInteger leaderWeight = BigInteger.ZERO;
        boolean tied = false;
        for (Map.Entry<Integer, BigInteger> entry : weightByShare.entrySet()) {
            int cmp = entry.getValue().compareTo(leaderWeight);
            if (cmp > 0) {
                leader = entry.getKey();
                leaderWeight = entry.getValue();
                tied = false;
            } else if (cmp == 0 && leader != null) {
                tied = true;
            }
        }
        if (leader == null || tied) {
            return new Result(null, leaderWeight, total);
        }
        return new Result(leader, leaderWeight, total);
    }

    /**
     * Maps a Tier 2 validation verdict to the provider share it votes for.
     * DISAGREE votes for the side the AI ruled against.
     */
    public static int validationShare(Verdict verdict, int aiShareBps, Integer modifiedShareBps) {
        return switch (verdict) {
            case AGREE -> aiShareBps;
            case DISAGREE -> aiShareBps >= Dispute.MAX_SHARE_BPS / 2 ? 0 : Dispute.MAX_SHARE_BPS;
            case MODIFY -> {
                if (modifiedShareBps == null) {
                    throw new ValidationException(ErrorCode.INVALID_SHARE, "MODIFY requires a share");
                }
                Dispute.requireShare(modifiedShareBps);
                yield modifiedShareBps;
            }
        };
    }

    public record Ballot(String jurorDid, int providerShareBps, BigInteger weight) {}

    /**
     * @param winningShareBps null on a tie or when nobody voted
     */
    public record Result(Integer winningShareBps, BigInteger winningWeight, BigInteger totalWeight) {

        public boolean hasMajority() {
            return winningShareBps != null;
        }
    }
}
