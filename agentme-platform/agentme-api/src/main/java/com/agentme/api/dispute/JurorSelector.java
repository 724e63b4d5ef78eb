package com.agentme.api.dispute;

import com.agentme.api.config.ArbitrationProperties;
import com.agentme.api.trust.TrustRegistryService;
import com.agentme.core.domain.Agent;
import com.agentme.core.domain.Dispute;
import com.agentme.core.domain.TrustRecord;
import com.agentme.core.error.ErrorCode;
import com.agentme.core.error.InsufficientResourceException;
import com.agentme.core.repository.AgentRepository;
import com.agentme.core.repository.TrustRecordRepository;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.UUID;

/**
 * Juror eligibility and drafting.
 * <p>
 * Draws are deterministic for a given dispute and round: the candidate list is sorted by DID
 * and the random source is seeded from keccak256 of the dispute id and round.
 */
@Component
public class JurorSelector {

    private final TrustRecordRepository trustRecordRepository;
    private final AgentRepository agentRepository;
    private final TrustRegistryService trustRegistry;
    private final ArbitrationProperties properties;

    public JurorSelector(
            TrustRecordRepository trustRecordRepository,
            AgentRepository agentRepository,
            TrustRegistryService trustRegistry,
            ArbitrationProperties properties) {
        this.trustRecordRepository = trustRecordRepository;
        this.agentRepository = agentRepository;
        this.trustRegistry = trustRegistry;
        this.properties = properties;
    }

    /**
     * Active agents with enough stake and trust that are not a party to the dispute, by DID or
     * by owner address.
     */
    public List<Candidate> eligibleCandidates(Dispute dispute, BigInteger requiredStake) {
        List<Candidate> candidates = new ArrayList<>();
        for (TrustRecord record : trustRecordRepository.findByStakedAmountGreaterThanEqualOrderByDidAsc(requiredStake)) {
            if (dispute.isPartyDid(record.getDid())) {
                continue;
            }
            Agent agent = agentRepository.findByDid(record.getDid()).orElse(null);
            if (agent == null || !agent.isActive() || dispute.isParty(agent.getOwner())) {
                continue;
            }
            int score = trustRegistry.getTrustScore(record.getDid());
            if (score >= properties.getJurorTrustFloor()) {
                candidates.add(new Candidate(agent.getDid(), agent.getOwner(), record.getStakedAmount(), score));
            }
        }
        return candidates;
    }

    /**
     * Tier 2: every candidate equally likely.
     */
    public static List<Candidate> selectUniform(List<Candidate> candidates, int count, long seed) {
        requireEnough(candidates, count);
        List<Candidate> pool = new ArrayList<>(candidates);
        Collections.shuffle(pool, new Random(seed));
        return List.copyOf(pool.subList(0, count));
    }

    /**
     * Tier 3: probability proportional to stake x trust score, without replacement.
     */
    public static List<Candidate> selectWeighted(List<Candidate> candidates, int count, long seed) {
        requireEnough(candidates, count);
        Random random = new Random(seed);
        List<Candidate> pool = new ArrayList<>(candidates);
        List<Candidate> drafted = new ArrayList<>(count);

        while (drafted.size() < count) {
            BigInteger total = pool.stream().map(Candidate::weight).reduce(BigInteger.ZERO, BigInteger::add);
            int index;
            if (total.signum() == 0) {
                index = random.nextInt(pool.size());
            } else {
                BigInteger target = new BigInteger(total.bitLength() + 64, random).mod(total);
                index = 0;
                BigInteger cumulative = pool.get(0).weight();
                while (cumulative.compareTo(target) <= 0) {
                    index++;
                    cumulative = cumulative.add(pool.get(index).weight());
                }
            }
            drafted.add(pool.remove(index));
        }
        return List.copyOf(drafted);
    }

    public static long seed(UUID disputeId, int round) {
        String digest = Hash.sha3String(disputeId + ":" + round);
        return new BigInteger(digest.substring(2), 16).longValue();
    }

    private static void requireEnough(List<Candidate> candidates, int count) {
        if (candidates.size() < count) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_JURORS,
                    "Need " + count + " eligible jurors, found " + candidates.size());
        }
    }

    public record Candidate(String did, String address, BigInteger stake, int trustScore) {

        public BigInteger weight() {
            return stake.multiply(BigInteger.valueOf(trustScore));
        }
    }
}
