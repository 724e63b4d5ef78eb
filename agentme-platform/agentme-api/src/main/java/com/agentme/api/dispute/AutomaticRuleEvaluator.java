package com.agentme.api.dispute;

import com.agentme.api.config.ArbitrationProperties;
import com.agentme.core.domain.Dispute;
import com.agentme.core.domain.Dispute.AutomaticRule;
import com.agentme.core.domain.Dispute.SubjectType;
import com.agentme.core.domain.Escrow;
import com.agentme.core.domain.Escrow.EscrowState;
import com.agentme.core.domain.PaymentStream.StreamStatus;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Tier 1 rules, checked in a fixed order against the facts captured at filing.
 */
@Component
public class AutomaticRuleEvaluator {

    private static final Pattern OUTPUT_HASH = Pattern.compile("0x[0-9a-fA-F]{64}");

    private final ArbitrationProperties properties;

    public AutomaticRuleEvaluator(ArbitrationProperties properties) {
        this.properties = properties;
    }

    public Optional<Outcome> evaluate(Dispute dispute, Instant now) {
        if (dispute.hasMutualCancelConsent()) {
            return Optional.of(new Outcome(AutomaticRule.MUTUAL_CANCEL, dispute.getAccruedToProvider()));
        }
        if (dispute.getSubjectType() == SubjectType.ESCROW) {
            return evaluateEscrow(dispute, now);
        }
        if (StreamStatus.COMPLETED.name().equals(dispute.getStateAtFiling())) {
            return Optional.of(new Outcome(AutomaticRule.STREAM_COMPLETED, dispute.getDisputedAmount()));
        }
        return Optional.empty();
    }

    private Optional<Outcome> evaluateEscrow(Dispute dispute, Instant now) {
        String state = dispute.getStateAtFiling();
        if (EscrowState.DELIVERED.name().equals(state)) {
            if (!isValidOutput(dispute.getOutputHash())) {
                return Optional.of(new Outcome(AutomaticRule.INVALID_OUTPUT, BigInteger.ZERO));
            }
            Instant graceEnd = dispute.getDeliveredAt().plus(properties.getDeliveryGracePeriod());
            if (!dispute.hasClientEvidence() && !now.isBefore(graceEnd)) {
                return Optional.of(new Outcome(AutomaticRule.UNCHALLENGED_DELIVERY, dispute.getDisputedAmount()));
            }
        } else if (EscrowState.FUNDED.name().equals(state) && !now.isBefore(dispute.getSubjectDeadline())) {
            return Optional.of(new Outcome(AutomaticRule.TIMEOUT, BigInteger.ZERO));
        }
        return Optional.empty();
    }

    static boolean isValidOutput(String outputHash) {
        return outputHash != null
                && OUTPUT_HASH.matcher(outputHash).matches()
                && !Escrow.ZERO_HASH.equalsIgnoreCase(outputHash);
    }

    public record Outcome(AutomaticRule rule, BigInteger providerAmount) {}
}
