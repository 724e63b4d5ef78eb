package com.agentme.api.settlement;

import com.agentme.core.domain.Dispute.Filing;
import com.agentme.core.domain.Dispute.SubjectType;

import java.math.BigInteger;
import java.util.UUID;

/**
 * A settlement ledger whose positions can be frozen by a dispute and later force-settled.
 * Dispute resolution reaches escrows and streams only through this interface.
 */
public interface DisputableSettlement {

    SubjectType subjectType();

    /**
     * Freezes the position (state DISPUTED) on behalf of a party and captures the facts the
     * dispute needs. Requires the SETTLE_DISPUTE permission, so only dispute resolution can
     * freeze a position, and always together with the dispute that will settle it. Fails if
     * {@code party} is not a party or the position cannot be disputed.
     */
    Filing freezeForDispute(String arbiter, String party, UUID subjectId);

    /**
     * Pays {@code providerAmount} of the disputed value to the provider side and the remainder
     * to the client side, closing the position. Requires the SETTLE_DISPUTE permission.
     */
    void settleDispute(String caller, UUID subjectId, BigInteger providerAmount);
}
